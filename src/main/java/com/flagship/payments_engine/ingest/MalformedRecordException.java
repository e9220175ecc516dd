package com.flagship.payments_engine.ingest;

import com.flagship.payments_engine.ledger.ApplyError;
import lombok.Getter;

/**
 * An input row that cannot be turned into a transaction record.
 * Raised by parsers only; malformed rows never reach the ledger engine.
 */
@Getter
public class MalformedRecordException extends Exception {

    private final ApplyError error = ApplyError.MALFORMED_RECORD;
    private final String source;

    public MalformedRecordException(String source, String message) {
        super(message);
        this.source = source;
    }

    public MalformedRecordException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }
}
