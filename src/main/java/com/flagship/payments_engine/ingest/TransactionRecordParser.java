package com.flagship.payments_engine.ingest;

import com.flagship.payments_engine.ledger.TransactionRecord;
import com.flagship.payments_engine.ledger.TransactionType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Turns raw field values into a {@link TransactionRecord}.
 *
 * Shared by every input format. Values are trimmed; the type is matched
 * ignoring case; an amount given on a dispute, resolve or chargeback is ignored.
 */
@Component
public class TransactionRecordParser {

    /**
     * @param source where the row came from, for error messages (e.g. "line 4")
     * @throws MalformedRecordException if any field is missing, non-numeric or out of range
     */
    public TransactionRecord parse(String source, String type, String client, String tx, String amount)
            throws MalformedRecordException {
        TransactionType transactionType;
        try {
            transactionType = TransactionType.fromCode(type);
        } catch (IllegalArgumentException e) {
            throw new MalformedRecordException(source, e.getMessage(), e);
        }

        int clientId = parseClientId(source, client);
        long txId = parseTxId(source, tx);
        BigDecimal value = transactionType.carriesAmount() ? parseAmount(source, amount) : null;

        try {
            return TransactionRecord.of(transactionType, clientId, txId, value);
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new MalformedRecordException(source, e.getMessage(), e);
        }
    }

    private int parseClientId(String source, String client) throws MalformedRecordException {
        long value = parseUnsigned(source, "client", client);
        if (value > TransactionRecord.MAX_CLIENT_ID) {
            throw new MalformedRecordException(source, "Client id out of range: " + value);
        }
        return (int) value;
    }

    private long parseTxId(String source, String tx) throws MalformedRecordException {
        long value = parseUnsigned(source, "tx", tx);
        if (value > TransactionRecord.MAX_TX_ID) {
            throw new MalformedRecordException(source, "Transaction id out of range: " + value);
        }
        return value;
    }

    private long parseUnsigned(String source, String field, String raw) throws MalformedRecordException {
        if (raw == null || raw.isBlank()) {
            throw new MalformedRecordException(source, "Missing " + field);
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value < 0) {
                throw new MalformedRecordException(source, "Negative " + field + ": " + raw.trim());
            }
            return value;
        } catch (NumberFormatException e) {
            throw new MalformedRecordException(source, "Non-numeric " + field + ": " + raw.trim(), e);
        }
    }

    private BigDecimal parseAmount(String source, String amount) throws MalformedRecordException {
        if (amount == null || amount.isBlank()) {
            throw new MalformedRecordException(source, "Missing amount");
        }
        try {
            return new BigDecimal(amount.trim());
        } catch (NumberFormatException e) {
            throw new MalformedRecordException(source, "Non-numeric amount: " + amount.trim(), e);
        }
    }
}
