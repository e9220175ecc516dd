package com.flagship.payments_engine.observability;

import com.flagship.payments_engine.ledger.TransactionRecord;
import org.slf4j.MDC;

/**
 * MDC scope for the record currently being applied.
 *
 * Every log statement issued while a record is applied carries its client id
 * and transaction id, whichever worker thread applies it.
 *
 * <pre>
 * try (RecordContext ignored = RecordContext.open(record)) {
 *     // log statements here carry clientId and txId
 * }
 * </pre>
 */
public final class RecordContext implements AutoCloseable {

    public static final String CLIENT_ID_MDC_KEY = "clientId";
    public static final String TX_ID_MDC_KEY = "txId";
    public static final String TYPE_MDC_KEY = "txType";

    private RecordContext(TransactionRecord record) {
        MDC.put(CLIENT_ID_MDC_KEY, String.valueOf(record.getClientId()));
        MDC.put(TX_ID_MDC_KEY, String.valueOf(record.getTxId()));
        MDC.put(TYPE_MDC_KEY, record.getType().code());
    }

    public static RecordContext open(TransactionRecord record) {
        return new RecordContext(record);
    }

    @Override
    public void close() {
        MDC.remove(CLIENT_ID_MDC_KEY);
        MDC.remove(TX_ID_MDC_KEY);
        MDC.remove(TYPE_MDC_KEY);
    }
}
