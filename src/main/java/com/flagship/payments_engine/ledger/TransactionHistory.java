package com.flagship.payments_engine.ledger;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only index of accepted deposits and withdrawals, keyed by transaction id.
 *
 * Transaction ids are unique across all clients, so the index is shared by
 * every dispatcher shard. Uniqueness is enforced atomically on insert.
 */
@Component
public class TransactionHistory {

    private final Map<Long, HistoryEntry> entries = new ConcurrentHashMap<>();

    public boolean contains(long txId) {
        return entries.containsKey(txId);
    }

    /**
     * Records an entry unless its transaction id is already taken.
     *
     * @return true if recorded, false if the id was already present
     */
    public boolean record(HistoryEntry entry) {
        return entries.putIfAbsent(entry.getTxId(), entry) == null;
    }

    /**
     * Finds the entry with the given id owned by the given client.
     * Entries of other clients are invisible.
     */
    public Optional<HistoryEntry> find(long txId, int clientId) {
        HistoryEntry entry = entries.get(txId);
        if (entry == null || entry.getClientId() != clientId) {
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public int size() {
        return entries.size();
    }
}
