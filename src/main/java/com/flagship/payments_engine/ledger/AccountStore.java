package com.flagship.payments_engine.ledger;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mapping from client id to account, owned by the {@link LedgerEngine}.
 *
 * Accounts are created lazily and never removed during a run.
 */
@Component
public class AccountStore {

    private final Map<Integer, Account> accounts = new ConcurrentHashMap<>();

    public Account getOrCreate(int clientId) {
        return accounts.computeIfAbsent(clientId, Account::new);
    }

    public Optional<Account> find(int clientId) {
        return Optional.ofNullable(accounts.get(clientId));
    }

    public int size() {
        return accounts.size();
    }

    /**
     * Snapshot of every account, ascending by client id.
     * Only meaningful once all submitted records have been applied.
     */
    public List<AccountSnapshot> snapshot() {
        return accounts.values().stream()
            .map(Account::snapshot)
            .sorted(Comparator.comparingInt(AccountSnapshot::getClientId))
            .toList();
    }
}
