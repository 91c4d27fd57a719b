package com.flagship.payment_processor.store;

import lombok.Value;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory {@link TransactionStore} backed by a {@link ConcurrentHashMap}.
 *
 * Ownership check and write happen inside {@code compute}, which locks the bin of the
 * transaction id only, so claims on different ids never contend.
 */
public class InMemoryTransactionStore implements TransactionStore {

    private final ConcurrentMap<Long, StoredTransaction> transactions = new ConcurrentHashMap<>();

    @Override
    public Optional<TxState> get(int clientId, long txId) {
        StoredTransaction stored = transactions.get(txId);
        if (stored == null || stored.getOwnerId() != clientId) {
            return Optional.empty();
        }
        return Optional.of(stored.getState());
    }

    @Override
    public void upsert(int clientId, long txId, TxState state) {
        transactions.compute(txId, (id, existing) -> {
            if (existing != null && existing.getOwnerId() != clientId) {
                throw new OwnershipConflictException(txId, clientId);
            }
            return new StoredTransaction(clientId, state);
        });
    }

    @Override
    public int size() {
        return transactions.size();
    }

    @Value
    private static class StoredTransaction {
        int ownerId;
        TxState state;
    }
}
