package com.flagship.payment_processor.store;

import java.util.Optional;

/**
 * Capability interface over the per-transaction ledger shared by every client of a run.
 *
 * Transaction ids are globally unique: the first client to write an id owns it for the
 * rest of the run. Implementations must make {@link #get} and {@link #upsert} on the same
 * transaction id linearizable, since clients may be processed concurrently.
 */
public interface TransactionStore {

    /**
     * Returns the state of a transaction owned by the given client.
     *
     * A transaction owned by another client is reported as absent, exactly like one
     * that never existed.
     *
     * @param clientId the requesting client
     * @param txId the transaction id
     * @return the state, or empty if absent or owned by someone else
     */
    Optional<TxState> get(int clientId, long txId);

    /**
     * Creates or overwrites a transaction.
     *
     * An absent id is created and bound to {@code clientId} permanently. An existing id
     * with the same owner is overwritten.
     *
     * @throws OwnershipConflictException if the id is owned by another client; nothing is written
     */
    void upsert(int clientId, long txId, TxState state);

    /**
     * Number of transaction ids recorded so far.
     */
    int size();
}
