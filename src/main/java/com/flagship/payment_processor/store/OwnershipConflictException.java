package com.flagship.payment_processor.store;

import lombok.Getter;

/**
 * Thrown by {@link TransactionStore#upsert} when a transaction id is already owned by
 * a different client.
 */
@Getter
public class OwnershipConflictException extends IllegalStateException {

    private final long txId;
    private final int requestingClientId;

    public OwnershipConflictException(long txId, int requestingClientId) {
        super(String.format("Transaction %d is not owned by client %d", txId, requestingClientId));
        this.txId = txId;
        this.requestingClientId = requestingClientId;
    }
}
