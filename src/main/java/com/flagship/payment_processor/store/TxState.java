package com.flagship.payment_processor.store;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Authoritative state of a single transaction.
 *
 * Immutable: a transition returns a new TxState and the caller writes it back to the
 * {@link TransactionStore}. Invalid transitions are rejected with IllegalStateException.
 */
@Value
public class TxState {
    TxStatus status;
    BigDecimal amount;

    public static TxState deposit(BigDecimal amount) {
        return new TxState(TxStatus.DEPOSIT, Objects.requireNonNull(amount));
    }

    public static TxState withdrawal(BigDecimal amount) {
        return new TxState(TxStatus.WITHDRAWAL, Objects.requireNonNull(amount));
    }

    /**
     * Moves a deposit under dispute. Only valid from DEPOSIT.
     */
    public TxState dispute() {
        if (status != TxStatus.DEPOSIT) {
            throw new IllegalStateException(
                String.format("Cannot dispute transaction in %s status. Only DEPOSIT transactions can be disputed.",
                    status));
        }
        return new TxState(TxStatus.DISPUTE, amount);
    }

    /**
     * Releases a dispute. Only valid from DISPUTE.
     */
    public TxState resolve() {
        if (status != TxStatus.DISPUTE) {
            throw new IllegalStateException(
                String.format("Cannot resolve transaction in %s status. Only DISPUTE transactions can be resolved.",
                    status));
        }
        return new TxState(TxStatus.DEPOSIT, amount);
    }

    public boolean isDisputed() {
        return status == TxStatus.DISPUTE;
    }
}
