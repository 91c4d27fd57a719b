package com.flagship.payment_processor.store;

/**
 * Lifecycle status of a stored transaction.
 *
 * Transitions:
 * - DEPOSIT -> DISPUTE (dispute)
 * - DISPUTE -> DEPOSIT (resolve)
 * - WITHDRAWAL is terminal
 */
public enum TxStatus {
    /**
     * Deposited funds, available to the client.
     */
    DEPOSIT,

    /**
     * Deposited funds currently held under dispute.
     */
    DISPUTE,

    /**
     * Withdrawn funds. Tracked only to reserve the id; can never be disputed.
     */
    WITHDRAWAL
}
