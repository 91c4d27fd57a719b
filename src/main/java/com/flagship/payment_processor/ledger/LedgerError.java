package com.flagship.payment_processor.ledger;

/**
 * Reasons a ledger rule can reject an event.
 */
public enum LedgerError {
    DUPLICATE_TRANSACTION("cannot overwrite existing transaction"),
    INSUFFICIENT_FUNDS("insufficient available funds"),
    TRANSACTION_NOT_FOUND("transaction does not exist"),
    TRANSACTION_NOT_DISPUTED("transaction is not disputed"),
    TRANSACTION_ALREADY_DISPUTED("transaction already disputed"),
    TRANSACTION_CANNOT_BE_DISPUTED("cannot dispute a withdrawal"),
    ACCOUNT_FROZEN("account is frozen");

    private final String description;

    LedgerError(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
