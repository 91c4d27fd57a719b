package com.flagship.payment_processor.event;

import java.util.Arrays;
import java.util.Optional;

/**
 * Supported payment event types, keyed by the literal used in the input.
 */
public enum EventType {
    /**
     * Credit to the client's account.
     */
    DEPOSIT("deposit", true),

    /**
     * Debit from the client's account.
     */
    WITHDRAWAL("withdrawal", true),

    /**
     * Claim that a deposit was erroneous. Its funds are held until resolved or charged back.
     */
    DISPUTE("dispute", false),

    /**
     * Releases held funds of a disputed deposit back to the client.
     */
    RESOLVE("resolve", false),

    /**
     * Reverses a disputed deposit and freezes the account.
     */
    CHARGEBACK("chargeback", false);

    private final String literal;
    private final boolean requiresAmount;

    EventType(String literal, boolean requiresAmount) {
        this.literal = literal;
        this.requiresAmount = requiresAmount;
    }

    public String getLiteral() {
        return literal;
    }

    public boolean requiresAmount() {
        return requiresAmount;
    }

    /**
     * Exact, case-sensitive lookup by input literal.
     */
    public static Optional<EventType> fromLiteral(String literal) {
        if (literal == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(type -> type.literal.equals(literal))
            .findFirst();
    }
}
