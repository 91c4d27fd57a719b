package com.flagship.payment_processor.event;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A validated payment event.
 *
 * Key invariant: {@code amount} is non-null exactly when {@link EventType#requiresAmount()}.
 * Instances are built through the static factories, which {@link EventValidator} calls
 * after checking the raw {@link PaymentRecord}. Once built, the ledger trusts the event as is.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Event {
    int clientId;
    long txId;
    EventType type;
    BigDecimal amount;

    public static Event deposit(int clientId, long txId, BigDecimal amount) {
        return new Event(clientId, txId, EventType.DEPOSIT, Objects.requireNonNull(amount));
    }

    public static Event withdrawal(int clientId, long txId, BigDecimal amount) {
        return new Event(clientId, txId, EventType.WITHDRAWAL, Objects.requireNonNull(amount));
    }

    public static Event dispute(int clientId, long txId) {
        return new Event(clientId, txId, EventType.DISPUTE, null);
    }

    public static Event resolve(int clientId, long txId) {
        return new Event(clientId, txId, EventType.RESOLVE, null);
    }

    public static Event chargeback(int clientId, long txId) {
        return new Event(clientId, txId, EventType.CHARGEBACK, null);
    }

    @Override
    public String toString() {
        String kind = amount != null ? type + "(" + amount.toPlainString() + ")" : type.name();
        return kind + " for client " + clientId + " with transaction " + txId;
    }
}
