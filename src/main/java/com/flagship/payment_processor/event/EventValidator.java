package com.flagship.payment_processor.event;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * The single validation gate between untrusted input and the ledger.
 *
 * Rules:
 * - the type must be one of the five known literals (exact match)
 * - deposits and withdrawals must carry a non-negative amount
 * - that amount must have at most 18 integer digits and at most 18 fractional digits;
 *   exponent notation such as {@code 1E+3} is rescaled to a plain whole number
 * - amounts supplied on dispute, resolve and chargeback records are ignored
 *
 * Stateless; safe to share between threads.
 */
@Component
public class EventValidator {

    static final int MAX_SCALE = 18;
    static final int MAX_INTEGER_DIGITS = 18;

    /**
     * Validates a raw record.
     *
     * @param record the record to validate; client and tx must already be present
     * @return the validated event
     * @throws InvalidRecordException if the record is not a well-formed event
     */
    public Event validate(PaymentRecord record) {
        EventType type = EventType.fromLiteral(record.getType())
            .orElseThrow(() -> new InvalidRecordException(
                InvalidRecordException.Reason.UNKNOWN_EVENT_TYPE, record,
                String.format("Invalid transaction type '%s'", record.getType())));

        int clientId = record.getClient();
        long txId = record.getTx();

        if (type.requiresAmount()) {
            BigDecimal amount = record.getAmount();
            if (amount == null) {
                throw new InvalidRecordException(
                    InvalidRecordException.Reason.MISSING_AMOUNT, record,
                    String.format("%s requires an amount (client %d, tx %d)",
                        type.getLiteral(), clientId, txId));
            }
            if (amount.signum() < 0) {
                throw new InvalidRecordException(
                    InvalidRecordException.Reason.NEGATIVE_AMOUNT, record,
                    String.format("%s amount must not be negative: %s (client %d, tx %d)",
                        type.getLiteral(), amount, clientId, txId));
            }
            amount = normalize(amount, type, record);
            return type == EventType.DEPOSIT
                ? Event.deposit(clientId, txId, amount)
                : Event.withdrawal(clientId, txId, amount);
        }

        return switch (type) {
            case DISPUTE -> Event.dispute(clientId, txId);
            case RESOLVE -> Event.resolve(clientId, txId);
            case CHARGEBACK -> Event.chargeback(clientId, txId);
            case DEPOSIT, WITHDRAWAL -> throw new IllegalStateException("Unreachable: " + type);
        };
    }

    private static BigDecimal normalize(BigDecimal amount, EventType type, PaymentRecord record) {
        long integerDigits = (long) amount.precision() - amount.scale();
        if (amount.scale() > MAX_SCALE || integerDigits > MAX_INTEGER_DIGITS) {
            throw new InvalidRecordException(
                InvalidRecordException.Reason.INVALID_AMOUNT, record,
                String.format("%s amount out of range: %s (client %d, tx %d)",
                    type.getLiteral(), amount, record.getClient(), record.getTx()));
        }
        return amount.scale() < 0 ? amount.setScale(0) : amount;
    }
}
