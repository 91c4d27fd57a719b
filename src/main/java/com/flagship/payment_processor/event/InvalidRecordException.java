package com.flagship.payment_processor.event;

import lombok.Getter;

/**
 * Thrown when a {@link PaymentRecord} cannot be turned into an {@link Event}.
 * The record is dropped; processing continues with the next one.
 */
@Getter
public class InvalidRecordException extends IllegalArgumentException {

    private final Reason reason;
    private final PaymentRecord record;

    public InvalidRecordException(Reason reason, PaymentRecord record, String message) {
        super(message);
        this.reason = reason;
        this.record = record;
    }

    public enum Reason {
        UNKNOWN_EVENT_TYPE,
        MISSING_AMOUNT,
        NEGATIVE_AMOUNT,
        INVALID_AMOUNT
    }
}
