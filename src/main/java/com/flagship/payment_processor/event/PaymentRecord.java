package com.flagship.payment_processor.event;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * A raw, unvalidated payment record as read from the input.
 *
 * Nothing about a record is trusted: the type may be unknown and the amount may be
 * missing. {@link EventValidator} is the only way to turn it into an {@link Event}.
 */
@Value
@Builder
@Jacksonized
public class PaymentRecord {
    String type;
    Integer client;
    Long tx;
    BigDecimal amount;
}
