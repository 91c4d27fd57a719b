package com.flagship.payment_processor.ledger;

import com.flagship.payment_processor.event.Event;
import lombok.Getter;

/**
 * Thrown when an event violates a ledger rule. The client and the transaction store are
 * left exactly as they were before the event.
 */
@Getter
public class LedgerException extends IllegalStateException {

    private final LedgerError error;
    private final int clientId;
    private final long txId;

    public LedgerException(LedgerError error, Event event) {
        super(String.format("%s: %s", event, error.getDescription()));
        this.error = error;
        this.clientId = event.getClientId();
        this.txId = event.getTxId();
    }
}
