package com.flagship.payment_processor.observability;

import com.flagship.payment_processor.event.Event;
import org.slf4j.MDC;

/**
 * MDC keys identifying the event being processed.
 *
 * Every log line written while an event is applied carries its client and transaction,
 * including lines written from partition lanes.
 */
public final class EventLogContext implements AutoCloseable {

    public static final String CLIENT_ID_MDC_KEY = "clientId";
    public static final String TX_ID_MDC_KEY = "txId";

    private EventLogContext() {
    }

    /**
     * Puts the event's ids in the MDC until the returned context is closed.
     */
    public static EventLogContext open(Event event) {
        MDC.put(CLIENT_ID_MDC_KEY, String.valueOf(event.getClientId()));
        MDC.put(TX_ID_MDC_KEY, String.valueOf(event.getTxId()));
        return new EventLogContext();
    }

    @Override
    public void close() {
        MDC.remove(CLIENT_ID_MDC_KEY);
        MDC.remove(TX_ID_MDC_KEY);
    }
}
