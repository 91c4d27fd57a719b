package com.flagship.payment_processor.observability;

import com.flagship.payment_processor.event.EventType;
import com.flagship.payment_processor.ledger.LedgerError;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for event processing.
 *
 * Metrics exposed:
 * - ledger.events.applied: Counter of applied events, tagged by type
 * - ledger.events.rejected: Counter of ledger rule violations, tagged by type and reason
 * - ledger.records.invalid: Counter of records dropped before reaching the ledger
 * - ledger.accounts.frozen: Counter of accounts locked by a chargeback
 * - ledger.run.duration: Timer for whole runs
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter accountsFrozen;
    private final Timer runTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.accountsFrozen = Counter.builder("ledger.accounts.frozen")
                .description("Number of accounts frozen by a chargeback")
                .register(registry);

        this.runTimer = Timer.builder("ledger.run.duration")
                .description("Time taken to process a whole input")
                .register(registry);
    }

    public void recordApplied(EventType type) {
        registry.counter("ledger.events.applied", "type", tag(type.name())).increment();
        if (type == EventType.CHARGEBACK) {
            accountsFrozen.increment();
        }
    }

    public void recordRejected(EventType type, LedgerError error) {
        registry.counter("ledger.events.rejected",
                "type", tag(type.name()),
                "reason", tag(error.name())
        ).increment();
    }

    /**
     * Records a record dropped by the reader or the validator.
     */
    public void recordInvalid(String reason) {
        registry.counter("ledger.records.invalid", "reason", tag(reason)).increment();
    }

    public void recordRunDuration(Duration duration) {
        runTimer.record(duration);
    }

    public double appliedCount(EventType type) {
        return registry.counter("ledger.events.applied", "type", tag(type.name())).count();
    }

    public double rejectedCount(EventType type, LedgerError error) {
        return registry.counter("ledger.events.rejected",
                "type", tag(type.name()),
                "reason", tag(error.name())
        ).count();
    }

    private String tag(String value) {
        return value.toLowerCase();
    }
}
