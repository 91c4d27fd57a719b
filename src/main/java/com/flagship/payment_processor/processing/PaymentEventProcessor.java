package com.flagship.payment_processor.processing;

import com.flagship.payment_processor.config.ProcessorProperties;
import com.flagship.payment_processor.event.Event;
import com.flagship.payment_processor.event.EventValidator;
import com.flagship.payment_processor.event.InvalidRecordException;
import com.flagship.payment_processor.event.PaymentRecord;
import com.flagship.payment_processor.io.MalformedRecordException;
import com.flagship.payment_processor.io.RecordReader;
import com.flagship.payment_processor.ledger.Client;
import com.flagship.payment_processor.ledger.Ledger;
import com.flagship.payment_processor.ledger.LedgerException;
import com.flagship.payment_processor.observability.EventLogContext;
import com.flagship.payment_processor.observability.LedgerMetrics;
import com.flagship.payment_processor.store.TransactionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Drives one run: reads records, validates them, applies events to a fresh {@link Ledger}
 * and collects the final balances.
 *
 * Failures are per record:
 * - malformed rows and invalid records never reach the ledger
 * - ledger rule violations leave the ledger untouched
 * - any other failure while applying an event is counted as {@code INTERNAL_ERROR}
 * Either way the record is logged, counted and skipped, and the run continues.
 * Only I/O failures on the input abort a run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentEventProcessor {

    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final RecordReader recordReader;
    private final EventValidator eventValidator;
    private final ObjectProvider<TransactionStore> transactionStores;
    private final LedgerMetrics metrics;
    private final ProcessorProperties properties;

    /**
     * Processes every record of a CSV input.
     *
     * @param input CSV with a {@code type,client,tx,amount} header; closed when done
     * @return final balances and counts for the run
     */
    public ProcessingReport process(Reader input) {
        long startedAt = System.nanoTime();
        Ledger ledger = new Ledger(transactionStores.getObject());
        RunCounters counters = new RunCounters();

        EventDispatcher dispatcher = new EventDispatcher(properties.getWorkers());
        try (dispatcher; RecordReader.RecordCursor records = recordReader.open(input)) {
            while (records.hasNext()) {
                counters.recordsRead.increment();
                readEvent(records, counters).ifPresent(event ->
                    dispatcher.dispatch(event.getClientId(), () -> apply(ledger, event, counters)));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close CSV input", e);
        }
        counters.reject(INTERNAL_ERROR, dispatcher.getFailureCount());

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
        metrics.recordRunDuration(elapsed);

        ProcessingReport report = new ProcessingReport(
            ledger.balances(),
            counters.recordsRead.sum(),
            counters.eventsApplied.sum(),
            ledger.transactionCount(),
            counters.snapshot()
        );
        log.info("Processed {} records in {} ms: {} applied, {} rejected, {} clients, {} transactions",
            report.getRecordsRead(), elapsed.toMillis(), report.getEventsApplied(),
            report.getRejectedCount(), ledger.clientCount(), report.getTransactionsTracked());
        return report;
    }

    private Optional<Event> readEvent(RecordReader.RecordCursor records, RunCounters counters) {
        try {
            return Optional.of(eventValidator.validate(records.next()));
        } catch (MalformedRecordException e) {
            log.warn("Skipping malformed record: {}", e.getMessage());
            counters.reject("MALFORMED_RECORD");
            metrics.recordInvalid("MALFORMED_RECORD");
        } catch (InvalidRecordException e) {
            log.warn("Skipping invalid record {}: {}", describe(e.getRecord()), e.getMessage());
            counters.reject(e.getReason().name());
            metrics.recordInvalid(e.getReason().name());
        }
        return Optional.empty();
    }

    private void apply(Ledger ledger, Event event, RunCounters counters) {
        try (EventLogContext ignored = EventLogContext.open(event)) {
            try {
                Client client = ledger.apply(event);
                counters.eventsApplied.increment();
                metrics.recordApplied(event.getType());
                if (client.isLocked()) {
                    log.info("Account {} frozen by {}", client.getId(), event);
                } else {
                    log.debug("Applied {}", event);
                }
            } catch (LedgerException e) {
                log.warn("Rejected {}", e.getMessage());
                counters.reject(e.getError().name());
                metrics.recordRejected(event.getType(), e.getError());
            }
        }
    }

    private static String describe(PaymentRecord record) {
        return String.format("(type=%s, client=%s, tx=%s, amount=%s)",
            record.getType(), record.getClient(), record.getTx(), record.getAmount());
    }

    private static class RunCounters {
        private final LongAdder recordsRead = new LongAdder();
        private final LongAdder eventsApplied = new LongAdder();
        private final ConcurrentMap<String, LongAdder> rejections = new ConcurrentHashMap<>();

        void reject(String reason) {
            rejections.computeIfAbsent(reason, r -> new LongAdder()).increment();
        }

        void reject(String reason, long count) {
            if (count > 0) {
                rejections.computeIfAbsent(reason, r -> new LongAdder()).add(count);
            }
        }

        Map<String, Long> snapshot() {
            Map<String, Long> counts = new TreeMap<>();
            rejections.forEach((reason, count) -> counts.put(reason, count.sum()));
            return counts;
        }
    }
}
