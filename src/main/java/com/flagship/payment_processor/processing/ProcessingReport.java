package com.flagship.payment_processor.processing;

import com.flagship.payment_processor.ledger.ClientBalance;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one run: final balances plus counts of what happened to each record.
 */
@Value
public class ProcessingReport {
    List<ClientBalance> balances;
    long recordsRead;
    long eventsApplied;
    long transactionsTracked;

    /**
     * Rejected records keyed by reason (invalid record reasons and ledger errors alike).
     */
    Map<String, Long> rejections;

    public long getRejectedCount() {
        return rejections.values().stream().mapToLong(Long::longValue).sum();
    }
}
