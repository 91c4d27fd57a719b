package com.flagship.payment_processor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Processor settings, bound from the {@code processor.*} properties.
 */
@Data
@ConfigurationProperties(prefix = "processor")
public class ProcessorProperties {

    /**
     * Number of lanes events are partitioned into by client id. 1 applies events inline.
     */
    private int workers = 1;

    /**
     * Decimal places used when writing amounts to the balance report.
     */
    private int amountScale = 4;

    /**
     * Print rejected records and the run summary to stderr.
     */
    private boolean verbose = false;
}
