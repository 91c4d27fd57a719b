package com.flagship.payment_processor.config;

import com.flagship.payment_processor.store.InMemoryTransactionStore;
import com.flagship.payment_processor.store.TransactionStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Scope;

/**
 * Wiring for the ledger.
 *
 * The transaction store is prototype-scoped: every run asks for a fresh store and hands
 * that one instance to all of its clients.
 */
@Configuration
@EnableConfigurationProperties(ProcessorProperties.class)
public class ProcessorConfig {

    @Bean
    @Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
    public TransactionStore transactionStore() {
        return new InMemoryTransactionStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
