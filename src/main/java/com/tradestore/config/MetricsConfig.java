package com.tradestore.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;

/**
 * Micrometer metrics configuration.
 *
 * <p>Registers the common {@code application} tag so auto-configured and custom meters share
 * one dimension. Record counters live in {@link com.tradestore.observability.RecordMetrics}.
 */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    public MetricsConfig(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void configureCommonTags() {
        meterRegistry.config().commonTags("application", "tradestore");
    }
}
