package com.adaptiverisk.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;

/**
 * Registers common tags applied to all metrics so that custom counters from
 * {@link com.adaptiverisk.observability.EngineMetricsService} and the auto-configured
 * JVM/HTTP metrics share the same application dimension.
 */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    public MetricsConfig(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void configureCommonTags() {
        meterRegistry.config().commonTags("application", "adaptive-risk-engine");
    }
}
