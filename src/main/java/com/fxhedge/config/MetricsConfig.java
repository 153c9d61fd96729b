package com.fxhedge.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;

/**
 * Adds the {@code application} tag to every meter so pricing metrics can be told apart from
 * other services in a shared registry. The pricing meters themselves live in
 * {@link com.fxhedge.observability.PricingMetricsService}.
 */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    public MetricsConfig(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void configureCommonTags() {
        meterRegistry.config().commonTags("application", "fx-hedge-pricer");
    }
}
