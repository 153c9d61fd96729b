package com.fxhedge.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.fxhedge.domain.enums.PricingMethod;
import com.fxhedge.observability.PricingMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PricingMetricsServiceTest {

    private SimpleMeterRegistry registry;
    private PricingMetricsService metricsService;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metricsService = new PricingMetricsService(registry);
    }

    @Test
    @DisplayName("Legs priced are counted per method")
    void legsPerMethod() {
        metricsService.recordLegPriced(PricingMethod.GARMAN_KOHLHAGEN);
        metricsService.recordLegPriced(PricingMethod.GARMAN_KOHLHAGEN);
        metricsService.recordLegPriced(PricingMethod.BARRIER_CLOSED_FORM);

        assertThat(registry.get("pricing.legs.priced").tag("method", "GARMAN_KOHLHAGEN").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("pricing.legs.priced").tag("method", "BARRIER_CLOSED_FORM").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Fallback counter starts at zero and increments")
    void fallbacks() {
        assertThat(registry.get("pricing.fallbacks").counter().count()).isZero();

        metricsService.recordFallback();

        assertThat(registry.get("pricing.fallbacks").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Monte Carlo timer records the run and passes its result through")
    void timer() {
        String result = metricsService.timeMonteCarlo(() -> "done");

        assertThat(result).isEqualTo("done");
        assertThat(registry.get("montecarlo.duration").timer().count()).isEqualTo(1L);
    }
}
