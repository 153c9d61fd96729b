package com.fxhedge.observability;

import com.fxhedge.domain.enums.PricingMethod;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.function.Supplier;
import org.springframework.stereotype.Service;

/**
 * Pricing meters:
 * <ul>
 *   <li><b>pricing.legs.priced</b> (counter, tag {@code method}): legs priced, by the method
 *       that actually produced the price</li>
 *   <li><b>pricing.fallbacks</b> (counter): closed-form requests that had to be simulated</li>
 *   <li><b>montecarlo.duration</b> (timer): wall time of one simulation run</li>
 * </ul>
 */
@Service
public class PricingMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter fallbackCounter;
    private final Timer monteCarloTimer;

    public PricingMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.fallbackCounter = Counter.builder("pricing.fallbacks")
                .description("Closed-form pricing requests answered by Monte Carlo")
                .register(meterRegistry);

        this.monteCarloTimer = Timer.builder("montecarlo.duration")
                .description("Wall time of a Monte Carlo pricing run")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(30))
                .register(meterRegistry);
    }

    public void recordLegPriced(PricingMethod method) {
        Counter.builder("pricing.legs.priced")
                .description("Option legs priced, by pricing method")
                .tag("method", method.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordFallback() {
        fallbackCounter.increment();
    }

    public <T> T timeMonteCarlo(Supplier<T> run) {
        return monteCarloTimer.record(run);
    }
}
