package com.fxhedge.core.engine;

import com.fxhedge.domain.model.MarketParams;
import com.fxhedge.domain.model.ResolvedLeg;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadLocalRandom;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.descriptive.AggregateSummaryStatistics;
import org.apache.commons.math3.stat.descriptive.StatisticalSummary;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Monte Carlo pricer for vanilla and barrier legs under geometric Brownian motion with
 * drift {@code r_d - r_f}.
 *
 * <p>Paths are split into fixed-size batches. Each batch owns a random stream seeded from the
 * request's master seed, runs on the pricing executor, and the batch statistics are merged in
 * batch order, so a given seed always yields the same estimate whatever the thread
 * scheduling.
 *
 * <p>The barrier is checked at inception and after every step. With the Brownian-bridge
 * correction on, the chance that the path touched the barrier between two monitoring dates is
 * sampled as well, so the estimate converges to the continuously monitored price. Knock-out
 * paths stop at the hit; knock-in paths run to maturity because the payoff needs the
 * terminal spot.
 *
 * <p>Invalid market inputs give a zero estimate and a warning; the engine never throws on
 * bad data.
 */
@Slf4j
@Component
public class MonteCarloEngine {

    private final RandomStreamFactory randomStreamFactory;
    private final Executor executor;
    private final MonteCarloProperties properties;

    public MonteCarloEngine(
            RandomStreamFactory randomStreamFactory,
            @Qualifier("pricingExecutor") Executor executor,
            MonteCarloProperties properties) {
        this.randomStreamFactory = randomStreamFactory;
        this.executor = executor;
        this.properties = properties;
    }

    /**
     * Builds a request from the configured defaults. Uses the configured seed, or a fresh one
     * when none is set.
     */
    public MonteCarloRequest defaultRequest(ResolvedLeg leg, MarketParams market) {
        long seed = properties.getSeed() != null
                ? properties.getSeed()
                : ThreadLocalRandom.current().nextLong();
        return MonteCarloRequest.builder()
                .leg(leg)
                .market(market)
                .paths(properties.getPaths())
                .stepsPerYear(properties.getStepsPerYear())
                .batchSize(properties.getBatchSize())
                .brownianBridge(properties.isBrownianBridge())
                .seed(seed)
                .build();
    }

    public MonteCarloEstimate price(ResolvedLeg leg, MarketParams market) {
        return price(defaultRequest(leg, market));
    }

    public MonteCarloEstimate price(MonteCarloRequest request) {
        ResolvedLeg leg = request.getLeg();
        MarketParams market = request.getMarket();
        if (!isSimulatable(request)) {
            return MonteCarloEstimate.empty(request.getSeed());
        }

        double maturity = market.getMaturity();
        double sigma = leg.getVolatility();
        int steps = request.steps();
        double dt = maturity / steps;
        PathSetup setup = new PathSetup(
                leg,
                BarrierMonitor.forLeg(leg),
                market.getSpot(),
                (market.getDomesticRate() - market.getForeignRate() - sigma * sigma / 2.0) * dt,
                sigma * Math.sqrt(dt),
                sigma * sigma * dt,
                steps,
                request.isBrownianBridge());

        int batchSize = Math.max(1, request.getBatchSize());
        int paths = request.getPaths();
        RandomGenerator seeder = randomStreamFactory.create(request.getSeed());
        List<CompletableFuture<BatchResult>> batches = new ArrayList<>();
        for (int start = 0; start < paths; start += batchSize) {
            int count = Math.min(batchSize, paths - start);
            long batchSeed = seeder.nextLong();
            batches.add(CompletableFuture.supplyAsync(() -> runBatch(setup, count, batchSeed), executor));
        }

        List<SummaryStatistics> statistics = new ArrayList<>(batches.size());
        long hits = 0;
        for (CompletableFuture<BatchResult> batch : batches) {
            BatchResult result = join(batch);
            statistics.add(result.statistics());
            hits += result.hits();
        }
        StatisticalSummary summary = AggregateSummaryStatistics.aggregate(statistics);

        double discount = Math.exp(-market.getDomesticRate() * maturity);
        double unitPrice = discount * summary.getMean();
        double unitError = discount * summary.getStandardDeviation() / Math.sqrt(summary.getN());
        double quantity = leg.quantityFactor();

        log.debug(
                "Monte Carlo {} {}: paths={}, steps={}, hits={}, unitPrice={}, se={}, seed={}",
                leg.getKind(),
                leg.getBarrierType(),
                paths,
                steps,
                hits,
                unitPrice,
                unitError,
                request.getSeed());

        return MonteCarloEstimate.builder()
                .unitPrice(unitPrice)
                .unitStandardError(unitError)
                .price(unitPrice * quantity)
                .standardError(unitError * Math.abs(quantity))
                .paths(paths)
                .steps(steps)
                .barrierHits(hits)
                .seed(request.getSeed())
                .build();
    }

    private boolean isSimulatable(MonteCarloRequest request) {
        ResolvedLeg leg = request.getLeg();
        MarketParams market = request.getMarket();
        if (!(market.getSpot() > 0)
                || !(market.getMaturity() > 0)
                || !(leg.getVolatility() > 0)
                || !(leg.getStrike() > 0)
                || request.getPaths() < 2) {
            log.warn(
                    "Monte Carlo {} priced at 0: spot={}, T={}, vol={}, strike={}, paths={}",
                    leg.getKind(),
                    market.getSpot(),
                    market.getMaturity(),
                    leg.getVolatility(),
                    leg.getStrike(),
                    request.getPaths());
            return false;
        }
        return true;
    }

    private BatchResult runBatch(PathSetup setup, int count, long seed) {
        GaussianSource gaussian = new GaussianSource(randomStreamFactory.create(seed));
        SummaryStatistics statistics = new SummaryStatistics();
        ResolvedLeg leg = setup.leg();
        BarrierMonitor monitor = setup.monitor();
        boolean knockOut = leg.getBarrierType().isKnockOut();
        boolean knockIn = leg.getBarrierType().isKnockIn();
        long hits = 0;

        for (int path = 0; path < count; path++) {
            double spot = setup.spot();
            boolean hit = monitor.isHit(spot);
            for (int step = 0; step < setup.steps(); step++) {
                if (hit && knockOut) {
                    break;
                }
                double next = spot * Math.exp(setup.drift() + setup.diffusion() * gaussian.next());
                if (!hit && monitor.isMonitored()) {
                    if (monitor.isHit(next)) {
                        hit = true;
                    } else if (setup.brownianBridge()) {
                        double p = monitor.crossingProbability(spot, next, setup.variance());
                        hit = p > 0 && gaussian.uniform() < p;
                    }
                }
                spot = next;
            }

            double payoff;
            if (knockOut) {
                payoff = hit ? 0.0 : leg.getKind().intrinsic(spot, leg.getStrike());
            } else if (knockIn) {
                payoff = hit ? leg.getKind().intrinsic(spot, leg.getStrike()) : 0.0;
            } else {
                payoff = leg.getKind().intrinsic(spot, leg.getStrike());
            }
            statistics.addValue(payoff);
            if (hit) {
                hits++;
            }
        }
        return new BatchResult(statistics, hits);
    }

    private static BatchResult join(CompletableFuture<BatchResult> batch) {
        try {
            return batch.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Monte Carlo batch failed", e.getCause());
        }
    }

    private record PathSetup(
            ResolvedLeg leg,
            BarrierMonitor monitor,
            double spot,
            double drift,
            double diffusion,
            double variance,
            int steps,
            boolean brownianBridge) {}

    private record BatchResult(SummaryStatistics statistics, long hits) {}

    /** Box-Muller normals; each pair of uniforms yields two draws. */
    private static final class GaussianSource {

        private final RandomGenerator random;
        private double spare;
        private boolean hasSpare;

        GaussianSource(RandomGenerator random) {
            this.random = random;
        }

        double next() {
            if (hasSpare) {
                hasSpare = false;
                return spare;
            }
            double u1 = 1.0 - random.nextDouble();
            double u2 = random.nextDouble();
            double radius = Math.sqrt(-2.0 * Math.log(u1));
            double angle = 2.0 * Math.PI * u2;
            spare = radius * Math.sin(angle);
            hasSpare = true;
            return radius * Math.cos(angle);
        }

        double uniform() {
            return random.nextDouble();
        }
    }
}
