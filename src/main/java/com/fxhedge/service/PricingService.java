package com.fxhedge.service;

import com.fxhedge.config.PayoffProperties;
import com.fxhedge.core.engine.MonteCarloEngine;
import com.fxhedge.core.engine.MonteCarloEstimate;
import com.fxhedge.core.processor.BarrierPricer;
import com.fxhedge.core.processor.ForwardCalculator;
import com.fxhedge.core.processor.VanillaPricer;
import com.fxhedge.domain.enums.HedgeSide;
import com.fxhedge.domain.enums.NamedStrategy;
import com.fxhedge.domain.enums.OptionKind;
import com.fxhedge.domain.enums.PricingMethod;
import com.fxhedge.domain.enums.PricingMode;
import com.fxhedge.domain.model.LegPricing;
import com.fxhedge.domain.model.MarketParams;
import com.fxhedge.domain.model.OptionLeg;
import com.fxhedge.domain.model.PayoffCurve;
import com.fxhedge.domain.model.PricingResult;
import com.fxhedge.domain.model.ResolvedLeg;
import com.fxhedge.domain.model.Strategy;
import com.fxhedge.domain.model.StrategyParams;
import com.fxhedge.domain.model.SweepConfig;
import com.fxhedge.exception.InvalidInputException;
import com.fxhedge.observability.PricingMetricsService;
import com.fxhedge.payoff.PayoffEvaluator;
import com.fxhedge.strategy.StrategyResolver;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for pricing: validates inputs, routes every leg to the right pricer and
 * assembles strategy premiums and payoff curves.
 *
 * <p>Routing in {@link PricingMode#CLOSED_FORM}:
 * <ul>
 *   <li>vanilla legs: Garman-Kohlhagen</li>
 *   <li>single barriers (standard or reverse): Reiner-Rubinstein</li>
 *   <li>standard double barriers: Ikeda-Kunitomo</li>
 *   <li>reverse double barriers: no closed form, simulated and flagged as a fallback</li>
 * </ul>
 * {@link PricingMode#MONTE_CARLO} simulates every leg, vanilla ones included.
 *
 * <p>All validation happens here, before any pricer runs; the pricers below never throw.
 */
@Slf4j
@Service
public class PricingService {

    static final String REVERSE_DOUBLE_FALLBACK =
            "No closed form for reverse double barriers; priced by Monte Carlo";

    private final VanillaPricer vanillaPricer;
    private final BarrierPricer barrierPricer;
    private final ForwardCalculator forwardCalculator;
    private final MonteCarloEngine monteCarloEngine;
    private final PayoffEvaluator payoffEvaluator;
    private final StrategyResolver strategyResolver;
    private final PayoffProperties payoffProperties;
    private final PricingMetricsService metricsService;

    public PricingService(
            VanillaPricer vanillaPricer,
            BarrierPricer barrierPricer,
            ForwardCalculator forwardCalculator,
            MonteCarloEngine monteCarloEngine,
            PayoffEvaluator payoffEvaluator,
            StrategyResolver strategyResolver,
            PayoffProperties payoffProperties,
            PricingMetricsService metricsService) {
        this.vanillaPricer = vanillaPricer;
        this.barrierPricer = barrierPricer;
        this.forwardCalculator = forwardCalculator;
        this.monteCarloEngine = monteCarloEngine;
        this.payoffEvaluator = payoffEvaluator;
        this.strategyResolver = strategyResolver;
        this.payoffProperties = payoffProperties;
        this.metricsService = metricsService;
    }

    /** Garman-Kohlhagen price of one unit of notional. */
    public double priceVanilla(OptionKind kind, double strike, MarketParams market) {
        if (kind == null) {
            throw new InvalidInputException("Option kind is required");
        }
        market.validate();
        if (!(strike > 0)) {
            throw new InvalidInputException("Strike must be positive", Map.of("strike", strike));
        }
        double price = vanillaPricer.price(
                kind,
                market.getSpot(),
                strike,
                market.getMaturity(),
                market.getDomesticRate(),
                market.getForeignRate(),
                market.getVolatility());
        metricsService.recordLegPriced(PricingMethod.GARMAN_KOHLHAGEN);
        return price;
    }

    /** Outright forward. Only spot, rates and maturity are read; volatility may be absent. */
    public double forward(MarketParams market) {
        if (!(market.getSpot() > 0)
                || !(market.getMaturity() >= 0)
                || !Double.isFinite(market.getDomesticRate())
                || !Double.isFinite(market.getForeignRate())) {
            throw new InvalidInputException(
                    "Invalid forward inputs",
                    Map.of(
                            "spot", market.getSpot(),
                            "maturity", market.getMaturity(),
                            "domesticRate", market.getDomesticRate(),
                            "foreignRate", market.getForeignRate()));
        }
        return forwardCalculator.forward(
                market.getSpot(), market.getMaturity(), market.getDomesticRate(), market.getForeignRate());
    }

    public Strategy resolveStrategy(NamedStrategy name, StrategyParams params, MarketParams market) {
        return strategyResolver.resolveStrategy(name, params, market);
    }

    /**
     * Prices a barrier leg.
     *
     * @throws InvalidInputException if the leg has no barrier or breaks a leg invariant
     */
    public LegPricing priceBarrier(OptionLeg leg, MarketParams market, PricingMode mode) {
        if (leg == null || !leg.effectiveBarrierType().isBarrier()) {
            throw new InvalidInputException("Leg has no barrier", Map.of("barrierType", "is NONE"));
        }
        return priceLeg(leg, market, mode);
    }

    /** Prices any leg, vanilla or barrier, in the requested mode. */
    public LegPricing priceLeg(OptionLeg leg, MarketParams market, PricingMode mode) {
        requireMode(mode);
        market.validate();
        if (leg == null) {
            throw new InvalidInputException("Leg is required");
        }
        leg.validate(market.getSpot());
        return price(leg.resolve(market.getSpot(), market.getVolatility()), market, mode);
    }

    /**
     * Prices every leg and sums the signed premiums. Legs are priced in order; the result keeps
     * that order.
     */
    public PricingResult priceStrategy(Strategy strategy, MarketParams market, PricingMode mode) {
        requireMode(mode);
        market.validate();
        List<OptionLeg> legs = requireLegs(strategy);
        for (OptionLeg leg : legs) {
            leg.validate(market.getSpot());
        }

        List<LegPricing> pricings = new ArrayList<>(legs.size());
        double total = 0.0;
        for (OptionLeg leg : legs) {
            LegPricing pricing = price(leg.resolve(market.getSpot(), market.getVolatility()), market, mode);
            pricings.add(pricing);
            total += pricing.getPremium();
        }
        log.debug("Priced {} ({} legs, mode={}): total premium {}", strategy.getName(), legs.size(), mode, total);
        return PricingResult.builder()
                .requestedMode(mode)
                .legs(pricings)
                .totalPremium(total)
                .build();
    }

    /**
     * Prices the strategy, then evaluates its hedged-rate curve with that premium.
     *
     * @param sweep null = configured default sweep
     * @param side  null = {@link HedgeSide#BUY_FOREIGN}
     */
    public PayoffCurve evaluatePayoffCurve(
            Strategy strategy, MarketParams market, SweepConfig sweep, HedgeSide side, PricingMode mode) {
        SweepConfig effectiveSweep = sweep != null ? sweep : payoffProperties.defaultSweep();
        effectiveSweep.validate();
        PricingResult pricing = priceStrategy(strategy, market, mode);
        return payoffEvaluator.payoffCurve(
                strategy,
                market,
                effectiveSweep,
                pricing.getTotalPremium(),
                side != null ? side : HedgeSide.BUY_FOREIGN);
    }

    private LegPricing price(ResolvedLeg leg, MarketParams market, PricingMode mode) {
        if (mode == PricingMode.MONTE_CARLO) {
            return simulate(leg, market, false, null);
        }
        if (leg.getBarrierType().isDouble() && leg.isReverse()) {
            log.warn(
                    "{} {} at [{}, {}]: {}",
                    leg.getKind(),
                    leg.getBarrierType(),
                    leg.getLowerBarrier(),
                    leg.getUpperBarrier(),
                    REVERSE_DOUBLE_FALLBACK);
            metricsService.recordFallback();
            return simulate(leg, market, true, REVERSE_DOUBLE_FALLBACK);
        }

        double unitPrice;
        PricingMethod method;
        if (leg.isVanilla()) {
            unitPrice = vanillaPricer.price(
                    leg.getKind(),
                    market.getSpot(),
                    leg.getStrike(),
                    market.getMaturity(),
                    market.getDomesticRate(),
                    market.getForeignRate(),
                    leg.getVolatility());
            method = PricingMethod.GARMAN_KOHLHAGEN;
        } else if (leg.getBarrierType().isDouble()) {
            unitPrice = barrierPricer.priceDouble(
                    leg.getKind(),
                    leg.getBarrierType().isKnockIn(),
                    market.getSpot(),
                    leg.getStrike(),
                    leg.getLowerBarrier(),
                    leg.getUpperBarrier(),
                    market.getMaturity(),
                    market.getDomesticRate(),
                    market.getForeignRate(),
                    leg.getVolatility());
            method = PricingMethod.DOUBLE_BARRIER_CLOSED_FORM;
        } else {
            unitPrice = barrierPricer.priceSingle(
                    BarrierPricer.flagFor(leg.getKind(), leg.getBarrierType(), leg.isReverse()),
                    market.getSpot(),
                    leg.getStrike(),
                    leg.singleBarrier(),
                    market.getMaturity(),
                    market.getDomesticRate(),
                    market.getForeignRate(),
                    leg.getVolatility());
            method = PricingMethod.BARRIER_CLOSED_FORM;
        }
        metricsService.recordLegPriced(method);
        return LegPricing.builder()
                .leg(leg)
                .unitPrice(unitPrice)
                .premium(unitPrice * leg.quantityFactor())
                .method(method)
                .build();
    }

    private LegPricing simulate(ResolvedLeg leg, MarketParams market, boolean fallback, String diagnostic) {
        MonteCarloEstimate estimate = metricsService.timeMonteCarlo(() -> monteCarloEngine.price(leg, market));
        metricsService.recordLegPriced(PricingMethod.MONTE_CARLO);
        return LegPricing.builder()
                .leg(leg)
                .unitPrice(estimate.getUnitPrice())
                .premium(estimate.getPrice())
                .method(PricingMethod.MONTE_CARLO)
                .fallback(fallback)
                .standardError(estimate.getStandardError())
                .diagnostic(diagnostic)
                .build();
    }

    private static void requireMode(PricingMode mode) {
        if (mode == null) {
            throw new InvalidInputException("Pricing mode is required", Map.of("mode", "is required"));
        }
    }

    private static List<OptionLeg> requireLegs(Strategy strategy) {
        if (strategy == null || strategy.getLegs() == null || strategy.getLegs().isEmpty()) {
            throw new InvalidInputException("Strategy needs at least one leg", Map.of("legs", "is empty"));
        }
        return strategy.getLegs();
    }
}
