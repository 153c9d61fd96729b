package com.fxhedge.payoff;

import com.fxhedge.core.engine.BarrierMonitor;
import com.fxhedge.domain.enums.BarrierType;
import com.fxhedge.domain.enums.HedgeSide;
import com.fxhedge.domain.enums.OptionKind;
import com.fxhedge.domain.model.MarketParams;
import com.fxhedge.domain.model.PayoffCurve;
import com.fxhedge.domain.model.PayoffPoint;
import com.fxhedge.domain.model.ResolvedLeg;
import com.fxhedge.domain.model.Strategy;
import com.fxhedge.domain.model.SweepConfig;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Expiry payoff of a strategy and the hedged-rate curve built from it.
 *
 * <p>Barrier legs are gated by a single-point test: the rate at expiry stands in for the whole
 * path, so a knock-out pays only if that rate is not through its barrier and a knock-in only
 * if it is. This is the usual display convention for payoff charts; prices always come from
 * the path-dependent pricers.
 *
 * <p>Stateless and thread-safe.
 */
@Slf4j
@Component
public class PayoffEvaluator {

    /** Signed payoff of one leg at the given spot, scaled by its quantity. */
    public double legPayoff(ResolvedLeg leg, double spot) {
        double intrinsic = leg.getKind().intrinsic(spot, leg.getStrike());
        BarrierType type = leg.getBarrierType();
        if (type.isBarrier()) {
            boolean hit = BarrierMonitor.forLeg(leg).isHit(spot);
            if (type.isKnockOut() == hit) {
                intrinsic = 0.0;
            }
        }
        return intrinsic * leg.quantityFactor();
    }

    public double payoffAtSpot(List<ResolvedLeg> legs, double spot) {
        double total = 0.0;
        for (ResolvedLeg leg : legs) {
            total += legPayoff(leg, spot);
        }
        return total;
    }

    public double payoffAtSpot(Strategy strategy, double spot, double initialSpot, double marketVolatility) {
        return payoffAtSpot(resolve(strategy, initialSpot, marketVolatility), spot);
    }

    public double hedgedRate(double spot, double payoff, HedgeSide side) {
        return side.hedgedRate(spot, payoff);
    }

    /**
     * Evaluates the strategy over {@code sweep.steps} evenly spaced spots covering
     * {@code [S0 (1 - w), S0 (1 + w)]}, both ends included.
     *
     * <p>The all-in rate is the hedged rate minus {@code totalPremium}, whatever the side.
     *
     * @param totalPremium net premium of the strategy per unit of notional (negative = received)
     */
    public PayoffCurve payoffCurve(
            Strategy strategy, MarketParams market, SweepConfig sweep, double totalPremium, HedgeSide side) {
        sweep.validate();
        double initialSpot = market.getSpot();
        List<ResolvedLeg> legs = resolve(strategy, initialSpot, market.getVolatility());
        Map<String, Double> references = Collections.unmodifiableMap(references(legs));

        double width = sweep.getWidthPct() / 100.0;
        double low = initialSpot * (1 - width);
        double high = initialSpot * (1 + width);
        double increment = (high - low) / (sweep.getSteps() - 1);

        List<PayoffPoint> points = new ArrayList<>(sweep.getSteps());
        for (int i = 0; i < sweep.getSteps(); i++) {
            double spot = i == sweep.getSteps() - 1 ? high : low + i * increment;
            double payoff = payoffAtSpot(legs, spot);
            double hedged = side.hedgedRate(spot, payoff);
            points.add(PayoffPoint.builder()
                    .spot(spot)
                    .unhedgedRate(spot)
                    .payoff(payoff)
                    .hedgedRateExcludingPremium(hedged)
                    .hedgedRateIncludingPremium(hedged - totalPremium)
                    .references(references)
                    .build());
        }

        log.debug(
                "Payoff curve for {}: {} points over [{}, {}], side={}",
                strategy.getName(),
                points.size(),
                low,
                high,
                side);

        return PayoffCurve.builder()
                .initialSpot(initialSpot)
                .totalPremium(totalPremium)
                .side(side)
                .points(points)
                .build();
    }

    private static List<ResolvedLeg> resolve(Strategy strategy, double initialSpot, double marketVolatility) {
        return strategy.getLegs().stream()
                .map(leg -> leg.resolve(initialSpot, marketVolatility))
                .toList();
    }

    /** Strike and barrier levels per leg, labelled "Leg 1 Call Strike", "Leg 2 Upper Barrier", ... */
    static Map<String, Double> references(List<ResolvedLeg> legs) {
        Map<String, Double> references = new LinkedHashMap<>();
        for (int i = 0; i < legs.size(); i++) {
            ResolvedLeg leg = legs.get(i);
            String prefix = "Leg " + (i + 1) + " ";
            String kind = leg.getKind() == OptionKind.CALL ? "Call" : "Put";
            references.put(prefix + kind + " Strike", leg.getStrike());
            if (leg.getBarrierType().isDouble()) {
                references.put(prefix + "Upper Barrier", leg.getUpperBarrier());
                references.put(prefix + "Lower Barrier", leg.getLowerBarrier());
            } else if (leg.getBarrierType().isBarrier()) {
                references.put(prefix + "Barrier", leg.singleBarrier());
            }
        }
        return references;
    }
}
