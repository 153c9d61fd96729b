package com.fxhedge.strategy;

import com.fxhedge.core.processor.ForwardCalculator;
import com.fxhedge.domain.enums.BarrierType;
import com.fxhedge.domain.enums.NamedStrategy;
import com.fxhedge.domain.enums.OptionKind;
import com.fxhedge.domain.model.Level;
import com.fxhedge.domain.model.MarketParams;
import com.fxhedge.domain.model.OptionLeg;
import com.fxhedge.domain.model.Strategy;
import com.fxhedge.domain.model.StrategyParams;
import com.fxhedge.exception.InvalidInputException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Expands a named template into its legs.
 *
 * <p>Templates are written for a buyer of the foreign currency: calls cap the purchase rate,
 * sold options finance the bought ones. Every template leg carries
 * the same quantity (params.quantity, 100 when absent).
 *
 * <p><b>Adding a template:</b> add the constant to {@link NamedStrategy}, then a case in
 * {@link #legsFor}. The switch is exhaustive, so the compiler flags a missing case.
 *
 * <p>Missing strikes or barriers, and legs that break their own invariants, are rejected here
 * with {@link InvalidInputException} rather than priced.
 */
@Component
public class StrategyResolver {

    private static final Logger log = LoggerFactory.getLogger(StrategyResolver.class);

    static final double DEFAULT_QUANTITY = 100.0;

    private final ForwardCalculator forwardCalculator;
    private final ZeroCostCollarSolver collarSolver;

    public StrategyResolver(ForwardCalculator forwardCalculator, ZeroCostCollarSolver collarSolver) {
        this.forwardCalculator = forwardCalculator;
        this.collarSolver = collarSolver;
    }

    /**
     * Builds the strategy for a template.
     *
     * @param name   template to expand
     * @param params strikes, barriers and quantity; which ones are required depends on the template
     * @param market validated market, used for the forward and the zero-cost solves
     * @return strategy whose legs all pass {@link OptionLeg#validate(double)}
     * @throws InvalidInputException if a required parameter is missing or a leg is invalid
     */
    public Strategy resolveStrategy(NamedStrategy name, StrategyParams params, MarketParams market) {
        if (name == null) {
            throw new InvalidInputException("Strategy name is required");
        }
        market.validate();
        StrategyParams p = params != null ? params : new StrategyParams();

        List<OptionLeg> legs = legsFor(name, p, market);
        for (OptionLeg leg : legs) {
            leg.validate(market.getSpot());
        }
        log.debug("Resolved strategy {} into {} legs", name, legs.size());
        return Strategy.builder().name(name).legs(legs).build();
    }

    private List<OptionLeg> legsFor(NamedStrategy name, StrategyParams p, MarketParams market) {
        double q = p.getQuantity() != null ? p.getQuantity() : DEFAULT_QUANTITY;
        double spot = market.getSpot();
        return switch (name) {
            case FORWARD -> {
                Level forward = Level.absolute(forwardCalculator.forward(
                        spot, market.getMaturity(), market.getDomesticRate(), market.getForeignRate()));
                yield List.of(vanilla(OptionKind.CALL, forward, q), vanilla(OptionKind.PUT, forward, -q));
            }
            case CALL -> List.of(vanilla(OptionKind.CALL, require(p.getStrikeUpper(), "strikeUpper", name), q));
            case PUT -> List.of(vanilla(OptionKind.PUT, require(p.getStrikeLower(), "strikeLower", name), q));
            case COLLAR -> List.of(
                    vanilla(OptionKind.CALL, require(p.getStrikeUpper(), "strikeUpper", name), q),
                    vanilla(OptionKind.PUT, require(p.getStrikeLower(), "strikeLower", name), -q));
            case COLLAR_PUT_FIXED -> {
                Level put = require(p.getStrikeLower(), "strikeLower", name);
                double callStrike = collarSolver.solveCallStrike(put.resolve(spot), market);
                yield List.of(
                        vanilla(OptionKind.PUT, put, -q), vanilla(OptionKind.CALL, Level.absolute(callStrike), q));
            }
            case COLLAR_CALL_FIXED -> {
                Level call = require(p.getStrikeUpper(), "strikeUpper", name);
                double putStrike = collarSolver.solvePutStrike(call.resolve(spot), market);
                yield List.of(
                        vanilla(OptionKind.CALL, call, q), vanilla(OptionKind.PUT, Level.absolute(putStrike), -q));
            }
            case STRANGLE -> List.of(
                    vanilla(OptionKind.CALL, require(p.getStrikeUpper(), "strikeUpper", name), q),
                    vanilla(OptionKind.PUT, require(p.getStrikeLower(), "strikeLower", name), q));
            case STRADDLE -> {
                Level mid = p.getStrikeMid() != null ? p.getStrikeMid() : Level.percent(100.0);
                yield List.of(vanilla(OptionKind.CALL, mid, q), vanilla(OptionKind.PUT, mid, q));
            }
            case SEAGULL -> List.of(
                    vanilla(OptionKind.PUT, require(p.getStrikeMid(), "strikeMid", name), q),
                    vanilla(OptionKind.CALL, require(p.getStrikeUpper(), "strikeUpper", name), -q),
                    vanilla(OptionKind.PUT, require(p.getStrikeLower(), "strikeLower", name), -q));
            case CALL_KO -> List.of(callKnockOut(p, q, name));
            case PUT_KI -> List.of(putKnockInAbove(p, q, name));
            case CALL_KO_PUT_KI -> List.of(callKnockOut(p, q, name), putKnockInBelow(p, q, name));
            case CUSTOM -> {
                if (p.getCustomLegs() == null || p.getCustomLegs().isEmpty()) {
                    throw new InvalidInputException(
                            "Custom strategy needs at least one leg", Map.of("customLegs", "is empty"));
                }
                yield new ArrayList<>(p.getCustomLegs());
            }
        };
    }

    private static OptionLeg vanilla(OptionKind kind, Level strike, double quantity) {
        return OptionLeg.builder().kind(kind).strike(strike).quantity(quantity).build();
    }

    private static OptionLeg callKnockOut(StrategyParams p, double quantity, NamedStrategy name) {
        return OptionLeg.builder()
                .kind(OptionKind.CALL)
                .barrierType(BarrierType.KNOCK_OUT)
                .strike(require(p.getStrikeUpper(), "strikeUpper", name))
                .upperBarrier(require(p.getBarrierUpper(), "barrierUpper", name))
                .quantity(quantity)
                .build();
    }

    /** Reverse put, activated once the rate trades up through barrierUpper. */
    private static OptionLeg putKnockInAbove(StrategyParams p, double quantity, NamedStrategy name) {
        return OptionLeg.builder()
                .kind(OptionKind.PUT)
                .barrierType(BarrierType.KNOCK_IN)
                .reverse(true)
                .strike(require(p.getStrikeLower(), "strikeLower", name))
                .upperBarrier(require(p.getBarrierUpper(), "barrierUpper", name))
                .quantity(quantity)
                .build();
    }

    /** Standard put, activated once the rate trades down through barrierLower. */
    private static OptionLeg putKnockInBelow(StrategyParams p, double quantity, NamedStrategy name) {
        return OptionLeg.builder()
                .kind(OptionKind.PUT)
                .barrierType(BarrierType.KNOCK_IN)
                .strike(require(p.getStrikeLower(), "strikeLower", name))
                .lowerBarrier(require(p.getBarrierLower(), "barrierLower", name))
                .quantity(quantity)
                .build();
    }

    private static Level require(Level level, String field, NamedStrategy name) {
        if (level == null) {
            throw new InvalidInputException(
                    name + " requires " + field, Map.of(field, "is required for " + name));
        }
        return level;
    }
}
