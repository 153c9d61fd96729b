package com.fxhedge.domain.model;

import com.fxhedge.domain.enums.BarrierType;
import com.fxhedge.domain.enums.OptionKind;
import com.fxhedge.exception.InvalidInputException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single instrument of a hedging strategy, as entered by the user.
 *
 * <p>Quantity sign convention: positive = bought (long), negative = sold (short). The value
 * is a percentage of the notional, so 100 hedges the full amount and -50 sells half of it.
 *
 * <p>A single barrier may be given in either {@link #upperBarrier} or {@link #lowerBarrier};
 * the field only labels it. Which side of spot it guards comes from the option kind and the
 * {@link #reverse} flag: a standard call is knocked above spot, a standard put below, and
 * reverse flips both. Double barriers use both levels.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OptionLeg {

    private OptionKind kind;

    @Builder.Default
    private BarrierType barrierType = BarrierType.NONE;

    /** Barrier sits on the opposite side of spot from the standard convention. */
    private boolean reverse;

    private Level strike;

    private Level upperBarrier;

    private Level lowerBarrier;

    /** Leg-specific volatility (decimal). Null = use the market volatility. */
    private Double volatility;

    /** Signed percentage of notional. */
    @Builder.Default
    private double quantity = 100.0;

    public BarrierType effectiveBarrierType() {
        return barrierType != null ? barrierType : BarrierType.NONE;
    }

    /**
     * Checks the structural invariants of the leg against the initial spot.
     *
     * @throws InvalidInputException if the kind or strike is missing, a level is not
     *     positive, a barrier leg lacks its level(s), a double barrier is not lower &lt; upper,
     *     the volatility override is not positive, or the quantity is zero
     */
    public OptionLeg validate(double initialSpot) {
        Map<String, Object> violations = new LinkedHashMap<>();
        if (kind == null) {
            violations.put("kind", "is required");
        }
        if (strike == null) {
            violations.put("strike", "is required");
        } else if (!(strike.resolve(initialSpot) > 0)) {
            violations.put("strike", "must resolve to a positive level");
        }
        BarrierType type = effectiveBarrierType();
        if (type.isDouble()) {
            if (upperBarrier == null || lowerBarrier == null) {
                violations.put("barrier", "double barriers need both upper and lower levels");
            } else {
                double upper = upperBarrier.resolve(initialSpot);
                double lower = lowerBarrier.resolve(initialSpot);
                if (!(lower > 0) || !(lower < upper)) {
                    violations.put("barrier", "need 0 < lower < upper, got lower=" + lower + ", upper=" + upper);
                }
            }
        } else if (type.isBarrier()) {
            Level level = upperBarrier != null ? upperBarrier : lowerBarrier;
            if (level == null) {
                violations.put("barrier", "is required for " + type);
            } else if (!(level.resolve(initialSpot) > 0)) {
                violations.put("barrier", "must resolve to a positive level");
            }
        }
        if (volatility != null && !(volatility > 0)) {
            violations.put("volatility", "override must be greater than 0");
        }
        if (!Double.isFinite(quantity) || quantity == 0.0) {
            violations.put("quantity", "must be a finite, non-zero number");
        }
        if (!violations.isEmpty()) {
            throw new InvalidInputException("Invalid option leg", violations);
        }
        return this;
    }

    /**
     * Converts percentage levels to absolute ones and fixes the volatility for this leg.
     *
     * @param initialSpot      spot used to scale percentage strikes and barriers
     * @param marketVolatility fallback volatility when the leg has no override
     */
    public ResolvedLeg resolve(double initialSpot, double marketVolatility) {
        BarrierType type = effectiveBarrierType();
        return ResolvedLeg.builder()
                .kind(kind)
                .barrierType(type)
                .reverse(reverse)
                .strike(strike.resolve(initialSpot))
                .upperBarrier(type.isBarrier() && upperBarrier != null ? upperBarrier.resolve(initialSpot) : null)
                .lowerBarrier(type.isBarrier() && lowerBarrier != null ? lowerBarrier.resolve(initialSpot) : null)
                .volatility(volatility != null ? volatility : marketVolatility)
                .quantity(quantity)
                .build();
    }
}
