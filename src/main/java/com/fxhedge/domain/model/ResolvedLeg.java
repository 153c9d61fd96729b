package com.fxhedge.domain.model;

import com.fxhedge.domain.enums.BarrierType;
import com.fxhedge.domain.enums.OptionKind;
import lombok.Builder;
import lombok.Value;

/**
 * An {@link OptionLeg} with every level in absolute terms and its effective volatility.
 * This is what the pricers and the payoff evaluator consume.
 */
@Value
@Builder(toBuilder = true)
public class ResolvedLeg {

    OptionKind kind;
    BarrierType barrierType;
    boolean reverse;
    double strike;

    /** Upper level of a double barrier, or a single barrier entered as "upper". */
    Double upperBarrier;

    /** Lower level of a double barrier, or a single barrier entered as "lower". */
    Double lowerBarrier;

    double volatility;

    /** Signed percentage of notional. */
    double quantity;

    /** Quantity as a signed fraction of notional (100 -> 1.0, -50 -> -0.5). */
    public double quantityFactor() {
        return quantity / 100.0;
    }

    public boolean isVanilla() {
        return !barrierType.isBarrier();
    }

    /** Level of a single barrier, whichever field it was entered in. */
    public double singleBarrier() {
        return upperBarrier != null ? upperBarrier : lowerBarrier;
    }

    /**
     * True when the knock level is hit by spot moving up: standard calls and reverse puts.
     * Meaningless for double barriers.
     */
    public boolean isUpBarrier() {
        return (kind == OptionKind.CALL) != reverse;
    }
}
