package com.fxhedge.core.engine;

import lombok.Builder;
import lombok.Value;

/**
 * Result of a simulation run. Unit figures are per unit of notional; {@link #price} and
 * {@link #standardError} are scaled by the leg's signed quantity.
 */
@Value
@Builder
public class MonteCarloEstimate {

    double unitPrice;
    double unitStandardError;
    double price;
    double standardError;
    int paths;
    int steps;

    /** Paths on which the barrier event fired. */
    long barrierHits;

    long seed;

    static MonteCarloEstimate empty(long seed) {
        return MonteCarloEstimate.builder().seed(seed).build();
    }
}
