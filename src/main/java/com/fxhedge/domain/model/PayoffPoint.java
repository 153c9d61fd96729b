package com.fxhedge.domain.model;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** One spot level of a payoff curve. */
@Value
@Builder
public class PayoffPoint {

    double spot;
    double unhedgedRate;
    double hedgedRateExcludingPremium;
    double hedgedRateIncludingPremium;

    /** Aggregate signed strategy payoff at this spot. */
    double payoff;

    /** Resolved strikes and barriers of each leg, keyed by display label, in leg order. */
    Map<String, Double> references;
}
