package com.fxhedge.domain.model;

import com.fxhedge.domain.enums.PricingMode;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Premiums of every leg of a strategy and their signed sum. */
@Value
@Builder
public class PricingResult {

    PricingMode requestedMode;
    List<LegPricing> legs;

    /** Sum of signed leg premiums, as a fraction of notional. Negative = net premium received. */
    double totalPremium;

    public boolean anyFallback() {
        return legs.stream().anyMatch(LegPricing::isFallback);
    }
}
