package com.fxhedge.domain.model;

import com.fxhedge.domain.enums.PricingMethod;
import lombok.Builder;
import lombok.Value;

/**
 * Premium of one leg plus what is needed to reproduce it: the resolved levels, the method
 * that actually priced it and, for simulated prices, the estimator's standard error.
 */
@Value
@Builder
public class LegPricing {

    ResolvedLeg leg;

    /** Price of one unit of notional, always >= 0. */
    double unitPrice;

    /** unitPrice x quantity / 100. Negative for sold legs (premium received). */
    double premium;

    PricingMethod method;

    /** True when the requested mode could not be honoured and Monte Carlo was used instead. */
    boolean fallback;

    /** Standard error of {@link #premium}. Null for closed-form prices. */
    Double standardError;

    /** Human-readable note on fallbacks or degenerate inputs. Null when pricing was clean. */
    String diagnostic;
}
