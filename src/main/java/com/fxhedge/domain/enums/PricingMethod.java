package com.fxhedge.domain.enums;

/**
 * Method that actually priced a leg. Differs from the requested {@link PricingMode} when
 * no closed form covers the leg and the engine fell back to simulation.
 */
public enum PricingMethod {
    GARMAN_KOHLHAGEN,
    BARRIER_CLOSED_FORM,
    DOUBLE_BARRIER_CLOSED_FORM,
    MONTE_CARLO
}
