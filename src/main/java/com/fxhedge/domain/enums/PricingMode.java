package com.fxhedge.domain.enums;

/**
 * Pricing method requested by the caller. Passed explicitly on every pricing call; the
 * engine keeps no process-wide selector.
 */
public enum PricingMode {
    CLOSED_FORM,
    MONTE_CARLO
}
