package com.fxhedge.domain.enums;

/** Call or put. A call pays {@code max(0, spot - strike)}, a put {@code max(0, strike - spot)}. */
public enum OptionKind {
    CALL,
    PUT;

    /** Intrinsic value at the given spot. */
    public double intrinsic(double spot, double strike) {
        return this == CALL ? Math.max(0.0, spot - strike) : Math.max(0.0, strike - spot);
    }
}
