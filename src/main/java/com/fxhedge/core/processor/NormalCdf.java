package com.fxhedge.core.processor;

/**
 * Standard normal cumulative distribution function.
 *
 * <p>Uses the Abramowitz-Stegun 7.1.26 rational approximation of erf evaluated at
 * {@code |x| / sqrt(2)}. Maximum absolute error is below 1e-7 over the whole real line, and
 * {@code cdf(-x) == 1 - cdf(x)} holds exactly because negative arguments are handled by
 * reflection.
 *
 * <p>Stateless and thread-safe.
 */
public final class NormalCdf {

    private static final double P = 0.3275911;
    private static final double A1 = 0.254829592;
    private static final double A2 = -0.284496736;
    private static final double A3 = 1.421413741;
    private static final double A4 = -1.453152027;
    private static final double A5 = 1.061405429;

    private static final double SQRT_2 = Math.sqrt(2.0);

    private NormalCdf() {}

    /**
     * P(Z &lt;= x) for a standard normal Z. Infinite arguments map to 0 and 1; NaN stays NaN.
     */
    public static double cdf(double x) {
        if (Double.isNaN(x)) {
            return Double.NaN;
        }
        double z = Math.abs(x) / SQRT_2;
        double t = 1.0 / (1.0 + P * z);
        double poly = ((((A5 * t + A4) * t + A3) * t + A2) * t + A1) * t;
        double erf = 1.0 - poly * Math.exp(-z * z);
        return x < 0 ? 0.5 * (1.0 - erf) : 0.5 * (1.0 + erf);
    }
}
