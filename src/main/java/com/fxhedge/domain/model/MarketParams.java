package com.fxhedge.domain.model;

import com.fxhedge.exception.InvalidInputException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Market inputs for one pricing request. Rates and volatility are decimals (0.02 = 2%),
 * maturity is in years. Nothing is defaulted: every field must be supplied by the caller.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MarketParams {

    /** Spot rate, units of domestic currency per unit of foreign currency. */
    private double spot;

    /** Domestic (quote currency) continuously compounded rate, r1. */
    private double domesticRate;

    /** Foreign (base currency) continuously compounded rate, r2. */
    private double foreignRate;

    /** Annualized volatility. */
    private double volatility;

    /** Time to maturity in years. */
    private double maturity;

    /** Cost of carry b = r_domestic - r_foreign. */
    public double costOfCarry() {
        return domesticRate - foreignRate;
    }

    /**
     * Rejects inputs no pricer can work with.
     *
     * @throws InvalidInputException if spot, volatility or maturity is not strictly positive
     *     or any field is not a finite number
     */
    public MarketParams validate() {
        Map<String, Object> violations = new LinkedHashMap<>();
        requirePositive(violations, "spot", spot);
        requirePositive(violations, "volatility", volatility);
        requirePositive(violations, "maturity", maturity);
        requireFinite(violations, "domesticRate", domesticRate);
        requireFinite(violations, "foreignRate", foreignRate);
        if (!violations.isEmpty()) {
            throw new InvalidInputException("Invalid market parameters", violations);
        }
        return this;
    }

    private static void requirePositive(Map<String, Object> violations, String field, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            violations.put(field, "must be a finite number greater than 0, got " + value);
        }
    }

    private static void requireFinite(Map<String, Object> violations, String field, double value) {
        if (!Double.isFinite(value)) {
            violations.put(field, "must be a finite number, got " + value);
        }
    }
}
