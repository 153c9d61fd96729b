package com.fxhedge.core.processor;

import com.fxhedge.domain.enums.OptionKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Garman-Kohlhagen pricer for European FX options.
 *
 * <p>Black-Scholes with the foreign rate playing the role of a continuous dividend yield:
 * <pre>
 *   call = S e^(-r_f T) N(d1) - K e^(-r_d T) N(d2)
 *   put  = K e^(-r_d T) N(-d2) - S e^(-r_f T) N(-d1)
 *   d1 = (ln(S/K) + (r_d - r_f + sigma^2/2) T) / (sigma sqrt(T)),  d2 = d1 - sigma sqrt(T)
 * </pre>
 *
 * <p>Maturity and volatility are floored at 1e-10 so expiring or zero-vol legs collapse to
 * their discounted intrinsic value instead of dividing by zero. Non-positive spot or strike
 * is logged and priced at 0; this class never throws, so a single bad point cannot abort a
 * whole payoff sweep.
 *
 * <p>This class is stateless and thread-safe.
 */
@Slf4j
@Component
public class VanillaPricer {

    static final double MIN_TIME_OR_VOL = 1e-10;

    /**
     * Premium of one unit of foreign notional, in domestic currency.
     *
     * @param kind         call or put
     * @param spot         spot rate
     * @param strike       strike rate
     * @param maturity     years to expiry
     * @param domesticRate r_d as a decimal
     * @param foreignRate  r_f as a decimal
     * @param volatility   annualized volatility as a decimal
     * @return premium, never negative
     */
    public double price(
            OptionKind kind,
            double spot,
            double strike,
            double maturity,
            double domesticRate,
            double foreignRate,
            double volatility) {
        if (!(spot > 0) || !(strike > 0)) {
            log.warn("Vanilla {} priced at 0: spot={} and strike={} must be positive", kind, spot, strike);
            return 0.0;
        }
        double t = Math.max(maturity, MIN_TIME_OR_VOL);
        double sigma = Math.max(volatility, MIN_TIME_OR_VOL);

        double d1 = d1(spot, strike, t, domesticRate, foreignRate, sigma);
        double d2 = d2(d1, t, sigma);
        double foreignDf = Math.exp(-foreignRate * t);
        double domesticDf = Math.exp(-domesticRate * t);

        double price =
                switch (kind) {
                    case CALL -> spot * foreignDf * NormalCdf.cdf(d1) - strike * domesticDf * NormalCdf.cdf(d2);
                    case PUT -> strike * domesticDf * NormalCdf.cdf(-d2) - spot * foreignDf * NormalCdf.cdf(-d1);
                };
        return Math.max(0.0, price);
    }

    public double d1(double spot, double strike, double maturity, double domesticRate, double foreignRate, double volatility) {
        return (Math.log(spot / strike) + (domesticRate - foreignRate + volatility * volatility / 2.0) * maturity)
                / (volatility * Math.sqrt(maturity));
    }

    public double d2(double d1, double maturity, double volatility) {
        return d1 - volatility * Math.sqrt(maturity);
    }
}
