package com.fxhedge.core.processor;

import com.fxhedge.domain.enums.BarrierType;
import com.fxhedge.domain.enums.OptionKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Closed-form prices for continuously monitored barrier options on an FX rate.
 *
 * <p>Single barriers use the Reiner-Rubinstein formulas in Haug's f1..f6 notation with cost of
 * carry {@code b = r_d - r_f}:
 * <pre>
 *   mu = (b - sigma^2/2) / sigma^2,   lambda = sqrt(mu^2 + 2 r_d / sigma^2)
 *   x1 = ln(S/K)/(sigma sqrt T) + (1 + mu) sigma sqrt T      x2 = same with H in place of K
 *   y1 = ln(H^2/(S K))/(sigma sqrt T) + (1 + mu) sigma sqrt T y2 = ln(H/S)/(sigma sqrt T) + (1 + mu) sigma sqrt T
 *   z  = ln(H/S)/(sigma sqrt T) + lambda sigma sqrt T
 * </pre>
 * with eta = +1 for down barriers and -1 for up barriers, phi = +1 for calls and -1 for puts.
 * f5 and f6 carry the rebate paid at expiry (knock-in not triggered) or at the hit (knock-out).
 *
 * <p>Double knock-outs use the Ikeda-Kunitomo series with flat boundaries, truncated at
 * n = -5..5; knock-ins follow from in + out = vanilla.
 *
 * <p>Degenerate inputs (non-positive levels, maturity or volatility, lower &gt;= upper) are
 * logged and priced at 0. Every result is floored at 0.
 *
 * <p>This class is stateless and thread-safe.
 */
@Slf4j
@Component
public class BarrierPricer {

    static final int SERIES_TERMS = 5;

    private final VanillaPricer vanillaPricer;

    public BarrierPricer(VanillaPricer vanillaPricer) {
        this.vanillaPricer = vanillaPricer;
    }

    /**
     * Maps a leg onto the single-barrier table. A standard call is knocked by an up barrier,
     * a standard put by a down barrier; {@code reverse} swaps the side.
     *
     * @throws IllegalArgumentException for vanilla or double-barrier types
     */
    public static BarrierFlag flagFor(OptionKind kind, BarrierType barrierType, boolean reverse) {
        if (!barrierType.isBarrier() || barrierType.isDouble()) {
            throw new IllegalArgumentException("Not a single barrier: " + barrierType);
        }
        boolean standardDown = kind == OptionKind.PUT;
        return BarrierFlag.of(kind, standardDown != reverse, barrierType.isKnockIn());
    }

    /** Single-barrier price without rebate. */
    public double priceSingle(
            BarrierFlag flag,
            double spot,
            double strike,
            double barrier,
            double maturity,
            double domesticRate,
            double foreignRate,
            double volatility) {
        return priceSingle(flag, spot, strike, barrier, maturity, domesticRate, foreignRate, volatility, 0.0);
    }

    /**
     * Single-barrier price.
     *
     * <p>If spot is already through the barrier (down: S &lt;= H, up: S &gt;= H) the contract is
     * settled at inception: a knock-out is worth the rebate, a knock-in is the vanilla.
     *
     * @param rebate cash amount paid when a knock-out is hit or a knock-in never activates
     */
    public double priceSingle(
            BarrierFlag flag,
            double spot,
            double strike,
            double barrier,
            double maturity,
            double domesticRate,
            double foreignRate,
            double volatility,
            double rebate) {
        if (!(spot > 0) || !(strike > 0) || !(barrier > 0) || !(maturity > 0) || !(volatility > 0)) {
            log.warn(
                    "Barrier {} priced at 0: invalid inputs spot={}, strike={}, barrier={}, T={}, vol={}",
                    flag,
                    spot,
                    strike,
                    barrier,
                    maturity,
                    volatility);
            return 0.0;
        }

        boolean breached = flag.isDown() ? spot <= barrier : spot >= barrier;
        if (breached) {
            if (flag.isKnockIn()) {
                return vanillaPricer.price(
                        flag.kind(), spot, strike, maturity, domesticRate, foreignRate, volatility);
            }
            return Math.max(0.0, rebate);
        }

        double b = domesticRate - foreignRate;
        double r = domesticRate;
        double sigma2 = volatility * volatility;
        double vt = volatility * Math.sqrt(maturity);
        double mu = (b - sigma2 / 2.0) / sigma2;
        // Negative with r_d < 0 and low volatility; only the rebate terms need lambda.
        double lambdaSquared = mu * mu + 2.0 * r / sigma2;
        if (rebate != 0.0 && lambdaSquared < 0.0) {
            log.warn(
                    "Barrier {} priced at 0: rebate {} undefined for r_d={}, vol={} (mu^2 + 2r/vol^2 = {})",
                    flag,
                    rebate,
                    domesticRate,
                    volatility,
                    lambdaSquared);
            return 0.0;
        }

        double x1 = Math.log(spot / strike) / vt + (1 + mu) * vt;
        double x2 = Math.log(spot / barrier) / vt + (1 + mu) * vt;
        double y1 = Math.log(barrier * barrier / (spot * strike)) / vt + (1 + mu) * vt;
        double y2 = Math.log(barrier / spot) / vt + (1 + mu) * vt;

        double eta = flag.isDown() ? 1.0 : -1.0;
        double phi = flag.kind() == OptionKind.CALL ? 1.0 : -1.0;
        double carry = spot * Math.exp((b - r) * maturity);
        double df = Math.exp(-r * maturity);
        double ratio = barrier / spot;
        double ratio2mu1 = Math.pow(ratio, 2 * (mu + 1));
        double ratio2mu = Math.pow(ratio, 2 * mu);

        double f1 = phi * carry * NormalCdf.cdf(phi * x1) - phi * strike * df * NormalCdf.cdf(phi * x1 - phi * vt);
        double f2 = phi * carry * NormalCdf.cdf(phi * x2) - phi * strike * df * NormalCdf.cdf(phi * x2 - phi * vt);
        double f3 = phi * carry * ratio2mu1 * NormalCdf.cdf(eta * y1)
                - phi * strike * df * ratio2mu * NormalCdf.cdf(eta * y1 - eta * vt);
        double f4 = phi * carry * ratio2mu1 * NormalCdf.cdf(eta * y2)
                - phi * strike * df * ratio2mu * NormalCdf.cdf(eta * y2 - eta * vt);
        double f5 = 0.0;
        double f6 = 0.0;
        if (rebate != 0.0) {
            double lambda = Math.sqrt(lambdaSquared);
            double z = Math.log(barrier / spot) / vt + lambda * vt;
            f5 = rebate * df * (NormalCdf.cdf(eta * x2 - eta * vt) - ratio2mu * NormalCdf.cdf(eta * y2 - eta * vt));
            f6 = rebate
                    * (Math.pow(ratio, mu + lambda) * NormalCdf.cdf(eta * z)
                            + Math.pow(ratio, mu - lambda) * NormalCdf.cdf(eta * z - 2 * eta * lambda * vt));
        }

        boolean strikeAboveBarrier = strike >= barrier;
        double price =
                switch (flag) {
                    case CDI -> strikeAboveBarrier ? f3 + f5 : f1 - f2 + f4 + f5;
                    case CUI -> strikeAboveBarrier ? f1 + f5 : f2 - f3 + f4 + f5;
                    case PDI -> strikeAboveBarrier ? f2 - f3 + f4 + f5 : f1 + f5;
                    case PUI -> strikeAboveBarrier ? f1 - f2 + f4 + f5 : f3 + f5;
                    case CDO -> strikeAboveBarrier ? f1 - f3 + f6 : f2 - f4 + f6;
                    case CUO -> strikeAboveBarrier ? f6 : f1 - f2 + f3 - f4 + f6;
                    case PDO -> strikeAboveBarrier ? f1 - f2 + f3 - f4 + f6 : f6;
                    case PUO -> strikeAboveBarrier ? f2 - f4 + f6 : f1 - f3 + f6;
                };
        return Math.max(0.0, price);
    }

    /**
     * Double-barrier price with a corridor (lower, upper) that knocks the option out when
     * either level is touched, or in, for knock-ins.
     *
     * <p>Spot outside the open corridor means the barrier event already happened: the
     * knock-out is worthless and the knock-in is the vanilla.
     */
    public double priceDouble(
            OptionKind kind,
            boolean knockIn,
            double spot,
            double strike,
            double lower,
            double upper,
            double maturity,
            double domesticRate,
            double foreignRate,
            double volatility) {
        if (!(spot > 0) || !(strike > 0) || !(lower > 0) || !(lower < upper) || !(maturity > 0) || !(volatility > 0)) {
            log.warn(
                    "Double barrier {} priced at 0: invalid inputs spot={}, strike={}, lower={}, upper={}, T={}, vol={}",
                    kind,
                    spot,
                    strike,
                    lower,
                    upper,
                    maturity,
                    volatility);
            return 0.0;
        }
        double vanilla = vanillaPricer.price(kind, spot, strike, maturity, domesticRate, foreignRate, volatility);
        double out = doubleKnockOut(kind, spot, strike, lower, upper, maturity, domesticRate, foreignRate, volatility);
        return knockIn ? Math.max(0.0, vanilla - out) : out;
    }

    private double doubleKnockOut(
            OptionKind kind,
            double spot,
            double strike,
            double lower,
            double upper,
            double maturity,
            double domesticRate,
            double foreignRate,
            double volatility) {
        if (spot <= lower || spot >= upper) {
            return 0.0;
        }
        // strike outside the corridor: the payoff region can never be reached alive
        if (kind == OptionKind.CALL && strike >= upper) {
            return 0.0;
        }
        if (kind == OptionKind.PUT && strike <= lower) {
            return 0.0;
        }

        double b = domesticRate - foreignRate;
        double r = domesticRate;
        double sigma2 = volatility * volatility;
        double vt = volatility * Math.sqrt(maturity);
        double drift = (b + sigma2 / 2.0) * maturity;
        double mu1 = 2.0 * b / sigma2 + 1.0;
        double mu3 = mu1;

        double sum1 = 0.0;
        double sum2 = 0.0;
        for (int n = -SERIES_TERMS; n <= SERIES_TERMS; n++) {
            double u2n = Math.pow(upper, 2 * n);
            double l2n = Math.pow(lower, 2 * n);
            double l2n2 = Math.pow(lower, 2 * n + 2);
            double inner = Math.pow(upper, n) / Math.pow(lower, n);
            double outer = Math.pow(lower, n + 1) / (Math.pow(upper, n) * spot);

            if (kind == OptionKind.CALL) {
                double d1 = (Math.log(spot * u2n / (strike * l2n)) + drift) / vt;
                double d2 = (Math.log(spot * u2n / (upper * l2n)) + drift) / vt;
                double d3 = (Math.log(l2n2 / (strike * spot * u2n)) + drift) / vt;
                double d4 = (Math.log(l2n2 / (upper * spot * u2n)) + drift) / vt;
                sum1 += Math.pow(inner, mu1) * (NormalCdf.cdf(d1) - NormalCdf.cdf(d2))
                        - Math.pow(outer, mu3) * (NormalCdf.cdf(d3) - NormalCdf.cdf(d4));
                sum2 += Math.pow(inner, mu1 - 2) * (NormalCdf.cdf(d1 - vt) - NormalCdf.cdf(d2 - vt))
                        - Math.pow(outer, mu3 - 2) * (NormalCdf.cdf(d3 - vt) - NormalCdf.cdf(d4 - vt));
            } else {
                double y1 = (Math.log(spot * u2n / (lower * l2n)) + drift) / vt;
                double y2 = (Math.log(spot * u2n / (strike * l2n)) + drift) / vt;
                double y3 = (Math.log(l2n2 / (lower * spot * u2n)) + drift) / vt;
                double y4 = (Math.log(l2n2 / (strike * spot * u2n)) + drift) / vt;
                sum1 += Math.pow(inner, mu1 - 2) * (NormalCdf.cdf(y1 - vt) - NormalCdf.cdf(y2 - vt))
                        - Math.pow(outer, mu3 - 2) * (NormalCdf.cdf(y3 - vt) - NormalCdf.cdf(y4 - vt));
                sum2 += Math.pow(inner, mu1) * (NormalCdf.cdf(y1) - NormalCdf.cdf(y2))
                        - Math.pow(outer, mu3) * (NormalCdf.cdf(y3) - NormalCdf.cdf(y4));
            }
        }

        double carry = spot * Math.exp((b - r) * maturity);
        double df = Math.exp(-r * maturity);
        double price = kind == OptionKind.CALL ? carry * sum1 - strike * df * sum2 : strike * df * sum1 - carry * sum2;
        return Math.max(0.0, price);
    }
}
