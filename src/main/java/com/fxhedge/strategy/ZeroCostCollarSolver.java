package com.fxhedge.strategy;

import com.fxhedge.core.processor.VanillaPricer;
import com.fxhedge.domain.enums.OptionKind;
import com.fxhedge.domain.model.MarketParams;
import com.fxhedge.exception.InvalidInputException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.analysis.solvers.BisectionSolver;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.springframework.stereotype.Component;

/**
 * Finds the missing strike of a zero-cost collar: with one strike fixed, the other is solved
 * so that the call bought and the put sold have the same Garman-Kohlhagen premium.
 *
 * <p>Search ranges follow desk practice: a put strike is looked for in
 * [80% of spot, call strike], a call strike in [put strike, 120% of spot]. Bisection stops
 * once the bracket is narrower than 1e-4.
 */
@Slf4j
@Component
public class ZeroCostCollarSolver {

    static final double STRIKE_TOLERANCE = 1e-4;
    static final double PUT_SEARCH_FLOOR = 0.8;
    static final double CALL_SEARCH_CAP = 1.2;
    private static final int MAX_EVALUATIONS = 200;

    private final VanillaPricer vanillaPricer;

    public ZeroCostCollarSolver(VanillaPricer vanillaPricer) {
        this.vanillaPricer = vanillaPricer;
    }

    /**
     * Put strike whose premium matches the call at {@code callStrike}.
     *
     * @throws InvalidInputException if no strike in [0.8 S, callStrike] balances the call
     */
    public double solvePutStrike(double callStrike, MarketParams market) {
        double callPremium = premium(OptionKind.CALL, callStrike, market);
        return solve(
                OptionKind.PUT, callPremium, PUT_SEARCH_FLOOR * market.getSpot(), callStrike, market);
    }

    /**
     * Call strike whose premium matches the put at {@code putStrike}.
     *
     * @throws InvalidInputException if no strike in [putStrike, 1.2 S] balances the put
     */
    public double solveCallStrike(double putStrike, MarketParams market) {
        double putPremium = premium(OptionKind.PUT, putStrike, market);
        return solve(OptionKind.CALL, putPremium, putStrike, CALL_SEARCH_CAP * market.getSpot(), market);
    }

    private double solve(OptionKind kind, double targetPremium, double low, double high, MarketParams market) {
        BisectionSolver solver = new BisectionSolver(STRIKE_TOLERANCE);
        try {
            double strike = solver.solve(
                    MAX_EVALUATIONS, k -> premium(kind, k, market) - targetPremium, low, high);
            log.debug(
                    "Zero-cost {} strike {} matches premium {} after {} evaluations",
                    kind,
                    strike,
                    targetPremium,
                    solver.getEvaluations());
            return strike;
        } catch (TooManyEvaluationsException | MathIllegalArgumentException e) {
            throw new InvalidInputException(
                    "No zero-cost " + kind + " strike in search range",
                    Map.of("low", low, "high", high, "targetPremium", targetPremium),
                    e);
        }
    }

    private double premium(OptionKind kind, double strike, MarketParams market) {
        return vanillaPricer.price(
                kind,
                market.getSpot(),
                strike,
                market.getMaturity(),
                market.getDomesticRate(),
                market.getForeignRate(),
                market.getVolatility());
    }
}
