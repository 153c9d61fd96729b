package com.fxhedge.core.engine;

import com.fxhedge.domain.enums.BarrierType;
import com.fxhedge.domain.model.ResolvedLeg;

/**
 * Decides when a leg's barrier event fires. Shared by the simulation and by the static
 * payoff evaluation so both read the same direction rules:
 * <ul>
 *   <li>single barrier, up (standard call, reverse put): hit at spot &gt;= H
 *   <li>single barrier, down (standard put, reverse call): hit at spot &lt;= H
 *   <li>double barrier, standard: hit when spot leaves the corridor (spot &lt;= L or spot &gt;= U)
 *   <li>double barrier, reverse: hit when spot is strictly inside (L, U)
 * </ul>
 *
 * <p>Also gives the Brownian-bridge probability that a log-normal path touched a level
 * between two observed points, which removes the discrete-monitoring bias of the simulation.
 */
public final class BarrierMonitor {

    private static final BarrierMonitor NONE = new BarrierMonitor(Shape.NONE, Double.NaN, Double.NaN);

    private enum Shape {
        NONE,
        UP,
        DOWN,
        CORRIDOR_EXIT,
        CORRIDOR_ENTRY
    }

    private final Shape shape;
    private final double lower;
    private final double upper;

    private BarrierMonitor(Shape shape, double lower, double upper) {
        this.shape = shape;
        this.lower = lower;
        this.upper = upper;
    }

    public static BarrierMonitor forLeg(ResolvedLeg leg) {
        BarrierType type = leg.getBarrierType();
        if (type == null || !type.isBarrier()) {
            return NONE;
        }
        if (type.isDouble()) {
            return new BarrierMonitor(
                    leg.isReverse() ? Shape.CORRIDOR_ENTRY : Shape.CORRIDOR_EXIT,
                    leg.getLowerBarrier(),
                    leg.getUpperBarrier());
        }
        double level = leg.singleBarrier();
        return leg.isUpBarrier()
                ? new BarrierMonitor(Shape.UP, Double.NaN, level)
                : new BarrierMonitor(Shape.DOWN, level, Double.NaN);
    }

    public boolean isMonitored() {
        return shape != Shape.NONE;
    }

    /** True if the barrier event fires with the rate at {@code spot}. */
    public boolean isHit(double spot) {
        return switch (shape) {
            case NONE -> false;
            case UP -> spot >= upper;
            case DOWN -> spot <= lower;
            case CORRIDOR_EXIT -> spot <= lower || spot >= upper;
            case CORRIDOR_ENTRY -> spot > lower && spot < upper;
        };
    }

    /**
     * Probability that the continuous path between two observed, un-hit points fired the
     * barrier anyway.
     *
     * @param from     spot at the start of the step
     * @param to       spot at the end of the step
     * @param variance sigma^2 * dt of the step
     */
    public double crossingProbability(double from, double to, double variance) {
        return switch (shape) {
            case NONE -> 0.0;
            case UP -> touch(from, to, upper, variance);
            case DOWN -> touch(from, to, lower, variance);
            case CORRIDOR_EXIT -> {
                double missUpper = 1.0 - touch(from, to, upper, variance);
                double missLower = 1.0 - touch(from, to, lower, variance);
                yield 1.0 - missUpper * missLower;
            }
            case CORRIDOR_ENTRY -> {
                if (from >= upper && to >= upper) {
                    yield touch(from, to, upper, variance);
                }
                if (from <= lower && to <= lower) {
                    yield touch(from, to, lower, variance);
                }
                // jumped across the corridor
                yield 1.0;
            }
        };
    }

    static double touch(double from, double to, double level, double variance) {
        double logFrom = Math.log(from / level);
        double logTo = Math.log(to / level);
        double product = logFrom * logTo;
        if (product <= 0) {
            return 1.0;
        }
        return Math.exp(-2.0 * product / variance);
    }
}
