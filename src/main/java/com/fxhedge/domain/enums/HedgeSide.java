package com.fxhedge.domain.enums;

/**
 * Which side of the currency pair the hedger is on. Decides the sign with which a strategy
 * payoff moves the effective rate.
 *
 * <ul>
 *   <li>BUY_FOREIGN (importer): hedged rate = spot - payoff
 *   <li>SELL_FOREIGN (exporter): hedged rate = spot + payoff
 * </ul>
 *
 * The premium is taken off the hedged rate the same way on both sides.
 */
public enum HedgeSide {
    BUY_FOREIGN,
    SELL_FOREIGN;

    public double hedgedRate(double spot, double payoff) {
        return this == BUY_FOREIGN ? spot - payoff : spot + payoff;
    }
}
