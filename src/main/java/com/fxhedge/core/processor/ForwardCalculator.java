package com.fxhedge.core.processor;

import org.springframework.stereotype.Component;

/**
 * Outright FX forward from covered interest parity: {@code F = S * e^((r_d - r_f) * T)}.
 */
@Component
public class ForwardCalculator {

    /**
     * @param spot         spot rate
     * @param maturity     years to delivery
     * @param domesticRate quote currency rate (r1)
     * @param foreignRate  base currency rate (r2)
     */
    public double forward(double spot, double maturity, double domesticRate, double foreignRate) {
        return spot * Math.exp((domesticRate - foreignRate) * maturity);
    }
}
