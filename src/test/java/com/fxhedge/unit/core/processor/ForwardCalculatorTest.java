package com.fxhedge.unit.core.processor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.fxhedge.core.processor.ForwardCalculator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ForwardCalculatorTest {

    private final ForwardCalculator calculator = new ForwardCalculator();

    @Test
    @DisplayName("One-year forward with a 1% carry is 1.10 e^0.01")
    void oneYearForward() {
        assertThat(calculator.forward(1.10, 1.0, 0.02, 0.01)).isCloseTo(1.10 * Math.exp(0.01), within(1e-12));
    }

    @Test
    @DisplayName("Forward at zero maturity is spot")
    void zeroMaturity() {
        assertThat(calculator.forward(1.10, 0.0, 0.05, 0.01)).isEqualTo(1.10);
    }

    @Test
    @DisplayName("Forward trades below spot when the foreign rate is higher")
    void discountWhenForeignRateHigher() {
        assertThat(calculator.forward(1.10, 0.5, 0.01, 0.04)).isLessThan(1.10);
    }
}
