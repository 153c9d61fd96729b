package com.fxhedge.config;

import com.fxhedge.domain.model.SweepConfig;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/** Default payoff sweep, bound from {@code fxhedge.payoff.*}. */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "fxhedge.payoff")
public class PayoffProperties {

    private double sweepWidthPct = 30.0;
    private int steps = 100;

    public SweepConfig defaultSweep() {
        return SweepConfig.builder().widthPct(sweepWidthPct).steps(steps).build();
    }
}
