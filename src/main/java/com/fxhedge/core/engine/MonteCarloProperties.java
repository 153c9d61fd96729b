package com.fxhedge.core.engine;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/** Simulation defaults, bound from {@code fxhedge.montecarlo.*}. */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "fxhedge.montecarlo")
public class MonteCarloProperties {

    private int paths = 10_000;
    private int stepsPerYear = 252;
    private int batchSize = 1_000;
    private boolean brownianBridge = true;

    /** Master seed. When unset every run draws a fresh one and logs it. */
    private Long seed;
}
