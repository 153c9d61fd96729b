package com.fxhedge.core.engine;

import com.fxhedge.domain.model.MarketParams;
import com.fxhedge.domain.model.ResolvedLeg;
import lombok.Builder;
import lombok.Getter;

/** One simulation run: the leg, its market and the sampling parameters. */
@Getter
@Builder
public class MonteCarloRequest {

    private final ResolvedLeg leg;
    private final MarketParams market;

    @Builder.Default
    private final int paths = 10_000;

    @Builder.Default
    private final int stepsPerYear = 252;

    @Builder.Default
    private final int batchSize = 1_000;

    @Builder.Default
    private final boolean brownianBridge = true;

    private final long seed;

    /** Monitoring dates: ceil(stepsPerYear * T), at least one. Vanilla legs need a single step. */
    public int steps() {
        if (leg.isVanilla()) {
            return 1;
        }
        return Math.max(1, (int) Math.ceil(stepsPerYear * market.getMaturity()));
    }
}
