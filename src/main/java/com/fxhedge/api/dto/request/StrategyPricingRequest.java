package com.fxhedge.api.dto.request;

import com.fxhedge.domain.enums.HedgeSide;
import com.fxhedge.domain.enums.NamedStrategy;
import com.fxhedge.domain.enums.PricingMode;
import com.fxhedge.domain.model.StrategyParams;
import com.fxhedge.domain.model.SweepConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Strategy pricing and payoff-curve request. {@link #sweep} and {@link #side} only matter
 * for the payoff curve; when absent the configured sweep and BUY_FOREIGN are used.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyPricingRequest {

    @NotNull
    private NamedStrategy name;

    private StrategyParams params;

    @NotNull
    @Valid
    private MarketParamsRequest market;

    @NotNull
    private PricingMode mode;

    private SweepConfig sweep;

    private HedgeSide side;
}
