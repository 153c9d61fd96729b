package com.fxhedge.api.dto.request;

import com.fxhedge.domain.enums.NamedStrategy;
import com.fxhedge.domain.model.StrategyParams;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A named template with its parameters, used to resolve a strategy into legs. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyRequest {

    @NotNull
    private NamedStrategy name;

    /** Template inputs. For CUSTOM, {@code params.customLegs} carries the legs. */
    private StrategyParams params;

    @NotNull
    @Valid
    private MarketParamsRequest market;
}
