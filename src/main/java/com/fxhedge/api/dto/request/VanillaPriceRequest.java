package com.fxhedge.api.dto.request;

import com.fxhedge.domain.enums.OptionKind;
import com.fxhedge.domain.model.Level;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VanillaPriceRequest {

    @NotNull
    @Valid
    private MarketParamsRequest market;

    @NotNull
    private OptionKind kind;

    /** Percentage of spot or absolute rate. */
    @NotNull
    private Level strike;
}
