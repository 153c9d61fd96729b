package com.fxhedge.api.dto.request;

import com.fxhedge.domain.model.MarketParams;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Market inputs as sent by clients. Every field is required: a missing rate is an error,
 * never silently read as 0.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketParamsRequest {

    @NotNull
    @Positive
    private Double spot;

    /** Domestic (quote currency) rate as a decimal. */
    @NotNull
    private Double domesticRate;

    /** Foreign (base currency) rate as a decimal. */
    @NotNull
    private Double foreignRate;

    @NotNull
    @Positive
    private Double volatility;

    /** Years to maturity. */
    @NotNull
    @Positive
    private Double maturity;

    public MarketParams toMarketParams() {
        return MarketParams.builder()
                .spot(spot)
                .domesticRate(domesticRate)
                .foreignRate(foreignRate)
                .volatility(volatility)
                .maturity(maturity)
                .build();
    }
}
