package com.fxhedge.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fxhedge.api.controller.PricingController;
import com.fxhedge.config.ApiResponseAdvice;
import com.fxhedge.domain.enums.HedgeSide;
import com.fxhedge.domain.enums.NamedStrategy;
import com.fxhedge.domain.enums.OptionKind;
import com.fxhedge.domain.enums.PricingMode;
import com.fxhedge.domain.model.Level;
import com.fxhedge.domain.model.MarketParams;
import com.fxhedge.domain.model.OptionLeg;
import com.fxhedge.domain.model.PayoffCurve;
import com.fxhedge.domain.model.PayoffPoint;
import com.fxhedge.domain.model.PricingResult;
import com.fxhedge.domain.model.Strategy;
import com.fxhedge.domain.model.StrategyParams;
import com.fxhedge.exception.GlobalExceptionHandler;
import com.fxhedge.exception.InvalidInputException;
import com.fxhedge.service.PricingService;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the PricingController: request binding, validation and the
 * response envelopes.
 */
@ExtendWith(MockitoExtension.class)
class PricingControllerTest {

    private static final String MARKET_JSON = """
            "market": { "spot": 1.10, "domesticRate": 0.02, "foreignRate": 0.01, "volatility": 0.10, "maturity": 1.0 }
            """;

    private MockMvc mockMvc;

    @Mock
    private PricingService pricingService;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new PricingController(pricingService))
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    private static Strategy callStrategy() {
        OptionLeg call = OptionLeg.builder()
                .kind(OptionKind.CALL)
                .strike(Level.percent(105))
                .build();
        return Strategy.builder().name(NamedStrategy.CALL).legs(List.of(call)).build();
    }

    @Test
    @DisplayName("POST /api/pricing/vanilla resolves a percentage strike and wraps the price")
    void priceVanilla() throws Exception {
        when(pricingService.priceVanilla(eq(OptionKind.CALL), eq(1.10 * 100.0 / 100.0), any(MarketParams.class)))
                .thenReturn(0.0488466);

        String body = "{" + MARKET_JSON + """
                , "kind": "CALL", "strike": { "value": 100, "type": "PERCENT_OF_SPOT" } }
                """;

        mockMvc.perform(post("/api/pricing/vanilla")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.kind").value("CALL"))
                .andExpect(jsonPath("$.data.price").value(0.0488466));
    }

    @Test
    @DisplayName("POST /api/pricing/vanilla with a missing rate is a validation error, never a default")
    void missingRateRejected() throws Exception {
        String body = """
                {
                  "market": { "spot": 1.10, "foreignRate": 0.01, "volatility": 0.10, "maturity": 1.0 },
                  "kind": "CALL",
                  "strike": { "value": 1.10, "type": "ABSOLUTE" }
                }
                """;

        mockMvc.perform(post("/api/pricing/vanilla")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details['market.domesticRate']").exists());

        verify(pricingService, never()).priceVanilla(any(), anyDouble(), any());
    }

    @Test
    @DisplayName("GET /api/pricing/forward returns the forward rate")
    void forward() throws Exception {
        when(pricingService.forward(any(MarketParams.class))).thenReturn(1.111055);

        mockMvc.perform(get("/api/pricing/forward")
                        .param("spot", "1.10")
                        .param("domesticRate", "0.02")
                        .param("foreignRate", "0.01")
                        .param("maturity", "1.0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.forward").value(1.111055));
    }

    @Test
    @DisplayName("POST /api/pricing/strategy/resolve returns the template legs")
    void resolveStrategy() throws Exception {
        when(pricingService.resolveStrategy(eq(NamedStrategy.CALL), any(StrategyParams.class), any(MarketParams.class)))
                .thenReturn(callStrategy());

        String body = "{" + MARKET_JSON + """
                , "name": "CALL", "params": { "strikeUpper": { "value": 105, "type": "PERCENT_OF_SPOT" } } }
                """;

        mockMvc.perform(post("/api/pricing/strategy/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.name").value("CALL"))
                .andExpect(jsonPath("$.data.legs[0].kind").value("CALL"))
                .andExpect(jsonPath("$.data.legs[0].strike.value").value(105.0));
    }

    @Test
    @DisplayName("POST /api/pricing/strategy/price returns per-leg premiums and the total")
    void priceStrategy() throws Exception {
        Strategy strategy = callStrategy();
        when(pricingService.resolveStrategy(eq(NamedStrategy.CALL), any(StrategyParams.class), any(MarketParams.class)))
                .thenReturn(strategy);
        when(pricingService.priceStrategy(eq(strategy), any(MarketParams.class), eq(PricingMode.CLOSED_FORM)))
                .thenReturn(PricingResult.builder()
                        .requestedMode(PricingMode.CLOSED_FORM)
                        .legs(List.of())
                        .totalPremium(0.0277)
                        .build());

        String body = "{" + MARKET_JSON + """
                , "name": "CALL", "mode": "CLOSED_FORM",
                  "params": { "strikeUpper": { "value": 105, "type": "PERCENT_OF_SPOT" } } }
                """;

        mockMvc.perform(post("/api/pricing/strategy/price")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.requestedMode").value("CLOSED_FORM"))
                .andExpect(jsonPath("$.data.totalPremium").value(0.0277));
    }

    @Test
    @DisplayName("POST /api/pricing/strategy/price without a mode is rejected")
    void modeRequired() throws Exception {
        String body = "{" + MARKET_JSON + ", \"name\": \"FORWARD\" }";

        mockMvc.perform(post("/api/pricing/strategy/price")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.details.mode").exists());
    }

    @Test
    @DisplayName("POST /api/pricing/payoff-curve passes sweep and side through")
    void payoffCurve() throws Exception {
        Strategy strategy = callStrategy();
        PayoffPoint point = PayoffPoint.builder()
                .spot(1.10)
                .unhedgedRate(1.10)
                .hedgedRateExcludingPremium(1.10)
                .hedgedRateIncludingPremium(1.1277)
                .payoff(0.0)
                .references(Map.of("Leg 1 Call Strike", 1.155))
                .build();
        when(pricingService.resolveStrategy(eq(NamedStrategy.CALL), any(StrategyParams.class), any(MarketParams.class)))
                .thenReturn(strategy);
        when(pricingService.evaluatePayoffCurve(
                        eq(strategy), any(MarketParams.class), any(), eq(HedgeSide.BUY_FOREIGN), eq(PricingMode.CLOSED_FORM)))
                .thenReturn(PayoffCurve.builder()
                        .initialSpot(1.10)
                        .totalPremium(0.0277)
                        .side(HedgeSide.BUY_FOREIGN)
                        .points(List.of(point))
                        .build());

        String body = "{" + MARKET_JSON + """
                , "name": "CALL", "mode": "CLOSED_FORM", "side": "BUY_FOREIGN",
                  "sweep": { "widthPct": 30, "steps": 100 },
                  "params": { "strikeUpper": { "value": 105, "type": "PERCENT_OF_SPOT" } } }
                """;

        mockMvc.perform(post("/api/pricing/payoff-curve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.points[0].hedgedRateIncludingPremium").value(1.1277))
                .andExpect(jsonPath("$.data.points[0].references['Leg 1 Call Strike']").value(1.155));
    }

    @Test
    @DisplayName("Service input errors map to 400 INVALID_INPUT with details")
    void invalidInputMapped() throws Exception {
        when(pricingService.resolveStrategy(eq(NamedStrategy.COLLAR), any(), any(MarketParams.class)))
                .thenThrow(new InvalidInputException("COLLAR requires strikeUpper", Map.of("strikeUpper", "is required")));

        String body = "{" + MARKET_JSON + ", \"name\": \"COLLAR\" }";

        mockMvc.perform(post("/api/pricing/strategy/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_INPUT"))
                .andExpect(jsonPath("$.error.details.strikeUpper").value("is required"));
    }
}
