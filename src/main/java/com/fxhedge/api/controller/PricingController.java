package com.fxhedge.api.controller;

import com.fxhedge.api.dto.request.StrategyPricingRequest;
import com.fxhedge.api.dto.request.StrategyRequest;
import com.fxhedge.api.dto.request.VanillaPriceRequest;
import com.fxhedge.domain.model.MarketParams;
import com.fxhedge.domain.model.PayoffCurve;
import com.fxhedge.domain.model.PricingResult;
import com.fxhedge.domain.model.Strategy;
import com.fxhedge.service.PricingService;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for FX option pricing and hedge payoffs.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/pricing/vanilla -- Garman-Kohlhagen price of a call or put</li>
 *   <li>GET /api/pricing/forward -- outright forward rate</li>
 *   <li>POST /api/pricing/strategy/resolve -- expand a named template into legs</li>
 *   <li>POST /api/pricing/strategy/price -- premium of every leg and the total</li>
 *   <li>POST /api/pricing/payoff-curve -- hedged-rate curve, premium included</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/pricing")
public class PricingController {

    private static final Logger log = LoggerFactory.getLogger(PricingController.class);

    private final PricingService pricingService;

    public PricingController(PricingService pricingService) {
        this.pricingService = pricingService;
    }

    @PostMapping("/vanilla")
    public ResponseEntity<Map<String, Object>> priceVanilla(@Valid @RequestBody VanillaPriceRequest request) {
        MarketParams market = request.getMarket().toMarketParams();
        double strike = request.getStrike().resolve(market.getSpot());
        double price = pricingService.priceVanilla(request.getKind(), strike, market);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("kind", request.getKind());
        body.put("strike", strike);
        body.put("price", price);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/forward")
    public ResponseEntity<Map<String, Object>> forward(
            @RequestParam double spot,
            @RequestParam double domesticRate,
            @RequestParam double foreignRate,
            @RequestParam double maturity) {
        MarketParams market = MarketParams.builder()
                .spot(spot)
                .domesticRate(domesticRate)
                .foreignRate(foreignRate)
                .maturity(maturity)
                .build();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("spot", spot);
        body.put("maturity", maturity);
        body.put("forward", pricingService.forward(market));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/strategy/resolve")
    public ResponseEntity<Strategy> resolveStrategy(@Valid @RequestBody StrategyRequest request) {
        Strategy strategy = pricingService.resolveStrategy(
                request.getName(), request.getParams(), request.getMarket().toMarketParams());
        return ResponseEntity.ok(strategy);
    }

    @PostMapping("/strategy/price")
    public ResponseEntity<PricingResult> priceStrategy(@Valid @RequestBody StrategyPricingRequest request) {
        MarketParams market = request.getMarket().toMarketParams();
        Strategy strategy = pricingService.resolveStrategy(request.getName(), request.getParams(), market);
        log.info("Pricing {} with {} legs, mode={}", strategy.getName(), strategy.getLegs().size(), request.getMode());
        return ResponseEntity.ok(pricingService.priceStrategy(strategy, market, request.getMode()));
    }

    @PostMapping("/payoff-curve")
    public ResponseEntity<PayoffCurve> payoffCurve(@Valid @RequestBody StrategyPricingRequest request) {
        MarketParams market = request.getMarket().toMarketParams();
        Strategy strategy = pricingService.resolveStrategy(request.getName(), request.getParams(), market);
        PayoffCurve curve = pricingService.evaluatePayoffCurve(
                strategy, market, request.getSweep(), request.getSide(), request.getMode());
        return ResponseEntity.ok(curve);
    }
}
