package com.fxhedge.unit.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.fxhedge.core.processor.ForwardCalculator;
import com.fxhedge.core.processor.VanillaPricer;
import com.fxhedge.domain.enums.BarrierType;
import com.fxhedge.domain.enums.NamedStrategy;
import com.fxhedge.domain.enums.OptionKind;
import com.fxhedge.domain.model.Level;
import com.fxhedge.domain.model.MarketParams;
import com.fxhedge.domain.model.OptionLeg;
import com.fxhedge.domain.model.Strategy;
import com.fxhedge.domain.model.StrategyParams;
import com.fxhedge.exception.InvalidInputException;
import com.fxhedge.strategy.StrategyResolver;
import com.fxhedge.strategy.ZeroCostCollarSolver;
import java.util.List;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class StrategyResolverTest {

    private static final double SPOT = 1.10;

    private static final MarketParams MARKET = MarketParams.builder()
            .spot(SPOT)
            .domesticRate(0.02)
            .foreignRate(0.01)
            .volatility(0.10)
            .maturity(1.0)
            .build();

    private VanillaPricer vanillaPricer;
    private StrategyResolver resolver;

    @BeforeEach
    void setUp() {
        vanillaPricer = new VanillaPricer();
        resolver = new StrategyResolver(new ForwardCalculator(), new ZeroCostCollarSolver(vanillaPricer));
    }

    private double premium(OptionKind kind, double strike) {
        return vanillaPricer.price(kind, SPOT, strike, 1.0, 0.02, 0.01, 0.10);
    }

    @Nested
    @DisplayName("Vanilla templates")
    class VanillaTemplates {

        @Test
        @DisplayName("FORWARD: long call and short put struck at the forward")
        void forward() {
            Strategy strategy = resolver.resolveStrategy(NamedStrategy.FORWARD, null, MARKET);

            double forward = SPOT * Math.exp(0.01);
            assertThat(strategy.getLegs()).hasSize(2);
            assertThat(strategy.getLegs())
                    .allSatisfy(leg -> assertThat(leg.getStrike().resolve(SPOT)).isCloseTo(forward, within(1e-12)));
            assertThat(strategy.getLegs().get(0).getQuantity()).isEqualTo(100.0);
            assertThat(strategy.getLegs().get(1).getQuantity()).isEqualTo(-100.0);
        }

        @Test
        @DisplayName("COLLAR: long call at the upper strike, short put at the lower")
        void collar() {
            StrategyParams params = StrategyParams.builder()
                    .strikeUpper(Level.percent(105))
                    .strikeLower(Level.percent(95))
                    .build();

            Strategy strategy = resolver.resolveStrategy(NamedStrategy.COLLAR, params, MARKET);

            OptionLeg call = strategy.getLegs().get(0);
            OptionLeg put = strategy.getLegs().get(1);
            assertThat(call.getKind()).isEqualTo(OptionKind.CALL);
            assertThat(call.getQuantity()).isEqualTo(100.0);
            assertThat(put.getKind()).isEqualTo(OptionKind.PUT);
            assertThat(put.getQuantity()).isEqualTo(-100.0);
            assertThat(put.getStrike().resolve(SPOT)).isCloseTo(SPOT * 0.95, within(1e-12));
        }

        @Test
        @DisplayName("STRADDLE defaults to an at-the-money strike")
        void straddle() {
            Strategy strategy = resolver.resolveStrategy(NamedStrategy.STRADDLE, new StrategyParams(), MARKET);

            assertThat(strategy.getLegs())
                    .extracting(OptionLeg::getKind)
                    .containsExactly(OptionKind.CALL, OptionKind.PUT);
            assertThat(strategy.getLegs())
                    .allSatisfy(leg -> assertThat(leg.getStrike().resolve(SPOT)).isCloseTo(SPOT, within(1e-12)));
            assertThat(strategy.getLegs()).extracting(OptionLeg::getQuantity).containsExactly(100.0, 100.0);
        }

        @Test
        @DisplayName("SEAGULL: long put at mid, short call above, short put below")
        void seagull() {
            StrategyParams params = StrategyParams.builder()
                    .strikeMid(Level.percent(102))
                    .strikeUpper(Level.percent(108))
                    .strikeLower(Level.percent(95))
                    .quantity(50.0)
                    .build();

            Strategy strategy = resolver.resolveStrategy(NamedStrategy.SEAGULL, params, MARKET);

            assertThat(strategy.getLegs())
                    .extracting(OptionLeg::getKind)
                    .containsExactly(OptionKind.PUT, OptionKind.CALL, OptionKind.PUT);
            assertThat(strategy.getLegs()).extracting(OptionLeg::getQuantity).containsExactly(50.0, -50.0, -50.0);
            assertThat(strategy.getLegs().get(0).getStrike().resolve(SPOT)).isCloseTo(SPOT * 1.02, within(1e-12));
        }
    }

    @Nested
    @DisplayName("Zero-cost collars")
    class ZeroCostCollars {

        @Test
        @DisplayName("COLLAR_CALL_FIXED solves a put strike with the same premium as the call")
        void callFixed() {
            StrategyParams params = StrategyParams.builder().strikeUpper(Level.absolute(1.15)).build();

            Strategy strategy = resolver.resolveStrategy(NamedStrategy.COLLAR_CALL_FIXED, params, MARKET);

            double putStrike = strategy.getLegs().get(1).getStrike().resolve(SPOT);
            assertThat(putStrike).isBetween(SPOT * 0.8, SPOT);
            assertThat(premium(OptionKind.PUT, putStrike)).isCloseTo(premium(OptionKind.CALL, 1.15), within(1e-4));
        }

        @Test
        @DisplayName("COLLAR_PUT_FIXED solves a call strike with the same premium as the put")
        void putFixed() {
            StrategyParams params = StrategyParams.builder().strikeLower(Level.absolute(1.05)).build();

            Strategy strategy = resolver.resolveStrategy(NamedStrategy.COLLAR_PUT_FIXED, params, MARKET);

            double callStrike = strategy.getLegs().get(1).getStrike().resolve(SPOT);
            assertThat(callStrike).isBetween(1.05, SPOT * 1.2);
            assertThat(premium(OptionKind.CALL, callStrike)).isCloseTo(premium(OptionKind.PUT, 1.05), within(1e-4));
        }

        @Test
        @DisplayName("No zero-cost strike inside the search range is an input error")
        void unbracketed() {
            // a deep ITM put costs more than any call struck above it
            StrategyParams params = StrategyParams.builder().strikeLower(Level.absolute(1.40)).build();

            assertThatThrownBy(() -> resolver.resolveStrategy(NamedStrategy.COLLAR_PUT_FIXED, params, MARKET))
                    .isInstanceOf(InvalidInputException.class)
                    .hasCauseInstanceOf(MathIllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Barrier templates")
    class BarrierTemplates {

        @Test
        @DisplayName("PUT_KI: reverse put knocked in when the rate rises through the upper barrier")
        void putKi() {
            StrategyParams params = StrategyParams.builder()
                    .strikeLower(Level.percent(95))
                    .barrierUpper(Level.percent(110))
                    .build();

            Strategy strategy = resolver.resolveStrategy(NamedStrategy.PUT_KI, params, MARKET);

            OptionLeg put = strategy.getLegs().get(0);
            assertThat(put.getKind()).isEqualTo(OptionKind.PUT);
            assertThat(put.getBarrierType()).isEqualTo(BarrierType.KNOCK_IN);
            assertThat(put.isReverse()).isTrue();
            assertThat(put.getUpperBarrier().resolve(SPOT)).isCloseTo(SPOT * 1.1, within(1e-12));
            assertThat(put.resolve(SPOT, 0.10).isUpBarrier()).isTrue();
        }

        @Test
        @DisplayName("PUT_KI without the upper barrier is rejected")
        void putKiNeedsUpperBarrier() {
            StrategyParams params = StrategyParams.builder()
                    .strikeLower(Level.percent(95))
                    .barrierLower(Level.percent(90))
                    .build();

            assertThatThrownBy(() -> resolver.resolveStrategy(NamedStrategy.PUT_KI, params, MARKET))
                    .isInstanceOf(InvalidInputException.class)
                    .hasMessageContaining("barrierUpper");
        }

        @Test
        @DisplayName("CALL_KO_PUT_KI: up-and-out call plus down-and-in put")
        void callKoPutKi() {
            StrategyParams params = StrategyParams.builder()
                    .strikeUpper(Level.percent(105))
                    .barrierUpper(Level.percent(115))
                    .strikeLower(Level.percent(95))
                    .barrierLower(Level.percent(90))
                    .build();

            Strategy strategy = resolver.resolveStrategy(NamedStrategy.CALL_KO_PUT_KI, params, MARKET);

            assertThat(strategy.getLegs())
                    .extracting(OptionLeg::getBarrierType)
                    .containsExactly(BarrierType.KNOCK_OUT, BarrierType.KNOCK_IN);
            assertThat(strategy.getLegs().get(1).getLowerBarrier().resolve(SPOT)).isCloseTo(SPOT * 0.9, within(1e-12));
            assertThat(strategy.getLegs().get(1).isReverse()).isFalse();
        }

        @Test
        @DisplayName("CALL_KO without a barrier is rejected")
        void missingBarrier() {
            StrategyParams params = StrategyParams.builder().strikeUpper(Level.percent(105)).build();

            assertThatThrownBy(() -> resolver.resolveStrategy(NamedStrategy.CALL_KO, params, MARKET))
                    .isInstanceOf(InvalidInputException.class)
                    .hasMessageContaining("barrierUpper");
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Zero quantity is rejected")
        void zeroQuantity() {
            StrategyParams params = StrategyParams.builder()
                    .strikeUpper(Level.percent(105))
                    .quantity(0.0)
                    .build();

            assertThatThrownBy(() -> resolver.resolveStrategy(NamedStrategy.CALL, params, MARKET))
                    .isInstanceOf(InvalidInputException.class)
                    .satisfies(ex -> assertThat(((InvalidInputException) ex).getDetails()).containsKey("quantity"));
        }

        @Test
        @DisplayName("Missing strike fails fast")
        void missingStrike() {
            assertThatThrownBy(() -> resolver.resolveStrategy(NamedStrategy.COLLAR, new StrategyParams(), MARKET))
                    .isInstanceOf(InvalidInputException.class)
                    .hasMessageContaining("strikeUpper");
        }

        @Test
        @DisplayName("CUSTOM needs at least one leg, and every leg must be valid")
        void custom() {
            assertThatThrownBy(() -> resolver.resolveStrategy(NamedStrategy.CUSTOM, new StrategyParams(), MARKET))
                    .isInstanceOf(InvalidInputException.class);

            OptionLeg brokenDouble = OptionLeg.builder()
                    .kind(OptionKind.CALL)
                    .barrierType(BarrierType.DOUBLE_KNOCK_OUT)
                    .strike(Level.percent(100))
                    .lowerBarrier(Level.percent(110))
                    .upperBarrier(Level.percent(90))
                    .build();
            StrategyParams params =
                    StrategyParams.builder().customLegs(List.of(brokenDouble)).build();

            assertThatThrownBy(() -> resolver.resolveStrategy(NamedStrategy.CUSTOM, params, MARKET))
                    .isInstanceOf(InvalidInputException.class);
        }

        @Test
        @DisplayName("Invalid market is rejected before any template runs")
        void invalidMarket() {
            MarketParams noVol = MARKET.toBuilder().volatility(0.0).build();

            assertThatThrownBy(() -> resolver.resolveStrategy(NamedStrategy.FORWARD, null, noVol))
                    .isInstanceOf(InvalidInputException.class);
        }
    }
}
