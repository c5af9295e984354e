package com.optiongreeks.unit.greeks;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.optiongreeks.core.processor.GreeksCalculator;
import com.optiongreeks.domain.enums.OptionStyle;
import com.optiongreeks.domain.enums.Side;
import com.optiongreeks.domain.model.ExpirationDate;
import com.optiongreeks.domain.model.Greek;
import com.optiongreeks.domain.model.OptionContract;
import com.optiongreeks.domain.model.Position;
import com.optiongreeks.exception.ErrorCode;
import com.optiongreeks.exception.GreeksException;
import com.optiongreeks.greeks.Greeks;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for the default aggregation in {@link Greeks}: sums over legs, alpha, and
 * error propagation from the holder and from individual legs.
 */
class GreeksAggregationTest {

    private static OptionContract contract(OptionStyle style, Side side, int strike) {
        return OptionContract.builder()
                .underlyingSymbol("TEST")
                .underlyingPrice(BigDecimal.valueOf(100))
                .strikePrice(BigDecimal.valueOf(strike))
                .riskFreeRate(new BigDecimal("0.05"))
                .expiration(ExpirationDate.ofDays(45))
                .impliedVolatility(new BigDecimal("0.25"))
                .dividendYield(new BigDecimal("0.01"))
                .optionStyle(style)
                .quantity(BigDecimal.ONE)
                .side(side)
                .build();
    }

    /** Holder backed by a fixed list of legs. */
    private static Greeks holder(OptionContract... options) {
        List<OptionContract> legs = List.of(options);
        return () -> legs;
    }

    @Nested
    @DisplayName("Sums")
    class Sums {

        @Test
        @DisplayName("Aggregate delta equals the sum of leg deltas")
        void deltaIsAdditive() {
            OptionContract call = contract(OptionStyle.CALL, Side.SHORT, 105);
            OptionContract put = contract(OptionStyle.PUT, Side.LONG, 95);

            BigDecimal expected = GreeksCalculator.delta(call).add(GreeksCalculator.delta(put));
            assertThat(holder(call, put).delta().doubleValue()).isCloseTo(expected.doubleValue(), within(1e-12));
        }

        @Test
        @DisplayName("Long and short of the same contract cancel in delta but not in gamma")
        void longAndShortCancelDelta() {
            Greeks pair = holder(contract(OptionStyle.CALL, Side.LONG, 100), contract(OptionStyle.CALL, Side.SHORT, 100));
            OptionContract single = contract(OptionStyle.CALL, Side.LONG, 100);

            assertThat(pair.delta()).isEqualByComparingTo(BigDecimal.ZERO);
            assertThat(pair.gamma().doubleValue())
                    .isCloseTo(2 * GreeksCalculator.gamma(single).doubleValue(), within(1e-12));
        }

        @Test
        @DisplayName("A single contract is its own holder")
        void contractIsGreeksCapable() {
            OptionContract call = contract(OptionStyle.CALL, Side.LONG, 100);
            assertThat(call.getOptions()).containsExactly(call);
            assertThat(call.vega()).isEqualByComparingTo(GreeksCalculator.vega(call));
        }
    }

    @Nested
    @DisplayName("Full Greek and alpha")
    class FullGreek {

        @Test
        @DisplayName("greeks() fills every field and alpha = gamma / theta")
        void greekRecord() {
            Greek greek = holder(contract(OptionStyle.PUT, Side.SHORT, 95)).greeks();

            assertThat(greek.getDelta()).isNotNull();
            assertThat(greek.getRho()).isNotNull();
            assertThat(greek.getRhoD()).isNotNull();
            assertThat(greek.getAlpha().doubleValue())
                    .isCloseTo(greek.getGamma().doubleValue() / greek.getTheta().doubleValue(), within(1e-9));
        }

        @Test
        @DisplayName("alpha is zero when theta is zero")
        void alphaZeroWhenThetaZero() {
            OptionContract closed = contract(OptionStyle.CALL, Side.LONG, 100).toBuilder()
                    .quantity(BigDecimal.ZERO)
                    .build();

            assertThat(holder(closed).alpha()).isEqualByComparingTo(BigDecimal.ZERO);
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("A failing leg stops the aggregation")
        void legFailurePropagates() {
            OptionContract bad = contract(OptionStyle.CALL, Side.LONG, 100).toBuilder()
                    .impliedVolatility(new BigDecimal("-0.1"))
                    .build();

            assertThatThrownBy(() -> holder(contract(OptionStyle.PUT, Side.LONG, 95), bad).gamma())
                    .isInstanceOf(GreeksException.class)
                    .extracting("errorCode")
                    .isEqualTo(ErrorCode.INVALID_VOLATILITY);
        }

        @Test
        @DisplayName("A position without a contract cannot list its options")
        void positionWithoutOption() {
            Position empty = Position.builder().id("P-1").build();

            assertThatThrownBy(empty::delta)
                    .isInstanceOf(GreeksException.class)
                    .extracting("errorCode")
                    .isEqualTo(ErrorCode.OPTIONS_RETRIEVAL);
        }
    }
}
