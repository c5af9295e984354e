package com.optiongreeks.unit.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.optiongreeks.domain.enums.OptionStyle;
import com.optiongreeks.domain.enums.Side;
import com.optiongreeks.domain.enums.StrategyType;
import com.optiongreeks.domain.model.ExpirationDate;
import com.optiongreeks.domain.model.OptionContract;
import com.optiongreeks.domain.model.Position;
import com.optiongreeks.exception.BusinessException;
import com.optiongreeks.exception.ErrorCode;
import com.optiongreeks.exception.ResourceNotFoundException;
import com.optiongreeks.strategy.base.BaseStrategy;
import com.optiongreeks.strategy.base.StrategyConfig;
import com.optiongreeks.strategy.impl.BearPutSpreadStrategy;
import com.optiongreeks.strategy.impl.BullCallSpreadStrategy;
import com.optiongreeks.strategy.impl.CustomStrategy;
import com.optiongreeks.strategy.impl.IronCondorConfig;
import com.optiongreeks.strategy.impl.IronCondorStrategy;
import com.optiongreeks.strategy.impl.LongStraddleStrategy;
import com.optiongreeks.strategy.impl.SpreadConfig;
import com.optiongreeks.strategy.impl.StraddleConfig;
import com.optiongreeks.strategy.impl.StraddleStrategy;
import com.optiongreeks.strategy.impl.StrangleConfig;
import com.optiongreeks.strategy.impl.StrangleStrategy;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for the strategy shapes: leg construction from config, leg validation,
 * position bookkeeping and underlying price propagation.
 */
class StrategiesTest {

    private static final BigDecimal SPOT = new BigDecimal("452.30");

    private static Position leg(String id, int strike, OptionStyle style, Side side) {
        OptionContract option = OptionContract.builder()
                .underlyingSymbol("SPY")
                .underlyingPrice(SPOT)
                .strikePrice(BigDecimal.valueOf(strike))
                .riskFreeRate(new BigDecimal("0.045"))
                .expiration(ExpirationDate.ofDays(21))
                .impliedVolatility(new BigDecimal("0.18"))
                .optionStyle(style)
                .quantity(BigDecimal.ONE)
                .side(side)
                .build();
        return Position.builder().id(id).option(option).build();
    }

    private static List<Integer> strikes(BaseStrategy strategy) {
        return strategy.getPositions().stream()
                .map(p -> p.getOption().getStrikePrice().intValueExact())
                .toList();
    }

    @Nested
    @DisplayName("Straddles")
    class Straddles {

        private StraddleConfig config() {
            return StraddleConfig.builder()
                    .underlying("SPY")
                    .underlyingPrice(SPOT)
                    .expiration(ExpirationDate.ofDays(21))
                    .impliedVolatility(new BigDecimal("0.18"))
                    .riskFreeRate(new BigDecimal("0.045"))
                    .quantity(BigDecimal.valueOf(2))
                    .strikeInterval(BigDecimal.valueOf(5))
                    .build();
        }

        @Test
        @DisplayName("open() sells a call and a put at the rounded ATM strike")
        void opensShortLegsAtAtm() {
            StraddleStrategy straddle = new StraddleStrategy("STR-1", "Straddle", config());

            straddle.open();

            assertThat(straddle.getType()).isEqualTo(StrategyType.STRADDLE);
            assertThat(straddle.getPositions()).hasSize(2);
            assertThat(strikes(straddle)).containsOnly(450);
            assertThat(straddle.getPositions()).allMatch(p -> p.getOption().getSide() == Side.SHORT);
            assertThat(straddle.getPositions()).allMatch(p -> p.getQuantity().compareTo(BigDecimal.valueOf(2)) == 0);
            assertThat(straddle.getAtmStrike()).isEqualByComparingTo("450");
        }

        @Test
        @DisplayName("Opening twice is rejected")
        void openTwice() {
            StraddleStrategy straddle = new StraddleStrategy("STR-1", "Straddle", config());
            straddle.open();

            assertThatThrownBy(straddle::open).isInstanceOf(BusinessException.class);
        }

        @Test
        @DisplayName("Legs at different strikes are rejected")
        void mismatchedStrike() {
            StraddleStrategy straddle = new StraddleStrategy("STR-1", "Straddle", config());
            straddle.addPosition(leg("C", 450, OptionStyle.CALL, Side.SHORT));

            assertThatThrownBy(() -> straddle.addPosition(leg("P", 445, OptionStyle.PUT, Side.SHORT)))
                    .isInstanceOf(BusinessException.class)
                    .extracting("errorCode")
                    .isEqualTo(ErrorCode.VALIDATION_ERROR);
        }

        @Test
        @DisplayName("A short straddle rejects long legs, a long straddle rejects short legs")
        void sideIsEnforced() {
            StraddleStrategy shortStraddle = new StraddleStrategy("STR-1", "Short", config());
            LongStraddleStrategy longStraddle = new LongStraddleStrategy("STR-2", "Long", config());

            assertThatThrownBy(() -> shortStraddle.addPosition(leg("C", 450, OptionStyle.CALL, Side.LONG)))
                    .isInstanceOf(BusinessException.class);
            assertThatThrownBy(() -> longStraddle.addPosition(leg("C", 450, OptionStyle.CALL, Side.SHORT)))
                    .isInstanceOf(BusinessException.class);
        }

        @Test
        @DisplayName("A long straddle at the money is close to delta neutral and long gamma")
        void longStraddleGreeks() {
            LongStraddleStrategy straddle = new LongStraddleStrategy("STR-2", "Long", config());
            straddle.open();

            assertThat(straddle.getType()).isEqualTo(StrategyType.LONG_STRADDLE);
            assertThat(straddle.delta().doubleValue()).isCloseTo(0.0, within(0.5));
            assertThat(straddle.gamma().signum()).isPositive();
        }
    }

    @Nested
    @DisplayName("Strangle and iron condor")
    class WingedShapes {

        @Test
        @DisplayName("Strangle opens a put below and a call above ATM")
        void strangleLegs() {
            StrangleStrategy strangle = new StrangleStrategy("STR-3", "Strangle", StrangleConfig.builder()
                    .underlying("SPY")
                    .underlyingPrice(SPOT)
                    .expiration(ExpirationDate.ofDays(21))
                    .impliedVolatility(new BigDecimal("0.18"))
                    .riskFreeRate(new BigDecimal("0.045"))
                    .quantity(BigDecimal.ONE)
                    .strikeInterval(BigDecimal.valueOf(5))
                    .callOffset(BigDecimal.TEN)
                    .putOffset(BigDecimal.TEN)
                    .build());

            strangle.open();

            assertThat(strikes(strangle)).containsExactly(440, 460);
        }

        @Test
        @DisplayName("Strangle rejects a call struck below its put")
        void strangleOrdering() {
            StrangleStrategy strangle = new StrangleStrategy("STR-3", "Strangle", StrangleConfig.builder()
                    .underlyingPrice(SPOT)
                    .build());
            strangle.addPosition(leg("P", 440, OptionStyle.PUT, Side.SHORT));

            assertThatThrownBy(() -> strangle.addPosition(leg("C", 435, OptionStyle.CALL, Side.SHORT)))
                    .isInstanceOf(BusinessException.class);
        }

        @Test
        @DisplayName("Iron condor opens four ordered legs")
        void ironCondorLegs() {
            IronCondorStrategy condor = new IronCondorStrategy("STR-4", "Condor", IronCondorConfig.builder()
                    .underlying("SPY")
                    .underlyingPrice(SPOT)
                    .expiration(ExpirationDate.ofDays(21))
                    .impliedVolatility(new BigDecimal("0.18"))
                    .riskFreeRate(new BigDecimal("0.045"))
                    .quantity(BigDecimal.ONE)
                    .strikeInterval(BigDecimal.valueOf(5))
                    .callOffset(BigDecimal.TEN)
                    .putOffset(BigDecimal.TEN)
                    .wingWidth(BigDecimal.valueOf(5))
                    .build());

            condor.open();

            assertThat(condor.getType()).isEqualTo(StrategyType.IRON_CONDOR);
            assertThat(strikes(condor)).containsExactly(435, 440, 460, 465);
            assertThat(condor.getPosition(OptionStyle.CALL, Side.LONG, BigDecimal.valueOf(465))).hasSize(1);
        }

        @Test
        @DisplayName("Iron condor rejects a long put above the short put")
        void ironCondorOrdering() {
            IronCondorStrategy condor = new IronCondorStrategy("STR-4", "Condor", IronCondorConfig.builder()
                    .underlyingPrice(SPOT)
                    .build());
            condor.addPosition(leg("SP", 440, OptionStyle.PUT, Side.SHORT));

            assertThatThrownBy(() -> condor.addPosition(leg("LP", 445, OptionStyle.PUT, Side.LONG)))
                    .isInstanceOf(BusinessException.class);
            assertThatThrownBy(() -> condor.addPosition(leg("SP2", 430, OptionStyle.PUT, Side.SHORT)))
                    .isInstanceOf(BusinessException.class);
        }
    }

    @Nested
    @DisplayName("Vertical spreads")
    class Spreads {

        private SpreadConfig config(int buyOffset, int sellOffset) {
            return SpreadConfig.builder()
                    .underlying("SPY")
                    .underlyingPrice(SPOT)
                    .expiration(ExpirationDate.ofDays(21))
                    .impliedVolatility(new BigDecimal("0.18"))
                    .riskFreeRate(new BigDecimal("0.045"))
                    .quantity(BigDecimal.ONE)
                    .strikeInterval(BigDecimal.valueOf(5))
                    .buyOffset(BigDecimal.valueOf(buyOffset))
                    .sellOffset(BigDecimal.valueOf(sellOffset))
                    .build();
        }

        @Test
        @DisplayName("Bull call spread is net long delta")
        void bullCallSpread() {
            BullCallSpreadStrategy spread = new BullCallSpreadStrategy("STR-5", "Bull", config(0, 10));
            spread.open();

            assertThat(spread.getType()).isEqualTo(StrategyType.BULL_CALL_SPREAD);
            assertThat(spread.delta().signum()).isPositive();
        }

        @Test
        @DisplayName("Bull call spread rejects inverted strikes and puts")
        void bullCallSpreadValidation() {
            BullCallSpreadStrategy inverted = new BullCallSpreadStrategy("STR-5", "Bull", config(10, 0));
            assertThatThrownBy(inverted::open).isInstanceOf(BusinessException.class);

            BullCallSpreadStrategy spread = new BullCallSpreadStrategy("STR-6", "Bull", config(0, 10));
            assertThatThrownBy(() -> spread.addPosition(leg("P", 450, OptionStyle.PUT, Side.LONG)))
                    .isInstanceOf(BusinessException.class);
        }

        @Test
        @DisplayName("Bear put spread is net short delta")
        void bearPutSpread() {
            BearPutSpreadStrategy spread = new BearPutSpreadStrategy("STR-7", "Bear", config(0, -10));
            spread.open();

            assertThat(spread.getType()).isEqualTo(StrategyType.BEAR_PUT_SPREAD);
            assertThat(spread.delta().signum()).isNegative();
        }

        @Test
        @DisplayName("Bear put spread rejects a long put below the short put")
        void bearPutSpreadValidation() {
            BearPutSpreadStrategy spread = new BearPutSpreadStrategy("STR-7", "Bear", config(0, -10));
            spread.addPosition(leg("SP", 440, OptionStyle.PUT, Side.SHORT));

            assertThatThrownBy(() -> spread.addPosition(leg("LP", 435, OptionStyle.PUT, Side.LONG)))
                    .isInstanceOf(BusinessException.class);
        }
    }

    @Nested
    @DisplayName("Position bookkeeping")
    class Bookkeeping {

        private CustomStrategy custom() {
            return new CustomStrategy("STR-8", "Custom", StrategyConfig.builder()
                    .underlying("SPY")
                    .underlyingPrice(SPOT)
                    .build());
        }

        @Test
        @DisplayName("Duplicate ids and negative quantities are rejected")
        void addValidation() {
            CustomStrategy strategy = custom();
            strategy.addPosition(leg("A", 450, OptionStyle.CALL, Side.LONG));

            assertThatThrownBy(() -> strategy.addPosition(leg("A", 455, OptionStyle.CALL, Side.LONG)))
                    .isInstanceOf(BusinessException.class);

            Position negative = leg("B", 455, OptionStyle.CALL, Side.LONG);
            negative.getOption().setQuantity(BigDecimal.valueOf(-1));
            assertThatThrownBy(() -> strategy.addPosition(negative)).isInstanceOf(BusinessException.class);
        }

        @Test
        @DisplayName("modifyPosition replaces by id and fails for unknown ids")
        void modify() {
            CustomStrategy strategy = custom();
            strategy.addPosition(leg("A", 450, OptionStyle.CALL, Side.LONG));

            strategy.modifyPosition(leg("A", 455, OptionStyle.PUT, Side.SHORT));

            assertThat(strategy.getPositions()).hasSize(1);
            assertThat(strategy.getPosition(OptionStyle.PUT, Side.SHORT, BigDecimal.valueOf(455))).hasSize(1);
            assertThatThrownBy(() -> strategy.modifyPosition(leg("Z", 455, OptionStyle.PUT, Side.SHORT)))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("removePosition drops the leg and fails for unknown ids")
        void remove() {
            CustomStrategy strategy = custom();
            strategy.addPosition(leg("A", 450, OptionStyle.CALL, Side.LONG));

            strategy.removePosition("A");

            assertThat(strategy.getPositions()).isEmpty();
            assertThat(strategy.hasPositions()).isFalse();
            assertThatThrownBy(() -> strategy.removePosition("A")).isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("getPosition returns live references")
        void liveReferences() {
            CustomStrategy strategy = custom();
            strategy.addPosition(leg("A", 450, OptionStyle.CALL, Side.LONG));

            strategy.getPosition(OptionStyle.CALL, Side.LONG, new BigDecimal("450.00"))
                    .get(0)
                    .getOption()
                    .setQuantity(BigDecimal.valueOf(3));

            assertThat(strategy.getPositions().get(0).getQuantity()).isEqualByComparingTo("3");
        }

        @Test
        @DisplayName("A new underlying price reaches every leg")
        void underlyingPricePropagates() {
            CustomStrategy strategy = custom();
            strategy.addPosition(leg("A", 450, OptionStyle.CALL, Side.LONG));
            strategy.addPosition(leg("B", 440, OptionStyle.PUT, Side.LONG));
            BigDecimal before = strategy.delta();

            strategy.setUnderlyingPrice(BigDecimal.valueOf(470));

            assertThat(strategy.getUnderlyingPrice()).isEqualByComparingTo("470");
            assertThat(strategy.getPositions())
                    .allMatch(p -> p.getOption().getUnderlyingPrice().compareTo(BigDecimal.valueOf(470)) == 0);
            assertThat(strategy.delta()).isGreaterThan(before);
            assertThat(strategy.getAtmStrike()).isEqualByComparingTo("450");
        }

        @Test
        @DisplayName("ATM strike falls back to the underlying price when nothing is held")
        void atmFallback() {
            assertThat(custom().getAtmStrike()).isEqualByComparingTo(SPOT);
        }
    }
}
