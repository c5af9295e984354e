package com.optiongreeks.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.optiongreeks.domain.model.AdjustmentTarget;
import com.optiongreeks.greeks.PortfolioGreeks;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AdjustmentTargetTest {

    private static final BigDecimal TOLERANCE = new BigDecimal("0.01");

    private static PortfolioGreeks greeks(String delta, String gamma, String vega) {
        return PortfolioGreeks.ZERO.toBuilder()
                .delta(new BigDecimal(delta))
                .gamma(new BigDecimal(gamma))
                .theta(new BigDecimal("-0.05"))
                .vega(new BigDecimal(vega))
                .build();
    }

    @Nested
    @DisplayName("Presets")
    class Presets {

        @Test
        @DisplayName("Each preset adds one more Greek at zero")
        void presets() {
            AdjustmentTarget delta = AdjustmentTarget.deltaNeutral();
            AdjustmentTarget deltaGamma = AdjustmentTarget.deltaGammaNeutral();
            AdjustmentTarget full = AdjustmentTarget.fullNeutral();

            assertThat(delta.getDelta()).isEqualByComparingTo(BigDecimal.ZERO);
            assertThat(delta.getGamma()).isNull();
            assertThat(deltaGamma.getGamma()).isEqualByComparingTo(BigDecimal.ZERO);
            assertThat(deltaGamma.getVega()).isNull();
            assertThat(full.getVega()).isEqualByComparingTo(BigDecimal.ZERO);
            assertThat(full.getTheta()).isNull();
            assertThat(delta.targetsGamma()).isFalse();
            assertThat(full.targetsGamma()).isTrue();
        }

        @Test
        @DisplayName("with* returns a copy with one field changed")
        void withers() {
            AdjustmentTarget base = AdjustmentTarget.none();
            AdjustmentTarget custom = base.withDelta(new BigDecimal("0.1")).withGamma(new BigDecimal("0.02"));

            assertThat(base.getDelta()).isNull();
            assertThat(custom.getDelta()).isEqualByComparingTo("0.1");
            assertThat(custom.getGamma()).isEqualByComparingTo("0.02");
            assertThat(custom.getVega()).isNull();
        }
    }

    @Nested
    @DisplayName("Gaps")
    class Gaps {

        @Test
        @DisplayName("Gaps are target minus current, and only for targeted Greeks")
        void gaps() {
            PortfolioGreeks current = greeks("0.3", "0.02", "0.15");

            assertThat(AdjustmentTarget.deltaNeutral().deltaGap(current)).isEqualByComparingTo("-0.3");
            assertThat(AdjustmentTarget.deltaNeutral().gammaGap(current)).isEmpty();
            assertThat(AdjustmentTarget.deltaGammaNeutral().gammaGap(current)).hasValueSatisfying(
                    gap -> assertThat(gap).isEqualByComparingTo("-0.02"));
            assertThat(AdjustmentTarget.fullNeutral().vegaGap(current)).hasValueSatisfying(
                    gap -> assertThat(gap).isEqualByComparingTo("-0.15"));
        }

        @Test
        @DisplayName("An untargeted delta has no gap")
        void untargetedDelta() {
            assertThat(AdjustmentTarget.none().deltaGap(greeks("5", "0", "0"))).isEqualByComparingTo(BigDecimal.ZERO);
        }
    }

    @Test
    @DisplayName("Satisfied when every targeted Greek is within tolerance")
    void satisfied() {
        AdjustmentTarget target = AdjustmentTarget.deltaNeutral();

        assertThat(target.isSatisfied(greeks("0.005", "0.02", "0.15"), TOLERANCE)).isTrue();
        assertThat(target.isSatisfied(greeks("0.5", "0.02", "0.15"), TOLERANCE)).isFalse();
        assertThat(AdjustmentTarget.deltaGammaNeutral().isSatisfied(greeks("0.005", "0.02", "0"), TOLERANCE))
                .isFalse();
        assertThat(target.withTheta(new BigDecimal("-0.05")).isSatisfied(greeks("0", "1", "1"), TOLERANCE))
                .isTrue();
        assertThat(AdjustmentTarget.none().isSatisfied(greeks("9", "9", "9"), TOLERANCE)).isTrue();
    }
}
