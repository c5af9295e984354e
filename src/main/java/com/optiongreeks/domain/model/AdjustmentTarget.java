package com.optiongreeks.domain.model;

import static com.optiongreeks.core.math.DecimalMath.MC;

import com.optiongreeks.greeks.PortfolioGreeks;
import java.math.BigDecimal;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Greek values an adjustment plan aims for. A null field is not targeted.
 *
 * <p>Common targets:
 * <ul>
 *   <li>{@link #deltaNeutral()}: delta 0
 *   <li>{@link #deltaGammaNeutral()}: delta 0, gamma 0
 *   <li>{@link #fullNeutral()}: delta 0, gamma 0, vega 0
 * </ul>
 * Any target can be tweaked with the {@code with*} methods.
 */
@Value
@With
@Builder(toBuilder = true)
public class AdjustmentTarget {

    BigDecimal delta;
    BigDecimal gamma;
    BigDecimal vega;
    BigDecimal theta;

    public static AdjustmentTarget none() {
        return AdjustmentTarget.builder().build();
    }

    public static AdjustmentTarget deltaNeutral() {
        return none().withDelta(BigDecimal.ZERO);
    }

    public static AdjustmentTarget deltaGammaNeutral() {
        return deltaNeutral().withGamma(BigDecimal.ZERO);
    }

    public static AdjustmentTarget fullNeutral() {
        return deltaGammaNeutral().withVega(BigDecimal.ZERO);
    }

    /** Delta to add to reach the target, zero when delta is not targeted. */
    public BigDecimal deltaGap(PortfolioGreeks current) {
        return delta == null ? BigDecimal.ZERO : current.deltaGap(delta);
    }

    public Optional<BigDecimal> gammaGap(PortfolioGreeks current) {
        return Optional.ofNullable(gamma).map(current::gammaGap);
    }

    public Optional<BigDecimal> vegaGap(PortfolioGreeks current) {
        return Optional.ofNullable(vega).map(v -> v.subtract(current.getVega(), MC));
    }

    /** True when every targeted Greek is within {@code tolerance} of its target. */
    public boolean isSatisfied(PortfolioGreeks current, BigDecimal tolerance) {
        return within(delta, current.getDelta(), tolerance)
                && within(gamma, current.getGamma(), tolerance)
                && within(vega, current.getVega(), tolerance)
                && within(theta, current.getTheta(), tolerance);
    }

    public boolean targetsGamma() {
        return gamma != null;
    }

    private static boolean within(BigDecimal target, BigDecimal actual, BigDecimal tolerance) {
        return target == null || actual.subtract(target, MC).abs().compareTo(tolerance) <= 0;
    }
}
