package com.optiongreeks.greeks;

import static com.optiongreeks.core.math.DecimalMath.MC;

import com.optiongreeks.domain.model.Greek;
import java.math.BigDecimal;
import java.util.Collection;
import lombok.Builder;
import lombok.Value;

/**
 * Greeks summed across several holders (strategies, positions, single contracts),
 * optionally including shares of the underlying at delta 1 each.
 *
 * <p>Used for risk checks that span more than one strategy. Alpha is not carried here
 * since it only makes sense for a single aggregate.
 */
@Value
@Builder(toBuilder = true)
public class PortfolioGreeks {

    public static final PortfolioGreeks ZERO = PortfolioGreeks.builder()
            .delta(BigDecimal.ZERO)
            .gamma(BigDecimal.ZERO)
            .theta(BigDecimal.ZERO)
            .vega(BigDecimal.ZERO)
            .rho(BigDecimal.ZERO)
            .build();

    BigDecimal delta;
    BigDecimal gamma;
    BigDecimal theta;
    BigDecimal vega;
    BigDecimal rho;

    public static PortfolioGreeks of(Collection<? extends Greeks> holders) {
        PortfolioGreeks total = ZERO;
        for (Greeks holder : holders) {
            total = total.combined(from(holder.greeks()));
        }
        return total;
    }

    /** Same as {@link #of} plus a signed share count of the underlying. */
    public static PortfolioGreeks of(Collection<? extends Greeks> holders, BigDecimal underlyingShares) {
        PortfolioGreeks options = of(holders);
        return options.toBuilder().delta(options.delta.add(underlyingShares, MC)).build();
    }

    public static PortfolioGreeks from(Greek greek) {
        return PortfolioGreeks.builder()
                .delta(greek.getDelta())
                .gamma(greek.getGamma())
                .theta(greek.getTheta())
                .vega(greek.getVega())
                .rho(greek.getRho())
                .build();
    }

    public PortfolioGreeks combined(PortfolioGreeks other) {
        return PortfolioGreeks.builder()
                .delta(delta.add(other.delta, MC))
                .gamma(gamma.add(other.gamma, MC))
                .theta(theta.add(other.theta, MC))
                .vega(vega.add(other.vega, MC))
                .rho(rho.add(other.rho, MC))
                .build();
    }

    public boolean isDeltaNeutral(BigDecimal tolerance) {
        return delta.abs().compareTo(tolerance) <= 0;
    }

    public boolean isGammaNeutral(BigDecimal tolerance) {
        return gamma.abs().compareTo(tolerance) <= 0;
    }

    public boolean isVegaNeutral(BigDecimal tolerance) {
        return vega.abs().compareTo(tolerance) <= 0;
    }

    /** How much delta must be added to reach {@code target}. */
    public BigDecimal deltaGap(BigDecimal target) {
        return target.subtract(delta, MC);
    }

    public BigDecimal gammaGap(BigDecimal target) {
        return target.subtract(gamma, MC);
    }
}
