package com.optiongreeks.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Black-Scholes sensitivities for one contract or summed across the legs of a strategy.
 *
 * <p>Theta is annualised (per year of decay, not per day) and vega is per unit of
 * volatility (not per 1%). Alpha is never summed: it is derived once from the
 * aggregated gamma and theta.
 */
@Value
@Builder
public class Greek {

    /** Price sensitivity to the underlying. Signed by side: short legs contribute negative delta for calls. */
    BigDecimal delta;

    /** Rate of change of delta. */
    BigDecimal gamma;

    /** Time decay per year. */
    BigDecimal theta;

    /** Sensitivity to volatility. */
    BigDecimal vega;

    /** Sensitivity to the risk-free rate. */
    BigDecimal rho;

    /** Sensitivity to the dividend yield. */
    BigDecimal rhoD;

    /** gamma / theta, zero when theta is zero. */
    BigDecimal alpha;
}
