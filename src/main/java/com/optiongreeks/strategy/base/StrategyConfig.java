package com.optiongreeks.strategy.base;

import com.optiongreeks.domain.model.ExpirationDate;
import java.math.BigDecimal;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Market inputs and sizing shared by every strategy shape.
 *
 * <p>Each leg a strategy opens is priced off these values: same underlying, same
 * expiry, same volatility. Shape-specific configs extend this with strike offsets.
 *
 * <p>Uses {@code @SuperBuilder} so subclasses can chain builder calls:
 * {@code StrangleConfig.builder().underlying("SPY").underlyingPrice(price).callOffset(10).build()}.
 */
@Data
@SuperBuilder
@NoArgsConstructor
public class StrategyConfig {

    /** Underlying symbol, e.g. "SPY". */
    private String underlying;

    private BigDecimal underlyingPrice;

    private ExpirationDate expiration;

    /** Annualised implied volatility applied to every leg. */
    private BigDecimal impliedVolatility;

    private BigDecimal riskFreeRate;

    /** Null is read as no dividend. */
    private BigDecimal dividendYield;

    /** Contracts per leg when the strategy opens its legs. */
    private BigDecimal quantity;

    /**
     * Strike interval for the underlying. Used for rounding the spot to the ATM strike.
     * Null or zero = no rounding.
     */
    private BigDecimal strikeInterval;
}
