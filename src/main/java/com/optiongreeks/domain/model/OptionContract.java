package com.optiongreeks.domain.model;

import com.optiongreeks.domain.enums.OptionStyle;
import com.optiongreeks.domain.enums.Side;
import com.optiongreeks.exception.GreeksException;
import com.optiongreeks.greeks.Greeks;
import java.math.BigDecimal;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single European option contract: the input to every Greek function.
 *
 * <p>Quantity is never negative; direction lives in {@link #side}. A quantity of zero
 * means the leg has been fully closed by a delta adjustment but is still tracked.
 *
 * <p>A contract is itself Greeks-capable: it lists only itself.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OptionContract implements Greeks {

    private String underlyingSymbol;
    private BigDecimal underlyingPrice;
    private BigDecimal strikePrice;

    /** Continuously compounded, may be negative. */
    private BigDecimal riskFreeRate;

    private ExpirationDate expiration;

    /** Annualised implied volatility as a decimal (0.2 = 20%). */
    private BigDecimal impliedVolatility;

    /** Continuous dividend yield as a decimal. Null is treated as zero. */
    private BigDecimal dividendYield;

    private OptionStyle optionStyle;
    private BigDecimal quantity;
    private Side side;

    public BigDecimal getDividendYield() {
        return dividendYield != null ? dividendYield : BigDecimal.ZERO;
    }

    /** Years to expiration. A contract without an expiration fails as an invalid time. */
    public BigDecimal getYears() {
        if (expiration == null) {
            throw GreeksException.invalidTime(null);
        }
        return expiration.getYears();
    }

    public boolean isLong() {
        return side == Side.LONG;
    }

    public boolean isCall() {
        return optionStyle == OptionStyle.CALL;
    }

    @Override
    public List<OptionContract> getOptions() {
        return List.of(this);
    }
}
