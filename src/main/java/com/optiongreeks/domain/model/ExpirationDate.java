package com.optiongreeks.domain.model;

import static com.optiongreeks.core.math.DecimalMath.MC;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import lombok.Value;

/**
 * Time to expiration, normalised to years. All Greek formulas consume {@link #getYears()}.
 */
@Value
public class ExpirationDate {

    private static final BigDecimal DAYS_PER_YEAR = BigDecimal.valueOf(365);

    // 525600 = 365 * 24 * 60
    private static final BigDecimal MINUTES_PER_YEAR = BigDecimal.valueOf(525600);

    BigDecimal years;

    public static ExpirationDate ofYears(BigDecimal years) {
        return new ExpirationDate(years);
    }

    public static ExpirationDate ofDays(BigDecimal days) {
        return new ExpirationDate(days.divide(DAYS_PER_YEAR, MC));
    }

    public static ExpirationDate ofDays(int days) {
        return ofDays(BigDecimal.valueOf(days));
    }

    /**
     * Minutes between {@code now} and {@code expiry}, converted to years. Clamped to a
     * minimum of 1 minute so an expiring contract never produces T = 0.
     */
    public static ExpirationDate between(LocalDateTime now, LocalDateTime expiry) {
        long minutes = Math.max(ChronoUnit.MINUTES.between(now, expiry), 1);
        return new ExpirationDate(BigDecimal.valueOf(minutes).divide(MINUTES_PER_YEAR, MC));
    }
}
