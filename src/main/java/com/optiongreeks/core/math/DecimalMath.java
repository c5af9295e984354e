package com.optiongreeks.core.math;

import com.optiongreeks.exception.DecimalConversionException;
import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Decimal arithmetic shared by every numeric routine.
 *
 * <p>All money and Greek values are {@link BigDecimal}s computed in
 * {@link MathContext#DECIMAL64}. Transcendental functions (exp, ln) have no exact
 * decimal implementation in the JDK, so they cross into {@code double} and back.
 * That crossing is the only place a conversion can fail, and it is kept here so
 * callers never touch {@code doubleValue()} directly.
 */
public final class DecimalMath {

    public static final MathContext MC = MathContext.DECIMAL64;

    public static final BigDecimal TWO = BigDecimal.valueOf(2);

    private DecimalMath() {}

    public static double toDouble(BigDecimal value) {
        if (value == null) {
            throw new DecimalConversionException("Cannot convert null decimal to double");
        }
        double result = value.doubleValue();
        if (Double.isInfinite(result)) {
            throw new DecimalConversionException("Decimal out of double range", value);
        }
        return result;
    }

    public static BigDecimal toDecimal(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new DecimalConversionException("Cannot convert non-finite double to decimal", value);
        }
        return new BigDecimal(value, MC);
    }

    public static BigDecimal exp(BigDecimal x) {
        return toDecimal(Math.exp(toDouble(x)));
    }

    public static BigDecimal ln(BigDecimal x) {
        if (x == null || x.signum() <= 0) {
            throw new DecimalConversionException("Logarithm undefined for non-positive value", x);
        }
        return toDecimal(Math.log(toDouble(x)));
    }

    public static BigDecimal sqrt(BigDecimal x) {
        if (x == null || x.signum() < 0) {
            throw new DecimalConversionException("Square root undefined for negative value", x);
        }
        return x.sqrt(MC);
    }

    /** e^(-rate * years), the continuous discount factor used for rates and dividend yields. */
    public static BigDecimal discountFactor(BigDecimal rate, BigDecimal years) {
        return exp(rate.multiply(years, MC).negate());
    }

    public static boolean isZero(BigDecimal x) {
        return x.signum() == 0;
    }

    public static BigDecimal min(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
