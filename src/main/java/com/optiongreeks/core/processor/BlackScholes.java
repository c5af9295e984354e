package com.optiongreeks.core.processor;

import static com.optiongreeks.core.math.DecimalMath.MC;
import static com.optiongreeks.core.math.DecimalMath.TWO;

import com.optiongreeks.core.math.DecimalMath;
import com.optiongreeks.exception.GreeksException;
import java.math.BigDecimal;
import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Black-Scholes building blocks: d1/d2 and the standard normal PDF and CDF.
 *
 * <p>Key formulas:
 * <ul>
 *   <li>d1 = [ln(S/K) + (r + sigma^2/2) * T] / (sigma * sqrt(T))
 *   <li>d2 = d1 - sigma * sqrt(T)
 *   <li>n(x) = e^(-x^2/2) / sqrt(2 * pi)
 *   <li>N(x) = standard normal CDF (commons-math3)
 * </ul>
 *
 * <p>Inputs are validated before anything is computed: S, K, sigma and T must all be
 * strictly positive, and each violation has its own error code. The rate may be any sign
 * but must be present; it is checked last.
 *
 * <p>Stateless and thread-safe.
 */
public final class BlackScholes {

    // Reusable standard normal distribution (thread-safe in commons-math3)
    private static final NormalDistribution NORM = new NormalDistribution();

    private static final BigDecimal SQRT_TWO_PI = DecimalMath.sqrt(TWO.multiply(BigDecimal.valueOf(Math.PI), MC));

    private BlackScholes() {}

    public static BigDecimal d1(
            BigDecimal underlyingPrice,
            BigDecimal strikePrice,
            BigDecimal riskFreeRate,
            BigDecimal years,
            BigDecimal volatility) {
        validate(underlyingPrice, strikePrice, riskFreeRate, years, volatility);

        BigDecimal sqrtT = DecimalMath.sqrt(years);
        BigDecimal drift = riskFreeRate.add(volatility.multiply(volatility, MC).divide(TWO, MC), MC);
        BigDecimal numerator = DecimalMath.ln(underlyingPrice.divide(strikePrice, MC))
                .add(drift.multiply(years, MC), MC);

        return numerator.divide(volatility.multiply(sqrtT, MC), MC);
    }

    public static BigDecimal d2(
            BigDecimal underlyingPrice,
            BigDecimal strikePrice,
            BigDecimal riskFreeRate,
            BigDecimal years,
            BigDecimal volatility) {
        BigDecimal d1 = d1(underlyingPrice, strikePrice, riskFreeRate, years, volatility);
        return d1.subtract(volatility.multiply(DecimalMath.sqrt(years), MC), MC);
    }

    /** Standard normal probability density. */
    public static BigDecimal n(BigDecimal x) {
        BigDecimal exponent = x.multiply(x, MC).divide(TWO, MC).negate();
        return DecimalMath.exp(exponent).divide(SQRT_TWO_PI, MC);
    }

    /** First derivative of the standard normal density: -x * n(x). */
    public static BigDecimal nPrime(BigDecimal x) {
        return x.negate().multiply(n(x), MC);
    }

    /**
     * Standard normal cumulative distribution. The only step that leaves decimal
     * arithmetic, so a decimal/double conversion failure is its only error.
     */
    public static BigDecimal bigN(BigDecimal x) {
        return DecimalMath.toDecimal(NORM.cumulativeProbability(DecimalMath.toDouble(x)));
    }

    private static void validate(
            BigDecimal underlyingPrice,
            BigDecimal strikePrice,
            BigDecimal riskFreeRate,
            BigDecimal years,
            BigDecimal volatility) {
        if (underlyingPrice == null || underlyingPrice.signum() <= 0) {
            throw GreeksException.invalidPrice(underlyingPrice);
        }
        if (strikePrice == null || strikePrice.signum() <= 0) {
            throw GreeksException.invalidStrike(strikePrice);
        }
        if (volatility == null || volatility.signum() <= 0) {
            throw GreeksException.invalidVolatility(volatility);
        }
        if (years == null || years.signum() <= 0) {
            throw GreeksException.invalidTime(years);
        }
        if (riskFreeRate == null) {
            throw GreeksException.invalidRate(null);
        }
    }
}
