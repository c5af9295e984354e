package com.optiongreeks.core.processor;

import static com.optiongreeks.core.math.DecimalMath.MC;
import static com.optiongreeks.core.math.DecimalMath.TWO;

import com.optiongreeks.core.math.DecimalMath;
import com.optiongreeks.domain.model.OptionContract;
import com.optiongreeks.exception.GreeksException;
import java.math.BigDecimal;

/**
 * Black-Scholes Greeks for a single European option contract.
 *
 * <p>Key formulas (q = dividend yield, all results multiplied by quantity):
 * <ul>
 *   <li>Delta: sign * N(d1) * e^(-qT) for calls, sign * [N(d1) - 1] * e^(-qT) for puts
 *   <li>Gamma: e^(-qT) * n(d1) / (S * sigma * sqrt(T))
 *   <li>Theta: -S * sigma * e^(-qT) * n(d1) / (2 * sqrt(T)) -/+ r * K * e^(-rT) * N(+/-d2)
 *       +/- q * S * e^(-qT) * N(+/-d1)
 *   <li>Vega: S * e^(-qT) * n(d1) * sqrt(T)
 *   <li>Rho: K * T * e^(-rT) * N(d2) for calls, -K * T * e^(-rT) * N(-d2) for puts
 *   <li>Rho_d: -T * S * e^(-qT) * N(d1) for calls, T * S * e^(-qT) * N(-d1) for puts
 * </ul>
 *
 * <p>Only delta carries the side sign (+1 long, -1 short).
 *
 * <p>Edge cases handled:
 * <ul>
 *   <li>Zero volatility: delta only, defined by moneyness (ITM = +/-quantity, OTM = 0)
 *   <li>Every other Greek at zero volatility fails in the kernel with INVALID_VOLATILITY
 * </ul>
 */
public final class GreeksCalculator {

    private GreeksCalculator() {}

    public static BigDecimal delta(OptionContract option) {
        BigDecimal sign = option.getSide().sign();

        if (option.getImpliedVolatility() != null && DecimalMath.isZero(option.getImpliedVolatility())) {
            return zeroVolatilityDelta(option, sign);
        }

        BigDecimal d1 = d1(option);
        BigDecimal dividendDiscount = dividendDiscount(option);
        BigDecimal cdf = BlackScholes.bigN(d1);

        BigDecimal unit = option.isCall() ? cdf : cdf.subtract(BigDecimal.ONE, MC);
        return sign.multiply(unit, MC).multiply(dividendDiscount, MC).multiply(option.getQuantity(), MC);
    }

    public static BigDecimal gamma(OptionContract option) {
        BigDecimal d1 = d1(option);
        BigDecimal denominator = option.getUnderlyingPrice()
                .multiply(option.getImpliedVolatility(), MC)
                .multiply(DecimalMath.sqrt(option.getYears()), MC);

        return dividendDiscount(option)
                .multiply(BlackScholes.n(d1), MC)
                .divide(denominator, MC)
                .multiply(option.getQuantity(), MC);
    }

    public static BigDecimal theta(OptionContract option) {
        BigDecimal d1 = d1(option);
        BigDecimal d2 = d2(option);
        BigDecimal s = option.getUnderlyingPrice();
        BigDecimal k = option.getStrikePrice();
        BigDecimal r = option.getRiskFreeRate();
        BigDecimal q = option.getDividendYield();
        BigDecimal dividendDiscount = dividendDiscount(option);
        BigDecimal rateDiscount = rateDiscount(option);

        BigDecimal decay = s.negate()
                .multiply(option.getImpliedVolatility(), MC)
                .multiply(dividendDiscount, MC)
                .multiply(BlackScholes.n(d1), MC)
                .divide(TWO.multiply(DecimalMath.sqrt(option.getYears()), MC), MC);

        BigDecimal theta;
        if (option.isCall()) {
            BigDecimal rateTerm = r.multiply(k, MC).multiply(rateDiscount, MC).multiply(BlackScholes.bigN(d2), MC);
            BigDecimal dividendTerm =
                    q.multiply(s, MC).multiply(dividendDiscount, MC).multiply(BlackScholes.bigN(d1), MC);
            theta = decay.subtract(rateTerm, MC).add(dividendTerm, MC);
        } else {
            BigDecimal rateTerm =
                    r.multiply(k, MC).multiply(rateDiscount, MC).multiply(BlackScholes.bigN(d2.negate()), MC);
            BigDecimal dividendTerm =
                    q.multiply(s, MC).multiply(dividendDiscount, MC).multiply(BlackScholes.bigN(d1.negate()), MC);
            theta = decay.add(rateTerm, MC).subtract(dividendTerm, MC);
        }
        return theta.multiply(option.getQuantity(), MC);
    }

    public static BigDecimal vega(OptionContract option) {
        BigDecimal d1 = d1(option);

        return option.getUnderlyingPrice()
                .multiply(dividendDiscount(option), MC)
                .multiply(BlackScholes.n(d1), MC)
                .multiply(DecimalMath.sqrt(option.getYears()), MC)
                .multiply(option.getQuantity(), MC);
    }

    public static BigDecimal rho(OptionContract option) {
        BigDecimal d2 = d2(option);
        BigDecimal base = option.getStrikePrice().multiply(option.getYears(), MC).multiply(rateDiscount(option), MC);

        BigDecimal rho = option.isCall()
                ? base.multiply(BlackScholes.bigN(d2), MC)
                : base.multiply(BlackScholes.bigN(d2.negate()), MC).negate();
        return rho.multiply(option.getQuantity(), MC);
    }

    public static BigDecimal rhoD(OptionContract option) {
        BigDecimal d1 = d1(option);
        BigDecimal base = option.getYears().multiply(option.getUnderlyingPrice(), MC).multiply(dividendDiscount(option), MC);

        BigDecimal rhoD = option.isCall()
                ? base.multiply(BlackScholes.bigN(d1), MC).negate()
                : base.multiply(BlackScholes.bigN(d1.negate()), MC);
        return rhoD.multiply(option.getQuantity(), MC);
    }

    /**
     * Without volatility the option is worth its intrinsic value, so delta is a step
     * function of moneyness. At-the-money counts as in-the-money for both styles.
     */
    private static BigDecimal zeroVolatilityDelta(OptionContract option, BigDecimal sign) {
        if (option.getUnderlyingPrice() == null || option.getUnderlyingPrice().signum() <= 0) {
            throw GreeksException.invalidPrice(option.getUnderlyingPrice());
        }
        if (option.getStrikePrice() == null || option.getStrikePrice().signum() <= 0) {
            throw GreeksException.invalidStrike(option.getStrikePrice());
        }
        int moneyness = option.getUnderlyingPrice().compareTo(option.getStrikePrice());
        boolean inTheMoney = option.isCall() ? moneyness >= 0 : moneyness <= 0;
        if (!inTheMoney) {
            return BigDecimal.ZERO;
        }
        BigDecimal unit = option.isCall() ? sign : sign.negate();
        return unit.multiply(option.getQuantity(), MC);
    }

    private static BigDecimal d1(OptionContract option) {
        return BlackScholes.d1(
                option.getUnderlyingPrice(),
                option.getStrikePrice(),
                option.getRiskFreeRate(),
                option.getYears(),
                option.getImpliedVolatility());
    }

    private static BigDecimal d2(OptionContract option) {
        return BlackScholes.d2(
                option.getUnderlyingPrice(),
                option.getStrikePrice(),
                option.getRiskFreeRate(),
                option.getYears(),
                option.getImpliedVolatility());
    }

    private static BigDecimal dividendDiscount(OptionContract option) {
        return DecimalMath.discountFactor(option.getDividendYield(), option.getYears());
    }

    private static BigDecimal rateDiscount(OptionContract option) {
        return DecimalMath.discountFactor(option.getRiskFreeRate(), option.getYears());
    }
}
