package com.optiongreeks.exception;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Failure of a Greeks calculation. Input-validation errors come from the Black-Scholes
 * kernel, retrieval errors from holders that cannot list their option legs.
 *
 * <p>All of them are deterministic: the same inputs fail the same way, so callers
 * should not retry.
 */
public class GreeksException extends BaseException {

    public GreeksException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public GreeksException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }

    public static GreeksException invalidPrice(BigDecimal value) {
        return invalidInput(ErrorCode.INVALID_PRICE, "Underlying price must be positive", value);
    }

    public static GreeksException invalidStrike(BigDecimal value) {
        return invalidInput(ErrorCode.INVALID_STRIKE, "Strike price must be positive", value);
    }

    public static GreeksException invalidVolatility(BigDecimal value) {
        return invalidInput(ErrorCode.INVALID_VOLATILITY, "Implied volatility must be positive", value);
    }

    public static GreeksException invalidTime(BigDecimal value) {
        return invalidInput(ErrorCode.INVALID_TIME, "Time to expiration must be positive", value);
    }

    public static GreeksException invalidRate(BigDecimal value) {
        return invalidInput(ErrorCode.INVALID_RATE, "Risk-free rate is required", value);
    }

    public static GreeksException optionsRetrieval(String holder, String reason) {
        return new GreeksException(
                ErrorCode.OPTIONS_RETRIEVAL,
                String.format("Unable to list options of %s: %s", holder, reason),
                Map.of("holder", holder));
    }

    private static GreeksException invalidInput(ErrorCode code, String reason, BigDecimal value) {
        return new GreeksException(code, reason + ", got: " + value, Map.of("value", String.valueOf(value)));
    }
}
