package com.optiongreeks.exception;

import java.util.Map;

/**
 * Raised when a value cannot cross the decimal/floating-point boundary: null input,
 * NaN or infinite doubles, or arguments outside the domain of ln/sqrt.
 */
public class DecimalConversionException extends BaseException {

    public DecimalConversionException(String message) {
        super(ErrorCode.DECIMAL_CONVERSION, message);
    }

    public DecimalConversionException(String message, Object value) {
        super(ErrorCode.DECIMAL_CONVERSION, message, Map.of("value", String.valueOf(value)));
    }
}
