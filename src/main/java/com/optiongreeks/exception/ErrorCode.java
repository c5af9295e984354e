package com.optiongreeks.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INVALID_PRICE("INVALID_PRICE", Category.INPUT),
    INVALID_STRIKE("INVALID_STRIKE", Category.INPUT),
    INVALID_VOLATILITY("INVALID_VOLATILITY", Category.INPUT),
    INVALID_TIME("INVALID_TIME", Category.INPUT),
    INVALID_RATE("INVALID_RATE", Category.INPUT),
    DECIMAL_CONVERSION("DECIMAL_CONVERSION", Category.CONVERSION),
    OPTIONS_RETRIEVAL("OPTIONS_RETRIEVAL", Category.RETRIEVAL),
    CALCULATION_ERROR("CALCULATION_ERROR", Category.CALCULATION),
    VALIDATION_ERROR("VALIDATION_ERROR", Category.POSITION),
    NOT_FOUND("NOT_FOUND", Category.POSITION),
    NO_VIABLE_PLAN("NO_VIABLE_PLAN", Category.ADJUSTMENT),
    COST_EXCEEDED("COST_EXCEEDED", Category.ADJUSTMENT);

    private final String code;
    private final Category category;

    /** Coarse grouping used by callers that only care about the failure family. */
    public enum Category {
        INPUT,
        CONVERSION,
        RETRIEVAL,
        CALCULATION,
        POSITION,
        ADJUSTMENT
    }
}
