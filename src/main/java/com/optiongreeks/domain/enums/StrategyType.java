package com.optiongreeks.domain.enums;

/**
 * Supported strategy shapes. Each type has an implementation extending BaseStrategy
 * that only differs in which legs it accepts. CUSTOM accepts any combination.
 */
public enum StrategyType {
    STRADDLE,
    LONG_STRADDLE,
    STRANGLE,
    IRON_CONDOR,
    BULL_CALL_SPREAD,
    BEAR_PUT_SPREAD,
    CUSTOM
}
