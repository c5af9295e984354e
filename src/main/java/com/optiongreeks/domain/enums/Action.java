package com.optiongreeks.domain.enums;

/**
 * Trade direction used to filter delta adjustments before they are applied.
 * A null action means "apply every adjustment".
 */
public enum Action {
    BUY,
    SELL
}
