package com.optiongreeks.domain.enums;

import java.math.BigDecimal;

/**
 * Direction of exposure on an option leg. The quantity itself is always non-negative;
 * the side carries the sign.
 */
public enum Side {
    LONG,
    SHORT;

    /** +1 for LONG, -1 for SHORT. Applied to delta only. */
    public BigDecimal sign() {
        return this == LONG ? BigDecimal.ONE : BigDecimal.ONE.negate();
    }

    public Side opposite() {
        return this == LONG ? SHORT : LONG;
    }
}
