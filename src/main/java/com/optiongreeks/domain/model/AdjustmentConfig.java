package com.optiongreeks.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Which kinds of plan the adjustment optimizer may propose, and the limits they must
 * respect.
 */
@Value
@With
@Builder(toBuilder = true)
public class AdjustmentConfig {

    private static final BigDecimal DEFAULT_DELTA_TOLERANCE = new BigDecimal("0.01");

    /** Try resizing the legs already held. */
    @Builder.Default
    boolean preferExistingLegs = true;

    /** Allow a plan that hedges delta with shares of the underlying. */
    @Builder.Default
    boolean allowUnderlying = false;

    /** Distance from the delta target still counted as on target. */
    @Builder.Default
    BigDecimal deltaTolerance = DEFAULT_DELTA_TOLERANCE;

    /** Plans whose estimated cost exceeds this are discarded. Null means unlimited. */
    BigDecimal maxCost;

    public static AdjustmentConfig defaults() {
        return AdjustmentConfig.builder().build();
    }

    public static AdjustmentConfig existingLegsOnly() {
        return defaults().withAllowUnderlying(false);
    }

    public static AdjustmentConfig withUnderlying() {
        return defaults().withAllowUnderlying(true);
    }

    public static AdjustmentConfig underlyingOnly() {
        return withUnderlying().withPreferExistingLegs(false);
    }
}
