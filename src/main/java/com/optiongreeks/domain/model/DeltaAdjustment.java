package com.optiongreeks.domain.model;

import com.optiongreeks.domain.enums.OptionStyle;
import com.optiongreeks.domain.enums.Side;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * A corrective trade proposed to move a strategy toward delta neutrality.
 *
 * <p>Variants:
 * <ul>
 *   <li>{@link BuyOptions} / {@link SellOptions}: grow or shrink the existing leg
 *       identified by (strike, style, side)
 *   <li>{@link BuyUnderlying} / {@link SellUnderlying}: trade the underlying directly
 *   <li>{@link NoAdjustmentNeeded}: the strategy is already neutral
 *   <li>{@link SameSize}: two option trades that move contracts from one leg to another
 *       without changing the total size. Applied as a unit or not at all.
 * </ul>
 *
 * <p>Quantities are always positive; the variant carries the direction.
 */
public interface DeltaAdjustment {

    NoAdjustmentNeeded NO_ADJUSTMENT_NEEDED = new NoAdjustmentNeeded();

    record BuyOptions(BigDecimal quantity, BigDecimal strike, OptionStyle optionStyle, Side side)
            implements DeltaAdjustment {

        public BuyOptions {
            Objects.requireNonNull(quantity, "quantity");
            Objects.requireNonNull(strike, "strike");
            Objects.requireNonNull(optionStyle, "optionStyle");
            Objects.requireNonNull(side, "side");
        }
    }

    record SellOptions(BigDecimal quantity, BigDecimal strike, OptionStyle optionStyle, Side side)
            implements DeltaAdjustment {

        public SellOptions {
            Objects.requireNonNull(quantity, "quantity");
            Objects.requireNonNull(strike, "strike");
            Objects.requireNonNull(optionStyle, "optionStyle");
            Objects.requireNonNull(side, "side");
        }
    }

    record BuyUnderlying(BigDecimal quantity) implements DeltaAdjustment {}

    record SellUnderlying(BigDecimal quantity) implements DeltaAdjustment {}

    record NoAdjustmentNeeded() implements DeltaAdjustment {}

    record SameSize(DeltaAdjustment first, DeltaAdjustment second) implements DeltaAdjustment {

        public SameSize {
            Objects.requireNonNull(first, "first");
            Objects.requireNonNull(second, "second");
        }

        public boolean isNested() {
            return first instanceof SameSize || second instanceof SameSize;
        }
    }
}
