package com.optiongreeks.strategy.base;

import com.optiongreeks.domain.enums.Action;
import com.optiongreeks.domain.enums.OptionStyle;
import com.optiongreeks.domain.enums.Side;
import com.optiongreeks.domain.model.AdjustmentReport;
import com.optiongreeks.domain.model.DeltaAdjustment;
import com.optiongreeks.domain.model.DeltaInfo;
import com.optiongreeks.greeks.Greeks;
import java.math.BigDecimal;
import java.util.List;

/**
 * Delta-neutral evaluation and rebalancing for a multi-leg strategy.
 *
 * <p>One decision cycle: evaluate net delta, stop if neutral, otherwise propose
 * adjustments and apply them to the strategy's own positions. The next evaluation
 * sees the new quantities.
 *
 * <p>Every operation has an overload taking the neutrality threshold; the short forms
 * use {@link #DELTA_THRESHOLD}. Neutral means {@code |netDelta| <= threshold}.
 *
 * <p>Applying adjustments is best effort. Each adjustment is applied on its own, a
 * failure is recorded and the rest of the batch continues, and nothing already applied
 * is rolled back. Only {@link DeltaAdjustment.SameSize} pairs are all-or-nothing.
 *
 * <p>Not thread-safe: a strategy must not be adjusted from several threads at once.
 */
public interface DeltaNeutrality extends Greeks, Strategies {

    BigDecimal DELTA_THRESHOLD = new BigDecimal("0.0001");

    default DeltaInfo deltaNeutrality() {
        return deltaNeutrality(DELTA_THRESHOLD);
    }

    /**
     * @throws com.optiongreeks.exception.GreeksException if any leg's delta cannot be computed
     */
    default DeltaInfo deltaNeutrality(BigDecimal threshold) {
        return DeltaNeutralityEngine.evaluate(this, threshold);
    }

    default boolean isDeltaNeutral() {
        return isDeltaNeutral(DELTA_THRESHOLD);
    }

    /** Never throws: a strategy whose delta cannot be computed is reported as not neutral. */
    default boolean isDeltaNeutral(BigDecimal threshold) {
        return DeltaNeutralityEngine.isNeutral(this, threshold);
    }

    default List<DeltaAdjustment> deltaAdjustments() {
        return deltaAdjustments(DELTA_THRESHOLD);
    }

    /**
     * Proposes trades that bring the net delta back within {@code threshold}, walking
     * the legs in the order they are listed. Returns a single
     * {@link DeltaAdjustment.NoAdjustmentNeeded} when already neutral.
     */
    default List<DeltaAdjustment> deltaAdjustments(BigDecimal threshold) {
        return DeltaNeutralityEngine.propose(this, threshold);
    }

    default AdjustmentReport applyDeltaAdjustments() {
        return applyDeltaAdjustments(null, DELTA_THRESHOLD);
    }

    default AdjustmentReport applyDeltaAdjustments(Action action) {
        return applyDeltaAdjustments(action, DELTA_THRESHOLD);
    }

    /**
     * Applies the proposed adjustments allowed by {@code action}: BUY keeps only
     * {@link DeltaAdjustment.BuyOptions}, SELL only {@link DeltaAdjustment.SellOptions},
     * null keeps everything.
     */
    default AdjustmentReport applyDeltaAdjustments(Action action, BigDecimal threshold) {
        return DeltaNeutralityEngine.apply(this, action, threshold);
    }

    default void applySingleAdjustment(DeltaAdjustment adjustment) {
        DeltaNeutralityEngine.applySingle(this, adjustment);
    }

    /**
     * Adds {@code quantity} (negative to reduce) to the leg matching (strike, style, side).
     *
     * @throws com.optiongreeks.exception.ResourceNotFoundException if no leg matches
     * @throws com.optiongreeks.exception.BusinessException if the leg would go below zero
     */
    default void adjustOptionPosition(BigDecimal quantity, BigDecimal strike, OptionStyle optionStyle, Side side) {
        DeltaNeutralityEngine.adjustOptionPosition(this, quantity, strike, optionStyle, side);
    }

    /**
     * Hook for trading the underlying directly. Does nothing here; strategies that hold
     * or can trade the underlying override it.
     */
    default void adjustUnderlyingPosition(BigDecimal quantity, Side side) {
        DeltaNeutralityEngine.ignoreUnderlying(this, quantity, side);
    }
}
