package com.optiongreeks.domain.model;

import static com.optiongreeks.core.math.DecimalMath.MC;

import com.optiongreeks.greeks.PortfolioGreeks;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * A candidate set of actions together with what it is expected to achieve.
 *
 * <p>Quality score = |residual delta| + 1% of the estimated cost. Lower is better.
 */
@Value
@Builder
public class AdjustmentPlan {

    private static final BigDecimal COST_WEIGHT = new BigDecimal("0.01");

    @Builder.Default
    List<AdjustmentAction> actions = List.of();

    BigDecimal estimatedCost;
    PortfolioGreeks resultingGreeks;

    /** Delta still missing to reach the target once the actions are applied. */
    BigDecimal residualDelta;

    BigDecimal qualityScore;

    public static AdjustmentPlan of(
            List<AdjustmentAction> actions,
            BigDecimal estimatedCost,
            PortfolioGreeks resultingGreeks,
            BigDecimal residualDelta) {
        return AdjustmentPlan.builder()
                .actions(List.copyOf(actions))
                .estimatedCost(estimatedCost)
                .resultingGreeks(resultingGreeks)
                .residualDelta(residualDelta)
                .qualityScore(residualDelta.abs().add(estimatedCost.multiply(COST_WEIGHT, MC), MC))
                .build();
    }

    public boolean isDeltaNeutral(BigDecimal tolerance) {
        return residualDelta.abs().compareTo(tolerance) <= 0;
    }

    public boolean isEmpty() {
        return actions.isEmpty();
    }

    public int actionCount() {
        return actions.size();
    }

    public boolean isBetterThan(AdjustmentPlan other) {
        return other == null || qualityScore.compareTo(other.qualityScore) < 0;
    }
}
