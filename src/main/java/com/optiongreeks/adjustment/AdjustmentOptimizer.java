package com.optiongreeks.adjustment;

import static com.optiongreeks.core.math.DecimalMath.MC;

import com.optiongreeks.domain.model.AdjustmentAction;
import com.optiongreeks.domain.model.AdjustmentAction.AddUnderlying;
import com.optiongreeks.domain.model.AdjustmentAction.ModifyQuantity;
import com.optiongreeks.domain.model.AdjustmentConfig;
import com.optiongreeks.domain.model.AdjustmentPlan;
import com.optiongreeks.domain.model.AdjustmentTarget;
import com.optiongreeks.domain.model.OptionContract;
import com.optiongreeks.domain.model.Position;
import com.optiongreeks.exception.BusinessException;
import com.optiongreeks.exception.ErrorCode;
import com.optiongreeks.greeks.PortfolioGreeks;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Finds the cheapest way to move a set of positions onto an {@link AdjustmentTarget}.
 *
 * <p>Candidate plans, each gated by {@link AdjustmentConfig}:
 * <ol>
 *   <li><b>Existing legs:</b> resize the held legs, largest per-contract delta first.
 *       A leg can be shrunk to zero but never below.</li>
 *   <li><b>Underlying:</b> buy or sell shares (delta 1 each) for the whole gap. Only
 *       offered when gamma is not targeted, since shares carry no gamma.</li>
 * </ol>
 * The plan with the lowest quality score wins. Plans over {@code maxCost} are dropped.
 *
 * <p>Planning only: positions are never modified. Resulting Greeks are computed on copies.
 */
@Slf4j
public class AdjustmentOptimizer {

    // Legs whose per-contract delta is below this barely move the book
    private static final BigDecimal MIN_UNIT_DELTA = new BigDecimal("0.001");

    private final List<Position> positions;
    private final AdjustmentConfig config;
    private final AdjustmentTarget target;

    public AdjustmentOptimizer(List<Position> positions, AdjustmentConfig config, AdjustmentTarget target) {
        this.positions = List.copyOf(positions);
        this.config = config;
        this.target = target;
    }

    /**
     * @return the best plan, or an empty plan when the positions already meet the target
     * @throws BusinessException VALIDATION_ERROR without positions, COST_EXCEEDED when every
     *     plan is over budget, NO_VIABLE_PLAN when nothing could be proposed
     */
    public AdjustmentPlan optimize() {
        if (positions.isEmpty()) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "No positions to adjust");
        }

        PortfolioGreeks current = PortfolioGreeks.of(positions);
        if (target.isSatisfied(current, config.getDeltaTolerance())) {
            log.debug("Positions already at target, delta {}", current.getDelta());
            return AdjustmentPlan.of(List.of(), BigDecimal.ZERO, current, BigDecimal.ZERO);
        }

        BigDecimal deltaGap = target.deltaGap(current);
        log.debug("Current delta {}, gap {}", current.getDelta(), deltaGap);

        List<AdjustmentPlan> candidates = new ArrayList<>();
        if (config.isPreferExistingLegs()) {
            existingLegsPlan(deltaGap).ifPresent(candidates::add);
        }
        if (config.isAllowUnderlying() && target.getDelta() != null && !target.targetsGamma()) {
            candidates.add(underlyingPlan(deltaGap));
        }

        AdjustmentPlan best = null;
        boolean overBudget = false;
        for (AdjustmentPlan plan : candidates) {
            if (config.getMaxCost() != null && plan.getEstimatedCost().compareTo(config.getMaxCost()) > 0) {
                log.debug("Dropping plan {} with cost {} over {}", plan.getActions(), plan.getEstimatedCost(), config.getMaxCost());
                overBudget = true;
                continue;
            }
            log.trace("Plan {} scores {}", plan.getActions(), plan.getQualityScore());
            if (plan.isBetterThan(best)) {
                best = plan;
            }
        }

        if (best == null) {
            ErrorCode code = overBudget ? ErrorCode.COST_EXCEEDED : ErrorCode.NO_VIABLE_PLAN;
            throw new BusinessException(
                    code,
                    "No adjustment plan reaches the target from delta " + current.getDelta(),
                    Map.of("deltaGap", deltaGap.toPlainString(), "candidates", candidates.size()));
        }
        log.debug("Chose {} actions, residual delta {}", best.actionCount(), best.getResidualDelta());
        return best;
    }

    // ========================
    // CANDIDATE PLANS
    // ========================

    private Optional<AdjustmentPlan> existingLegsPlan(BigDecimal deltaGap) {
        List<Leg> legs = new ArrayList<>();
        for (int i = 0; i < positions.size(); i++) {
            Position position = positions.get(i);
            BigDecimal quantity = position.getQuantity();
            if (quantity.signum() == 0) {
                continue;
            }
            legs.add(new Leg(i, position, position.delta().divide(quantity, MC)));
        }
        legs.sort(Comparator.comparing((Leg leg) -> leg.unitDelta().abs()).reversed());

        BigDecimal remaining = deltaGap;
        BigDecimal[] quantities = positions.stream().map(Position::getQuantity).toArray(BigDecimal[]::new);
        List<AdjustmentAction> actions = new ArrayList<>();

        for (Leg leg : legs) {
            if (remaining.abs().compareTo(config.getDeltaTolerance()) < 0) {
                break;
            }
            if (leg.unitDelta().abs().compareTo(MIN_UNIT_DELTA) < 0) {
                continue;
            }
            BigDecimal held = quantities[leg.index()];
            BigDecimal wanted = held.add(remaining.divide(leg.unitDelta(), MC), MC);
            BigDecimal updated = wanted.signum() < 0 ? BigDecimal.ZERO : wanted;
            BigDecimal change = updated.subtract(held, MC);
            if (change.signum() == 0) {
                continue;
            }
            quantities[leg.index()] = updated;
            actions.add(new ModifyQuantity(leg.index(), leg.position().getId(), updated));
            remaining = remaining.subtract(change.multiply(leg.unitDelta(), MC), MC);
        }

        if (actions.isEmpty()) {
            log.debug("No held leg can move delta by {}", deltaGap);
            return Optional.empty();
        }
        return Optional.of(AdjustmentPlan.of(actions, BigDecimal.ZERO, preview(quantities), remaining));
    }

    private AdjustmentPlan underlyingPlan(BigDecimal deltaGap) {
        BigDecimal spot = positions.get(0).getOption().getUnderlyingPrice();
        BigDecimal cost = spot.multiply(deltaGap, MC).abs();
        PortfolioGreeks resulting = PortfolioGreeks.of(positions, deltaGap);
        return AdjustmentPlan.of(List.of(new AddUnderlying(deltaGap)), cost, resulting, BigDecimal.ZERO);
    }

    /** Greeks of copies of the held contracts resized to {@code quantities}. */
    private PortfolioGreeks preview(BigDecimal[] quantities) {
        List<OptionContract> resized = new ArrayList<>();
        for (int i = 0; i < positions.size(); i++) {
            resized.add(positions.get(i).getOption().toBuilder().quantity(quantities[i]).build());
        }
        return PortfolioGreeks.of(resized);
    }

    private record Leg(int index, Position position, BigDecimal unitDelta) {}
}
