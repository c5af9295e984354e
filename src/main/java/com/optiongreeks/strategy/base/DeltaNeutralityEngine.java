package com.optiongreeks.strategy.base;

import static com.optiongreeks.core.math.DecimalMath.MC;

import com.optiongreeks.core.math.DecimalMath;
import com.optiongreeks.core.processor.GreeksCalculator;
import com.optiongreeks.domain.enums.Action;
import com.optiongreeks.domain.enums.OptionStyle;
import com.optiongreeks.domain.enums.Side;
import com.optiongreeks.domain.model.AdjustmentReport;
import com.optiongreeks.domain.model.DeltaAdjustment;
import com.optiongreeks.domain.model.DeltaAdjustment.BuyOptions;
import com.optiongreeks.domain.model.DeltaAdjustment.BuyUnderlying;
import com.optiongreeks.domain.model.DeltaAdjustment.SameSize;
import com.optiongreeks.domain.model.DeltaAdjustment.SellOptions;
import com.optiongreeks.domain.model.DeltaAdjustment.SellUnderlying;
import com.optiongreeks.domain.model.DeltaInfo;
import com.optiongreeks.domain.model.OptionContract;
import com.optiongreeks.domain.model.Position;
import com.optiongreeks.exception.BaseException;
import com.optiongreeks.exception.BusinessException;
import com.optiongreeks.exception.ErrorCode;
import com.optiongreeks.exception.ResourceNotFoundException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Logic behind the {@link DeltaNeutrality} defaults. Kept out of the interface so the
 * defaults stay one-liners and the algorithm can log.
 */
@Slf4j
final class DeltaNeutralityEngine {

    private DeltaNeutralityEngine() {}

    // ========================
    // EVALUATE
    // ========================

    static DeltaInfo evaluate(DeltaNeutrality strategy, BigDecimal threshold) {
        List<Leg> legs = legs(strategy);

        List<BigDecimal> individual = new ArrayList<>(legs.size());
        BigDecimal net = BigDecimal.ZERO;
        for (Leg leg : legs) {
            individual.add(leg.delta());
            net = net.add(leg.delta(), MC);
        }

        return DeltaInfo.builder()
                .netDelta(net)
                .individualDeltas(List.copyOf(individual))
                .neutral(net.abs().compareTo(threshold) <= 0)
                .neutralityThreshold(threshold)
                .underlyingPrice(strategy.getUnderlyingPrice())
                .build();
    }

    static boolean isNeutral(DeltaNeutrality strategy, BigDecimal threshold) {
        try {
            return evaluate(strategy, threshold).isNeutral();
        } catch (BaseException e) {
            log.warn("Delta evaluation failed for {}, treating as not neutral: {}", strategy.getName(), e.getMessage());
            return false;
        }
    }

    // ========================
    // PROPOSE
    // ========================

    /**
     * Walks the legs in order carrying the delta still to offset. A leg that pushes
     * delta the same way as the residual is shrunk (paired with a later leg pushing the
     * other way when one exists, so contracts move between legs instead of disappearing).
     * A leg pushing the other way is grown until the residual is gone. Whatever the legs
     * cannot absorb is hedged with the underlying.
     */
    static List<DeltaAdjustment> propose(DeltaNeutrality strategy, BigDecimal threshold) {
        List<Leg> legs = legs(strategy);
        BigDecimal residual = legs.stream().map(Leg::delta).reduce(BigDecimal.ZERO, (a, b) -> a.add(b, MC));

        if (residual.abs().compareTo(threshold) <= 0) {
            return List.of(DeltaAdjustment.NO_ADJUSTMENT_NEEDED);
        }

        List<DeltaAdjustment> adjustments = new ArrayList<>();
        boolean[] used = new boolean[legs.size()];

        for (int i = 0; i < legs.size() && residual.abs().compareTo(threshold) > 0; i++) {
            Leg leg = legs.get(i);
            if (used[i] || !leg.isAdjustable()) {
                continue;
            }
            used[i] = true;
            BigDecimal remaining = residual.abs();
            BigDecimal legUnit = leg.unitDelta().abs();

            if (leg.unitDelta().signum() == residual.signum()) {
                int partnerIndex = findOffsettingLeg(legs, used, i + 1, residual.signum());
                if (partnerIndex >= 0) {
                    Leg partner = legs.get(partnerIndex);
                    used[partnerIndex] = true;
                    BigDecimal perContract = legUnit.add(partner.unitDelta().abs(), MC);
                    BigDecimal quantity = DecimalMath.min(remaining.divide(perContract, MC), leg.quantity());
                    adjustments.add(new SameSize(sell(leg, quantity), buy(partner, quantity)));
                    residual = offset(residual, quantity.multiply(perContract, MC));
                } else {
                    BigDecimal quantity = DecimalMath.min(remaining.divide(legUnit, MC), leg.quantity());
                    adjustments.add(sell(leg, quantity));
                    residual = offset(residual, quantity.multiply(legUnit, MC));
                }
            } else {
                adjustments.add(buy(leg, remaining.divide(legUnit, MC)));
                residual = BigDecimal.ZERO;
            }
        }

        if (residual.abs().compareTo(threshold) > 0) {
            adjustments.add(
                    residual.signum() > 0 ? new SellUnderlying(residual.abs()) : new BuyUnderlying(residual.abs()));
        }

        log.debug("Proposed {} adjustment(s) for {}: {}", adjustments.size(), strategy.getName(), adjustments);
        return List.copyOf(adjustments);
    }

    private static int findOffsettingLeg(List<Leg> legs, boolean[] used, int from, int residualSign) {
        for (int j = from; j < legs.size(); j++) {
            Leg candidate = legs.get(j);
            if (!used[j] && candidate.isAdjustable() && candidate.unitDelta().signum() == -residualSign) {
                return j;
            }
        }
        return -1;
    }

    private static BigDecimal offset(BigDecimal residual, BigDecimal absorbed) {
        return residual.signum() > 0 ? residual.subtract(absorbed, MC) : residual.add(absorbed, MC);
    }

    private static BuyOptions buy(Leg leg, BigDecimal quantity) {
        OptionContract option = leg.option();
        return new BuyOptions(quantity, option.getStrikePrice(), option.getOptionStyle(), option.getSide());
    }

    private static SellOptions sell(Leg leg, BigDecimal quantity) {
        OptionContract option = leg.option();
        return new SellOptions(quantity, option.getStrikePrice(), option.getOptionStyle(), option.getSide());
    }

    // ========================
    // APPLY
    // ========================

    static AdjustmentReport apply(DeltaNeutrality strategy, Action action, BigDecimal threshold) {
        if (strategy.isDeltaNeutral(threshold)) {
            log.debug("{} already delta neutral, nothing to apply", strategy.getName());
            return AdjustmentReport.none();
        }

        List<DeltaAdjustment> applied = new ArrayList<>();
        List<DeltaAdjustment> skipped = new ArrayList<>();
        List<AdjustmentReport.Failure> failures = new ArrayList<>();

        for (DeltaAdjustment adjustment : strategy.deltaAdjustments(threshold)) {
            if (!accepts(action, adjustment)) {
                log.debug("Skipping {} under action filter {}", adjustment, action);
                skipped.add(adjustment);
                continue;
            }
            if (adjustment instanceof SameSize pair && pair.isNested()) {
                log.warn("Nested SameSize adjustments are not supported, skipping {}", pair);
                skipped.add(adjustment);
                continue;
            }
            try {
                strategy.applySingleAdjustment(adjustment);
                applied.add(adjustment);
            } catch (BaseException e) {
                // No rollback: earlier adjustments in this batch stay applied
                log.warn("Adjustment {} failed on {}: {}", adjustment, strategy.getName(), e.getMessage());
                failures.add(new AdjustmentReport.Failure(adjustment, e));
            }
        }

        return AdjustmentReport.builder()
                .applied(List.copyOf(applied))
                .skipped(List.copyOf(skipped))
                .failures(List.copyOf(failures))
                .build();
    }

    private static boolean accepts(Action action, DeltaAdjustment adjustment) {
        if (action == null) {
            return true;
        }
        return switch (action) {
            case BUY -> adjustment instanceof BuyOptions;
            case SELL -> adjustment instanceof SellOptions;
        };
    }

    static void applySingle(DeltaNeutrality strategy, DeltaAdjustment adjustment) {
        if (adjustment instanceof BuyOptions buy) {
            strategy.adjustOptionPosition(buy.quantity(), buy.strike(), buy.optionStyle(), buy.side());
        } else if (adjustment instanceof SellOptions sell) {
            strategy.adjustOptionPosition(sell.quantity().negate(), sell.strike(), sell.optionStyle(), sell.side());
        } else if (adjustment instanceof SameSize pair) {
            if (pair.isNested()) {
                log.warn("Nested SameSize adjustments are not supported, skipping {}", pair);
                return;
            }
            // Both halves are checked before either is applied so the pair is never split
            checkApplicable(strategy, pair.first());
            checkApplicable(strategy, pair.second());
            strategy.applySingleAdjustment(pair.first());
            strategy.applySingleAdjustment(pair.second());
        } else if (adjustment instanceof BuyUnderlying buy) {
            strategy.adjustUnderlyingPosition(buy.quantity(), Side.LONG);
        } else if (adjustment instanceof SellUnderlying sell) {
            strategy.adjustUnderlyingPosition(sell.quantity(), Side.SHORT);
        } else {
            log.debug("No adjustment needed for {}", strategy.getName());
        }
    }

    private static void checkApplicable(DeltaNeutrality strategy, DeltaAdjustment adjustment) {
        if (adjustment instanceof BuyOptions buy) {
            resolve(strategy, buy.strike(), buy.optionStyle(), buy.side());
        } else if (adjustment instanceof SellOptions sell) {
            Position position = resolve(strategy, sell.strike(), sell.optionStyle(), sell.side());
            checkNonNegative(position, position.getQuantity().subtract(sell.quantity(), MC));
        }
    }

    // ========================
    // POSITION MUTATION
    // ========================

    static void adjustOptionPosition(
            DeltaNeutrality strategy, BigDecimal quantity, BigDecimal strike, OptionStyle optionStyle, Side side) {
        Position position = resolve(strategy, strike, optionStyle, side);
        BigDecimal previous = position.getQuantity();
        BigDecimal updated = previous.add(quantity, MC);
        checkNonNegative(position, updated);

        position.getOption().setQuantity(updated);
        log.debug(
                "Adjusted {} {} {} @ {} on {}: {} -> {}",
                side, optionStyle, position.getId(), strike, strategy.getName(), previous, updated);
    }

    static void ignoreUnderlying(DeltaNeutrality strategy, BigDecimal quantity, Side side) {
        log.debug("{} does not trade the underlying, ignoring {} {} shares", strategy.getName(), side, quantity);
    }

    private static Position resolve(DeltaNeutrality strategy, BigDecimal strike, OptionStyle optionStyle, Side side) {
        List<Position> matches = strategy.getPosition(optionStyle, side, strike);
        if (matches.isEmpty()) {
            throw new ResourceNotFoundException(
                    "Position",
                    side + " " + optionStyle + " @ " + strike,
                    Map.of(
                            "strike", String.valueOf(strike),
                            "optionStyle", String.valueOf(optionStyle),
                            "side", String.valueOf(side)));
        }
        return matches.get(0);
    }

    private static void checkNonNegative(Position position, BigDecimal updated) {
        if (updated.signum() < 0) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Adjustment would leave position " + position.getId() + " with negative quantity " + updated,
                    Map.of("positionId", String.valueOf(position.getId()), "quantity", updated.toPlainString()));
        }
    }

    // ========================
    // LEG DELTAS
    // ========================

    private static List<Leg> legs(DeltaNeutrality strategy) {
        List<OptionContract> options = strategy.getOptions();
        List<Leg> legs = new ArrayList<>(options.size());
        for (OptionContract option : options) {
            legs.add(Leg.of(option, GreeksCalculator.delta(option)));
        }
        return legs;
    }

    /** A contract with its quantity-weighted delta and the delta of one contract. */
    private record Leg(OptionContract option, BigDecimal delta, BigDecimal unitDelta) {

        static Leg of(OptionContract option, BigDecimal delta) {
            BigDecimal quantity = option.getQuantity();
            BigDecimal unit = quantity.signum() == 0 ? BigDecimal.ZERO : delta.divide(quantity, MC);
            return new Leg(option, delta, unit);
        }

        BigDecimal quantity() {
            return option.getQuantity();
        }

        boolean isAdjustable() {
            return option.getQuantity().signum() > 0 && unitDelta.signum() != 0;
        }
    }
}
