package com.optiongreeks.strategy.base;

import com.optiongreeks.domain.enums.StrategyType;
import com.optiongreeks.domain.model.Position;
import java.math.BigDecimal;
import java.util.Comparator;

/** Strategy-level accessors needed by the delta-neutrality algorithm. */
public interface Strategies extends Positionable {

    String getName();

    StrategyType getType();

    BigDecimal getUnderlyingPrice();

    /**
     * The held strike closest to the underlying price. Falls back to the underlying
     * price itself when nothing is held. Ties go to the first leg listed.
     */
    default BigDecimal getAtmStrike() {
        BigDecimal underlying = getUnderlyingPrice();
        return getPositions().stream()
                .map(p -> p.getOption().getStrikePrice())
                .min(Comparator.comparing((BigDecimal strike) -> strike.subtract(underlying).abs()))
                .orElse(underlying);
    }

    default boolean hasPositions() {
        return getPositions().stream().map(Position::getQuantity).anyMatch(q -> q.signum() > 0);
    }
}
