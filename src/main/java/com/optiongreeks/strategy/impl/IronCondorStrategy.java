package com.optiongreeks.strategy.impl;

import com.optiongreeks.domain.enums.OptionStyle;
import com.optiongreeks.domain.enums.Side;
import com.optiongreeks.domain.enums.StrategyType;
import com.optiongreeks.domain.model.Position;
import com.optiongreeks.strategy.base.BaseStrategy;
import java.math.BigDecimal;
import java.util.List;

/**
 * Iron condor: a short strangle with long protective wings on both sides.
 *
 * <p><b>Leg order (ascending strike):</b> long PUT, short PUT, short CALL, long CALL.
 * Any subset may be held, but the legs present must keep that order.
 *
 * <p><b>Legs:</b> 4.
 */
public class IronCondorStrategy extends BaseStrategy {

    private final IronCondorConfig ironCondorConfig;

    public IronCondorStrategy(String id, String name, IronCondorConfig ironCondorConfig) {
        super(id, name, ironCondorConfig);
        this.ironCondorConfig = ironCondorConfig;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.IRON_CONDOR;
    }

    @Override
    protected List<Position> buildLegs() {
        BigDecimal shortCall = atmPlus(ironCondorConfig.getCallOffset());
        BigDecimal shortPut = ironCondorConfig.getPutOffset() == null
                ? atmStrike()
                : atmStrike().subtract(ironCondorConfig.getPutOffset());
        BigDecimal wing = ironCondorConfig.getWingWidth() == null ? BigDecimal.ZERO : ironCondorConfig.getWingWidth();

        return List.of(
                leg(shortPut.subtract(wing), OptionStyle.PUT, Side.LONG),
                leg(shortPut, OptionStyle.PUT, Side.SHORT),
                leg(shortCall, OptionStyle.CALL, Side.SHORT),
                leg(shortCall.add(wing), OptionStyle.CALL, Side.LONG));
    }

    @Override
    protected void validatePosition(Position candidate, List<Position> others) {
        requireUnique(candidate, others);

        int rank = rank(candidate);
        BigDecimal strike = candidate.getOption().getStrikePrice();
        for (Position other : others) {
            int otherRank = rank(other);
            int cmp = strike.compareTo(other.getOption().getStrikePrice());
            boolean ordered = rank < otherRank ? cmp < 0 : cmp > 0;
            require(ordered, "strike out of order against " + describe(other), candidate);
        }
    }

    // 0 = long put (lowest strike) .. 3 = long call (highest strike)
    private static int rank(Position position) {
        boolean isShort = position.getOption().getSide() == Side.SHORT;
        if (position.getOption().isCall()) {
            return isShort ? 2 : 3;
        }
        return isShort ? 1 : 0;
    }
}
