package com.optiongreeks.strategy.impl;

import com.optiongreeks.domain.enums.OptionStyle;
import com.optiongreeks.domain.enums.Side;
import com.optiongreeks.domain.enums.StrategyType;
import com.optiongreeks.domain.model.Position;
import com.optiongreeks.strategy.base.BaseStrategy;
import java.util.List;

/**
 * Bull call spread: buys a lower-strike call and sells a higher-strike call.
 *
 * <p><b>Market view:</b> Moderately bullish. Net delta is positive and capped.
 *
 * <p><b>Legs:</b> 2 (long CALL below short CALL).
 */
public class BullCallSpreadStrategy extends BaseStrategy {

    private final SpreadConfig spreadConfig;

    public BullCallSpreadStrategy(String id, String name, SpreadConfig spreadConfig) {
        super(id, name, spreadConfig);
        this.spreadConfig = spreadConfig;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.BULL_CALL_SPREAD;
    }

    @Override
    protected List<Position> buildLegs() {
        return List.of(
                leg(atmPlus(spreadConfig.getBuyOffset()), OptionStyle.CALL, Side.LONG),
                leg(atmPlus(spreadConfig.getSellOffset()), OptionStyle.CALL, Side.SHORT));
    }

    @Override
    protected void validatePosition(Position candidate, List<Position> others) {
        require(candidate.getOption().isCall(), "bull call spread holds calls only", candidate);
        requireUnique(candidate, others);

        Side opposite = candidate.getOption().getSide().opposite();
        find(others, OptionStyle.CALL, opposite).ifPresent(other -> {
            Position longLeg = opposite == Side.LONG ? other : candidate;
            Position shortLeg = opposite == Side.LONG ? candidate : other;
            require(
                    longLeg.getOption().getStrikePrice().compareTo(shortLeg.getOption().getStrikePrice()) < 0,
                    "long call strike must be below short call strike",
                    candidate);
        });
    }
}
