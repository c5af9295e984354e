package com.optiongreeks.strategy.impl;

import com.optiongreeks.domain.enums.OptionStyle;
import com.optiongreeks.domain.enums.Side;
import com.optiongreeks.domain.enums.StrategyType;
import com.optiongreeks.domain.model.Position;
import com.optiongreeks.strategy.base.BaseStrategy;
import java.util.List;

/**
 * Bear put spread: buys a higher-strike put and sells a lower-strike put.
 *
 * <p><b>Market view:</b> Moderately bearish. Net delta is negative and capped.
 *
 * <p><b>Legs:</b> 2 (long PUT above short PUT).
 */
public class BearPutSpreadStrategy extends BaseStrategy {

    private final SpreadConfig spreadConfig;

    public BearPutSpreadStrategy(String id, String name, SpreadConfig spreadConfig) {
        super(id, name, spreadConfig);
        this.spreadConfig = spreadConfig;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.BEAR_PUT_SPREAD;
    }

    @Override
    protected List<Position> buildLegs() {
        return List.of(
                leg(atmPlus(spreadConfig.getBuyOffset()), OptionStyle.PUT, Side.LONG),
                leg(atmPlus(spreadConfig.getSellOffset()), OptionStyle.PUT, Side.SHORT));
    }

    @Override
    protected void validatePosition(Position candidate, List<Position> others) {
        require(!candidate.getOption().isCall(), "bear put spread holds puts only", candidate);
        requireUnique(candidate, others);

        Side opposite = candidate.getOption().getSide().opposite();
        find(others, OptionStyle.PUT, opposite).ifPresent(other -> {
            Position longLeg = opposite == Side.LONG ? other : candidate;
            Position shortLeg = opposite == Side.LONG ? candidate : other;
            require(
                    longLeg.getOption().getStrikePrice().compareTo(shortLeg.getOption().getStrikePrice()) > 0,
                    "long put strike must be above short put strike",
                    candidate);
        });
    }
}
