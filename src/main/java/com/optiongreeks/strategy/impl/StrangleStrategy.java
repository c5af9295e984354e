package com.optiongreeks.strategy.impl;

import com.optiongreeks.domain.enums.OptionStyle;
import com.optiongreeks.domain.enums.Side;
import com.optiongreeks.domain.enums.StrategyType;
import com.optiongreeks.domain.model.Position;
import com.optiongreeks.strategy.base.BaseStrategy;
import java.math.BigDecimal;
import java.util.List;

/**
 * Short strangle: sells an OTM call and an OTM put.
 *
 * <p><b>Market view:</b> Neutral with a wider profit zone than a straddle, since both
 * strikes are away from the money.
 *
 * <p><b>Legs:</b> 2 (short PUT below short CALL).
 */
public class StrangleStrategy extends BaseStrategy {

    private final StrangleConfig strangleConfig;

    public StrangleStrategy(String id, String name, StrangleConfig strangleConfig) {
        super(id, name, strangleConfig);
        this.strangleConfig = strangleConfig;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.STRANGLE;
    }

    @Override
    protected List<Position> buildLegs() {
        BigDecimal putOffset = strangleConfig.getPutOffset() == null
                ? BigDecimal.ZERO
                : strangleConfig.getPutOffset().negate();
        return List.of(
                leg(atmPlus(putOffset), OptionStyle.PUT, Side.SHORT),
                leg(atmPlus(strangleConfig.getCallOffset()), OptionStyle.CALL, Side.SHORT));
    }

    @Override
    protected void validatePosition(Position candidate, List<Position> others) {
        require(candidate.getOption().getSide() == Side.SHORT, "strangle legs must be SHORT", candidate);
        requireUnique(candidate, others);

        BigDecimal strike = candidate.getOption().getStrikePrice();
        if (candidate.getOption().isCall()) {
            find(others, OptionStyle.PUT, Side.SHORT)
                    .ifPresent(put -> require(
                            strike.compareTo(put.getOption().getStrikePrice()) > 0,
                            "call strike must be above put strike " + put.getOption().getStrikePrice(),
                            candidate));
        } else {
            find(others, OptionStyle.CALL, Side.SHORT)
                    .ifPresent(call -> require(
                            strike.compareTo(call.getOption().getStrikePrice()) < 0,
                            "put strike must be below call strike " + call.getOption().getStrikePrice(),
                            candidate));
        }
    }
}
