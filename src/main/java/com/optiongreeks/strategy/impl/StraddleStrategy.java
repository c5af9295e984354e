package com.optiongreeks.strategy.impl;

import com.optiongreeks.domain.enums.OptionStyle;
import com.optiongreeks.domain.enums.Side;
import com.optiongreeks.domain.enums.StrategyType;
import com.optiongreeks.domain.model.Position;
import com.optiongreeks.strategy.base.BaseStrategy;
import java.math.BigDecimal;
import java.util.List;

/**
 * Short straddle: sells a call and a put at the same strike on the same expiry.
 *
 * <p><b>Market view:</b> Neutral. Delta starts near zero at the money and drifts as the
 * underlying moves, which is what delta rebalancing corrects.
 *
 * <p><b>Legs:</b> 2 (short CALL + short PUT at one strike).
 */
public class StraddleStrategy extends BaseStrategy {

    protected final StraddleConfig straddleConfig;

    public StraddleStrategy(String id, String name, StraddleConfig straddleConfig) {
        super(id, name, straddleConfig);
        this.straddleConfig = straddleConfig;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.STRADDLE;
    }

    /** Side both legs are held on. */
    protected Side side() {
        return Side.SHORT;
    }

    @Override
    protected List<Position> buildLegs() {
        BigDecimal strike = atmPlus(straddleConfig.getStrikeOffset());
        return List.of(leg(strike, OptionStyle.CALL, side()), leg(strike, OptionStyle.PUT, side()));
    }

    /**
     * Legs must be on {@link #side()}, one per style, and share a strike.
     */
    @Override
    protected void validatePosition(Position candidate, List<Position> others) {
        require(candidate.getOption().getSide() == side(), "straddle legs must be " + side(), candidate);
        requireUnique(candidate, others);

        BigDecimal strike = candidate.getOption().getStrikePrice();
        for (Position other : others) {
            require(
                    other.getOption().getStrikePrice().compareTo(strike) == 0,
                    "strike differs from " + other.getOption().getStrikePrice(),
                    candidate);
        }
    }
}
