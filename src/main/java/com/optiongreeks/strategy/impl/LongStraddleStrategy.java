package com.optiongreeks.strategy.impl;

import com.optiongreeks.domain.enums.Side;
import com.optiongreeks.domain.enums.StrategyType;

/**
 * Long straddle: buys a call and a put at the same strike. Profits from a large move in
 * either direction; the mirror image of {@link StraddleStrategy}.
 */
public class LongStraddleStrategy extends StraddleStrategy {

    public LongStraddleStrategy(String id, String name, StraddleConfig straddleConfig) {
        super(id, name, straddleConfig);
    }

    @Override
    public StrategyType getType() {
        return StrategyType.LONG_STRADDLE;
    }

    @Override
    protected Side side() {
        return Side.LONG;
    }
}
