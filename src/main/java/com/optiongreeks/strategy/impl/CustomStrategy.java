package com.optiongreeks.strategy.impl;

import com.optiongreeks.domain.enums.StrategyType;
import com.optiongreeks.domain.model.Position;
import com.optiongreeks.strategy.base.BaseStrategy;
import com.optiongreeks.strategy.base.StrategyConfig;
import java.util.List;

/**
 * Generic multi-leg strategy with user-defined legs.
 *
 * <p>CUSTOM accepts any combination of call/put, long/short legs at arbitrary strikes.
 * Leg coherence is not validated: the caller has full control. Legs are added with
 * {@link #addPosition}; {@link #open()} opens nothing.
 */
public class CustomStrategy extends BaseStrategy {

    public CustomStrategy(String id, String name, StrategyConfig config) {
        super(id, name, config);
    }

    @Override
    public StrategyType getType() {
        return StrategyType.CUSTOM;
    }

    @Override
    protected void validatePosition(Position candidate, List<Position> others) {
        // Any leg is accepted once the common checks pass
    }

    @Override
    protected List<Position> buildLegs() {
        return List.of();
    }
}
