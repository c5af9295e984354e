package com.optiongreeks.strategy.base;

import com.optiongreeks.domain.enums.OptionStyle;
import com.optiongreeks.domain.enums.Side;
import com.optiongreeks.domain.model.Position;
import java.math.BigDecimal;
import java.util.List;

/** Position lookup and mutation for anything that owns option legs. */
public interface Positionable {

    /**
     * Adds a leg.
     *
     * @throws com.optiongreeks.exception.BusinessException if the leg does not fit the strategy shape
     */
    void addPosition(Position position);

    /** Snapshot of the legs in insertion order. The positions themselves are live. */
    List<Position> getPositions();

    /**
     * Legs matching (strike, style, side) exactly. The returned positions are live
     * references: changing their quantity changes the strategy.
     */
    List<Position> getPosition(OptionStyle optionStyle, Side side, BigDecimal strike);

    /**
     * Replaces the leg with the same id.
     *
     * @throws com.optiongreeks.exception.ResourceNotFoundException if no leg has that id
     */
    void modifyPosition(Position position);

    void removePosition(String positionId);
}
