package com.optiongreeks.strategy.impl;

import com.optiongreeks.strategy.base.StrategyConfig;
import java.math.BigDecimal;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Configuration for the two-leg vertical spreads (bull call, bear put).
 *
 * <p>Offsets are points above ATM, so they may be negative. A bull call spread needs
 * {@code buyOffset < sellOffset}; a bear put spread needs {@code buyOffset > sellOffset}.
 * The strategy rejects the legs otherwise.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class SpreadConfig extends StrategyConfig {

    /** Points above ATM for the long leg. */
    private BigDecimal buyOffset;

    /** Points above ATM for the short leg. */
    private BigDecimal sellOffset;
}
