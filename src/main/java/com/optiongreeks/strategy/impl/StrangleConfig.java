package com.optiongreeks.strategy.impl;

import com.optiongreeks.strategy.base.StrategyConfig;
import java.math.BigDecimal;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Configuration for the short strangle strategy.
 *
 * <p><b>Leg layout example (SPY at 450, callOffset=10, putOffset=10):</b>
 * <pre>
 *   Sell PUT 440 | --- ATM 450 --- | Sell CALL 460
 * </pre>
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class StrangleConfig extends StrategyConfig {

    /** Points above ATM for the short call strike. */
    private BigDecimal callOffset;

    /** Points below ATM for the short put strike. */
    private BigDecimal putOffset;
}
