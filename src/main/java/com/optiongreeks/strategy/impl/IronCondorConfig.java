package com.optiongreeks.strategy.impl;

import com.optiongreeks.strategy.base.StrategyConfig;
import java.math.BigDecimal;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Configuration for the iron condor strategy.
 *
 * <p><b>Leg layout example (SPY at 450, callOffset=10, putOffset=10, wingWidth=5):</b>
 * <pre>
 *   Buy PUT 435 | Sell PUT 440 | --- ATM 450 --- | Sell CALL 460 | Buy CALL 465
 * </pre>
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class IronCondorConfig extends StrategyConfig {

    /** Points above ATM for the short call strike. */
    private BigDecimal callOffset;

    /** Points below ATM for the short put strike. */
    private BigDecimal putOffset;

    /**
     * Width between short and long (protection) strikes on each side.
     * Example: 5 means buy CALL at short call + 5, buy PUT at short put - 5.
     */
    private BigDecimal wingWidth;
}
