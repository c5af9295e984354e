package com.optiongreeks.strategy.impl;

import com.optiongreeks.strategy.base.StrategyConfig;
import java.math.BigDecimal;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Configuration for the short and long straddle strategies.
 *
 * <p>A straddle holds a call and a put at the same strike. By default that strike is
 * the ATM strike; {@code strikeOffset} moves both legs together.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class StraddleConfig extends StrategyConfig {

    /**
     * Points above ATM for the shared strike. Null or 0 = ATM.
     * Example: -5 opens both legs at ATM - 5.
     */
    private BigDecimal strikeOffset;
}
