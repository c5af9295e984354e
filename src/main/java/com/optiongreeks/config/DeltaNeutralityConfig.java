package com.optiongreeks.config;

import java.math.BigDecimal;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for delta-neutral rebalancing.
 *
 * <p>Controls how close to zero net delta must be and how many apply cycles a single
 * rebalance may run. Properties are read from the {@code optiongreeks.delta-neutrality}
 * prefix.
 */
@Configuration
@ConfigurationProperties(prefix = "optiongreeks.delta-neutrality")
@Getter
@Setter
public class DeltaNeutralityConfig {

    /** Neutral iff |net delta| <= threshold. */
    private BigDecimal threshold = new BigDecimal("0.0001");

    /**
     * Upper bound on apply cycles per rebalance. One cycle normally suffices; more help
     * when the action filter or a failed adjustment leaves a residual.
     */
    private int maxAdjustmentRounds = 1;
}
