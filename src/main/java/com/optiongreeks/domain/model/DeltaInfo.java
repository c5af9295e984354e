package com.optiongreeks.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of a strategy's delta exposure. Built fresh on every neutrality query and
 * stale as soon as any position changes.
 */
@Value
@Builder
public class DeltaInfo {

    /** Sum of the quantity-weighted, side-signed leg deltas. */
    BigDecimal netDelta;

    /** One entry per leg, in the order the strategy lists its options. */
    List<BigDecimal> individualDeltas;

    boolean neutral;

    BigDecimal neutralityThreshold;

    BigDecimal underlyingPrice;

    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("Delta Analysis:\n");
        sb.append("  Net Delta: ").append(scaled(netDelta)).append('\n');
        sb.append("  Is Neutral: ").append(neutral).append('\n');
        sb.append("  Neutrality Threshold: ").append(scaled(neutralityThreshold)).append('\n');
        sb.append("  Underlying Price: ").append(underlyingPrice).append('\n');
        sb.append("  Individual Deltas:\n");
        for (int i = 0; i < individualDeltas.size(); i++) {
            sb.append("    Position ").append(i + 1).append(": ").append(scaled(individualDeltas.get(i))).append('\n');
        }
        return sb.toString();
    }

    private static String scaled(BigDecimal value) {
        return value == null ? "n/a" : value.setScale(4, RoundingMode.HALF_UP).toPlainString();
    }
}
