package com.optiongreeks.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one apply cycle. Adjustments are applied one by one without rollback, so a
 * report with failures describes a strategy that has been partially adjusted.
 */
@Value
@Builder
public class AdjustmentReport {

    @Builder.Default
    List<DeltaAdjustment> applied = List.of();

    /** Adjustments left out by the requested action filter. */
    @Builder.Default
    List<DeltaAdjustment> skipped = List.of();

    @Builder.Default
    List<Failure> failures = List.of();

    public static AdjustmentReport none() {
        return AdjustmentReport.builder().build();
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }

    public boolean hasChanges() {
        return !applied.isEmpty();
    }

    public record Failure(DeltaAdjustment adjustment, RuntimeException error) {}
}
