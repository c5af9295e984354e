package com.optiongreeks.service;

import com.optiongreeks.adjustment.AdjustmentOptimizer;
import com.optiongreeks.config.DeltaNeutralityConfig;
import com.optiongreeks.domain.enums.Action;
import com.optiongreeks.domain.model.AdjustmentConfig;
import com.optiongreeks.domain.model.AdjustmentPlan;
import com.optiongreeks.domain.model.AdjustmentTarget;
import com.optiongreeks.domain.model.AdjustmentReport;
import com.optiongreeks.domain.model.DeltaAdjustment;
import com.optiongreeks.domain.model.DeltaInfo;
import com.optiongreeks.strategy.base.DeltaNeutrality;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for delta-neutral evaluation and rebalancing with the configured threshold.
 *
 * <p>Strategies carry the algorithm themselves (see {@link DeltaNeutrality}); this
 * service supplies the threshold from {@link DeltaNeutralityConfig} and repeats apply
 * cycles up to the configured number of rounds.
 */
@Service
public class DeltaNeutralityService {

    private static final Logger log = LoggerFactory.getLogger(DeltaNeutralityService.class);

    private final DeltaNeutralityConfig deltaNeutralityConfig;

    public DeltaNeutralityService(DeltaNeutralityConfig deltaNeutralityConfig) {
        this.deltaNeutralityConfig = deltaNeutralityConfig;
    }

    public DeltaInfo evaluate(DeltaNeutrality strategy) {
        return strategy.deltaNeutrality(deltaNeutralityConfig.getThreshold());
    }

    public boolean isNeutral(DeltaNeutrality strategy) {
        return strategy.isDeltaNeutral(deltaNeutralityConfig.getThreshold());
    }

    public List<DeltaAdjustment> suggestAdjustments(DeltaNeutrality strategy) {
        return strategy.deltaAdjustments(deltaNeutralityConfig.getThreshold());
    }

    /**
     * Proposes the best-scoring plan to move the strategy's legs onto {@code target}.
     * Nothing is applied.
     */
    public AdjustmentPlan planAdjustment(DeltaNeutrality strategy, AdjustmentTarget target, AdjustmentConfig config) {
        AdjustmentPlan plan = new AdjustmentOptimizer(strategy.getPositions(), config, target).optimize();
        log.info(
                "Planned {} action(s) for {}: residual delta {}, cost {}",
                plan.actionCount(),
                strategy.getName(),
                plan.getResidualDelta(),
                plan.getEstimatedCost());
        return plan;
    }

    /**
     * Runs apply cycles until the strategy is neutral, a cycle changes nothing, or the
     * configured round limit is reached.
     *
     * @param action BUY or SELL to restrict the trades, null for any
     * @return one report per cycle that ran, in order
     */
    public List<AdjustmentReport> rebalance(DeltaNeutrality strategy, Action action) {
        List<AdjustmentReport> reports = new ArrayList<>();
        int maxRounds = Math.max(deltaNeutralityConfig.getMaxAdjustmentRounds(), 1);

        for (int round = 1; round <= maxRounds; round++) {
            if (isNeutral(strategy)) {
                log.info("{} delta neutral after {} round(s)", strategy.getName(), round - 1);
                break;
            }
            AdjustmentReport report = strategy.applyDeltaAdjustments(action, deltaNeutralityConfig.getThreshold());
            reports.add(report);
            log.info(
                    "Rebalance round {} on {}: applied={}, skipped={}, failed={}",
                    round,
                    strategy.getName(),
                    report.getApplied().size(),
                    report.getSkipped().size(),
                    report.getFailures().size());
            if (!report.hasChanges()) {
                break;
            }
        }
        return reports;
    }
}
