package com.stagedsignal.backtester.domain.signal;

import com.stagedsignal.backtester.domain.Indicator;
import com.stagedsignal.backtester.domain.RunMode;
import com.stagedsignal.backtester.domain.SeriesBar;
import com.stagedsignal.backtester.domain.SeriesKind;
import com.stagedsignal.backtester.domain.StrategyProfile;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * RS stage: four-week relative-strength percentile of the last completed period at or above the cutoff.
 */
public class RelativeStrengthStage extends AbstractStageFilter {

    @Override
    public StageId getStageId() {
        return StageId.RELATIVE_STRENGTH;
    }

    @Override
    public boolean isEnabled(StrategyProfile profile) {
        return profile.getRelativeStrength().isEnabled();
    }

    @Override
    protected StageResult doEvaluate(SymbolSnapshot snapshot, StrategyProfile profile, RunMode mode) {
        Optional<SeriesBar> completed = completedPeriod(snapshot);
        if (completed.isEmpty()) {
            return fail(snapshot, "no completed relative-strength period");
        }
        BigDecimal rs = completed.get().require(Indicator.RS_4W);
        if (rs.compareTo(profile.getRelativeStrength().getThreshold()) < 0) {
            return fail(snapshot, "RS " + rs + " below threshold");
        }
        return StageResult.builder()
                .symbol(snapshot.getSymbol())
                .stage(getStageId())
                .passed(true)
                .metric(rs)
                .build();
    }

    /**
     * Last relative-strength bar stamped before the decision time.
     */
    static Optional<SeriesBar> completedPeriod(SymbolSnapshot snapshot) {
        return snapshot.window(SeriesKind.RELATIVE_STRENGTH).latestBefore(snapshot.getDecisionTime());
    }
}
