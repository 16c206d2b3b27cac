package com.stagedsignal.backtester.domain.signal;

import com.stagedsignal.backtester.domain.Indicator;
import com.stagedsignal.backtester.domain.RunMode;
import com.stagedsignal.backtester.domain.SeriesBar;
import com.stagedsignal.backtester.domain.SeriesKind;
import com.stagedsignal.backtester.domain.SeriesWindow;
import com.stagedsignal.backtester.domain.StrategyProfile;

import java.math.BigDecimal;

/**
 * E stage: revenue or EPS year-over-year growth is above the floor last quarter and has improved since.
 */
public class EarningsStage extends AbstractStageFilter {

    @Override
    public StageId getStageId() {
        return StageId.EARNINGS;
    }

    @Override
    public boolean isEnabled(StrategyProfile profile) {
        return profile.getEarnings().isEnabled();
    }

    @Override
    protected StageResult doEvaluate(SymbolSnapshot snapshot, StrategyProfile profile, RunMode mode) {
        SeriesWindow earnings = snapshot.window(SeriesKind.EARNINGS);
        if (earnings.size() < 2) {
            return fail(snapshot, "fewer than two earnings records");
        }
        SeriesBar latest = earnings.fromLatest(0).orElseThrow();
        SeriesBar prior = earnings.fromLatest(1).orElseThrow();
        BigDecimal floor = profile.getEarnings().getPriorGrowthFloor();

        Boolean revenue = improving(latest, prior, Indicator.REV_YOY, floor);
        Boolean eps = improving(latest, prior, Indicator.EPS_YOY, floor);
        if (revenue == null && eps == null) {
            return fail(snapshot, "missing REV_YOY and EPS_YOY");
        }
        if (Boolean.TRUE.equals(revenue) || Boolean.TRUE.equals(eps)) {
            return StageResult.builder()
                    .symbol(snapshot.getSymbol())
                    .stage(getStageId())
                    .passed(true)
                    .metric(latest.indicator(Boolean.TRUE.equals(revenue) ? Indicator.REV_YOY : Indicator.EPS_YOY))
                    .build();
        }
        return fail(snapshot, "growth not improving");
    }

    /**
     * Null when either quarter lacks the field, so the metric is left out of the decision.
     */
    private Boolean improving(SeriesBar latest, SeriesBar prior, Indicator field, BigDecimal floor) {
        BigDecimal current = latest.indicator(field);
        BigDecimal previous = prior.indicator(field);
        if (current == null || previous == null) {
            return null;
        }
        return previous.compareTo(floor) >= 0 && current.compareTo(previous) > 0;
    }
}
