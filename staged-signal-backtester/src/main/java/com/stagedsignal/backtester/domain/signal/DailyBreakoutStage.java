package com.stagedsignal.backtester.domain.signal;

import com.stagedsignal.backtester.domain.BreakoutWindow;
import com.stagedsignal.backtester.domain.Indicator;
import com.stagedsignal.backtester.domain.RunMode;
import com.stagedsignal.backtester.domain.SeriesBar;
import com.stagedsignal.backtester.domain.SeriesKind;
import com.stagedsignal.backtester.domain.StrategyProfile;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * D stage: trend structure plus a breakout through the longest matching rolling high.
 * Emits the rolling high as the target price and a fixed fraction below it as the stop.
 */
public class DailyBreakoutStage extends AbstractStageFilter {

    static final String RS_12W_FALLBACK_LABEL = "RS_12W_1M";

    @Override
    public StageId getStageId() {
        return StageId.DAILY;
    }

    @Override
    public boolean isEnabled(StrategyProfile profile) {
        return profile.getDaily().isEnabled();
    }

    @Override
    protected StageResult doEvaluate(SymbolSnapshot snapshot, StrategyProfile profile, RunMode mode) {
        Optional<SeriesBar> decisionBar = snapshot.window(SeriesKind.DAILY).latest();
        if (decisionBar.isEmpty()) {
            return fail(snapshot, "no daily bars");
        }
        SeriesBar bar = decisionBar.get();
        StrategyProfile.DailySettings settings = profile.getDaily();
        BigDecimal threshold = profile.getRelativeStrength().getThreshold();
        Optional<SeriesBar> rsBar = RelativeStrengthStage.completedPeriod(snapshot);

        BigDecimal high = bar.requireHigh();
        boolean trend = bar.require(Indicator.SMA200_MOMENTUM).signum() >= 0
                && bar.require(Indicator.SMA50).compareTo(bar.require(Indicator.SMA200)) > 0;
        boolean strength = !settings.isRequireRelativeStrength() || meetsRelativeStrength(rsBar, threshold);

        if (trend && strength) {
            for (BreakoutWindow window : scanOrder(settings.getBreakoutWindows())) {
                BigDecimal level = bar.indicator(window.getLevel());
                if (level == null || level.signum() <= 0) {
                    continue;
                }
                if (mode.isBreakout(level, high)) {
                    return breakout(snapshot, level, settings, window.signalLabel());
                }
            }
        }

        if (settings.isRs12wFallback() && rsBar.isPresent()) {
            BigDecimal rs12w = rsBar.get().indicator(Indicator.RS_12W);
            BigDecimal level = bar.indicator(Indicator.HIGHEST_1M);
            if (rs12w != null && rs12w.compareTo(threshold) >= 0
                    && level != null && level.signum() > 0 && mode.isBreakout(level, high)) {
                return breakout(snapshot, level, settings, RS_12W_FALLBACK_LABEL);
            }
        }

        if (!trend) {
            return fail(snapshot, "moving-average structure not met");
        }
        if (!strength) {
            return fail(snapshot, "relative strength below threshold");
        }
        return fail(snapshot, "no breakout");
    }

    /**
     * Configured windows from longest to shortest, whatever order they were listed in.
     */
    static Set<BreakoutWindow> scanOrder(List<BreakoutWindow> configured) {
        Set<BreakoutWindow> windows = EnumSet.noneOf(BreakoutWindow.class);
        for (BreakoutWindow window : configured) {
            if (window != null) {
                windows.add(window);
            }
        }
        return windows;
    }

    private boolean meetsRelativeStrength(Optional<SeriesBar> rsBar, BigDecimal threshold) {
        if (rsBar.isEmpty()) {
            return false;
        }
        return rsBar.get().require(Indicator.RS_4W).compareTo(threshold) >= 0;
    }

    private StageResult breakout(SymbolSnapshot snapshot, BigDecimal level,
                                 StrategyProfile.DailySettings settings, String label) {
        BigDecimal stop = level.multiply(BigDecimal.ONE.subtract(settings.getStopLossFraction()))
                .setScale(4, RoundingMode.HALF_UP);
        return StageResult.builder()
                .symbol(snapshot.getSymbol())
                .stage(getStageId())
                .passed(true)
                .targetPrice(level.setScale(4, RoundingMode.HALF_UP))
                .stopPrice(stop)
                .signalLabel(label)
                .build();
    }
}
