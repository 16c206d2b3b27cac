package com.stagedsignal.backtester.domain.signal;

import com.stagedsignal.backtester.domain.Indicator;
import com.stagedsignal.backtester.domain.RunMode;
import com.stagedsignal.backtester.domain.SeriesBar;
import com.stagedsignal.backtester.domain.SeriesKind;
import com.stagedsignal.backtester.domain.SeriesWindow;
import com.stagedsignal.backtester.domain.StrategyProfile;

import java.math.BigDecimal;

/**
 * W stage: five weekly price-structure conditions, all required.
 */
public class WeeklyStage extends AbstractStageFilter {

    private static final int REQUIRED_BARS = 3;

    @Override
    public StageId getStageId() {
        return StageId.WEEKLY;
    }

    @Override
    public boolean isEnabled(StrategyProfile profile) {
        return profile.getWeekly().isEnabled();
    }

    @Override
    protected StageResult doEvaluate(SymbolSnapshot snapshot, StrategyProfile profile, RunMode mode) {
        StrategyProfile.WeeklySettings settings = profile.getWeekly();
        SeriesWindow weekly = snapshot.window(SeriesKind.WEEKLY);
        if (weekly.size() < Math.max(REQUIRED_BARS, settings.getCloseLag() + 1)) {
            return fail(snapshot, "not enough weekly bars");
        }
        SeriesBar latest = weekly.fromLatest(0).orElseThrow();
        SeriesBar twoBack = weekly.fromLatest(2).orElseThrow();
        SeriesBar closeBar = weekly.fromLatest(settings.getCloseLag()).orElseThrow();

        // the one-year high is also the two-year high
        if (latest.require(Indicator.HIGH_1Y).compareTo(latest.require(Indicator.HIGH_2Y)) != 0) {
            return fail(snapshot, "1Y high below 2Y high");
        }
        if (latest.require(Indicator.LOW_2Y).compareTo(latest.require(Indicator.LOW_1Y)) >= 0) {
            return fail(snapshot, "2Y low not below 1Y low");
        }

        BigDecimal high52 = latest.require(Indicator.HIGH_52W);
        BigDecimal stableCeiling = twoBack.require(Indicator.HIGH_52W).multiply(settings.getStabilityTolerance());
        if (high52.compareTo(stableCeiling) > 0) {
            return fail(snapshot, "52W high not stable");
        }

        BigDecimal close = closeBar.requireClose();
        BigDecimal low52 = latest.require(Indicator.LOW_52W);
        if (close.compareTo(low52.multiply(settings.getLowDistanceFactor())) <= 0) {
            return fail(snapshot, "close too near 52W low");
        }
        if (close.compareTo(high52.multiply(settings.getHighDistanceFactor())) <= 0) {
            return fail(snapshot, "close too far below 52W high");
        }
        return StageResult.pass(snapshot.getSymbol(), getStageId());
    }
}
