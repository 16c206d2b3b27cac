package com.stagedsignal.backtester.domain.signal;

import com.stagedsignal.backtester.domain.Indicator;
import com.stagedsignal.backtester.domain.RunMode;
import com.stagedsignal.backtester.domain.SeriesBar;
import com.stagedsignal.backtester.domain.SeriesKind;
import com.stagedsignal.backtester.domain.SeriesWindow;
import com.stagedsignal.backtester.domain.StrategyProfile;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * F stage: market cap inside the band, revenue or EPS growth over the threshold, positive revenue.
 */
public class FundamentalStage extends AbstractStageFilter {

    @Override
    public StageId getStageId() {
        return StageId.FUNDAMENTAL;
    }

    @Override
    public boolean isEnabled(StrategyProfile profile) {
        return profile.getFundamental().isEnabled();
    }

    @Override
    protected StageResult doEvaluate(SymbolSnapshot snapshot, StrategyProfile profile, RunMode mode) {
        SeriesWindow fundamentals = snapshot.window(SeriesKind.FUNDAMENTAL);
        Optional<SeriesBar> latestRecord = fundamentals.latest();
        if (latestRecord.isEmpty()) {
            return fail(snapshot, "no fundamental records");
        }
        SeriesBar latest = latestRecord.get();
        SeriesBar prior = fundamentals.fromLatest(1).orElse(null);
        StrategyProfile.FundamentalSettings settings = profile.getFundamental();

        BigDecimal marketCap = latest.require(Indicator.MARKET_CAP);
        if (marketCap.compareTo(settings.getMinMarketCap()) < 0
                || marketCap.compareTo(settings.getMaxMarketCap()) > 0) {
            return fail(snapshot, "market cap outside band");
        }

        BigDecimal revenue = latest.require(Indicator.REVENUE);
        if (revenue.signum() <= 0) {
            return fail(snapshot, "revenue not positive");
        }

        boolean revenueGrowth = clears(latest, prior, Indicator.REV_YOY, settings);
        boolean epsGrowth = clears(latest, prior, Indicator.EPS_YOY, settings);
        if (!revenueGrowth && !epsGrowth) {
            return fail(snapshot, "growth below threshold");
        }
        return StageResult.builder()
                .symbol(snapshot.getSymbol())
                .stage(getStageId())
                .passed(true)
                .metric(marketCap)
                .build();
    }

    private boolean clears(SeriesBar latest, SeriesBar prior, Indicator field,
                           StrategyProfile.FundamentalSettings settings) {
        BigDecimal growth = latest.indicator(field);
        if (growth == null || growth.compareTo(settings.getGrowthThreshold()) < 0) {
            return false;
        }
        if (prior == null) {
            return true;
        }
        BigDecimal priorGrowth = prior.indicator(field);
        return priorGrowth == null || priorGrowth.compareTo(settings.getPriorGrowthFloor()) >= 0;
    }
}
