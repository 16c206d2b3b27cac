package com.stagedsignal.backtester.domain.execution;

import com.stagedsignal.backtester.domain.SeriesBar;
import com.stagedsignal.backtester.domain.StrategyProfile;
import com.stagedsignal.backtester.domain.signal.Candidate;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Entry size from the risk budget and the ADR-scaled allocation, whichever is smaller.
 * Pure; safe to call from worker threads.
 */
public class PositionSizer {

    private final StrategyProfile.ExecutionSettings settings;
    private final FillModel fills;

    public PositionSizer(StrategyProfile.ExecutionSettings settings, FillModel fills) {
        this.settings = settings;
        this.fills = fills;
    }

    public SizingProposal propose(Candidate candidate, SeriesBar bar, BigDecimal equity) {
        String symbol = candidate.getSymbol();
        if (bar == null || !bar.hasPrices()) {
            return SizingProposal.of(symbol, SizingProposal.Status.MISSING_PRICE);
        }
        BigDecimal fill = fills.entryFill(candidate.getTargetPrice(), bar);
        if (fill == null) {
            return SizingProposal.of(symbol, SizingProposal.Status.NOT_TRIGGERED);
        }
        BigDecimal riskPerShare = fill.subtract(candidate.getStopPrice());
        if (riskPerShare.signum() <= 0) {
            return SizingProposal.of(symbol, SizingProposal.Status.INVALID_STOP);
        }

        int byRisk = wholeShares(equity.multiply(settings.getRiskFraction()), riskPerShare);
        int byAllocation = wholeShares(equity.multiply(candidate.getSizingHint()), fill);
        return SizingProposal.ready(symbol, fill, Math.min(byRisk, byAllocation));
    }

    /**
     * Shares to add to a winning position: a fixed share of equity at the fill price.
     */
    public int pyramidQuantity(BigDecimal equity, BigDecimal fill) {
        return wholeShares(equity.multiply(settings.getPyramidingRatio()), fill);
    }

    static int wholeShares(BigDecimal amount, BigDecimal price) {
        if (price.signum() <= 0 || amount.signum() <= 0) {
            return 0;
        }
        return amount.divide(price, 0, RoundingMode.FLOOR).intValue();
    }
}
