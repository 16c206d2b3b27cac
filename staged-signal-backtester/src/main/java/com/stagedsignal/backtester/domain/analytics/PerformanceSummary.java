package com.stagedsignal.backtester.domain.analytics;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Return, risk and trade statistics of a completed run. Percentages are expressed in percent,
 * ratios and rates as plain fractions.
 */
@Value
@Builder
public class PerformanceSummary {
    BigDecimal initialEquity;
    BigDecimal finalEquity;
    BigDecimal totalReturn;
    BigDecimal annualizedReturn;
    BigDecimal volatility;
    BigDecimal sharpeRatio;
    BigDecimal sortinoRatio;
    BigDecimal maxDrawdown;
    BigDecimal winRate;

    /** Null when every closed position was a winner. */
    BigDecimal profitFactor;

    BigDecimal averageWin;
    BigDecimal averageLoss;
    BigDecimal largestWin;
    BigDecimal largestLoss;
    int maxConsecutiveWins;
    int maxConsecutiveLosses;
    BigDecimal averageHoldingDays;
    int totalTrades;
    int closedPositions;
    int winningPositions;
    int losingPositions;
    Map<String, BigDecimal> symbolContribution;
}
