package com.stagedsignal.backtester.domain.analytics;

import com.stagedsignal.backtester.domain.EquityPoint;
import com.stagedsignal.backtester.domain.Trade;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Derives the performance summary from a finished trade log and equity history. Stateless; the
 * same inputs always give the same summary.
 */
@Slf4j
public class PerformanceAnalyzer {

    private final BigDecimal riskFreeRate;
    private final int periodsPerYear;

    public PerformanceAnalyzer(BigDecimal riskFreeRate, int periodsPerYear) {
        this.riskFreeRate = riskFreeRate;
        this.periodsPerYear = periodsPerYear;
    }

    /**
     * @throws InsufficientDataException when fewer than two equity points exist
     */
    public PerformanceSummary analyze(List<Trade> trades, List<EquityPoint> equityHistory) {
        if (equityHistory.size() < 2) {
            throw new InsufficientDataException("insufficient data: " + equityHistory.size()
                    + " equity point(s), at least 2 required");
        }

        List<BigDecimal> values = equityHistory.stream().map(EquityPoint::getEquity).collect(Collectors.toList());
        EquityPoint first = equityHistory.get(0);
        EquityPoint last = equityHistory.get(equityHistory.size() - 1);
        List<BigDecimal> returns = PerformanceMetrics.calculateReturns(values);
        List<BigDecimal> positionResults = PerformanceMetrics.calculateClosedPositionResults(trades);

        BigDecimal initial = first.getEquity();
        BigDecimal finalEquity = last.getEquity();
        List<BigDecimal> wins = positionResults.stream().filter(p -> p.signum() > 0).collect(Collectors.toList());
        List<BigDecimal> losses = positionResults.stream().filter(p -> p.signum() < 0).collect(Collectors.toList());

        PerformanceSummary summary = PerformanceSummary.builder()
                .initialEquity(initial)
                .finalEquity(finalEquity)
                .totalReturn(PerformanceMetrics.calculateTotalReturn(initial, finalEquity))
                .annualizedReturn(PerformanceMetrics.calculateAnnualizedReturn(initial, finalEquity,
                        first.getTimestamp(), last.getTimestamp()))
                .volatility(PerformanceMetrics.calculateVolatility(returns, periodsPerYear))
                .sharpeRatio(PerformanceMetrics.calculateSharpeRatio(returns, riskFreeRate, periodsPerYear))
                .sortinoRatio(PerformanceMetrics.calculateSortinoRatio(returns, riskFreeRate, periodsPerYear))
                .maxDrawdown(PerformanceMetrics.calculateMaxDrawdown(values))
                .winRate(PerformanceMetrics.calculateWinRate(positionResults))
                .profitFactor(PerformanceMetrics.calculateProfitFactor(positionResults))
                .averageWin(average(wins))
                .averageLoss(average(losses))
                .largestWin(wins.stream().max(BigDecimal::compareTo).orElse(BigDecimal.ZERO))
                .largestLoss(losses.stream().min(BigDecimal::compareTo).orElse(BigDecimal.ZERO))
                .maxConsecutiveWins(PerformanceMetrics.calculateMaxConsecutive(positionResults, true))
                .maxConsecutiveLosses(PerformanceMetrics.calculateMaxConsecutive(positionResults, false))
                .averageHoldingDays(averageHoldingDays(trades))
                .totalTrades(trades.size())
                .closedPositions(positionResults.size())
                .winningPositions(wins.size())
                .losingPositions(losses.size())
                .symbolContribution(PerformanceMetrics.calculateSymbolContribution(trades))
                .build();

        log.info("Performance - Total Return: {}%, Annualized: {}%, Volatility: {}%, Sharpe: {}, Sortino: {}, "
                        + "Max DD: {}%, Win Rate: {}%, Profit Factor: {}",
                summary.getTotalReturn(), summary.getAnnualizedReturn(), summary.getVolatility(),
                summary.getSharpeRatio(), summary.getSortinoRatio(), summary.getMaxDrawdown(),
                summary.getWinRate().multiply(BigDecimal.valueOf(100)), summary.getProfitFactor());
        return summary;
    }

    private BigDecimal average(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return BigDecimal.ZERO;
        }
        return values.stream().reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(BigDecimal.valueOf(values.size()), 4, RoundingMode.HALF_UP);
    }

    /**
     * Mean calendar days between a position's entry and its terminal trade.
     */
    private BigDecimal averageHoldingDays(List<Trade> trades) {
        Map<Long, Trade> entries = new HashMap<>();
        long totalDays = 0;
        int closed = 0;
        for (Trade trade : trades) {
            switch (trade.getType()) {
                case ENTRY -> entries.put(trade.getPositionId(), trade);
                case EXIT, STOP_OUT -> {
                    Trade entry = entries.remove(trade.getPositionId());
                    if (entry != null) {
                        totalDays += ChronoUnit.DAYS.between(entry.getTimestamp().toLocalDate(),
                                trade.getTimestamp().toLocalDate());
                        closed++;
                    }
                }
                default -> {
                }
            }
        }
        if (closed == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(totalDays).divide(BigDecimal.valueOf(closed), 2, RoundingMode.HALF_UP);
    }
}
