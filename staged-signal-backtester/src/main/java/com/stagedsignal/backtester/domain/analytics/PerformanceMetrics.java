package com.stagedsignal.backtester.domain.analytics;

import com.stagedsignal.backtester.domain.Trade;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Calculator for backtest performance metrics.
 */
@Slf4j
public class PerformanceMetrics {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final double DAYS_PER_YEAR = 365.25;

    private PerformanceMetrics() {
    }

    /**
     * Calculate total return percentage.
     */
    public static BigDecimal calculateTotalReturn(BigDecimal initialCapital, BigDecimal finalValue) {
        if (initialCapital.compareTo(BigDecimal.ZERO) == 0) {
            return BigDecimal.ZERO;
        }

        return finalValue.subtract(initialCapital)
                .divide(initialCapital, 4, RoundingMode.HALF_UP)
                .multiply(HUNDRED);
    }

    /**
     * Calculate compound annual return percentage over the calendar span between two timestamps.
     */
    public static BigDecimal calculateAnnualizedReturn(BigDecimal initialCapital, BigDecimal finalValue,
                                                       LocalDateTime start, LocalDateTime end) {
        if (initialCapital.signum() <= 0 || finalValue.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        double days = Duration.between(start, end).toMinutes() / (24.0 * 60.0);
        if (days <= 0) {
            return BigDecimal.ZERO;
        }
        double growth = finalValue.divide(initialCapital, 10, RoundingMode.HALF_UP).doubleValue();
        double annualized = Math.pow(growth, DAYS_PER_YEAR / days) - 1;
        if (!Double.isFinite(annualized)) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(annualized * 100).setScale(4, RoundingMode.HALF_UP);
    }

    /**
     * Period-over-period returns of an equity series.
     */
    public static List<BigDecimal> calculateReturns(List<BigDecimal> portfolioValues) {
        List<BigDecimal> returns = new ArrayList<>();
        for (int i = 1; i < portfolioValues.size(); i++) {
            BigDecimal prevValue = portfolioValues.get(i - 1);
            BigDecimal currentValue = portfolioValues.get(i);

            if (prevValue.compareTo(BigDecimal.ZERO) > 0) {
                returns.add(currentValue.subtract(prevValue).divide(prevValue, 8, RoundingMode.HALF_UP));
            }
        }
        return returns;
    }

    /**
     * Calculate annualized volatility percentage of period returns.
     */
    public static BigDecimal calculateVolatility(List<BigDecimal> returns, int periodsPerYear) {
        double stdDev = standardDeviation(returns);
        return BigDecimal.valueOf(stdDev * Math.sqrt(periodsPerYear) * 100).setScale(4, RoundingMode.HALF_UP);
    }

    /**
     * Calculate annualized Sharpe ratio on returns in excess of the per-period risk-free rate.
     */
    public static BigDecimal calculateSharpeRatio(List<BigDecimal> returns, BigDecimal annualRiskFree,
                                                  int periodsPerYear) {
        if (returns.size() < 2) {
            return BigDecimal.ZERO;
        }
        double periodRiskFree = annualRiskFree.doubleValue() / periodsPerYear;
        double stdDev = standardDeviation(returns);
        if (stdDev == 0) {
            return BigDecimal.ZERO;
        }
        double sharpe = (mean(returns) - periodRiskFree) / stdDev * Math.sqrt(periodsPerYear);
        return BigDecimal.valueOf(sharpe).setScale(4, RoundingMode.HALF_UP);
    }

    /**
     * Calculate annualized Sortino ratio, penalising only returns below the risk-free rate.
     */
    public static BigDecimal calculateSortinoRatio(List<BigDecimal> returns, BigDecimal annualRiskFree,
                                                   int periodsPerYear) {
        if (returns.size() < 2) {
            return BigDecimal.ZERO;
        }
        double periodRiskFree = annualRiskFree.doubleValue() / periodsPerYear;
        double downsideSquares = 0;
        for (BigDecimal r : returns) {
            double shortfall = Math.min(0, r.doubleValue() - periodRiskFree);
            downsideSquares += shortfall * shortfall;
        }
        double downsideDeviation = Math.sqrt(downsideSquares / returns.size());
        if (downsideDeviation == 0) {
            return BigDecimal.ZERO;
        }
        double sortino = (mean(returns) - periodRiskFree) / downsideDeviation * Math.sqrt(periodsPerYear);
        return BigDecimal.valueOf(sortino).setScale(4, RoundingMode.HALF_UP);
    }

    /**
     * Calculate maximum drawdown percentage.
     */
    public static BigDecimal calculateMaxDrawdown(List<BigDecimal> portfolioValues) {
        if (portfolioValues.isEmpty()) {
            return BigDecimal.ZERO;
        }

        BigDecimal maxDrawdown = BigDecimal.ZERO;
        BigDecimal peak = portfolioValues.get(0);

        for (BigDecimal value : portfolioValues) {
            if (value.compareTo(peak) > 0) {
                peak = value;
            }

            if (peak.compareTo(BigDecimal.ZERO) > 0) {
                BigDecimal drawdown = peak.subtract(value)
                        .divide(peak, 4, RoundingMode.HALF_UP)
                        .multiply(HUNDRED);

                if (drawdown.compareTo(maxDrawdown) > 0) {
                    maxDrawdown = drawdown;
                }
            }
        }

        return maxDrawdown.negate(); // Return as negative percentage
    }

    /**
     * Net realized P&L per position, in the order positions were closed. Only fully closed positions count.
     */
    public static List<BigDecimal> calculateClosedPositionResults(List<Trade> trades) {
        Map<Long, BigDecimal> pnlByPosition = new LinkedHashMap<>();
        List<BigDecimal> results = new ArrayList<>();
        for (Trade trade : trades) {
            if (!trade.getType().isOpening()) {
                pnlByPosition.merge(trade.getPositionId(), trade.getRealizedPnl(), BigDecimal::add);
            }
            if (trade.getType().isTerminal()) {
                results.add(pnlByPosition.remove(trade.getPositionId()));
            }
        }
        return results;
    }

    /**
     * Calculate win rate (fraction of closed positions with positive net P&L).
     */
    public static BigDecimal calculateWinRate(List<BigDecimal> positionResults) {
        if (positionResults.isEmpty()) {
            return BigDecimal.ZERO;
        }
        long winners = positionResults.stream().filter(p -> p.signum() > 0).count();
        return BigDecimal.valueOf(winners)
                .divide(BigDecimal.valueOf(positionResults.size()), 4, RoundingMode.HALF_UP);
    }

    /**
     * Gross profit over gross loss of closed positions.
     *
     * @return null when there were winners and no losses (the ratio is unbounded), zero when there
     * were neither
     */
    public static BigDecimal calculateProfitFactor(List<BigDecimal> positionResults) {
        BigDecimal grossProfit = BigDecimal.ZERO;
        BigDecimal grossLoss = BigDecimal.ZERO;
        for (BigDecimal pnl : positionResults) {
            if (pnl.signum() > 0) {
                grossProfit = grossProfit.add(pnl);
            } else {
                grossLoss = grossLoss.add(pnl.abs());
            }
        }
        if (grossLoss.signum() == 0) {
            return grossProfit.signum() > 0 ? null : BigDecimal.ZERO;
        }
        return grossProfit.divide(grossLoss, 4, RoundingMode.HALF_UP);
    }

    /**
     * Longest run of wins (or losses) among closed positions.
     */
    public static int calculateMaxConsecutive(List<BigDecimal> positionResults, boolean wins) {
        int longest = 0;
        int current = 0;
        for (BigDecimal pnl : positionResults) {
            boolean matches = wins ? pnl.signum() > 0 : pnl.signum() < 0;
            current = matches ? current + 1 : 0;
            longest = Math.max(longest, current);
        }
        return longest;
    }

    /**
     * Net realized P&L by ticker, partial exits included.
     */
    public static Map<String, BigDecimal> calculateSymbolContribution(List<Trade> trades) {
        Map<String, BigDecimal> contribution = new TreeMap<>();
        for (Trade trade : trades) {
            BigDecimal pnl = trade.getType().isOpening() ? BigDecimal.ZERO : trade.getRealizedPnl();
            contribution.merge(trade.getTicker(), pnl, BigDecimal::add);
        }
        return contribution;
    }

    static double mean(List<BigDecimal> values) {
        return values.stream().mapToDouble(BigDecimal::doubleValue).average().orElse(0);
    }

    static double standardDeviation(List<BigDecimal> values) {
        if (values.size() < 2) {
            return 0;
        }
        double mean = mean(values);
        double sumSquaredDiff = values.stream()
                .mapToDouble(v -> Math.pow(v.doubleValue() - mean, 2))
                .sum();
        return Math.sqrt(sumSquaredDiff / values.size());
    }
}
