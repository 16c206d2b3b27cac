package com.stagedsignal.backtester.domain.analytics;

import com.stagedsignal.backtester.domain.EquityPoint;
import com.stagedsignal.backtester.domain.ReasonCode;
import com.stagedsignal.backtester.domain.Trade;
import com.stagedsignal.backtester.domain.TradeType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static com.stagedsignal.backtester.domain.Bars.day;
import static com.stagedsignal.backtester.domain.Bars.dec;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PerformanceAnalyzer.
 */
class PerformanceAnalyzerTest {

    private final PerformanceAnalyzer analyzer = new PerformanceAnalyzer(BigDecimal.ZERO, 252);

    private static EquityPoint point(int day, String equity) {
        return EquityPoint.builder()
                .timestamp(day(day))
                .equity(dec(equity))
                .cash(dec(equity))
                .realizedPnl(BigDecimal.ZERO)
                .unrealizedPnl(BigDecimal.ZERO)
                .build();
    }

    private static Trade trade(long positionId, String ticker, TradeType type, LocalDateTime time, String pnl) {
        return Trade.builder()
                .positionId(positionId)
                .ticker(ticker)
                .type(type)
                .quantity(10)
                .price(dec("100"))
                .timestamp(time)
                .reason(ReasonCode.BREAKOUT_ENTRY)
                .realizedPnl(dec(pnl))
                .build();
    }

    private static List<Trade> trades() {
        return List.of(
                trade(1, "AAA", TradeType.ENTRY, day(1), "0"),
                trade(2, "BBB", TradeType.ENTRY, day(2), "0"),
                trade(1, "AAA", TradeType.STOP_OUT, day(3), "-500"),
                trade(2, "BBB", TradeType.PARTIAL_EXIT, day(3), "300"),
                trade(2, "BBB", TradeType.EXIT, day(4), "700"));
    }

    private static List<EquityPoint> history() {
        return List.of(point(1, "100000"), point(2, "101000"), point(3, "99000"), point(4, "102000"));
    }

    @Test
    void testAnalyze_Summary() {
        // Act
        PerformanceSummary summary = analyzer.analyze(trades(), history());

        // Assert
        assertEquals(new BigDecimal("2.0000"), summary.getTotalReturn());
        assertEquals(new BigDecimal("-1.9800"), summary.getMaxDrawdown());
        assertEquals(new BigDecimal("0.5000"), summary.getWinRate());
        assertEquals(new BigDecimal("2.0000"), summary.getProfitFactor());
        assertEquals(new BigDecimal("1000.0000"), summary.getAverageWin());
        assertEquals(new BigDecimal("-500.0000"), summary.getAverageLoss());
        assertEquals(0, dec("-500").compareTo(summary.getLargestLoss()));
        assertEquals(new BigDecimal("2.00"), summary.getAverageHoldingDays());
        assertEquals(5, summary.getTotalTrades());
        assertEquals(2, summary.getClosedPositions());
        assertEquals(1, summary.getWinningPositions());
        assertEquals(1, summary.getMaxConsecutiveWins());
        assertEquals(1, summary.getMaxConsecutiveLosses());
        assertEquals(0, dec("1000").compareTo(summary.getSymbolContribution().get("BBB")));
    }

    @Test
    void testAnalyze_IsDeterministic() {
        PerformanceSummary first = analyzer.analyze(trades(), history());
        PerformanceSummary second = analyzer.analyze(trades(), history());

        assertEquals(first, second, "Same inputs should give the same summary");
    }

    @Test
    void testAnalyze_NoTrades() {
        PerformanceSummary summary = analyzer.analyze(List.of(), List.of(point(1, "100000"), point(2, "100000")));

        assertEquals(BigDecimal.ZERO, summary.getWinRate());
        assertEquals(0, summary.getClosedPositions());
        assertEquals(BigDecimal.ZERO, summary.getSharpeRatio());
    }

    @Test
    void testAnalyze_InsufficientData() {
        InsufficientDataException e = assertThrows(InsufficientDataException.class,
                () -> analyzer.analyze(List.of(), List.of(point(1, "100000"))));

        assertTrue(e.getMessage().startsWith("insufficient data"), e.getMessage());
    }
}
