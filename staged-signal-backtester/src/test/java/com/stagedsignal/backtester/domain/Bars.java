package com.stagedsignal.backtester.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Test helpers for building bars on a simple daily calendar.
 */
public final class Bars {

    public static final LocalDate START = LocalDate.of(2024, 1, 1);

    private Bars() {
    }

    /**
     * Close of trading day n, counting from 1.
     */
    public static LocalDateTime day(int n) {
        return START.plusDays(n - 1L).atTime(16, 0);
    }

    public static SeriesBar.SeriesBarBuilder bar(String symbol, LocalDateTime timestamp,
                                                 String open, String high, String low, String close) {
        return SeriesBar.builder()
                .symbol(symbol)
                .timestamp(timestamp)
                .open(new BigDecimal(open))
                .high(new BigDecimal(high))
                .low(new BigDecimal(low))
                .close(new BigDecimal(close))
                .volume(1_000_000L);
    }

    /**
     * Bar without prices, for fundamental, earnings and relative-strength records.
     */
    public static SeriesBar.SeriesBarBuilder record(String symbol, LocalDateTime timestamp) {
        return SeriesBar.builder().symbol(symbol).timestamp(timestamp);
    }

    /**
     * Daily bar whose moving averages are in an uptrend.
     */
    public static SeriesBar.SeriesBarBuilder trending(String symbol, LocalDateTime timestamp,
                                                      String open, String high, String low, String close,
                                                      String highestOneMonth) {
        return bar(symbol, timestamp, open, high, low, close)
                .indicator(Indicator.SMA50, new BigDecimal("90"))
                .indicator(Indicator.SMA200, new BigDecimal("80"))
                .indicator(Indicator.SMA200_MOMENTUM, new BigDecimal("0.5"))
                .indicator(Indicator.HIGHEST_1M, new BigDecimal(highestOneMonth))
                .indicator(Indicator.ADR, new BigDecimal("3"));
    }

    public static BigDecimal dec(String value) {
        return new BigDecimal(value);
    }
}
