package com.stagedsignal.backtester.domain;

/**
 * The distinct per-symbol series supplied by the indicator store.
 */
public enum SeriesKind {

    DAILY(252),
    WEEKLY(52),
    RELATIVE_STRENGTH(252),
    FUNDAMENTAL(4),
    EARNINGS(4),
    MINUTE(252 * 390);

    private final int periodsPerYear;

    SeriesKind(int periodsPerYear) {
        this.periodsPerYear = periodsPerYear;
    }

    /**
     * Number of bars of this kind in a trading year, used to annualize step returns.
     */
    public int getPeriodsPerYear() {
        return periodsPerYear;
    }
}
