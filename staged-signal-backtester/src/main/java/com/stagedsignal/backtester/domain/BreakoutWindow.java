package com.stagedsignal.backtester.domain;

/**
 * Rolling-high lookback windows scanned by the daily breakout stage. Declared from longest to
 * shortest; that is the scan order.
 */
public enum BreakoutWindow {

    TWO_YEAR(Indicator.HIGHEST_2Y, "2Y"),
    ONE_YEAR(Indicator.HIGHEST_1Y, "1Y"),
    SIX_MONTH(Indicator.HIGHEST_6M, "6M"),
    THREE_MONTH(Indicator.HIGHEST_3M, "3M"),
    ONE_MONTH(Indicator.HIGHEST_1M, "1M");

    private final Indicator level;
    private final String label;

    BreakoutWindow(Indicator level, String label) {
        this.level = level;
        this.label = label;
    }

    public Indicator getLevel() {
        return level;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Signal label recorded on a breakout through this window.
     */
    public String signalLabel() {
        return "BREAKOUT_" + label;
    }
}
