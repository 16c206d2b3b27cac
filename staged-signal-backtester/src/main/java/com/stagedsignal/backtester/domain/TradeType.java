package com.stagedsignal.backtester.domain;

public enum TradeType {
    ENTRY,
    EXIT,
    PARTIAL_EXIT,
    PYRAMID,
    STOP_OUT;

    /**
     * True for fills that add shares to a position.
     */
    public boolean isOpening() {
        return this == ENTRY || this == PYRAMID;
    }

    /**
     * True for fills that close a position completely.
     */
    public boolean isTerminal() {
        return this == EXIT || this == STOP_OUT;
    }
}
