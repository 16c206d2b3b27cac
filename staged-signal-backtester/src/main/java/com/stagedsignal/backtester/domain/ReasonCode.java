package com.stagedsignal.backtester.domain;

/**
 * Why a trade happened.
 */
public enum ReasonCode {
    BREAKOUT_ENTRY,
    PYRAMID_ADD,
    STOP_LOSS,
    SAME_BAR_STOP,
    SIGNAL_EXIT,
    PROFIT_TARGET,
    END_OF_RUN
}
