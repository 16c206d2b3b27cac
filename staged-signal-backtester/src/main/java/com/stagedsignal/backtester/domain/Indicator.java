package com.stagedsignal.backtester.domain;

/**
 * Derived fields carried on a {@link SeriesBar}, computed upstream by the indicator layer.
 */
public enum Indicator {

    // daily technicals
    SMA20,
    SMA50,
    SMA200,
    SMA200_MOMENTUM,
    HIGHEST_1M,
    HIGHEST_3M,
    HIGHEST_6M,
    HIGHEST_1Y,
    HIGHEST_2Y,
    ADR,

    // weekly structure
    HIGH_52W,
    LOW_52W,
    HIGH_1Y,
    LOW_1Y,
    HIGH_2Y,
    LOW_2Y,

    // relative strength percentile
    RS_4W,
    RS_12W,

    // fundamentals and earnings
    MARKET_CAP,
    REVENUE,
    REV_YOY,
    EPS_YOY
}
