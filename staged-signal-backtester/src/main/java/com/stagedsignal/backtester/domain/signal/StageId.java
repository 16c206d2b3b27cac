package com.stagedsignal.backtester.domain.signal;

/**
 * The five pipeline gates, in evaluation order.
 */
public enum StageId {
    EARNINGS("E"),
    FUNDAMENTAL("F"),
    WEEKLY("W"),
    RELATIVE_STRENGTH("RS"),
    DAILY("D");

    private final String code;

    StageId(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
