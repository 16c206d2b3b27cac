package com.stagedsignal.backtester.domain;

public enum RejectionReason {
    MAX_POSITIONS,
    CONCENTRATION_CLAMP,
    INSUFFICIENT_CASH,
    SIZE_TOO_SMALL,
    WHIPSAW_GUARD,
    SAME_STEP_EXIT,
    MISSING_PRICE
}
