package com.stagedsignal.backtester.domain;

public enum RunStatus {
    COMPLETED,
    CANCELLED
}
