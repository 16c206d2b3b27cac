package com.stagedsignal.backtester.domain.execution;

/**
 * Lifecycle of a position. Open may loop to itself when pyramiding.
 */
public enum PositionState {
    OPEN,
    PARTIALLY_CLOSED,
    CLOSED;

    public boolean canTransitionTo(PositionState next) {
        switch (this) {
            case OPEN:
                return true;
            case PARTIALLY_CLOSED:
                return next == CLOSED;
            default:
                return false;
        }
    }
}
