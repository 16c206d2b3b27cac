package com.stagedsignal.backtester.domain.analytics;

/**
 * Raised when a statistic needs more equity history than the run produced.
 */
public class InsufficientDataException extends IllegalStateException {

    public InsufficientDataException(String message) {
        super(message);
    }
}
