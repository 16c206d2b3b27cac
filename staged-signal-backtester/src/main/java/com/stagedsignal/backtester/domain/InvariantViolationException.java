package com.stagedsignal.backtester.domain;

import lombok.Getter;

import java.time.LocalDateTime;

/**
 * Fatal bookkeeping failure detected while applying a step. Carries the last committed state and
 * the state that failed verification so the run can be reproduced.
 */
@Getter
public class InvariantViolationException extends RuntimeException {

    private final LocalDateTime stepTime;
    private final PortfolioSnapshot lastCommitted;
    private final PortfolioSnapshot offending;

    public InvariantViolationException(String message, LocalDateTime stepTime,
                                       PortfolioSnapshot lastCommitted, PortfolioSnapshot offending) {
        super(message + " at " + stepTime);
        this.stepTime = stepTime;
        this.lastCommitted = lastCommitted;
        this.offending = offending;
    }

    public InvariantViolationException(String message, LocalDateTime stepTime,
                                       PortfolioSnapshot lastCommitted, PortfolioSnapshot offending,
                                       Throwable cause) {
        super(message + " at " + stepTime, cause);
        this.stepTime = stepTime;
        this.lastCommitted = lastCommitted;
        this.offending = offending;
    }
}
