package com.stagedsignal.backtester.domain;

import java.math.BigDecimal;

/**
 * Timing mode of a run. Both modes share every stage predicate and threshold; they differ only in
 * whether the step's own bar is visible to the stages and in the breakout comparison.
 */
public enum RunMode {

    /**
     * Historical backtesting. Stages see only bars stamped before the step and a breakout means the
     * price already reached the level.
     */
    RETROSPECTIVE(false) {
        @Override
        public boolean isBreakout(BigDecimal level, BigDecimal high) {
            return level.compareTo(high) <= 0;
        }
    },

    /**
     * Live or paper execution. Stages see the most recent bar available at the step and a breakout
     * is pending while the price is still below the level; the resulting orders work at the next step.
     */
    FORWARD(true) {
        @Override
        public boolean isBreakout(BigDecimal level, BigDecimal high) {
            return level.compareTo(high) > 0;
        }
    };

    private final boolean stepBarVisible;

    RunMode(boolean stepBarVisible) {
        this.stepBarVisible = stepBarVisible;
    }

    /**
     * Whether bars stamped exactly at the step time are part of the decision window.
     */
    public boolean isStepBarVisible() {
        return stepBarVisible;
    }

    /**
     * Whether entries and exits decided at a step are executed at the following step. A decision that
     * has read the step's own bar can only be acted on once the next bar opens; the target it emits
     * becomes a buy-stop against that bar.
     */
    public boolean isExecutionDeferred() {
        return stepBarVisible;
    }

    /**
     * Breakout comparison between a rolling-high level and the decision bar's high.
     */
    public abstract boolean isBreakout(BigDecimal level, BigDecimal high);
}
