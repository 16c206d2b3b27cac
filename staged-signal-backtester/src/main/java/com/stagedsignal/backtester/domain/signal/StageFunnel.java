package com.stagedsignal.backtester.domain.signal;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * How many symbols reached a stage and how many got through it.
 */
@Value
public class StageFunnel {

    StageId stage;
    long input;
    long passed;
    long skipped;

    public static StageFunnel empty(StageId stage) {
        return new StageFunnel(stage, 0, 0, 0);
    }

    public StageFunnel plus(StageFunnel other) {
        return new StageFunnel(stage, input + other.input, passed + other.passed, skipped + other.skipped);
    }

    /**
     * Share of the stage's input that passed, 0 when nothing reached it.
     */
    public BigDecimal passRate() {
        if (input == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(passed).divide(BigDecimal.valueOf(input), 4, RoundingMode.HALF_UP);
    }
}
