package com.stagedsignal.backtester.domain.signal;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of one stage for one symbol at one step.
 */
@Value
@Builder
public class StageResult {

    String symbol;
    StageId stage;
    boolean passed;
    boolean skipped;
    BigDecimal targetPrice;
    BigDecimal stopPrice;
    String signalLabel;

    /** Stage-specific strength value, e.g. the RS percentile. */
    BigDecimal metric;

    String reason;

    public static StageResult pass(String symbol, StageId stage) {
        return StageResult.builder().symbol(symbol).stage(stage).passed(true).build();
    }

    public static StageResult fail(String symbol, StageId stage, String reason) {
        return StageResult.builder().symbol(symbol).stage(stage).passed(false).reason(reason).build();
    }

    /**
     * Result for a stage disabled in the profile. Every symbol passes it.
     */
    public static StageResult skipped(String symbol, StageId stage) {
        return StageResult.builder().symbol(symbol).stage(stage).passed(true).skipped(true)
                .reason("stage disabled").build();
    }
}
