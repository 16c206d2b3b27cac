package com.stagedsignal.backtester.domain;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Callbacks from the engine on the simulation thread. All methods are optional.
 */
public interface BacktestListener {

    BacktestListener NONE = new BacktestListener() {
    };

    /**
     * A step passed verification and was committed.
     */
    default void onStepCommitted(LocalDateTime step, List<Trade> trades, List<OrderRejection> rejections,
                                 EquityPoint equity, long elapsedNanos) {
    }

    /**
     * Symbols dropped from a step because their evaluation faulted or timed out.
     */
    default void onSymbolFailures(LocalDateTime step, Map<String, String> failures) {
    }
}
