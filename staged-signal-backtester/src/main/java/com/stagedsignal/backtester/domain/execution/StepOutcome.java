package com.stagedsignal.backtester.domain.execution;

import com.stagedsignal.backtester.domain.OrderRejection;
import com.stagedsignal.backtester.domain.Trade;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fills, rejections and skipped symbols produced by one step, not yet committed.
 */
@Value
public class StepOutcome {
    List<Trade> trades;
    List<OrderRejection> rejections;
    Set<String> closedTickers;
    Map<String, String> skippedSymbols;
}
