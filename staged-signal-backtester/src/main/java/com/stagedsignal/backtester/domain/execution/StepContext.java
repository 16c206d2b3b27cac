package com.stagedsignal.backtester.domain.execution;

import com.stagedsignal.backtester.domain.SeriesBar;
import com.stagedsignal.backtester.domain.signal.Candidate;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Inputs the simulator needs for one step, all gathered before the portfolio is touched.
 */
@Value
@Builder
public class StepContext {

    LocalDateTime timestamp;

    /** Execution bars stamped at the step, by symbol. */
    Map<String, SeriesBar> bars;

    /** In score order. */
    List<Candidate> candidates;

    Set<String> exitSignals;
    Map<String, SizingProposal> proposals;
    boolean finalStep;

    public SeriesBar bar(String symbol) {
        return bars.get(symbol);
    }
}
