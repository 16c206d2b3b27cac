package com.stagedsignal.backtester.domain.signal;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Merged result of one pipeline pass: ordered candidates, exit signals for held symbols and the
 * per-stage funnel.
 */
@Value
@Builder
public class PipelineOutcome {

    LocalDateTime decisionTime;
    int universeSize;

    /** Highest score first, ties broken by symbol. */
    List<Candidate> candidates;

    Set<String> exitSignals;
    Map<StageId, StageFunnel> funnel;

    /** Symbols whose evaluation faulted or timed out, with the reason. */
    Map<String, String> failures;

    /**
     * Candidate symbols in ranking order.
     */
    public List<String> candidateSymbols() {
        return candidates.stream().map(Candidate::getSymbol).collect(Collectors.toList());
    }

    /**
     * One-line summary in the form {@code E 40->12 F 12->8 ...}.
     */
    public String funnelSummary() {
        return funnel.values().stream()
                .map(f -> f.getStage().getCode() + " " + f.getInput() + "->" + f.getPassed())
                .collect(Collectors.joining(" "));
    }
}
