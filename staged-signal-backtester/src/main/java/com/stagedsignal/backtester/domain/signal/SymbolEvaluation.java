package com.stagedsignal.backtester.domain.signal;

import lombok.Value;

import java.util.List;

/**
 * Stage results for one symbol at one step, plus the candidate and exit flag derived from them.
 */
@Value
public class SymbolEvaluation {
    String symbol;
    List<StageResult> results;
    Candidate candidate;
    boolean exitSignal;
    String failure;
}
