package com.stagedsignal.backtester.domain.signal;

import com.stagedsignal.backtester.domain.RunMode;
import com.stagedsignal.backtester.domain.StrategyProfile;

/**
 * One gate of the signal pipeline. Implementations are stateless and thread-safe.
 */
public interface StageFilter {

    StageId getStageId();

    /**
     * Whether the profile switches this stage on.
     */
    boolean isEnabled(StrategyProfile profile);

    /**
     * Evaluate the symbol. Never throws for data problems; those produce a failed result.
     */
    StageResult evaluate(SymbolSnapshot snapshot, StrategyProfile profile, RunMode mode);
}
