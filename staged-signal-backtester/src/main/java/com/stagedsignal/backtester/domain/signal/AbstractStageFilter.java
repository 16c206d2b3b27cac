package com.stagedsignal.backtester.domain.signal;

import com.stagedsignal.backtester.domain.MissingIndicatorException;
import com.stagedsignal.backtester.domain.RunMode;
import com.stagedsignal.backtester.domain.StrategyProfile;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns data errors raised while evaluating a stage into a closed failure for that symbol.
 */
@Slf4j
public abstract class AbstractStageFilter implements StageFilter {

    @Override
    public final StageResult evaluate(SymbolSnapshot snapshot, StrategyProfile profile, RunMode mode) {
        String symbol = snapshot.getSymbol();
        try {
            return doEvaluate(snapshot, profile, mode);
        } catch (MissingIndicatorException e) {
            log.debug("{} stage failed closed for {}: {}", getStageId().getCode(), symbol, e.getMessage());
            return StageResult.fail(symbol, getStageId(), "missing " + e.getField());
        } catch (ArithmeticException e) {
            log.debug("{} stage arithmetic failure for {}: {}", getStageId().getCode(), symbol, e.getMessage());
            return StageResult.fail(symbol, getStageId(), "arithmetic: " + e.getMessage());
        }
    }

    protected abstract StageResult doEvaluate(SymbolSnapshot snapshot, StrategyProfile profile, RunMode mode);

    protected StageResult fail(SymbolSnapshot snapshot, String reason) {
        return StageResult.fail(snapshot.getSymbol(), getStageId(), reason);
    }
}
