package com.stagedsignal.backtester.domain.signal;

import java.util.Collection;
import java.util.SortedMap;
import java.util.function.Function;

/**
 * Runs an independent task per symbol and gathers the results keyed and ordered by symbol.
 * A task that throws or times out becomes a failure for that symbol only.
 */
public interface SymbolExecutor {

    <T> SortedMap<String, SymbolTaskResult<T>> invokeAll(Collection<String> symbols, Function<String, T> task);
}
