package com.stagedsignal.backtester.domain.signal;

import lombok.Value;

/**
 * Value computed for one symbol by a worker, or the reason it could not be computed.
 */
@Value
public class SymbolTaskResult<T> {

    String symbol;
    T value;
    String failure;

    public static <T> SymbolTaskResult<T> success(String symbol, T value) {
        return new SymbolTaskResult<>(symbol, value, null);
    }

    public static <T> SymbolTaskResult<T> failure(String symbol, String failure) {
        return new SymbolTaskResult<>(symbol, null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
