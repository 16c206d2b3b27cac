package com.stagedsignal.backtester.domain;

import lombok.Getter;

/**
 * Raised when a required bar field is absent or was not finite when the bar was built.
 */
@Getter
public class MissingIndicatorException extends RuntimeException {

    private final String symbol;
    private final String field;

    public MissingIndicatorException(String symbol, String field) {
        super("Missing " + field + " for " + symbol);
        this.symbol = symbol;
        this.field = field;
    }
}
