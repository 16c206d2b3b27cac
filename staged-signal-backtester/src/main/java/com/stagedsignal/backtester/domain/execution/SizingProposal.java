package com.stagedsignal.backtester.domain.execution;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Pre-limit entry size for one candidate, computed against the equity at the start of the step.
 */
@Value
public class SizingProposal {

    public enum Status {
        READY,
        NOT_TRIGGERED,
        MISSING_PRICE,
        INVALID_STOP
    }

    String symbol;
    Status status;
    BigDecimal fillPrice;
    int quantity;

    public static SizingProposal ready(String symbol, BigDecimal fillPrice, int quantity) {
        return new SizingProposal(symbol, Status.READY, fillPrice, quantity);
    }

    public static SizingProposal of(String symbol, Status status) {
        return new SizingProposal(symbol, status, null, 0);
    }
}
