package com.stagedsignal.backtester.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, append-only record of every fill in a run.
 */
public class TradeLog {

    private final List<Trade> trades = new ArrayList<>();

    /**
     * Appends a fill, stamping its sequence number. Timestamps must never go backwards.
     */
    public Trade append(Trade trade) {
        if (!trades.isEmpty()) {
            Trade last = trades.get(trades.size() - 1);
            if (trade.getTimestamp().isBefore(last.getTimestamp())) {
                throw new IllegalStateException("Trade at " + trade.getTimestamp()
                        + " is earlier than last recorded trade at " + last.getTimestamp());
            }
        }
        Trade recorded = trade.toBuilder().sequence(trades.size() + 1L).build();
        trades.add(recorded);
        return recorded;
    }

    public void appendAll(List<Trade> fills) {
        fills.forEach(this::append);
    }

    public List<Trade> getTrades() {
        return Collections.unmodifiableList(trades);
    }

    public int size() {
        return trades.size();
    }

    public boolean isEmpty() {
        return trades.isEmpty();
    }
}
