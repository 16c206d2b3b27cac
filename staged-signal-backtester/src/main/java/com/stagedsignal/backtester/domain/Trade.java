package com.stagedsignal.backtester.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A single simulated fill. Immutable once recorded.
 */
@Value
@Builder(toBuilder = true)
public class Trade {

    long sequence;
    long positionId;
    String ticker;
    TradeType type;
    int quantity;
    BigDecimal price;
    LocalDateTime timestamp;
    ReasonCode reason;

    @Builder.Default
    BigDecimal realizedPnl = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal commission = BigDecimal.ZERO;

    String signalLabel;

    /**
     * Price times quantity, before commission.
     */
    public BigDecimal getNotional() {
        return price.multiply(BigDecimal.valueOf(quantity));
    }

    /**
     * Signed change in cash caused by this fill.
     */
    public BigDecimal getCashFlow() {
        if (type.isOpening()) {
            return getNotional().add(commission).negate();
        }
        return getNotional().subtract(commission);
    }
}
