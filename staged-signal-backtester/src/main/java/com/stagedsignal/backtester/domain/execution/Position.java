package com.stagedsignal.backtester.domain.execution;

import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * An open holding in one ticker. Mutated only through the transitions below, which the portfolio
 * invokes on behalf of the execution simulator.
 */
@Getter
public class Position {

    private final long id;
    private final String ticker;
    private final LocalDateTime entryTime;
    private final String signalLabel;
    private int quantity;
    private BigDecimal averageEntryPrice;
    private BigDecimal stopPrice;
    private BigDecimal targetPrice;
    private BigDecimal currentPrice;
    private BigDecimal riskFraction;
    private int daysHeld;
    private LocalDate lastMarkedDate;
    private int pyramidLevel;
    private PositionState state;
    private BigDecimal openCommission;
    private BigDecimal realizedPnl;

    private Position(long id, String ticker, LocalDateTime entryTime, String signalLabel) {
        this.id = id;
        this.ticker = ticker;
        this.entryTime = entryTime;
        this.signalLabel = signalLabel;
    }

    static Position open(long id, String ticker, LocalDateTime entryTime, int quantity, BigDecimal fillPrice,
                         BigDecimal commission, BigDecimal stopPrice, BigDecimal targetPrice,
                         BigDecimal riskFraction, String signalLabel) {
        if (quantity <= 0) {
            throw new IllegalStateException("Cannot open " + ticker + " with quantity " + quantity);
        }
        Position position = new Position(id, ticker, entryTime, signalLabel);
        position.quantity = quantity;
        position.averageEntryPrice = fillPrice;
        position.currentPrice = fillPrice;
        position.stopPrice = stopPrice;
        position.targetPrice = targetPrice;
        position.riskFraction = riskFraction;
        position.lastMarkedDate = entryTime.toLocalDate();
        position.state = PositionState.OPEN;
        position.openCommission = commission;
        position.realizedPnl = BigDecimal.ZERO;
        return position;
    }

    /**
     * Pyramid addition: Open to Open with a weighted average entry price.
     */
    void add(int addedQuantity, BigDecimal fillPrice, BigDecimal commission) {
        transition(PositionState.OPEN);
        if (addedQuantity <= 0) {
            throw new IllegalStateException("Pyramid quantity must be positive for " + ticker);
        }
        BigDecimal cost = averageEntryPrice.multiply(BigDecimal.valueOf(quantity))
                .add(fillPrice.multiply(BigDecimal.valueOf(addedQuantity)));
        quantity += addedQuantity;
        averageEntryPrice = cost.divide(BigDecimal.valueOf(quantity), 6, RoundingMode.HALF_UP);
        currentPrice = fillPrice;
        openCommission = openCommission.add(commission);
        pyramidLevel++;
    }

    /**
     * Sell part or all of the position. Returns the realized P&L of the sold shares net of the exit
     * commission and their share of entry commissions.
     */
    BigDecimal reduce(int soldQuantity, BigDecimal fillPrice, BigDecimal commission, PositionState next) {
        if (soldQuantity <= 0 || soldQuantity > quantity) {
            throw new IllegalStateException("Cannot sell " + soldQuantity + " of " + quantity + " " + ticker);
        }
        if (next == PositionState.CLOSED && soldQuantity != quantity) {
            throw new IllegalStateException("Closing " + ticker + " requires selling all " + quantity + " shares");
        }
        if (next == PositionState.PARTIALLY_CLOSED && soldQuantity == quantity) {
            throw new IllegalStateException("Partial exit of " + ticker + " would leave no shares");
        }
        if (next == PositionState.OPEN) {
            throw new IllegalStateException("A sale cannot leave " + ticker + " open");
        }
        transition(next);

        BigDecimal allocatedCommission = openCommission.multiply(BigDecimal.valueOf(soldQuantity))
                .divide(BigDecimal.valueOf(quantity), 4, RoundingMode.HALF_UP);
        BigDecimal pnl = fillPrice.subtract(averageEntryPrice)
                .multiply(BigDecimal.valueOf(soldQuantity))
                .subtract(commission)
                .subtract(allocatedCommission)
                .setScale(4, RoundingMode.HALF_UP);

        openCommission = openCommission.subtract(allocatedCommission);
        quantity -= soldQuantity;
        currentPrice = fillPrice;
        realizedPnl = realizedPnl.add(pnl);
        return pnl;
    }

    void markToMarket(BigDecimal price, LocalDateTime timestamp) {
        currentPrice = price;
        LocalDate date = timestamp.toLocalDate();
        if (date.isAfter(lastMarkedDate)) {
            daysHeld++;
            lastMarkedDate = date;
        }
    }

    /**
     * Move the stop up. Lower values are ignored.
     */
    void raiseStop(BigDecimal candidate) {
        if (candidate.compareTo(stopPrice) > 0) {
            stopPrice = candidate;
        }
    }

    /**
     * Reset the stop after a partial exit with a wider trailing step. The only path that may lower it.
     */
    void widenStop(BigDecimal newStop, BigDecimal newRiskFraction) {
        if (state != PositionState.PARTIALLY_CLOSED) {
            throw new IllegalStateException("Stop of " + ticker + " can only be widened after a partial exit");
        }
        stopPrice = newStop;
        riskFraction = newRiskFraction;
    }

    public BigDecimal getMarketValue() {
        return currentPrice.multiply(BigDecimal.valueOf(quantity));
    }

    public BigDecimal getUnrealizedPnl() {
        return currentPrice.subtract(averageEntryPrice).multiply(BigDecimal.valueOf(quantity));
    }

    public boolean isHeld() {
        return state != PositionState.CLOSED;
    }

    Position copy() {
        Position copy = new Position(id, ticker, entryTime, signalLabel);
        copy.quantity = quantity;
        copy.averageEntryPrice = averageEntryPrice;
        copy.stopPrice = stopPrice;
        copy.targetPrice = targetPrice;
        copy.currentPrice = currentPrice;
        copy.riskFraction = riskFraction;
        copy.daysHeld = daysHeld;
        copy.lastMarkedDate = lastMarkedDate;
        copy.pyramidLevel = pyramidLevel;
        copy.state = state;
        copy.openCommission = openCommission;
        copy.realizedPnl = realizedPnl;
        return copy;
    }

    private void transition(PositionState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition " + state + " -> " + next + " for " + ticker);
        }
        state = next;
    }
}
