package com.stagedsignal.backtester.domain.execution;

import com.stagedsignal.backtester.domain.EquityPoint;
import com.stagedsignal.backtester.domain.PortfolioSnapshot;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Cash, open positions keyed by ticker and the committed equity history. All mutators are
 * package-private; the execution simulator is the only writer.
 */
public class Portfolio {

    private final BigDecimal initialCash;
    private BigDecimal cash;
    private BigDecimal realizedPnl;
    private long nextPositionId;
    private final NavigableMap<String, Position> positions;
    private final List<Position> closedPositions;

    // shared between a committed portfolio and its working copy; appended only on commit
    private final List<EquityPoint> equityHistory;

    public Portfolio(BigDecimal initialCash) {
        if (initialCash == null || initialCash.signum() <= 0) {
            throw new IllegalArgumentException("Initial cash must be positive");
        }
        this.initialCash = initialCash;
        this.cash = initialCash;
        this.realizedPnl = BigDecimal.ZERO;
        this.nextPositionId = 1;
        this.positions = new TreeMap<>();
        this.closedPositions = new ArrayList<>();
        this.equityHistory = new ArrayList<>();
    }

    private Portfolio(Portfolio source) {
        this.initialCash = source.initialCash;
        this.cash = source.cash;
        this.realizedPnl = source.realizedPnl;
        this.nextPositionId = source.nextPositionId;
        this.positions = new TreeMap<>();
        source.positions.forEach((ticker, position) -> this.positions.put(ticker, position.copy()));
        this.closedPositions = new ArrayList<>(source.closedPositions);
        this.equityHistory = source.equityHistory;
    }

    /**
     * Working copy for one step. Positions are deep-copied so a discarded step leaves this one untouched.
     */
    public Portfolio copy() {
        return new Portfolio(this);
    }

    Position openPosition(String ticker, LocalDateTime time, int quantity, BigDecimal fillPrice,
                          BigDecimal commission, BigDecimal stopPrice, BigDecimal targetPrice,
                          BigDecimal riskFraction, String signalLabel) {
        if (positions.containsKey(ticker)) {
            throw new IllegalStateException("Position already open for " + ticker);
        }
        BigDecimal cost = fillPrice.multiply(BigDecimal.valueOf(quantity)).add(commission);
        requireCash(cost, ticker);
        Position position = Position.open(nextPositionId++, ticker, time, quantity, fillPrice, commission,
                stopPrice, targetPrice, riskFraction, signalLabel);
        positions.put(ticker, position);
        cash = cash.subtract(cost);
        return position;
    }

    void addToPosition(String ticker, int quantity, BigDecimal fillPrice, BigDecimal commission) {
        Position position = requirePosition(ticker);
        BigDecimal cost = fillPrice.multiply(BigDecimal.valueOf(quantity)).add(commission);
        requireCash(cost, ticker);
        position.add(quantity, fillPrice, commission);
        cash = cash.subtract(cost);
    }

    /**
     * Sell shares. A CLOSED transition removes the position from the open set.
     */
    BigDecimal reducePosition(String ticker, int quantity, BigDecimal fillPrice, BigDecimal commission,
                              PositionState next) {
        Position position = requirePosition(ticker);
        BigDecimal pnl = position.reduce(quantity, fillPrice, commission, next);
        cash = cash.add(fillPrice.multiply(BigDecimal.valueOf(quantity))).subtract(commission);
        realizedPnl = realizedPnl.add(pnl);
        if (next == PositionState.CLOSED) {
            positions.remove(ticker);
            closedPositions.add(position);
        }
        return pnl;
    }

    void markToMarket(String ticker, BigDecimal price, LocalDateTime timestamp) {
        requirePosition(ticker).markToMarket(price, timestamp);
    }

    /**
     * Append the end-of-step valuation. Called once per committed step.
     */
    public EquityPoint recordEquity(LocalDateTime timestamp) {
        if (!equityHistory.isEmpty()
                && !timestamp.isAfter(equityHistory.get(equityHistory.size() - 1).getTimestamp())) {
            throw new IllegalStateException("Equity history must advance, got " + timestamp);
        }
        EquityPoint point = EquityPoint.builder()
                .timestamp(timestamp)
                .equity(getEquity())
                .cash(cash)
                .openPositions(positions.size())
                .realizedPnl(realizedPnl)
                .unrealizedPnl(getUnrealizedPnl())
                .build();
        equityHistory.add(point);
        return point;
    }

    public BigDecimal getInitialCash() {
        return initialCash;
    }

    public BigDecimal getCash() {
        return cash;
    }

    public BigDecimal getRealizedPnl() {
        return realizedPnl;
    }

    public BigDecimal getUnrealizedPnl() {
        return positions.values().stream()
                .map(Position::getUnrealizedPnl)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Cash plus the market value of every open position at its current price.
     */
    public BigDecimal getEquity() {
        return cash.add(positions.values().stream()
                .map(Position::getMarketValue)
                .reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    public Map<String, Position> getPositions() {
        return Collections.unmodifiableMap(positions);
    }

    public Optional<Position> getPosition(String ticker) {
        return Optional.ofNullable(positions.get(ticker));
    }

    public boolean isHeld(String ticker) {
        return positions.containsKey(ticker);
    }

    public int getOpenPositionCount() {
        return positions.size();
    }

    public List<Position> getClosedPositions() {
        return Collections.unmodifiableList(closedPositions);
    }

    public List<EquityPoint> getEquityHistory() {
        return Collections.unmodifiableList(equityHistory);
    }

    public PortfolioSnapshot snapshot(LocalDateTime asOf) {
        Map<String, Integer> quantities = new LinkedHashMap<>();
        Map<String, BigDecimal> prices = new LinkedHashMap<>();
        Map<String, BigDecimal> stops = new LinkedHashMap<>();
        positions.forEach((ticker, position) -> {
            quantities.put(ticker, position.getQuantity());
            prices.put(ticker, position.getCurrentPrice());
            stops.put(ticker, position.getStopPrice());
        });
        return PortfolioSnapshot.builder()
                .asOf(asOf)
                .cash(cash)
                .equity(getEquity())
                .realizedPnl(realizedPnl)
                .quantities(Collections.unmodifiableMap(quantities))
                .prices(Collections.unmodifiableMap(prices))
                .stops(Collections.unmodifiableMap(stops))
                .build();
    }

    private Position requirePosition(String ticker) {
        Position position = positions.get(ticker);
        if (position == null) {
            throw new IllegalStateException("No open position for " + ticker);
        }
        return position;
    }

    private void requireCash(BigDecimal cost, String ticker) {
        if (cost.compareTo(cash) > 0) {
            throw new IllegalStateException("Insufficient cash for " + ticker + ": need " + cost + ", have " + cash);
        }
    }
}
