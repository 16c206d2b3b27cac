package com.stagedsignal.backtester.domain.execution;

import com.stagedsignal.backtester.domain.InvariantViolationException;
import com.stagedsignal.backtester.domain.PortfolioSnapshot;
import com.stagedsignal.backtester.domain.Trade;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Reconciles a finished step against an independent ledger built from the trade log alone.
 * One instance per run; {@link #verify} advances the ledger only when the step passes.
 */
public class InvariantChecker {

    private BigDecimal ledgerCash;
    private final Map<Long, Integer> ledgerQuantities = new HashMap<>();
    private LocalDateTime lastStep;

    public InvariantChecker(BigDecimal initialCash) {
        this.ledgerCash = initialCash;
    }

    /**
     * @throws InvariantViolationException with both snapshots when any check fails
     */
    public void verify(LocalDateTime step, Portfolio working, StepOutcome outcome, PortfolioSnapshot lastCommitted) {
        BigDecimal cash = ledgerCash;
        Map<Long, Integer> quantities = new HashMap<>(ledgerQuantities);
        Map<Long, Integer> terminalTrades = new HashMap<>();

        if (lastStep != null && !step.isAfter(lastStep)) {
            throw violation("Step time did not advance past " + lastStep, step, working, lastCommitted);
        }

        for (Trade trade : outcome.getTrades()) {
            if (!step.equals(trade.getTimestamp())) {
                throw violation("Trade " + trade.getTicker() + " stamped " + trade.getTimestamp()
                        + " outside its step", step, working, lastCommitted);
            }
            cash = cash.add(trade.getCashFlow());
            int signed = trade.getType().isOpening() ? trade.getQuantity() : -trade.getQuantity();
            quantities.merge(trade.getPositionId(), signed, Integer::sum);
            if (trade.getType().isTerminal()) {
                terminalTrades.merge(trade.getPositionId(), 1, Integer::sum);
            }
        }

        if (working.getCash().signum() < 0) {
            throw violation("Negative cash " + working.getCash(), step, working, lastCommitted);
        }
        if (working.getCash().compareTo(cash) != 0) {
            throw violation("Cash " + working.getCash() + " does not reconcile with trade log " + cash,
                    step, working, lastCommitted);
        }

        BigDecimal marked = working.getCash();
        for (Position position : working.getPositions().values()) {
            Integer expected = quantities.get(position.getId());
            if (position.getQuantity() <= 0) {
                throw violation("Non-positive quantity for open " + position.getTicker(), step, working, lastCommitted);
            }
            if (expected == null || expected != position.getQuantity()) {
                throw violation("Quantity of " + position.getTicker() + " is " + position.getQuantity()
                        + " but trade log implies " + expected, step, working, lastCommitted);
            }
            marked = marked.add(position.getCurrentPrice().multiply(BigDecimal.valueOf(position.getQuantity())));
        }
        if (marked.compareTo(working.getEquity()) != 0) {
            throw violation("Equity " + working.getEquity() + " differs from cash plus holdings " + marked,
                    step, working, lastCommitted);
        }

        for (Map.Entry<Long, Integer> entry : quantities.entrySet()) {
            if (entry.getValue() < 0) {
                throw violation("Negative quantity for position " + entry.getKey(), step, working, lastCommitted);
            }
            // the ledger only carries non-zero quantities, so a zero here was emptied this step
            if (entry.getValue() == 0 && !terminalTrades.containsKey(entry.getKey())) {
                throw violation("Position " + entry.getKey() + " emptied without a terminal trade",
                        step, working, lastCommitted);
            }
        }
        for (Position closed : working.getClosedPositions()) {
            if (quantities.getOrDefault(closed.getId(), 0) != 0) {
                throw violation("Closed position " + closed.getTicker() + " still has shares in the trade log",
                        step, working, lastCommitted);
            }
        }
        for (Map.Entry<Long, Integer> entry : terminalTrades.entrySet()) {
            if (entry.getValue() != 1 || quantities.getOrDefault(entry.getKey(), 0) != 0) {
                throw violation("Position " + entry.getKey() + " has " + entry.getValue()
                        + " terminal trades", step, working, lastCommitted);
            }
        }

        ledgerCash = cash;
        ledgerQuantities.clear();
        quantities.forEach((id, quantity) -> {
            if (quantity != 0) {
                ledgerQuantities.put(id, quantity);
            }
        });
        lastStep = step;
    }

    private InvariantViolationException violation(String message, LocalDateTime step, Portfolio working,
                                                  PortfolioSnapshot lastCommitted) {
        return new InvariantViolationException(message, step, lastCommitted, working.snapshot(step));
    }
}
