package com.stagedsignal.backtester.domain.execution;

import com.stagedsignal.backtester.domain.OrderRejection;
import com.stagedsignal.backtester.domain.ReasonCode;
import com.stagedsignal.backtester.domain.RejectionReason;
import com.stagedsignal.backtester.domain.SeriesBar;
import com.stagedsignal.backtester.domain.StrategyProfile;
import com.stagedsignal.backtester.domain.Trade;
import com.stagedsignal.backtester.domain.TradeType;
import com.stagedsignal.backtester.domain.signal.Candidate;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Applies one step to a portfolio: exits, then entries and pyramid additions, then end-of-step
 * marks and trailing stops. Runs on the simulation thread only.
 */
@Slf4j
public class ExecutionSimulator {

    private final StrategyProfile.ExecutionSettings settings;
    private final FillModel fills;
    private final PositionSizer sizer;
    private final TrailingStopCalculator trailingStops;

    public ExecutionSimulator(StrategyProfile.ExecutionSettings settings) {
        this(settings, FillModel.from(settings));
    }

    public ExecutionSimulator(StrategyProfile.ExecutionSettings settings, FillModel fills) {
        this.settings = settings;
        this.fills = fills;
        this.sizer = new PositionSizer(settings, fills);
        this.trailingStops = new TrailingStopCalculator(settings.getMinLossCutFraction());
    }

    /**
     * Run the step against the given (working) portfolio.
     *
     * @throws IllegalStateException when a transition is illegal or a fill breaks the concentration cap
     */
    public StepOutcome execute(StepContext step, Portfolio portfolio) {
        StepRecorder recorder = new StepRecorder(step.getTimestamp());

        evaluateExits(step, portfolio, recorder);
        evaluateEntries(step, portfolio, recorder);
        markPositions(step, portfolio);
        if (step.isFinalStep() && settings.isCloseOpenPositionsAtEnd()) {
            liquidate(step, portfolio, recorder);
        }
        return recorder.toOutcome();
    }

    private void evaluateExits(StepContext step, Portfolio portfolio, StepRecorder recorder) {
        for (Position position : new ArrayList<>(portfolio.getPositions().values())) {
            String ticker = position.getTicker();
            SeriesBar bar = step.bar(ticker);
            if (bar == null || !bar.hasPrices()) {
                log.warn("No prices for held {} at {}, skipping its exits", ticker, step.getTimestamp());
                recorder.skipped(ticker, "no execution bar");
                continue;
            }

            if (bar.getLow().compareTo(position.getStopPrice()) <= 0) {
                stopOut(position, bar, ReasonCode.STOP_LOSS, portfolio, recorder);
            } else if (step.getExitSignals().contains(ticker)) {
                close(position, fills.openSell(bar), TradeType.EXIT, ReasonCode.SIGNAL_EXIT, portfolio, recorder);
            } else if (settings.isPartialExitEnabled()
                    && position.getState() == PositionState.OPEN
                    && bar.getHigh().compareTo(position.getTargetPrice()) >= 0) {
                partialExit(position, bar, portfolio, recorder);
            }
        }
    }

    private void evaluateEntries(StepContext step, Portfolio portfolio, StepRecorder recorder) {
        for (Candidate candidate : step.getCandidates()) {
            String ticker = candidate.getSymbol();
            SizingProposal proposal = step.getProposals().get(ticker);

            if (recorder.stoppedTickers.contains(ticker)) {
                log.info("Whipsaw guard: {} stopped out at {}, re-entry deferred", ticker, step.getTimestamp());
                recorder.reject(ticker, RejectionReason.WHIPSAW_GUARD, requested(proposal), 0,
                        "stopped out earlier in the same step");
                continue;
            }
            if (recorder.closedTickers.contains(ticker)) {
                log.info("{} exited at {}, re-entry deferred", ticker, step.getTimestamp());
                recorder.reject(ticker, RejectionReason.SAME_STEP_EXIT, requested(proposal), 0,
                        "exited earlier in the same step");
                continue;
            }

            if (portfolio.isHeld(ticker)) {
                pyramid(candidate, portfolio.getPosition(ticker).orElseThrow(), proposal, portfolio, recorder);
                continue;
            }

            if (proposal == null || proposal.getStatus() == SizingProposal.Status.MISSING_PRICE) {
                recorder.reject(ticker, RejectionReason.MISSING_PRICE, 0, 0, "no execution bar");
                continue;
            }
            if (proposal.getStatus() == SizingProposal.Status.NOT_TRIGGERED) {
                log.debug("Entry for {} not triggered at {}", ticker, step.getTimestamp());
                continue;
            }
            if (portfolio.getOpenPositionCount() >= settings.getMaxPositions()) {
                log.info("Capacity rejection for {} at {}: {} positions held", ticker, step.getTimestamp(),
                        portfolio.getOpenPositionCount());
                recorder.reject(ticker, RejectionReason.MAX_POSITIONS, proposal.getQuantity(), 0,
                        "max positions " + settings.getMaxPositions() + " reached");
                continue;
            }
            if (proposal.getStatus() == SizingProposal.Status.INVALID_STOP || proposal.getQuantity() < 1) {
                recorder.reject(ticker, RejectionReason.SIZE_TOO_SMALL, proposal.getQuantity(), 0,
                        proposal.getStatus() == SizingProposal.Status.INVALID_STOP
                                ? "stop at or above fill" : "sized below one share");
                continue;
            }

            BigDecimal fill = proposal.getFillPrice();
            int quantity = applyLimits(ticker, proposal.getQuantity(), fill, null, portfolio, recorder);
            if (quantity < 1) {
                continue;
            }

            BigDecimal commission = fills.commission(fill, quantity);
            BigDecimal target = fill.multiply(BigDecimal.ONE.add(settings.getProfitTargetFraction()))
                    .setScale(4, RoundingMode.HALF_UP);
            Position position = portfolio.openPosition(ticker, step.getTimestamp(), quantity, fill, commission,
                    candidate.getStopPrice(), target, settings.getTrailingStep(), candidate.getSignalLabel());
            recorder.trade(position, TradeType.ENTRY, quantity, fill, ReasonCode.BREAKOUT_ENTRY,
                    BigDecimal.ZERO, commission);
            log.info("Entry {} {} @ {} stop {} ({})", ticker, quantity, fill, position.getStopPrice(),
                    candidate.getSignalLabel());
            verifyConcentration(position, portfolio);

            SeriesBar bar = step.bar(ticker);
            if (settings.isSameBarStopCheck() && bar.getLow().compareTo(position.getStopPrice()) <= 0) {
                stopOut(position, bar, ReasonCode.SAME_BAR_STOP, portfolio, recorder);
            }
        }
    }

    private void pyramid(Candidate candidate, Position position, SizingProposal proposal,
                         Portfolio portfolio, StepRecorder recorder) {
        String ticker = candidate.getSymbol();
        if (!settings.isPyramidingEnabled()
                || position.getState() != PositionState.OPEN
                || position.getPyramidLevel() >= settings.getMaxPyramidLevels()) {
            return;
        }
        if (proposal == null || proposal.getStatus() != SizingProposal.Status.READY) {
            return;
        }
        if (position.getCurrentPrice().compareTo(position.getAverageEntryPrice()) <= 0) {
            log.debug("Pyramid skipped for {}: position not in profit", ticker);
            return;
        }

        BigDecimal fill = proposal.getFillPrice();
        int requested = sizer.pyramidQuantity(portfolio.getEquity(), fill);
        if (requested < 1) {
            recorder.reject(ticker, RejectionReason.SIZE_TOO_SMALL, requested, 0, "pyramid below one share");
            return;
        }
        int quantity = applyLimits(ticker, requested, fill, position, portfolio, recorder);
        if (quantity < 1) {
            return;
        }

        BigDecimal commission = fills.commission(fill, quantity);
        portfolio.addToPosition(ticker, quantity, fill, commission);
        recorder.trade(position, TradeType.PYRAMID, quantity, fill, ReasonCode.PYRAMID_ADD,
                BigDecimal.ZERO, commission);
        log.info("Pyramid {} +{} @ {} level {}", ticker, quantity, fill, position.getPyramidLevel());
        verifyConcentration(position, portfolio);
    }

    private void stopOut(Position position, SeriesBar bar, ReasonCode reason,
                         Portfolio portfolio, StepRecorder recorder) {
        close(position, fills.stopFill(position.getStopPrice(), bar), TradeType.STOP_OUT, reason,
                portfolio, recorder);
    }

    private void close(Position position, BigDecimal price, TradeType type, ReasonCode reason,
                       Portfolio portfolio, StepRecorder recorder) {
        int quantity = position.getQuantity();
        BigDecimal commission = fills.commission(price, quantity);
        BigDecimal pnl = portfolio.reducePosition(position.getTicker(), quantity, price, commission,
                PositionState.CLOSED);
        recorder.trade(position, type, quantity, price, reason, pnl, commission);
        recorder.closedTickers.add(position.getTicker());
        if (type == TradeType.STOP_OUT) {
            recorder.stoppedTickers.add(position.getTicker());
        }
        log.info("{} {} {} @ {} pnl {}", type, position.getTicker(), quantity, price, pnl);
    }

    private void partialExit(Position position, SeriesBar bar, Portfolio portfolio, StepRecorder recorder) {
        int quantity = BigDecimal.valueOf(position.getQuantity())
                .multiply(settings.getPartialExitFraction())
                .setScale(0, RoundingMode.FLOOR)
                .intValue();
        if (quantity < 1 || quantity >= position.getQuantity()) {
            log.debug("Partial exit of {} skipped: {} of {} shares", position.getTicker(), quantity,
                    position.getQuantity());
            return;
        }

        BigDecimal price = fills.targetFill(position.getTargetPrice(), bar);
        BigDecimal commission = fills.commission(price, quantity);
        BigDecimal pnl = portfolio.reducePosition(position.getTicker(), quantity, price, commission,
                PositionState.PARTIALLY_CLOSED);
        BigDecimal widenedStep = position.getRiskFraction().multiply(settings.getStopWidenMultiplier());
        position.widenStop(trailingStops.widenedStop(position.getAverageEntryPrice(), price, widenedStep),
                widenedStep);
        recorder.trade(position, TradeType.PARTIAL_EXIT, quantity, price, ReasonCode.PROFIT_TARGET, pnl, commission);
        log.info("Partial exit {} {} @ {} pnl {}, stop now {}", position.getTicker(), quantity, price, pnl,
                position.getStopPrice());
    }

    private void markPositions(StepContext step, Portfolio portfolio) {
        for (Position position : portfolio.getPositions().values()) {
            SeriesBar bar = step.bar(position.getTicker());
            if (bar == null || !bar.hasPrices()) {
                continue;
            }
            portfolio.markToMarket(position.getTicker(), bar.getClose(), step.getTimestamp());
            if (settings.isTrailingStopEnabled()) {
                position.raiseStop(trailingStops.stopFor(position.getAverageEntryPrice(), bar.getClose(),
                        position.getRiskFraction()));
            }
        }
    }

    private void liquidate(StepContext step, Portfolio portfolio, StepRecorder recorder) {
        for (Position position : new ArrayList<>(portfolio.getPositions().values())) {
            SeriesBar bar = step.bar(position.getTicker());
            if (bar == null || !bar.hasPrices()) {
                log.warn("Cannot liquidate {} at {}: no prices", position.getTicker(), step.getTimestamp());
                continue;
            }
            close(position, fills.closeSell(bar), TradeType.EXIT, ReasonCode.END_OF_RUN, portfolio, recorder);
        }
    }

    /**
     * Clamp a requested quantity to the concentration cap, then to available cash. Each reduction is
     * recorded; a result below one share means the order is dropped.
     */
    private int applyLimits(String ticker, int requested, BigDecimal fill, Position existing,
                            Portfolio portfolio, StepRecorder recorder) {
        int quantity = requested;

        int capped = Math.max(0, concentrationLimit(fill, existing, portfolio));
        if (capped < quantity) {
            recorder.reject(ticker, RejectionReason.CONCENTRATION_CLAMP, quantity, capped,
                    "capped at " + settings.getMaxPositionFraction() + " of equity");
            quantity = capped;
        }
        if (quantity < 1) {
            return 0;
        }

        int affordable = affordable(fill, portfolio.getCash());
        if (affordable < quantity) {
            recorder.reject(ticker, RejectionReason.INSUFFICIENT_CASH, quantity, affordable,
                    "cash " + portfolio.getCash());
            quantity = affordable;
        }
        return quantity;
    }

    /**
     * Largest addition that keeps the position, marked at the fill, within the cap of post-fill equity.
     */
    private int concentrationLimit(BigDecimal fill, Position existing, Portfolio portfolio) {
        int held = existing == null ? 0 : existing.getQuantity();
        BigDecimal revaluation = existing == null ? BigDecimal.ZERO
                : fill.subtract(existing.getCurrentPrice()).multiply(BigDecimal.valueOf(held));
        BigDecimal equity = portfolio.getEquity().add(revaluation);
        BigDecimal cap = settings.getMaxPositionFraction();

        int addition = PositionSizer.wholeShares(equity.multiply(cap), fill) - held;
        while (addition > 0) {
            BigDecimal value = fill.multiply(BigDecimal.valueOf(held + (long) addition));
            BigDecimal equityAfter = equity.subtract(fills.commission(fill, addition));
            if (value.compareTo(equityAfter.multiply(cap)) <= 0) {
                break;
            }
            addition--;
        }
        return addition;
    }

    private int affordable(BigDecimal fill, BigDecimal cash) {
        BigDecimal grossPrice = fill.multiply(BigDecimal.ONE.add(fills.getCommissionRate()));
        int quantity = PositionSizer.wholeShares(cash, grossPrice);
        while (quantity > 0
                && fill.multiply(BigDecimal.valueOf(quantity)).add(fills.commission(fill, quantity)).compareTo(cash) > 0) {
            quantity--;
        }
        return quantity;
    }

    private void verifyConcentration(Position position, Portfolio portfolio) {
        BigDecimal limit = portfolio.getEquity().multiply(settings.getMaxPositionFraction());
        if (position.getMarketValue().compareTo(limit) > 0) {
            throw new IllegalStateException("Concentration cap breached for " + position.getTicker()
                    + ": " + position.getMarketValue() + " > " + limit);
        }
    }

    private static int requested(SizingProposal proposal) {
        return proposal == null ? 0 : proposal.getQuantity();
    }

    /**
     * Collects what one step produced, in the order it happened.
     */
    private static final class StepRecorder {

        private final LocalDateTime timestamp;
        private final List<Trade> trades = new ArrayList<>();
        private final List<OrderRejection> rejections = new ArrayList<>();
        private final Set<String> closedTickers = new LinkedHashSet<>();
        private final Set<String> stoppedTickers = new LinkedHashSet<>();
        private final Map<String, String> skipped = new TreeMap<>();

        private StepRecorder(LocalDateTime timestamp) {
            this.timestamp = timestamp;
        }

        void trade(Position position, TradeType type, int quantity, BigDecimal price, ReasonCode reason,
                   BigDecimal pnl, BigDecimal commission) {
            trades.add(Trade.builder()
                    .positionId(position.getId())
                    .ticker(position.getTicker())
                    .type(type)
                    .quantity(quantity)
                    .price(price)
                    .timestamp(timestamp)
                    .reason(reason)
                    .realizedPnl(pnl)
                    .commission(commission)
                    .signalLabel(position.getSignalLabel())
                    .build());
        }

        void reject(String ticker, RejectionReason reason, int requested, int granted, String detail) {
            rejections.add(OrderRejection.builder()
                    .timestamp(timestamp)
                    .ticker(ticker)
                    .reason(reason)
                    .requestedQuantity(requested)
                    .grantedQuantity(granted)
                    .detail(detail)
                    .build());
        }

        void skipped(String ticker, String reason) {
            skipped.put(ticker, reason);
        }

        StepOutcome toOutcome() {
            return new StepOutcome(List.copyOf(trades), List.copyOf(rejections),
                    Set.copyOf(closedTickers), Map.copyOf(skipped));
        }
    }
}
