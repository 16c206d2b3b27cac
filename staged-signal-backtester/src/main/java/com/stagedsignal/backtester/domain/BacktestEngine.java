package com.stagedsignal.backtester.domain;

import com.stagedsignal.backtester.domain.analytics.PerformanceAnalyzer;
import com.stagedsignal.backtester.domain.analytics.PerformanceSummary;
import com.stagedsignal.backtester.domain.execution.ExecutionSimulator;
import com.stagedsignal.backtester.domain.execution.FillModel;
import com.stagedsignal.backtester.domain.execution.InvariantChecker;
import com.stagedsignal.backtester.domain.execution.Portfolio;
import com.stagedsignal.backtester.domain.execution.PositionSizer;
import com.stagedsignal.backtester.domain.execution.SizingProposal;
import com.stagedsignal.backtester.domain.execution.StepContext;
import com.stagedsignal.backtester.domain.execution.StepOutcome;
import com.stagedsignal.backtester.domain.signal.Candidate;
import com.stagedsignal.backtester.domain.signal.PipelineOutcome;
import com.stagedsignal.backtester.domain.signal.PipelineRunner;
import com.stagedsignal.backtester.domain.signal.StageFunnel;
import com.stagedsignal.backtester.domain.signal.StageId;
import com.stagedsignal.backtester.domain.signal.SymbolExecutor;
import com.stagedsignal.backtester.domain.signal.SymbolTaskResult;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Core backtesting engine: advances the portfolio one step at a time through the signal pipeline
 * and the execution simulator. Each step runs on a copy of the portfolio and is committed only
 * after it passes the invariant checks. In forward mode the orders decided at a step are worked
 * at the next one.
 */
@Slf4j
public class BacktestEngine {

    private final PipelineRunner pipeline;
    private final SymbolExecutor executor;

    public BacktestEngine(PipelineRunner pipeline, SymbolExecutor executor) {
        this.pipeline = pipeline;
        this.executor = executor;
    }

    /**
     * Run a backtest with the given parameters.
     *
     * @throws InvariantViolationException when a step fails verification; nothing from that step is kept
     */
    public BacktestResult runBacktest(BacktestConfig config) {
        StrategyProfile profile = config.getProfile();
        RunMode mode = config.getMode();
        IndicatorSeriesStore store = config.getStore();
        SeriesKind stepSeries = config.getStepSeries();
        List<String> universe = new ArrayList<>(new TreeSet<>(
                config.getUniverse() != null ? config.getUniverse() : store.symbols()));

        NavigableSet<LocalDateTime> steps = store.timeline(stepSeries, config.getStart(), config.getEnd());
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("No " + stepSeries + " bars between "
                    + config.getStart() + " and " + config.getEnd());
        }

        log.info("Starting backtest - Profile: {}, Mode: {}, Symbols: {}, Steps: {} ({} to {})",
                profile.getName(), mode, universe.size(), steps.size(), steps.first(), steps.last());

        StrategyProfile.ExecutionSettings execution = profile.getExecution();
        FillModel fills = FillModel.from(execution);
        ExecutionSimulator simulator = new ExecutionSimulator(execution, fills);
        PositionSizer sizer = new PositionSizer(execution, fills);
        InvariantChecker checker = new InvariantChecker(execution.getInitialCash());

        Portfolio committed = new Portfolio(execution.getInitialCash());
        TradeLog tradeLog = new TradeLog();
        List<OrderRejection> rejections = new ArrayList<>();
        Map<StageId, StageFunnel> funnel = new EnumMap<>(StageId.class);
        RunStatus status = RunStatus.COMPLETED;
        LocalDateTime lastCommitted = null;
        List<Candidate> pendingEntries = List.of();
        Set<String> pendingExits = Set.of();

        for (LocalDateTime step : steps) {
            if (config.getCancellation().getAsBoolean()) {
                status = RunStatus.CANCELLED;
                break;
            }
            long started = System.nanoTime();
            Portfolio working = committed.copy();
            PipelineOutcome signals;
            StepOutcome outcome;
            try {
                signals = pipeline.run(store, universe, new TreeSet<>(working.getPositions().keySet()), step,
                        profile, mode, executor);
                if (!signals.getFailures().isEmpty()) {
                    log.warn("{} symbol(s) dropped at {}: {}", signals.getFailures().size(), step,
                            signals.getFailures());
                    config.getListener().onSymbolFailures(step, signals.getFailures());
                }

                List<Candidate> entries = mode.isExecutionDeferred() ? pendingEntries : signals.getCandidates();
                Set<String> exits = mode.isExecutionDeferred() ? pendingExits : signals.getExitSignals();
                Map<String, SeriesBar> bars = executionBars(store, stepSeries, step, entries, working);
                StepContext context = StepContext.builder()
                        .timestamp(step)
                        .bars(bars)
                        .candidates(entries)
                        .exitSignals(exits)
                        .proposals(proposeSizes(entries, bars, working.getEquity(), sizer))
                        .finalStep(step.equals(steps.last()))
                        .build();
                outcome = simulator.execute(context, working);
            } catch (IllegalStateException e) {
                log.error("Illegal portfolio transition at {}: {}", step, e.getMessage(), e);
                throw new InvariantViolationException("Illegal portfolio transition: " + e.getMessage(), step,
                        committed.snapshot(lastCommitted), working.snapshot(step), e);
            }

            if (config.getCancellation().getAsBoolean()) {
                log.info("Run cancelled during step {}, step discarded", step);
                status = RunStatus.CANCELLED;
                break;
            }

            checker.verify(step, working, outcome, committed.snapshot(lastCommitted));

            List<Trade> recorded = new ArrayList<>();
            outcome.getTrades().forEach(trade -> recorded.add(tradeLog.append(trade)));
            rejections.addAll(outcome.getRejections());
            signals.getFunnel().forEach((stage, counts) -> funnel.merge(stage, counts, StageFunnel::plus));
            EquityPoint point = working.recordEquity(step);
            committed = working;
            lastCommitted = step;
            if (mode.isExecutionDeferred()) {
                pendingEntries = signals.getCandidates();
                pendingExits = signals.getExitSignals();
            }

            log.debug("Step {} committed: {} trades, {} rejections, equity {}, funnel {}", step, recorded.size(),
                    outcome.getRejections().size(), point.getEquity(), signals.funnelSummary());
            config.getListener().onStepCommitted(step, recorded, outcome.getRejections(), point,
                    System.nanoTime() - started);
        }

        if (status == RunStatus.COMPLETED && !pendingEntries.isEmpty()) {
            log.info("{} order(s) decided at the last step left unworked: {}", pendingEntries.size(),
                    pendingEntries.stream().map(Candidate::getSymbol).collect(Collectors.toList()));
        }

        List<EquityPoint> history = committed.getEquityHistory();
        PerformanceSummary performance = null;
        if (history.size() >= 2) {
            performance = new PerformanceAnalyzer(profile.getAnalytics().getRiskFreeRate(),
                    stepSeries.getPeriodsPerYear()).analyze(tradeLog.getTrades(), history);
        } else {
            log.warn("Only {} equity point(s) committed, performance summary skipped", history.size());
        }

        log.info("Backtest {} - Steps: {}, Trades: {}, Rejections: {}, Final equity: {}",
                status, history.size(), tradeLog.size(), rejections.size(), committed.getEquity());

        return BacktestResult.builder()
                .runId(config.getRunId())
                .status(status)
                .profileName(profile.getName())
                .mode(mode)
                .stepsCommitted(history.size())
                .trades(tradeLog.getTrades())
                .equityHistory(List.copyOf(history))
                .rejections(List.copyOf(rejections))
                .funnel(funnel)
                .finalEquity(committed.getEquity())
                .finalState(committed.snapshot(lastCommitted))
                .performance(performance)
                .build();
    }

    /**
     * Bars at the step for every candidate being worked and every held symbol.
     */
    private Map<String, SeriesBar> executionBars(IndicatorSeriesStore store, SeriesKind stepSeries,
                                                 LocalDateTime step, List<Candidate> entries, Portfolio portfolio) {
        Set<String> symbols = new LinkedHashSet<>(portfolio.getPositions().keySet());
        entries.forEach(candidate -> symbols.add(candidate.getSymbol()));
        Map<String, SeriesBar> bars = new TreeMap<>();
        for (String symbol : symbols) {
            store.barAt(symbol, stepSeries, step).ifPresent(bar -> bars.put(symbol, bar));
        }
        return bars;
    }

    private Map<String, SizingProposal> proposeSizes(List<Candidate> candidates, Map<String, SeriesBar> bars,
                                                     BigDecimal equity, PositionSizer sizer) {
        Map<String, Candidate> bySymbol = new HashMap<>();
        candidates.forEach(candidate -> bySymbol.put(candidate.getSymbol(), candidate));
        SortedMap<String, SymbolTaskResult<SizingProposal>> results = executor.invokeAll(bySymbol.keySet(),
                symbol -> sizer.propose(bySymbol.get(symbol), bars.get(symbol), equity));

        Map<String, SizingProposal> proposals = new TreeMap<>();
        results.forEach((symbol, result) -> {
            if (result.isSuccess()) {
                proposals.put(symbol, result.getValue());
            } else {
                log.warn("Sizing failed for {}: {}", symbol, result.getFailure());
            }
        });
        return proposals;
    }

    /**
     * Configuration for a backtest run.
     */
    @Data
    @Builder
    public static class BacktestConfig {
        private String runId;
        private StrategyProfile profile;
        private RunMode mode;
        private IndicatorSeriesStore store;
        private Collection<String> universe;
        private LocalDateTime start;
        private LocalDateTime end;

        @Builder.Default
        private SeriesKind stepSeries = SeriesKind.DAILY;

        @Builder.Default
        private BacktestListener listener = BacktestListener.NONE;

        @Builder.Default
        private BooleanSupplier cancellation = () -> false;
    }

    /**
     * Result of a backtest run, consistent up to the last committed step.
     */
    @Data
    @Builder
    public static class BacktestResult {
        private String runId;
        private RunStatus status;
        private String profileName;
        private RunMode mode;
        private int stepsCommitted;
        private List<Trade> trades;
        private List<EquityPoint> equityHistory;
        private List<OrderRejection> rejections;
        private Map<StageId, StageFunnel> funnel;
        private BigDecimal finalEquity;
        private PortfolioSnapshot finalState;
        private PerformanceSummary performance;
    }
}
