package com.stagedsignal.backtester.domain.signal;

import com.stagedsignal.backtester.domain.Indicator;
import com.stagedsignal.backtester.domain.IndicatorSeriesStore;
import com.stagedsignal.backtester.domain.RunMode;
import com.stagedsignal.backtester.domain.SeriesBar;
import com.stagedsignal.backtester.domain.SeriesKind;
import com.stagedsignal.backtester.domain.SeriesWindow;
import com.stagedsignal.backtester.domain.StrategyProfile;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Runs the ordered stage list over a universe of symbols at one decision time and assembles the
 * surviving candidates.
 */
@Slf4j
public class PipelineRunner {

    private final List<StageFilter> stages;
    private final CompositeScorer scorer;
    private final SizingHintCalculator sizingHints;
    private final ExitSignalEvaluator exitSignals;

    public PipelineRunner() {
        this(defaultStages(), new CompositeScorer(), new SizingHintCalculator(), new ExitSignalEvaluator());
    }

    public PipelineRunner(List<StageFilter> stages, CompositeScorer scorer,
                          SizingHintCalculator sizingHints, ExitSignalEvaluator exitSignals) {
        this.stages = List.copyOf(stages);
        this.scorer = scorer;
        this.sizingHints = sizingHints;
        this.exitSignals = exitSignals;
    }

    /**
     * E, F, W, RS, D.
     */
    public static List<StageFilter> defaultStages() {
        return List.of(
                new EarningsStage(),
                new FundamentalStage(),
                new WeeklyStage(),
                new RelativeStrengthStage(),
                new DailyBreakoutStage());
    }

    /**
     * Evaluate every symbol in parallel, then merge in symbol order.
     */
    public PipelineOutcome run(IndicatorSeriesStore store, Collection<String> universe, Set<String> held,
                               LocalDateTime decisionTime, StrategyProfile profile, RunMode mode,
                               SymbolExecutor executor) {
        SortedMap<String, SymbolTaskResult<SymbolEvaluation>> evaluations = executor.invokeAll(universe,
                symbol -> evaluate(SymbolSnapshot.capture(store, symbol, decisionTime, mode),
                        held.contains(symbol), profile, mode));

        Map<StageId, long[]> counts = new EnumMap<>(StageId.class);
        stages.forEach(stage -> counts.put(stage.getStageId(), new long[3]));
        List<Candidate> candidates = new ArrayList<>();
        Set<String> exits = new TreeSet<>();
        Map<String, String> failures = new TreeMap<>();

        for (SymbolTaskResult<SymbolEvaluation> result : evaluations.values()) {
            if (!result.isSuccess()) {
                failures.put(result.getSymbol(), result.getFailure());
                continue;
            }
            SymbolEvaluation evaluation = result.getValue();
            for (StageResult stageResult : evaluation.getResults()) {
                long[] count = counts.get(stageResult.getStage());
                count[0]++;
                if (stageResult.isPassed()) {
                    count[1]++;
                }
                if (stageResult.isSkipped()) {
                    count[2]++;
                }
            }
            if (evaluation.getFailure() != null) {
                failures.put(evaluation.getSymbol(), evaluation.getFailure());
            }
            if (evaluation.getCandidate() != null) {
                candidates.add(evaluation.getCandidate());
            }
            if (evaluation.isExitSignal()) {
                exits.add(evaluation.getSymbol());
            }
        }

        candidates.sort(Comparator.comparing(Candidate::getScore).reversed()
                .thenComparing(Candidate::getSymbol));

        Map<StageId, StageFunnel> funnel = new EnumMap<>(StageId.class);
        counts.forEach((stage, count) -> funnel.put(stage, new StageFunnel(stage, count[0], count[1], count[2])));

        PipelineOutcome outcome = PipelineOutcome.builder()
                .decisionTime(decisionTime)
                .universeSize(universe.size())
                .candidates(List.copyOf(candidates))
                .exitSignals(exits)
                .funnel(funnel)
                .failures(failures)
                .build();

        log.debug("Pipeline at {} ({}): {} -> {} candidates, {} failures",
                decisionTime, mode, outcome.funnelSummary(), candidates.size(), failures.size());
        return outcome;
    }

    /**
     * Run the stages for one symbol, stopping at the first failed gate.
     */
    public SymbolEvaluation evaluate(SymbolSnapshot snapshot, boolean held, StrategyProfile profile, RunMode mode) {
        String symbol = snapshot.getSymbol();
        boolean exit = held && profile.getExecution().isSignalExitEnabled() && exitSignals.shouldExit(snapshot);

        List<StageResult> results = new ArrayList<>();
        for (StageFilter stage : stages) {
            StageResult result = stage.isEnabled(profile)
                    ? stage.evaluate(snapshot, profile, mode)
                    : StageResult.skipped(symbol, stage.getStageId());
            results.add(result);
            if (!result.isPassed()) {
                return new SymbolEvaluation(symbol, List.copyOf(results), null, exit, null);
            }
        }

        Optional<SeriesBar> decisionBar = snapshot.window(SeriesKind.DAILY).latest();
        StageResult daily = results.get(results.size() - 1);
        BigDecimal target = daily.getTargetPrice();
        BigDecimal stop = daily.getStopPrice();
        String label = daily.getSignalLabel();
        if (target == null) {
            // D stage skipped: price the candidate off the last decision close
            if (decisionBar.isEmpty() || decisionBar.get().getClose() == null) {
                return new SymbolEvaluation(symbol, List.copyOf(results), null, exit, "no price for candidate");
            }
            target = decisionBar.get().getClose();
            stop = target.multiply(BigDecimal.ONE.subtract(profile.getDaily().getStopLossFraction()))
                    .setScale(4, RoundingMode.HALF_UP);
            label = "UNFILTERED";
        }

        BigDecimal rs = RelativeStrengthStage.completedPeriod(snapshot)
                .map(bar -> bar.indicator(Indicator.RS_4W))
                .orElse(null);
        BigDecimal close = decisionBar.map(SeriesBar::getClose).orElse(null);
        SeriesWindow dailyWindow = snapshot.window(SeriesKind.DAILY);
        BigDecimal adr = sizingHints.averageDailyRange(dailyWindow, profile.getExecution().getAdrLookback());

        Candidate candidate = Candidate.builder()
                .symbol(symbol)
                .score(scorer.score(results, rs, close, target))
                .targetPrice(target)
                .stopPrice(stop)
                .sizingHint(sizingHints.allocationFraction(adr, profile.getExecution()))
                .averageDailyRange(adr)
                .signalLabel(label)
                .stageResults(List.copyOf(results))
                .build();
        return new SymbolEvaluation(symbol, List.copyOf(results), candidate, exit, null);
    }
}
