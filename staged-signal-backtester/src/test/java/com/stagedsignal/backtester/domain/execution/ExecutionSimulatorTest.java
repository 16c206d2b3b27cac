package com.stagedsignal.backtester.domain.execution;

import com.stagedsignal.backtester.domain.OrderRejection;
import com.stagedsignal.backtester.domain.ReasonCode;
import com.stagedsignal.backtester.domain.RejectionReason;
import com.stagedsignal.backtester.domain.SeriesBar;
import com.stagedsignal.backtester.domain.StrategyProfile;
import com.stagedsignal.backtester.domain.Trade;
import com.stagedsignal.backtester.domain.TradeType;
import com.stagedsignal.backtester.domain.signal.Candidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.stagedsignal.backtester.domain.Bars.bar;
import static com.stagedsignal.backtester.domain.Bars.day;
import static com.stagedsignal.backtester.domain.Bars.dec;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ExecutionSimulator: exit ordering, resource limits and position lifecycle.
 */
class ExecutionSimulatorTest {

    private StrategyProfile.ExecutionSettings settings;
    private Portfolio portfolio;

    @BeforeEach
    void setUp() {
        settings = new StrategyProfile.ExecutionSettings();
        settings.setSlippage(BigDecimal.ZERO);
        settings.setPartialExitEnabled(false);
        settings.setPyramidingEnabled(false);
        settings.setTrailingStopEnabled(false);
        portfolio = new Portfolio(new BigDecimal("100000"));
    }

    private static Candidate candidate(String symbol, String target, String stop, String hint) {
        return Candidate.builder()
                .symbol(symbol)
                .score(dec("0.5"))
                .targetPrice(dec(target))
                .stopPrice(dec(stop))
                .sizingHint(dec(hint))
                .signalLabel("BREAKOUT_1M")
                .build();
    }

    private static Candidate aaa() {
        return candidate("AAA", "104", "100.88", "0.2");
    }

    private StepOutcome step(LocalDateTime time, List<Candidate> candidates, Set<String> exits, boolean last,
                             SeriesBar... bars) {
        Map<String, SeriesBar> bySymbol = new HashMap<>();
        Arrays.stream(bars).forEach(bar -> bySymbol.put(bar.getSymbol(), bar));
        PositionSizer sizer = new PositionSizer(settings, FillModel.from(settings));
        Map<String, SizingProposal> proposals = new HashMap<>();
        for (Candidate candidate : candidates) {
            proposals.put(candidate.getSymbol(),
                    sizer.propose(candidate, bySymbol.get(candidate.getSymbol()), portfolio.getEquity()));
        }
        StepContext context = StepContext.builder()
                .timestamp(time)
                .bars(bySymbol)
                .candidates(candidates)
                .exitSignals(exits)
                .proposals(proposals)
                .finalStep(last)
                .build();
        return new ExecutionSimulator(settings).execute(context, portfolio);
    }

    private StepOutcome step(LocalDateTime time, List<Candidate> candidates, SeriesBar... bars) {
        return step(time, candidates, Set.of(), false, bars);
    }

    private void enterAaa() {
        step(day(5), List.of(aaa()), bar("AAA", day(5), "104.5", "106", "103", "105").build());
    }

    @Test
    void testEntry_OpensPositionWithProfitTarget() {
        // Act
        StepOutcome outcome = step(day(5), List.of(aaa()), bar("AAA", day(5), "104.5", "106", "103", "105").build());

        // Assert
        assertEquals(1, outcome.getTrades().size());
        Trade entry = outcome.getTrades().get(0);
        assertEquals(TradeType.ENTRY, entry.getType());
        assertEquals(ReasonCode.BREAKOUT_ENTRY, entry.getReason());
        assertEquals(191, entry.getQuantity());
        assertEquals(dec("104.5000"), entry.getPrice());

        Position position = portfolio.getPosition("AAA").orElseThrow();
        assertEquals(dec("125.4000"), position.getTargetPrice(), "Target should be 20% above the fill");
        assertEquals(dec("100.88"), position.getStopPrice());
        assertEquals(dec("105"), position.getCurrentPrice(), "Position should be marked at the close");
        assertEquals(0, dec("80040.5").compareTo(portfolio.getCash()));
    }

    @Test
    void testExit_StopLossFillsAtStop() {
        // Arrange
        enterAaa();

        // Act
        StepOutcome outcome = step(day(9), List.of(), bar("AAA", day(9), "101", "101.5", "99", "100").build());

        // Assert
        Trade stop = outcome.getTrades().get(0);
        assertEquals(TradeType.STOP_OUT, stop.getType());
        assertEquals(ReasonCode.STOP_LOSS, stop.getReason());
        assertEquals(dec("100.8800"), stop.getPrice());
        assertEquals(dec("-691.4200"), stop.getRealizedPnl());
        assertEquals(0, dec("99308.58").compareTo(portfolio.getCash()));
        assertEquals(Set.of("AAA"), outcome.getClosedTickers());
    }

    @Test
    void testExit_GapBelowStopFillsAtOpen() {
        enterAaa();

        StepOutcome outcome = step(day(9), List.of(), bar("AAA", day(9), "98", "99", "97", "98.5").build());

        assertEquals(dec("98.0000"), outcome.getTrades().get(0).getPrice());
    }

    @Test
    void testEntry_WhipsawGuardBlocksReentrySameStep() {
        // Arrange
        enterAaa();

        // Act - stop is hit and the ticker signals again on the same bar
        StepOutcome outcome = step(day(9), List.of(candidate("AAA", "100", "97", "0.2")),
                bar("AAA", day(9), "101", "101.5", "99", "100").build());

        // Assert
        assertEquals(1, outcome.getTrades().size(), "Only the stop should fill");
        assertEquals(TradeType.STOP_OUT, outcome.getTrades().get(0).getType());
        assertEquals(1, outcome.getRejections().size());
        assertEquals(RejectionReason.WHIPSAW_GUARD, outcome.getRejections().get(0).getReason());
        assertFalse(portfolio.isHeld("AAA"));
    }

    @Test
    void testEntry_SignalExitSameStep_NotReportedAsWhipsaw() {
        // Arrange
        enterAaa();

        // Act
        StepOutcome outcome = step(day(7), List.of(candidate("AAA", "100", "97", "0.2")), Set.of("AAA"), false,
                bar("AAA", day(7), "106", "107", "105", "106").build());

        // Assert
        assertEquals(1, outcome.getTrades().size());
        assertEquals(ReasonCode.SIGNAL_EXIT, outcome.getTrades().get(0).getReason());
        assertEquals(1, outcome.getRejections().size());
        assertEquals(RejectionReason.SAME_STEP_EXIT, outcome.getRejections().get(0).getReason());
        assertFalse(portfolio.isHeld("AAA"));
    }

    @Test
    void testEntry_MaxPositionsRejectsLowerRanked() {
        // Arrange
        settings.setMaxPositions(1);

        // Act
        StepOutcome outcome = step(day(5), List.of(aaa(), candidate("BBB", "50", "48.5", "0.2")),
                bar("AAA", day(5), "104.5", "106", "103", "105").build(),
                bar("BBB", day(5), "50", "51", "49.5", "50.5").build());

        // Assert
        assertTrue(portfolio.isHeld("AAA"));
        assertFalse(portfolio.isHeld("BBB"));
        OrderRejection rejection = outcome.getRejections().get(0);
        assertEquals(RejectionReason.MAX_POSITIONS, rejection.getReason());
        assertEquals("BBB", rejection.getTicker());
        assertFalse(rejection.isClamp());
    }

    @Test
    void testEntry_ConcentrationClamp() {
        // Arrange
        settings.setMaxPositionFraction(dec("0.1"));

        // Act
        StepOutcome outcome = step(day(5), List.of(candidate("AAA", "104", "103", "0.4")),
                bar("AAA", day(5), "103", "105", "103.5", "104").build());

        // Assert
        OrderRejection clamp = outcome.getRejections().get(0);
        assertEquals(RejectionReason.CONCENTRATION_CLAMP, clamp.getReason());
        assertEquals(384, clamp.getRequestedQuantity());
        assertEquals(96, clamp.getGrantedQuantity());
        assertTrue(clamp.isClamp());
        assertEquals(96, outcome.getTrades().get(0).getQuantity());
    }

    @Test
    void testEntry_InsufficientCashClamp() {
        // Arrange
        settings.setRiskFraction(BigDecimal.ONE);
        settings.setMaxPositionFraction(dec("0.9"));

        // Act
        StepOutcome outcome = step(day(5),
                List.of(candidate("BBB", "100", "90", "0.8"), candidate("AAA", "104", "100", "0.5")),
                bar("BBB", day(5), "100", "101", "99.5", "100").build(),
                bar("AAA", day(5), "103", "105", "102", "104").build());

        // Assert
        assertEquals(800, portfolio.getPosition("BBB").orElseThrow().getQuantity());
        OrderRejection clamp = outcome.getRejections().get(0);
        assertEquals(RejectionReason.INSUFFICIENT_CASH, clamp.getReason());
        assertEquals(480, clamp.getRequestedQuantity());
        assertEquals(192, clamp.getGrantedQuantity());
        assertEquals(192, portfolio.getPosition("AAA").orElseThrow().getQuantity());
        assertEquals(0, dec("32").compareTo(portfolio.getCash()));
    }

    @Test
    void testEntry_SameBarStop() {
        // Act
        StepOutcome outcome = step(day(5), List.of(aaa()), bar("AAA", day(5), "104.5", "106", "100", "101").build());

        // Assert
        assertEquals(2, outcome.getTrades().size());
        assertEquals(TradeType.ENTRY, outcome.getTrades().get(0).getType());
        Trade stop = outcome.getTrades().get(1);
        assertEquals(ReasonCode.SAME_BAR_STOP, stop.getReason());
        assertEquals(dec("100.8800"), stop.getPrice());
        assertEquals(0, portfolio.getOpenPositionCount());
    }

    @Test
    void testEntry_NotTriggeredIsSilent() {
        StepOutcome outcome = step(day(5), List.of(aaa()), bar("AAA", day(5), "102", "103.5", "101", "103").build());

        assertTrue(outcome.getTrades().isEmpty());
        assertTrue(outcome.getRejections().isEmpty());
    }

    @Test
    void testEntry_MissingBarRejected() {
        StepOutcome outcome = step(day(5), List.of(aaa()));

        assertEquals(RejectionReason.MISSING_PRICE, outcome.getRejections().get(0).getReason());
    }

    @Test
    void testPartialExit_WidensStop() {
        // Arrange
        settings.setPartialExitEnabled(true);
        enterAaa();

        // Act
        StepOutcome outcome = step(day(6), List.of(), bar("AAA", day(6), "120", "126", "119", "125").build());

        // Assert
        Trade partial = outcome.getTrades().get(0);
        assertEquals(TradeType.PARTIAL_EXIT, partial.getType());
        assertEquals(95, partial.getQuantity());
        assertEquals(dec("125.4000"), partial.getPrice());
        assertEquals(dec("1985.5000"), partial.getRealizedPnl());

        Position position = portfolio.getPosition("AAA").orElseThrow();
        assertEquals(PositionState.PARTIALLY_CLOSED, position.getState());
        assertEquals(96, position.getQuantity());
        assertEquals(dec("112.8600"), position.getStopPrice());
    }

    @Test
    void testPyramid_AddsToWinningPosition() {
        // Arrange
        settings.setPyramidingEnabled(true);
        enterAaa();

        // Act
        StepOutcome outcome = step(day(6), List.of(candidate("AAA", "106", "100.88", "0.2")),
                bar("AAA", day(6), "106", "108", "105.5", "107").build());

        // Assert
        Trade add = outcome.getTrades().get(0);
        assertEquals(TradeType.PYRAMID, add.getType());
        assertEquals(94, add.getQuantity());
        Position position = portfolio.getPosition("AAA").orElseThrow();
        assertEquals(285, position.getQuantity());
        assertEquals(1, position.getPyramidLevel());
        assertEquals(dec("104.994737"), position.getAverageEntryPrice());
    }

    @Test
    void testPyramid_DisabledIgnoresHeldCandidate() {
        enterAaa();

        StepOutcome outcome = step(day(6), List.of(candidate("AAA", "106", "100.88", "0.2")),
                bar("AAA", day(6), "106", "108", "105.5", "107").build());

        assertTrue(outcome.getTrades().isEmpty());
        assertEquals(191, portfolio.getPosition("AAA").orElseThrow().getQuantity());
    }

    @Test
    void testSignalExit_FillsAtOpen() {
        enterAaa();

        StepOutcome outcome = step(day(6), List.of(), Set.of("AAA"), false,
                bar("AAA", day(6), "103", "104", "102", "103.5").build());

        Trade exit = outcome.getTrades().get(0);
        assertEquals(TradeType.EXIT, exit.getType());
        assertEquals(ReasonCode.SIGNAL_EXIT, exit.getReason());
        assertEquals(dec("103.0000"), exit.getPrice());
    }

    @Test
    void testFinalStep_LiquidatesAtClose() {
        // Arrange
        settings.setCloseOpenPositionsAtEnd(true);
        enterAaa();

        // Act
        StepOutcome outcome = step(day(6), List.of(), Set.of(), true,
                bar("AAA", day(6), "105", "107", "104", "106").build());

        // Assert
        Trade exit = outcome.getTrades().get(0);
        assertEquals(ReasonCode.END_OF_RUN, exit.getReason());
        assertEquals(dec("106.0000"), exit.getPrice());
        assertEquals(0, portfolio.getOpenPositionCount());
    }

    @Test
    void testTrailingStop_RatchetsAtClose() {
        // Arrange
        settings.setTrailingStopEnabled(true);
        enterAaa();

        // Act
        step(day(6), List.of(), bar("AAA", day(6), "110", "116", "109", "115").build());
        step(day(7), List.of(), bar("AAA", day(7), "112", "113", "110", "110.5").build());

        // Assert - 115 is two 5% steps over 104.5, so one step is locked; the lower close does not undo it
        assertEquals(dec("109.7250"), portfolio.getPosition("AAA").orElseThrow().getStopPrice());
    }

    @Test
    void testHeldWithoutBar_Skipped() {
        enterAaa();

        StepOutcome outcome = step(day(6), List.of());

        assertTrue(outcome.getTrades().isEmpty());
        assertTrue(outcome.getSkippedSymbols().containsKey("AAA"));
        assertTrue(portfolio.isHeld("AAA"));
    }
}
