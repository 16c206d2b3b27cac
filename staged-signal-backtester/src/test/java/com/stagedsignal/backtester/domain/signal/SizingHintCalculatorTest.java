package com.stagedsignal.backtester.domain.signal;

import com.stagedsignal.backtester.domain.Indicator;
import com.stagedsignal.backtester.domain.SeriesKind;
import com.stagedsignal.backtester.domain.SeriesWindow;
import com.stagedsignal.backtester.domain.StrategyProfile;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.stagedsignal.backtester.domain.Bars.bar;
import static com.stagedsignal.backtester.domain.Bars.day;
import static com.stagedsignal.backtester.domain.Bars.dec;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SizingHintCalculator.
 */
class SizingHintCalculatorTest {

    private final SizingHintCalculator calculator = new SizingHintCalculator();
    private final StrategyProfile.ExecutionSettings settings = new StrategyProfile.ExecutionSettings();

    @Test
    void testAverageDailyRange_UsesSuppliedField() {
        // Arrange
        SeriesWindow window = SeriesWindow.of(SeriesKind.DAILY, List.of(
                bar("ACME", day(1), "100", "110", "90", "100").indicator(Indicator.ADR, dec("4.2")).build()));

        // Act
        BigDecimal adr = calculator.averageDailyRange(window, 20);

        // Assert
        assertEquals(0, dec("4.2").compareTo(adr));
    }

    @Test
    void testAverageDailyRange_ComputedFromBars() {
        // Arrange
        SeriesWindow window = SeriesWindow.of(SeriesKind.DAILY, List.of(
                bar("ACME", day(1), "100", "102", "98", "100").build(),
                bar("ACME", day(2), "100", "101", "99", "100").build()));

        // Act
        BigDecimal adr = calculator.averageDailyRange(window, 20);

        // Assert: mean of 4% and 2%
        assertEquals(0, dec("3").compareTo(adr));
    }

    @Test
    void testAverageDailyRange_EmptyWindow_Null() {
        assertNull(calculator.averageDailyRange(SeriesWindow.empty(SeriesKind.DAILY), 20));
    }

    @Test
    void testAllocationFraction_ScaledByRange() {
        // Act
        BigDecimal wide = calculator.allocationFraction(dec("6"), settings);
        BigDecimal normal = calculator.allocationFraction(dec("3"), settings);
        BigDecimal quiet = calculator.allocationFraction(dec("1.5"), settings);
        BigDecimal unknown = calculator.allocationFraction(null, settings);

        // Assert
        assertEquals(0, dec("0.1").compareTo(wide));
        assertEquals(0, dec("0.2").compareTo(normal));
        assertEquals(0, dec("0.3").compareTo(quiet));
        assertEquals(0, dec("0.2").compareTo(unknown));
    }

    @Test
    void testAllocationFraction_CappedAtMaxPositionFraction() {
        // Arrange
        settings.setBaseAllocation(dec("0.35"));

        // Act
        BigDecimal quiet = calculator.allocationFraction(dec("1"), settings);

        // Assert
        assertEquals(0, dec("0.4").compareTo(quiet));
    }
}
