package com.stagedsignal.backtester.domain.execution;

import com.stagedsignal.backtester.domain.EquityPoint;
import com.stagedsignal.backtester.domain.PortfolioSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.stagedsignal.backtester.domain.Bars.day;
import static com.stagedsignal.backtester.domain.Bars.dec;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Portfolio operations.
 */
class PortfolioTest {

    private Portfolio portfolio;

    @BeforeEach
    void setUp() {
        portfolio = new Portfolio(new BigDecimal("10000.00"));
    }

    private Position buyAapl(int quantity) {
        return portfolio.openPosition("AAPL", day(1), quantity, dec("100.00"), dec("5.00"),
                dec("97.00"), dec("120.00"), dec("0.05"), "BREAKOUT_1M");
    }

    @Test
    void testConstructor_NonPositiveCash_Throws() {
        assertThrows(IllegalArgumentException.class, () -> new Portfolio(BigDecimal.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new Portfolio(null));
    }

    @Test
    void testOpenPosition_SuccessfulPurchase() {
        // Act
        Position position = buyAapl(50);

        // Assert
        assertEquals(new BigDecimal("4995.00"), portfolio.getCash(), "Cost and commission should leave the cash");
        assertEquals(1, portfolio.getOpenPositionCount());
        assertEquals(1, position.getId());
        assertEquals(new BigDecimal("9995.00"), portfolio.getEquity(), "Equity should drop by the commission only");
        assertTrue(portfolio.isHeld("AAPL"));
    }

    @Test
    void testOpenPosition_InsufficientFunds() {
        // Act - 100 shares at $100 plus commission is more than $10,000
        assertThrows(IllegalStateException.class, () -> buyAapl(100));

        // Assert - nothing changed
        assertEquals(new BigDecimal("10000.00"), portfolio.getCash(), "Cash should remain unchanged");
        assertEquals(0, portfolio.getOpenPositionCount());
    }

    @Test
    void testOpenPosition_AlreadyHeld_Throws() {
        buyAapl(10);

        assertThrows(IllegalStateException.class, () -> buyAapl(10));
        assertEquals(1, portfolio.getOpenPositionCount());
    }

    @Test
    void testReducePosition_CloseMovesToClosed() {
        // Arrange
        buyAapl(50);

        // Act
        BigDecimal pnl = portfolio.reducePosition("AAPL", 50, dec("110.00"), dec("5.00"), PositionState.CLOSED);

        // Assert
        assertEquals(dec("490.0000"), pnl, "Gain less both commissions");
        assertEquals(0, dec("10490.00").compareTo(portfolio.getCash()));
        assertFalse(portfolio.isHeld("AAPL"));
        assertEquals(1, portfolio.getClosedPositions().size());
        assertEquals(0, pnl.compareTo(portfolio.getRealizedPnl()));
        assertEquals(0, portfolio.getEquity().compareTo(portfolio.getCash()), "No holdings left to value");
    }

    @Test
    void testReducePosition_UnknownTicker_Throws() {
        assertThrows(IllegalStateException.class,
                () -> portfolio.reducePosition("MSFT", 1, dec("10"), BigDecimal.ZERO, PositionState.CLOSED));
    }

    @Test
    void testAddToPosition_DeductsCash() {
        // Arrange
        buyAapl(40);

        // Act
        portfolio.addToPosition("AAPL", 10, dec("110.00"), dec("1.00"));

        // Assert
        assertEquals(0, dec("4894.00").compareTo(portfolio.getCash()));
        assertEquals(50, portfolio.getPosition("AAPL").orElseThrow().getQuantity());
    }

    @Test
    void testMarkToMarket_UpdatesEquity() {
        // Arrange
        buyAapl(50);

        // Act
        portfolio.markToMarket("AAPL", dec("102.00"), day(2));

        // Assert
        assertEquals(0, dec("10095.00").compareTo(portfolio.getEquity()));
        assertEquals(0, dec("100.00").compareTo(portfolio.getUnrealizedPnl()));
    }

    @Test
    void testCopy_WorkingCopyDoesNotTouchOriginal() {
        // Arrange
        buyAapl(50);
        Portfolio working = portfolio.copy();

        // Act
        working.reducePosition("AAPL", 50, dec("90.00"), BigDecimal.ZERO, PositionState.CLOSED);

        // Assert
        assertTrue(portfolio.isHeld("AAPL"), "Discarded step must leave the committed portfolio intact");
        assertEquals(new BigDecimal("4995.00"), portfolio.getCash());
        assertEquals(50, portfolio.getPosition("AAPL").orElseThrow().getQuantity());
        assertFalse(working.isHeld("AAPL"));
    }

    @Test
    void testRecordEquity_AppendsInOrder() {
        // Act
        EquityPoint first = portfolio.recordEquity(day(1));
        buyAapl(10);
        EquityPoint second = portfolio.recordEquity(day(2));

        // Assert
        assertEquals(2, portfolio.getEquityHistory().size());
        assertEquals(new BigDecimal("10000.00"), first.getEquity());
        assertEquals(1, second.getOpenPositions());
        assertThrows(IllegalStateException.class, () -> portfolio.recordEquity(day(2)),
                "Equity history timestamps must strictly increase");
    }

    @Test
    void testSnapshot_CapturesHoldings() {
        // Arrange
        buyAapl(20);

        // Act
        PortfolioSnapshot snapshot = portfolio.snapshot(day(1));

        // Assert
        assertEquals(20, snapshot.getQuantities().get("AAPL"));
        assertEquals(dec("97.00"), snapshot.getStops().get("AAPL"));
        assertEquals(portfolio.getCash(), snapshot.getCash());
        assertEquals(day(1), snapshot.getAsOf());
    }
}
