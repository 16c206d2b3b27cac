package com.stagedsignal.backtester.domain;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static com.stagedsignal.backtester.domain.Bars.day;
import static com.stagedsignal.backtester.domain.Bars.dec;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TradeLog ordering and sequencing.
 */
class TradeLogTest {

    private static Trade fill(LocalDateTime time, TradeType type) {
        return Trade.builder()
                .positionId(1)
                .ticker("AAPL")
                .type(type)
                .quantity(10)
                .price(dec("100.00"))
                .timestamp(time)
                .reason(ReasonCode.BREAKOUT_ENTRY)
                .build();
    }

    @Test
    void testAppend_AssignsSequence() {
        // Arrange
        TradeLog log = new TradeLog();

        // Act
        Trade first = log.append(fill(day(1), TradeType.ENTRY));
        log.appendAll(List.of(fill(day(2), TradeType.STOP_OUT), fill(day(2), TradeType.ENTRY)));

        // Assert
        assertEquals(1, first.getSequence());
        assertEquals(3, log.size());
        assertEquals(3, log.getTrades().get(2).getSequence());
        assertFalse(log.isEmpty());
    }

    @Test
    void testAppend_RejectsEarlierTimestamp() {
        TradeLog log = new TradeLog();
        log.append(fill(day(2), TradeType.ENTRY));

        assertThrows(IllegalStateException.class, () -> log.append(fill(day(1), TradeType.EXIT)));
        assertEquals(1, log.size());
    }

    @Test
    void testGetTrades_IsReadOnly() {
        TradeLog log = new TradeLog();
        log.append(fill(day(1), TradeType.ENTRY));

        assertThrows(UnsupportedOperationException.class, () -> log.getTrades().clear());
    }

    @Test
    void testCashFlow_SignsByDirection() {
        Trade buy = fill(day(1), TradeType.ENTRY).toBuilder().commission(dec("1.00")).build();
        Trade sell = fill(day(2), TradeType.EXIT).toBuilder().commission(dec("1.00")).build();

        assertEquals(0, dec("-1001.00").compareTo(buy.getCashFlow()));
        assertEquals(0, dec("999.00").compareTo(sell.getCashFlow()));
    }
}
