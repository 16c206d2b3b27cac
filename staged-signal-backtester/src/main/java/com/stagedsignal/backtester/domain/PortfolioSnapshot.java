package com.stagedsignal.backtester.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Read-only copy of portfolio state, kept for inspection when a run halts.
 */
@Value
@Builder
public class PortfolioSnapshot {
    LocalDateTime asOf;
    BigDecimal cash;
    BigDecimal equity;
    BigDecimal realizedPnl;
    Map<String, Integer> quantities;
    Map<String, BigDecimal> prices;
    Map<String, BigDecimal> stops;
}
