package com.stagedsignal.backtester.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Portfolio valuation at the end of a committed step.
 */
@Value
@Builder
public class EquityPoint {
    LocalDateTime timestamp;
    BigDecimal equity;
    BigDecimal cash;
    int openPositions;
    BigDecimal realizedPnl;
    BigDecimal unrealizedPnl;
}
