package com.stagedsignal.backtester.domain.signal;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * A symbol that survived every enabled stage at one step. Lives for that step only.
 */
@Value
@Builder
public class Candidate {

    String symbol;
    BigDecimal score;
    BigDecimal targetPrice;
    BigDecimal stopPrice;

    /** Fraction of equity to allocate, already scaled by the symbol's average daily range. */
    BigDecimal sizingHint;

    BigDecimal averageDailyRange;
    String signalLabel;
    List<StageResult> stageResults;
}
