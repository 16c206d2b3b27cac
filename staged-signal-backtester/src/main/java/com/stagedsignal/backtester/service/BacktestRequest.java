package com.stagedsignal.backtester.service;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.stagedsignal.backtester.domain.RunMode;
import com.stagedsignal.backtester.domain.SeriesKind;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Set;

/**
 * Parameters of a single backtest run. A null profile name selects the default profile and a null
 * universe selects every symbol in the store.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class BacktestRequest {

    private String runId;

    private String profileName;

    @NotNull(message = "Run mode is required")
    private RunMode mode;

    @NotNull(message = "Step series is required")
    @Builder.Default
    private SeriesKind stepSeries = SeriesKind.DAILY;

    @NotNull(message = "Start time is required")
    private LocalDateTime from;

    @NotNull(message = "End time is required")
    private LocalDateTime to;

    private Set<String> universe;

    @JsonIgnore
    @AssertTrue(message = "Start time must not be after end time")
    public boolean isPeriodValid() {
        return from == null || to == null || !from.isAfter(to);
    }

    @JsonIgnore
    @AssertTrue(message = "Steps must be DAILY or MINUTE bars")
    public boolean isStepSeriesSupported() {
        return stepSeries == null || stepSeries == SeriesKind.DAILY || stepSeries == SeriesKind.MINUTE;
    }
}
