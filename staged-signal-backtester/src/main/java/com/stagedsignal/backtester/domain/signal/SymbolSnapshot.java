package com.stagedsignal.backtester.domain.signal;

import com.stagedsignal.backtester.domain.IndicatorSeriesStore;
import com.stagedsignal.backtester.domain.RunMode;
import com.stagedsignal.backtester.domain.SeriesKind;
import com.stagedsignal.backtester.domain.SeriesWindow;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the stages may read for one symbol at one decision time.
 */
@Value
public class SymbolSnapshot {

    private static final List<SeriesKind> DECISION_SERIES = List.of(
            SeriesKind.DAILY,
            SeriesKind.WEEKLY,
            SeriesKind.RELATIVE_STRENGTH,
            SeriesKind.FUNDAMENTAL,
            SeriesKind.EARNINGS);

    String symbol;
    LocalDateTime decisionTime;
    Map<SeriesKind, SeriesWindow> windows;

    /**
     * Cuts every decision series at the step time. The step's own bars are only included when the
     * mode makes them visible.
     */
    public static SymbolSnapshot capture(IndicatorSeriesStore store, String symbol,
                                         LocalDateTime decisionTime, RunMode mode) {
        Map<SeriesKind, SeriesWindow> windows = new EnumMap<>(SeriesKind.class);
        for (SeriesKind kind : DECISION_SERIES) {
            windows.put(kind, store.window(symbol, kind, decisionTime, mode.isStepBarVisible()));
        }
        return new SymbolSnapshot(symbol, decisionTime, windows);
    }

    public SeriesWindow window(SeriesKind kind) {
        SeriesWindow window = windows.get(kind);
        return window != null ? window : SeriesWindow.empty(kind);
    }
}
