package com.stagedsignal.backtester.domain;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only source of per-symbol bar series. Implementations are supplied by the data layer.
 */
public interface IndicatorSeriesStore {

    /**
     * Symbols that have at least one series.
     */
    Set<String> symbols();

    /**
     * All bars of a kind for a symbol, ascending by timestamp. Empty when the symbol has none.
     */
    List<SeriesBar> series(String symbol, SeriesKind kind);

    /**
     * Bars up to a cutoff, inclusive or exclusive of bars stamped exactly at the cutoff.
     */
    default SeriesWindow window(String symbol, SeriesKind kind, LocalDateTime cutoff, boolean inclusive) {
        List<SeriesBar> bars = series(symbol, kind);
        int end = 0;
        while (end < bars.size()) {
            LocalDateTime timestamp = bars.get(end).getTimestamp();
            boolean visible = inclusive ? !timestamp.isAfter(cutoff) : timestamp.isBefore(cutoff);
            if (!visible) {
                break;
            }
            end++;
        }
        return SeriesWindow.of(kind, new ArrayList<>(bars.subList(0, end)));
    }

    /**
     * The bar stamped exactly at a timestamp, if the symbol traded then.
     */
    default Optional<SeriesBar> barAt(String symbol, SeriesKind kind, LocalDateTime timestamp) {
        return series(symbol, kind).stream()
                .filter(bar -> bar.getTimestamp().equals(timestamp))
                .findFirst();
    }

    /**
     * Distinct timestamps of a series kind across all symbols within [from, to].
     */
    default NavigableSet<LocalDateTime> timeline(SeriesKind kind, LocalDateTime from, LocalDateTime to) {
        NavigableSet<LocalDateTime> timestamps = new TreeSet<>();
        for (String symbol : symbols()) {
            for (SeriesBar bar : series(symbol, kind)) {
                LocalDateTime timestamp = bar.getTimestamp();
                if (!timestamp.isBefore(from) && !timestamp.isAfter(to)) {
                    timestamps.add(timestamp);
                }
            }
        }
        return timestamps;
    }
}
