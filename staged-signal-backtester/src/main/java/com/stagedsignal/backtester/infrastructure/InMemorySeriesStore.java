package com.stagedsignal.backtester.infrastructure;

import com.stagedsignal.backtester.domain.IndicatorSeriesStore;
import com.stagedsignal.backtester.domain.SeriesBar;
import com.stagedsignal.backtester.domain.SeriesKind;
import com.stagedsignal.backtester.domain.SeriesWindow;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Series held in memory, indexed by symbol, kind and timestamp. Populate it before a run starts;
 * reads during a run are safe from any thread once loading is done.
 */
public class InMemorySeriesStore implements IndicatorSeriesStore {

    private final Map<String, Map<SeriesKind, NavigableMap<LocalDateTime, SeriesBar>>> series = new TreeMap<>();

    /**
     * Add bars of one kind. A bar with the same symbol and timestamp replaces the earlier one.
     */
    public InMemorySeriesStore add(SeriesKind kind, Collection<SeriesBar> bars) {
        for (SeriesBar bar : bars) {
            if (bar.getSymbol() == null || bar.getTimestamp() == null) {
                throw new IllegalArgumentException("Bar needs a symbol and a timestamp: " + bar);
            }
            series.computeIfAbsent(bar.getSymbol(), symbol -> new EnumMap<>(SeriesKind.class))
                    .computeIfAbsent(kind, k -> new TreeMap<>())
                    .put(bar.getTimestamp(), bar);
        }
        return this;
    }

    public InMemorySeriesStore add(SeriesKind kind, SeriesBar... bars) {
        return add(kind, List.of(bars));
    }

    @Override
    public Set<String> symbols() {
        return Collections.unmodifiableSet(series.keySet());
    }

    @Override
    public List<SeriesBar> series(String symbol, SeriesKind kind) {
        NavigableMap<LocalDateTime, SeriesBar> bars = bars(symbol, kind);
        return bars == null ? List.of() : new ArrayList<>(bars.values());
    }

    @Override
    public SeriesWindow window(String symbol, SeriesKind kind, LocalDateTime cutoff, boolean inclusive) {
        NavigableMap<LocalDateTime, SeriesBar> bars = bars(symbol, kind);
        if (bars == null) {
            return SeriesWindow.empty(kind);
        }
        return SeriesWindow.of(kind, new ArrayList<>(bars.headMap(cutoff, inclusive).values()));
    }

    @Override
    public Optional<SeriesBar> barAt(String symbol, SeriesKind kind, LocalDateTime timestamp) {
        NavigableMap<LocalDateTime, SeriesBar> bars = bars(symbol, kind);
        return bars == null ? Optional.empty() : Optional.ofNullable(bars.get(timestamp));
    }

    private NavigableMap<LocalDateTime, SeriesBar> bars(String symbol, SeriesKind kind) {
        Map<SeriesKind, NavigableMap<LocalDateTime, SeriesBar>> kinds = series.get(symbol);
        return kinds == null ? null : kinds.get(kind);
    }
}
