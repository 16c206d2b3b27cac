package com.stagedsignal.backtester.domain;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * An ascending run of bars for one symbol and series kind, already cut at a decision time.
 * Stages only ever see data through a window.
 */
public final class SeriesWindow {

    private final SeriesKind kind;
    private final List<SeriesBar> bars;

    private SeriesWindow(SeriesKind kind, List<SeriesBar> bars) {
        this.kind = kind;
        this.bars = Collections.unmodifiableList(bars);
    }

    public static SeriesWindow of(SeriesKind kind, List<SeriesBar> bars) {
        return new SeriesWindow(kind, bars);
    }

    public static SeriesWindow empty(SeriesKind kind) {
        return new SeriesWindow(kind, List.of());
    }

    public SeriesKind getKind() {
        return kind;
    }

    public List<SeriesBar> getBars() {
        return bars;
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    /**
     * Bar {@code offset} positions before the latest one (0 is the latest).
     */
    public Optional<SeriesBar> fromLatest(int offset) {
        int index = bars.size() - 1 - offset;
        if (offset < 0 || index < 0) {
            return Optional.empty();
        }
        return Optional.of(bars.get(index));
    }

    public Optional<SeriesBar> latest() {
        return fromLatest(0);
    }

    /**
     * Latest bar strictly before the given time, i.e. the last completed period.
     */
    public Optional<SeriesBar> latestBefore(LocalDateTime time) {
        for (int i = bars.size() - 1; i >= 0; i--) {
            SeriesBar bar = bars.get(i);
            if (bar.getTimestamp().isBefore(time)) {
                return Optional.of(bar);
            }
        }
        return Optional.empty();
    }

    /**
     * The most recent {@code count} bars, fewer when the window is shorter.
     */
    public List<SeriesBar> tail(int count) {
        int from = Math.max(0, bars.size() - count);
        return bars.subList(from, bars.size());
    }

    public Optional<LocalDateTime> latestTimestamp() {
        return latest().map(SeriesBar::getTimestamp);
    }
}
