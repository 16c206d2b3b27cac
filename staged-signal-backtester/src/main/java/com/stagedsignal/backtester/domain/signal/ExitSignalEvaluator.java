package com.stagedsignal.backtester.domain.signal;

import com.stagedsignal.backtester.domain.Indicator;
import com.stagedsignal.backtester.domain.SeriesBar;
import com.stagedsignal.backtester.domain.SeriesKind;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Sell signal for held symbols: the decision bar closed below its 20-period average.
 */
public class ExitSignalEvaluator {

    public boolean shouldExit(SymbolSnapshot snapshot) {
        Optional<SeriesBar> latest = snapshot.window(SeriesKind.DAILY).latest();
        if (latest.isEmpty()) {
            return false;
        }
        BigDecimal close = latest.get().getClose();
        BigDecimal average = latest.get().indicator(Indicator.SMA20);
        return close != null && average != null && close.compareTo(average) < 0;
    }
}
