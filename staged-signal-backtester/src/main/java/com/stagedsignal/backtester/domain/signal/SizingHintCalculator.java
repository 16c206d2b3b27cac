package com.stagedsignal.backtester.domain.signal;

import com.stagedsignal.backtester.domain.Indicator;
import com.stagedsignal.backtester.domain.SeriesBar;
import com.stagedsignal.backtester.domain.SeriesWindow;
import com.stagedsignal.backtester.domain.StrategyProfile;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Allocation fraction for a new entry, scaled by the symbol's average daily range (ADR, in percent).
 */
public class SizingHintCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * ADR from the decision bar's field, otherwise the mean of (high - low) / close over the last
     * bars of the window. Null when neither is available.
     */
    public BigDecimal averageDailyRange(SeriesWindow daily, int lookback) {
        if (daily.isEmpty()) {
            return null;
        }
        BigDecimal supplied = daily.latest().orElseThrow().indicator(Indicator.ADR);
        if (supplied != null) {
            return supplied;
        }

        List<SeriesBar> recent = daily.tail(lookback);
        BigDecimal total = BigDecimal.ZERO;
        int counted = 0;
        for (SeriesBar bar : recent) {
            if (!bar.hasPrices() || bar.getClose().signum() <= 0) {
                continue;
            }
            total = total.add(bar.getHigh().subtract(bar.getLow())
                    .multiply(HUNDRED)
                    .divide(bar.getClose(), 6, RoundingMode.HALF_UP));
            counted++;
        }
        if (counted == 0) {
            return null;
        }
        return total.divide(BigDecimal.valueOf(counted), 6, RoundingMode.HALF_UP);
    }

    /**
     * Base allocation, reduced for wide-ranging symbols and raised for quiet ones.
     */
    public BigDecimal allocationFraction(BigDecimal adr, StrategyProfile.ExecutionSettings settings) {
        BigDecimal fraction = settings.getBaseAllocation();
        if (adr == null) {
            return fraction;
        }
        if (adr.compareTo(settings.getHighAdrThreshold()) >= 0) {
            fraction = fraction.multiply(settings.getHighAdrScale());
        } else if (adr.compareTo(settings.getLowAdrThreshold()) <= 0) {
            fraction = fraction.multiply(settings.getLowAdrScale());
        }
        return fraction.min(settings.getMaxPositionFraction()).setScale(6, RoundingMode.HALF_UP);
    }
}
