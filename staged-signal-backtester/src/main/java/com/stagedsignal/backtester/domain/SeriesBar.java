package com.stagedsignal.backtester.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * One symbol at one timestamp: OHLCV plus the derived fields computed upstream.
 * Bars are timestamped at the close of the period they describe.
 */
@Value
@Builder
public class SeriesBar {

    String symbol;
    LocalDateTime timestamp;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;
    long volume;

    @Singular
    Map<Indicator, BigDecimal> indicators;

    /**
     * Value of a derived field, or null when the store did not supply it.
     */
    public BigDecimal indicator(Indicator indicator) {
        return indicators.get(indicator);
    }

    /**
     * Value of a derived field, failing with {@link MissingIndicatorException} when absent.
     */
    public BigDecimal require(Indicator indicator) {
        BigDecimal value = indicators.get(indicator);
        if (value == null) {
            throw new MissingIndicatorException(symbol, indicator.name());
        }
        return value;
    }

    public BigDecimal requireOpen() {
        return requirePrice(open, "open");
    }

    public BigDecimal requireHigh() {
        return requirePrice(high, "high");
    }

    public BigDecimal requireLow() {
        return requirePrice(low, "low");
    }

    public BigDecimal requireClose() {
        return requirePrice(close, "close");
    }

    /**
     * True when all four prices are present.
     */
    public boolean hasPrices() {
        return open != null && high != null && low != null && close != null;
    }

    private BigDecimal requirePrice(BigDecimal price, String field) {
        if (price == null) {
            throw new MissingIndicatorException(symbol, field);
        }
        return price;
    }

    public static class SeriesBarBuilder {

        /**
         * Adds a field from a double, dropping NaN and infinite values so the field reads as missing.
         */
        public SeriesBarBuilder indicatorValue(Indicator indicator, double value) {
            if (Double.isFinite(value)) {
                indicator(indicator, BigDecimal.valueOf(value));
            }
            return this;
        }
    }
}
