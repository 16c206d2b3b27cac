package com.stagedsignal.backtester.domain.execution;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Step-wise trailing stop. Each full step of gain above the entry price locks in one step less.
 */
public class TrailingStopCalculator {

    private final BigDecimal minLossCutFraction;

    public TrailingStopCalculator(BigDecimal minLossCutFraction) {
        this.minLossCutFraction = minLossCutFraction;
    }

    /**
     * Stop for the given price. Never below {@code average * (1 - minLossCut)}.
     */
    public BigDecimal stopFor(BigDecimal averagePrice, BigDecimal price, BigDecimal step) {
        BigDecimal floor = floor(averagePrice);
        if (averagePrice.signum() <= 0 || step.signum() <= 0) {
            return floor;
        }
        BigDecimal gain = price.divide(averagePrice, 6, RoundingMode.HALF_UP).subtract(BigDecimal.ONE);
        if (gain.compareTo(step) < 0) {
            return floor;
        }
        BigDecimal steps = gain.divide(step, 0, RoundingMode.FLOOR);
        BigDecimal locked = averagePrice.multiply(BigDecimal.ONE.add(steps.subtract(BigDecimal.ONE).multiply(step)))
                .setScale(4, RoundingMode.HALF_UP);
        return locked.max(floor);
    }

    /**
     * Stop after a partial exit: one widened step below the exit price, never below the floor.
     */
    public BigDecimal widenedStop(BigDecimal averagePrice, BigDecimal exitPrice, BigDecimal widenedStep) {
        BigDecimal stop = exitPrice.multiply(BigDecimal.ONE.subtract(widenedStep)).setScale(4, RoundingMode.HALF_UP);
        return stop.max(floor(averagePrice));
    }

    public BigDecimal floor(BigDecimal averagePrice) {
        return averagePrice.multiply(BigDecimal.ONE.subtract(minLossCutFraction)).setScale(4, RoundingMode.HALF_UP);
    }
}
