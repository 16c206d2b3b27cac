package com.stagedsignal.backtester.domain.execution;

import com.stagedsignal.backtester.domain.SeriesBar;
import com.stagedsignal.backtester.domain.StrategyProfile;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fill prices against a bar, with slippage charged against the trader, and commissions.
 */
public class FillModel {

    private static final int PRICE_SCALE = 4;

    private final BigDecimal slippage;
    private final BigDecimal commissionRate;

    public FillModel(BigDecimal slippage, BigDecimal commissionRate) {
        this.slippage = slippage;
        this.commissionRate = commissionRate;
    }

    public static FillModel from(StrategyProfile.ExecutionSettings settings) {
        return new FillModel(settings.getSlippage(), settings.getCommissionRate());
    }

    /**
     * Buy-stop at the target: the open when the bar gapped through it, the target when the high
     * reached it. Null when the bar never traded at the target.
     */
    public BigDecimal entryFill(BigDecimal target, SeriesBar bar) {
        BigDecimal open = bar.requireOpen();
        BigDecimal raw;
        if (open.compareTo(target) >= 0) {
            raw = open;
        } else if (bar.requireHigh().compareTo(target) >= 0) {
            raw = target;
        } else {
            return null;
        }
        return buy(raw);
    }

    /**
     * Stop order: filled at the stop, or at the open when the bar gapped below it.
     */
    public BigDecimal stopFill(BigDecimal stop, SeriesBar bar) {
        BigDecimal open = bar.requireOpen();
        return sell(open.compareTo(stop) < 0 ? open : stop);
    }

    /**
     * Limit sell at the target, or the open when the bar gapped above it.
     */
    public BigDecimal targetFill(BigDecimal target, SeriesBar bar) {
        return sell(bar.requireOpen().max(target));
    }

    public BigDecimal openSell(SeriesBar bar) {
        return sell(bar.requireOpen());
    }

    public BigDecimal closeSell(SeriesBar bar) {
        return sell(bar.requireClose());
    }

    public BigDecimal buy(BigDecimal raw) {
        return raw.multiply(BigDecimal.ONE.add(slippage)).setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    public BigDecimal sell(BigDecimal raw) {
        return raw.multiply(BigDecimal.ONE.subtract(slippage)).setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    public BigDecimal commission(BigDecimal price, int quantity) {
        return price.multiply(BigDecimal.valueOf(quantity)).multiply(commissionRate)
                .setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    public BigDecimal getCommissionRate() {
        return commissionRate;
    }
}
