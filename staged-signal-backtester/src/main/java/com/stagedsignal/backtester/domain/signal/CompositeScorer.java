package com.stagedsignal.backtester.domain.signal;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ranks candidates by a weighted blend of the stages they passed, their RS percentile and how far
 * price already sits relative to the breakout level. Scores fall in [0, 1].
 */
public class CompositeScorer {

    private static final Map<StageId, BigDecimal> STAGE_WEIGHTS = new EnumMap<>(StageId.class);
    private static final BigDecimal RS_WEIGHT = new BigDecimal("0.20");
    private static final BigDecimal BREAKOUT_WEIGHT = new BigDecimal("0.10");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    static {
        STAGE_WEIGHTS.put(StageId.WEEKLY, new BigDecimal("0.10"));
        STAGE_WEIGHTS.put(StageId.DAILY, new BigDecimal("0.15"));
        STAGE_WEIGHTS.put(StageId.RELATIVE_STRENGTH, new BigDecimal("0.15"));
        STAGE_WEIGHTS.put(StageId.FUNDAMENTAL, new BigDecimal("0.15"));
        STAGE_WEIGHTS.put(StageId.EARNINGS, new BigDecimal("0.15"));
    }

    /**
     * Score from the stage results of a surviving symbol.
     *
     * @param results       results of every stage, skipped stages included
     * @param rsPercentile  RS percentile of the last completed period, or null
     * @param currentPrice  close of the decision bar, or null
     * @param targetPrice   breakout level, or null
     */
    public BigDecimal score(List<StageResult> results, BigDecimal rsPercentile,
                            BigDecimal currentPrice, BigDecimal targetPrice) {
        BigDecimal strength = BigDecimal.ZERO;
        BigDecimal weightSum = BigDecimal.ZERO;

        for (StageResult result : results) {
            if (result.isPassed() && !result.isSkipped()) {
                BigDecimal weight = STAGE_WEIGHTS.get(result.getStage());
                strength = strength.add(weight);
                weightSum = weightSum.add(weight);
            }
        }

        if (rsPercentile != null && rsPercentile.signum() > 0) {
            BigDecimal rsStrength = rsPercentile.divide(HUNDRED, 6, RoundingMode.HALF_UP).min(BigDecimal.ONE);
            strength = strength.add(rsStrength.multiply(RS_WEIGHT));
            weightSum = weightSum.add(RS_WEIGHT);
        }

        if (currentPrice != null && targetPrice != null && targetPrice.signum() > 0
                && currentPrice.compareTo(targetPrice) >= 0) {
            strength = strength.add(BREAKOUT_WEIGHT);
            weightSum = weightSum.add(BREAKOUT_WEIGHT);
        }

        if (weightSum.signum() == 0) {
            return BigDecimal.ZERO.setScale(4, RoundingMode.HALF_UP);
        }
        return strength.divide(weightSum, 4, RoundingMode.HALF_UP).min(BigDecimal.ONE);
    }
}
