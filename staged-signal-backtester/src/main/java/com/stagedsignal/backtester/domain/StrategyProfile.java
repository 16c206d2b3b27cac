package com.stagedsignal.backtester.domain;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * A named set of stage switches and thresholds. Bound from configuration and shared by every run
 * that selects it; the run mode is supplied separately per run.
 */
@Data
public class StrategyProfile {

    private String name;

    @Valid
    @NotNull
    private EarningsSettings earnings = new EarningsSettings();

    @Valid
    @NotNull
    private FundamentalSettings fundamental = new FundamentalSettings();

    @Valid
    @NotNull
    private WeeklySettings weekly = new WeeklySettings();

    @Valid
    @NotNull
    private RelativeStrengthSettings relativeStrength = new RelativeStrengthSettings();

    @Valid
    @NotNull
    private DailySettings daily = new DailySettings();

    @Valid
    @NotNull
    private ExecutionSettings execution = new ExecutionSettings();

    @Valid
    @NotNull
    private AnalyticsSettings analytics = new AnalyticsSettings();

    /**
     * Profile with every default applied.
     */
    public static StrategyProfile defaults(String name) {
        StrategyProfile profile = new StrategyProfile();
        profile.setName(name);
        return profile;
    }

    @Data
    public static class EarningsSettings {
        private boolean enabled = true;

        @NotNull
        private BigDecimal priorGrowthFloor = BigDecimal.ZERO;
    }

    @Data
    public static class FundamentalSettings {
        private boolean enabled = true;

        @NotNull
        @DecimalMin("0")
        private BigDecimal minMarketCap = new BigDecimal("2000000000");

        @NotNull
        @DecimalMin("0")
        private BigDecimal maxMarketCap = new BigDecimal("20000000000000");

        @NotNull
        private BigDecimal growthThreshold = new BigDecimal("0.10");

        @NotNull
        private BigDecimal priorGrowthFloor = BigDecimal.ZERO;
    }

    @Data
    public static class WeeklySettings {
        private boolean enabled = true;

        @NotNull
        @DecimalMin("1.0")
        private BigDecimal stabilityTolerance = new BigDecimal("1.05");

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal lowDistanceFactor = new BigDecimal("1.3");

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal highDistanceFactor = new BigDecimal("0.7");

        @Min(0)
        @Max(2)
        private int closeLag = 1;
    }

    @Data
    public static class RelativeStrengthSettings {
        private boolean enabled = true;

        @NotNull
        @DecimalMin("0")
        @DecimalMax("100")
        private BigDecimal threshold = new BigDecimal("90");
    }

    @Data
    public static class DailySettings {
        private boolean enabled = true;

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        @DecimalMax(value = "1", inclusive = false)
        private BigDecimal stopLossFraction = new BigDecimal("0.03");

        @NotEmpty
        private List<BreakoutWindow> breakoutWindows = new ArrayList<>(List.of(
                BreakoutWindow.TWO_YEAR,
                BreakoutWindow.ONE_YEAR,
                BreakoutWindow.SIX_MONTH,
                BreakoutWindow.THREE_MONTH,
                BreakoutWindow.ONE_MONTH));

        private boolean requireRelativeStrength = true;

        private boolean rs12wFallback = false;
    }

    @Data
    public static class ExecutionSettings {

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal initialCash = new BigDecimal("100000");

        @Min(1)
        private int maxPositions = 10;

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        @DecimalMax("1")
        private BigDecimal maxPositionFraction = new BigDecimal("0.4");

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        @DecimalMax("1")
        private BigDecimal baseAllocation = new BigDecimal("0.2");

        @NotNull
        @DecimalMin("0")
        private BigDecimal highAdrThreshold = new BigDecimal("5");

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal highAdrScale = new BigDecimal("0.5");

        @NotNull
        @DecimalMin("0")
        private BigDecimal lowAdrThreshold = new BigDecimal("2");

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal lowAdrScale = new BigDecimal("1.5");

        @Min(1)
        private int adrLookback = 20;

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        @DecimalMax("1")
        private BigDecimal riskFraction = new BigDecimal("0.01");

        @NotNull
        @DecimalMin("0")
        @DecimalMax(value = "1", inclusive = false)
        private BigDecimal slippage = new BigDecimal("0.002");

        @NotNull
        @DecimalMin("0")
        @DecimalMax(value = "1", inclusive = false)
        private BigDecimal commissionRate = BigDecimal.ZERO;

        private boolean partialExitEnabled = true;

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        @DecimalMax(value = "1", inclusive = false)
        private BigDecimal partialExitFraction = new BigDecimal("0.5");

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal profitTargetFraction = new BigDecimal("0.20");

        @NotNull
        @DecimalMin("1")
        private BigDecimal stopWidenMultiplier = new BigDecimal("2");

        private boolean pyramidingEnabled = true;

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        @DecimalMax("1")
        private BigDecimal pyramidingRatio = new BigDecimal("0.1");

        @Min(0)
        private int maxPyramidLevels = 2;

        private boolean trailingStopEnabled = true;

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        @DecimalMax(value = "1", inclusive = false)
        private BigDecimal trailingStep = new BigDecimal("0.05");

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        @DecimalMax(value = "1", inclusive = false)
        private BigDecimal minLossCutFraction = new BigDecimal("0.03");

        private boolean signalExitEnabled = true;

        private boolean sameBarStopCheck = true;

        private boolean closeOpenPositionsAtEnd = false;
    }

    @Data
    public static class AnalyticsSettings {

        @NotNull
        @DecimalMin("0")
        @DecimalMax("1")
        private BigDecimal riskFreeRate = BigDecimal.ZERO;
    }
}
