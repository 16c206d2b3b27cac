package com.stagedsignal.backtester.config;

import com.stagedsignal.backtester.domain.StrategyProfile;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings under {@code backtest.*}. Profiles are checked by the profile registry rather than at
 * binding time so that every invalid profile is reported together.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "backtest")
public class BacktestProperties {

    @NotBlank
    private String defaultProfile = "default";

    @Valid
    @NotNull
    private Worker worker = new Worker();

    private Map<String, StrategyProfile> profiles = new LinkedHashMap<>();

    @Data
    public static class Worker {

        @Min(1)
        private int threadCount = 4;

        @NotNull
        private Duration symbolTimeout = Duration.ofSeconds(30);
    }
}
