package com.stagedsignal.backtester.service;

import com.stagedsignal.backtester.domain.BacktestListener;
import com.stagedsignal.backtester.domain.EquityPoint;
import com.stagedsignal.backtester.domain.OrderRejection;
import com.stagedsignal.backtester.domain.Trade;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Service for tracking backtest run metrics.
 * Exposes metrics via Spring Boot Actuator for monitoring.
 */
@Service
@Slf4j
public class BacktestMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter runsStartedCounter;
    private final Counter runsCompletedCounter;
    private final Counter runsCancelledCounter;
    private final Counter runsFailedCounter;
    private final Counter symbolFailuresCounter;
    private final Timer runTimer;
    private final Timer stepTimer;

    public BacktestMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.runsStartedCounter = Counter.builder("backtest.runs.started")
                .description("Total number of backtest runs started")
                .register(meterRegistry);

        this.runsCompletedCounter = Counter.builder("backtest.runs.completed")
                .description("Total number of backtest runs that reached the end of their period")
                .register(meterRegistry);

        this.runsCancelledCounter = Counter.builder("backtest.runs.cancelled")
                .description("Total number of backtest runs cancelled before the end of their period")
                .register(meterRegistry);

        this.runsFailedCounter = Counter.builder("backtest.runs.failed")
                .description("Total number of backtest runs halted by an error")
                .register(meterRegistry);

        this.symbolFailuresCounter = Counter.builder("backtest.symbols.failed")
                .description("Symbols dropped from a step after a worker failure or timeout")
                .register(meterRegistry);

        this.runTimer = Timer.builder("backtest.run.time")
                .description("Backtest run execution time")
                .register(meterRegistry);

        this.stepTimer = Timer.builder("backtest.step.time")
                .description("Time to evaluate and commit one step")
                .register(meterRegistry);

        log.info("BacktestMetricsService initialized with Micrometer metrics");
    }

    /**
     * Record a run start.
     */
    public void recordRunStarted() {
        runsStartedCounter.increment();
    }

    /**
     * Record a run that reached its end with execution time.
     */
    public void recordRunCompleted(long executionTimeMs) {
        runsCompletedCounter.increment();
        runTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
    }

    public void recordRunCancelled(long executionTimeMs) {
        runsCancelledCounter.increment();
        runTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
    }

    public void recordRunFailed() {
        runsFailedCounter.increment();
    }

    public void recordTrade(Trade trade) {
        Counter.builder("backtest.trades")
                .description("Fills by trade type")
                .tag("type", trade.getType().name())
                .register(meterRegistry)
                .increment();
    }

    public void recordRejection(OrderRejection rejection) {
        Counter.builder("backtest.rejections")
                .description("Order rejections and clamps by reason")
                .tag("reason", rejection.getReason().name())
                .register(meterRegistry)
                .increment();
    }

    /**
     * Listener that feeds committed steps into these metrics.
     */
    public BacktestListener listener() {
        return new BacktestListener() {
            @Override
            public void onStepCommitted(LocalDateTime step, List<Trade> trades, List<OrderRejection> rejections,
                                        EquityPoint equity, long elapsedNanos) {
                trades.forEach(BacktestMetricsService.this::recordTrade);
                rejections.forEach(BacktestMetricsService.this::recordRejection);
                stepTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);
            }

            @Override
            public void onSymbolFailures(LocalDateTime step, Map<String, String> failures) {
                symbolFailuresCounter.increment(failures.size());
            }
        };
    }

    /**
     * Get current metrics summary (for logging purposes).
     */
    public String getMetricsSummary() {
        return String.format("Metrics: Started=%d, Completed=%d, Cancelled=%d, Failed=%d, Steps=%d, AvgRunTime=%.2fs",
                (long) runsStartedCounter.count(),
                (long) runsCompletedCounter.count(),
                (long) runsCancelledCounter.count(),
                (long) runsFailedCounter.count(),
                stepTimer.count(),
                runTimer.mean(TimeUnit.SECONDS));
    }
}
