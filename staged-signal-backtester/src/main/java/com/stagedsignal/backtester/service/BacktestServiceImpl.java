package com.stagedsignal.backtester.service;

import com.stagedsignal.backtester.domain.BacktestEngine;
import com.stagedsignal.backtester.domain.IndicatorSeriesStore;
import com.stagedsignal.backtester.domain.InvariantViolationException;
import com.stagedsignal.backtester.domain.RunStatus;
import com.stagedsignal.backtester.domain.StrategyProfile;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Implementation of BacktestService: validates requests, resolves profiles and runs the engine
 * with metrics and per-run logging context.
 */
@Service
@Slf4j
public class BacktestServiceImpl implements BacktestService {

    private final BacktestEngine backtestEngine;
    private final ProfileRegistry profileRegistry;
    private final BacktestMetricsService metricsService;
    private final Validator validator;
    private final Executor runExecutor;

    private final Map<String, AtomicBoolean> activeRuns = new ConcurrentHashMap<>();

    public BacktestServiceImpl(BacktestEngine backtestEngine,
                               ProfileRegistry profileRegistry,
                               BacktestMetricsService metricsService,
                               Validator validator,
                               @Qualifier("runExecutor") Executor runExecutor) {
        this.backtestEngine = backtestEngine;
        this.profileRegistry = profileRegistry;
        this.metricsService = metricsService;
        this.validator = validator;
        this.runExecutor = runExecutor;
    }

    @Override
    public BacktestEngine.BacktestResult run(BacktestRequest request, IndicatorSeriesStore store) {
        validate(request);
        StrategyProfile profile = profileRegistry.profile(request.getProfileName());
        String runId = request.getRunId() != null && !request.getRunId().isBlank()
                ? request.getRunId()
                : UUID.randomUUID().toString();

        AtomicBoolean cancelled = new AtomicBoolean(false);
        if (activeRuns.putIfAbsent(runId, cancelled) != null) {
            throw new IllegalArgumentException("Run " + runId + " is already active");
        }

        // Set MDC for structured logging
        MDC.put("runId", runId);
        MDC.put("mode", request.getMode().name());
        long startTime = System.currentTimeMillis();
        try {
            log.info("Started - Profile: {}, Steps: {}, Period: {} to {}",
                    profile.getName(), request.getStepSeries(), request.getFrom(), request.getTo());
            metricsService.recordRunStarted();

            BacktestEngine.BacktestResult result = backtestEngine.runBacktest(BacktestEngine.BacktestConfig.builder()
                    .runId(runId)
                    .profile(profile)
                    .mode(request.getMode())
                    .store(store)
                    .universe(request.getUniverse())
                    .stepSeries(request.getStepSeries())
                    .start(request.getFrom())
                    .end(request.getTo())
                    .listener(metricsService.listener())
                    .cancellation(cancelled::get)
                    .build());

            long executionTimeMs = System.currentTimeMillis() - startTime;
            if (result.getStatus() == RunStatus.CANCELLED) {
                log.info("Cancelled after {} committed steps", result.getStepsCommitted());
                metricsService.recordRunCancelled(executionTimeMs);
            } else {
                log.info("Completed in {} ms", executionTimeMs);
                metricsService.recordRunCompleted(executionTimeMs);
            }
            log.debug(metricsService.getMetricsSummary());
            return result;

        } catch (InvariantViolationException e) {
            log.error("Run halted by invariant violation: {}", e.getMessage(), e);
            metricsService.recordRunFailed();
            throw e;
        } catch (RuntimeException e) {
            log.error("Error during run: {}", e.getMessage(), e);
            metricsService.recordRunFailed();
            throw e;
        } finally {
            activeRuns.remove(runId);
            MDC.remove("runId");
            MDC.remove("mode");
        }
    }

    @Override
    public CompletableFuture<BacktestEngine.BacktestResult> submit(BacktestRequest request,
                                                                   IndicatorSeriesStore store) {
        validate(request);
        BacktestRequest submitted = request.getRunId() == null || request.getRunId().isBlank()
                ? request.toBuilder().runId(UUID.randomUUID().toString()).build()
                : request.toBuilder().build();
        log.info("Submitting run {}", submitted.getRunId());
        return CompletableFuture.supplyAsync(() -> run(submitted, store), runExecutor);
    }

    @Override
    public boolean cancel(String runId) {
        AtomicBoolean flag = activeRuns.get(runId);
        if (flag == null) {
            log.warn("No active run {} to cancel", runId);
            return false;
        }
        flag.set(true);
        log.info("Cancellation requested for run {}", runId);
        return true;
    }

    private void validate(BacktestRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request cannot be null");
        }
        Set<ConstraintViolation<BacktestRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .sorted(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
                    .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
                    .collect(Collectors.joining(", "));
            throw new IllegalArgumentException("Invalid backtest request - " + message);
        }
    }
}
