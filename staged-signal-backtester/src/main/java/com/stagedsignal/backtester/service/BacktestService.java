package com.stagedsignal.backtester.service;

import com.stagedsignal.backtester.domain.BacktestEngine;
import com.stagedsignal.backtester.domain.IndicatorSeriesStore;

import java.util.concurrent.CompletableFuture;

/**
 * Service interface for running backtests against a series store.
 */
public interface BacktestService {

    /**
     * Run a backtest on the calling thread.
     *
     * @param request run parameters
     * @param store   series the run reads
     * @return the result, consistent up to the last committed step
     * @throws IllegalArgumentException when the request is invalid or names an unknown profile
     */
    BacktestEngine.BacktestResult run(BacktestRequest request, IndicatorSeriesStore store);

    /**
     * Run a backtest on the run executor. The request is copied; a run without an id gets a generated
     * one, so callers that may cancel should set their own.
     */
    CompletableFuture<BacktestEngine.BacktestResult> submit(BacktestRequest request, IndicatorSeriesStore store);

    /**
     * Ask a running backtest to stop after its current step; that step is discarded.
     *
     * @return true when a run with that id was active
     */
    boolean cancel(String runId);
}
