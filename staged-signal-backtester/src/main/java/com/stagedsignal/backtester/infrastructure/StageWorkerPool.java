package com.stagedsignal.backtester.infrastructure;

import com.stagedsignal.backtester.config.BacktestProperties;
import com.stagedsignal.backtester.domain.signal.SymbolExecutor;
import com.stagedsignal.backtester.domain.signal.SymbolTaskResult;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Scatters per-symbol work over a fixed pool and gathers it back in symbol order, so results do not
 * depend on which worker finished first.
 */
@Component
@Slf4j
public class StageWorkerPool implements SymbolExecutor {

    private final ExecutorService stageExecutorService;
    private final Duration symbolTimeout;

    @Autowired
    public StageWorkerPool(ExecutorService stageExecutorService, BacktestProperties properties) {
        this(stageExecutorService, properties.getWorker().getSymbolTimeout());
    }

    public StageWorkerPool(ExecutorService stageExecutorService, Duration symbolTimeout) {
        this.stageExecutorService = stageExecutorService;
        this.symbolTimeout = symbolTimeout;
    }

    @Override
    public <T> SortedMap<String, SymbolTaskResult<T>> invokeAll(Collection<String> symbols,
                                                                Function<String, T> task) {
        Map<String, Future<T>> futures = new TreeMap<>();
        for (String symbol : new TreeSet<>(symbols)) {
            futures.put(symbol, stageExecutorService.submit(() -> task.apply(symbol)));
        }

        SortedMap<String, SymbolTaskResult<T>> results = new TreeMap<>();
        boolean interrupted = false;
        for (Map.Entry<String, Future<T>> entry : futures.entrySet()) {
            String symbol = entry.getKey();
            Future<T> future = entry.getValue();
            if (interrupted) {
                future.cancel(true);
                results.put(symbol, SymbolTaskResult.failure(symbol, "interrupted"));
                continue;
            }
            try {
                results.put(symbol, SymbolTaskResult.success(symbol,
                        future.get(symbolTimeout.toMillis(), TimeUnit.MILLISECONDS)));
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Worker for {} timed out after {}", symbol, symbolTimeout);
                results.put(symbol, SymbolTaskResult.failure(symbol, "timed out after " + symbolTimeout));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Worker for {} failed: {}", symbol, cause.toString());
                results.put(symbol, SymbolTaskResult.failure(symbol, cause.toString()));
            } catch (InterruptedException e) {
                log.warn("Interrupted while waiting for {}", symbol);
                future.cancel(true);
                results.put(symbol, SymbolTaskResult.failure(symbol, "interrupted"));
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return results;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Stopping stage workers...");
        stageExecutorService.shutdown();

        try {
            if (!stageExecutorService.awaitTermination(60, TimeUnit.SECONDS)) {
                log.warn("Stage workers did not terminate gracefully, forcing shutdown");
                stageExecutorService.shutdownNow();
            } else {
                log.info("All stage workers stopped gracefully");
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while waiting for stage workers to stop", e);
            stageExecutorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
