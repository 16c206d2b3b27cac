package com.stagedsignal.backtester.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pools for whole runs and for the per-symbol stage work inside a step.
 */
@Configuration
public class AsyncConfig {

    @Value("${backtest.worker.thread-count:4}")
    private int workerThreadCount;

    @Bean(name = "runExecutor")
    public Executor runExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(20);
        executor.setThreadNamePrefix("BacktestRun-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean(name = "stageExecutorService")
    public ExecutorService stageExecutorService() {
        return Executors.newFixedThreadPool(workerThreadCount,
                r -> {
                    Thread thread = new Thread(r);
                    thread.setName("StageWorker-" + thread.getId());
                    thread.setDaemon(false);
                    return thread;
                });
    }
}
