package com.stagedsignal.backtester.config;

import com.stagedsignal.backtester.domain.BacktestEngine;
import com.stagedsignal.backtester.domain.signal.PipelineRunner;
import com.stagedsignal.backtester.infrastructure.StageWorkerPool;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the stateless engine components. All per-run state lives inside {@link BacktestEngine#runBacktest}.
 */
@Configuration
public class EngineConfig {

    @Bean
    public PipelineRunner pipelineRunner() {
        return new PipelineRunner();
    }

    @Bean
    public BacktestEngine backtestEngine(PipelineRunner pipelineRunner, StageWorkerPool stageWorkerPool) {
        return new BacktestEngine(pipelineRunner, stageWorkerPool);
    }
}
