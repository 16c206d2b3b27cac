package com.stagedsignal.backtester.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.stagedsignal.backtester.domain.BacktestEngine;
import com.stagedsignal.backtester.domain.signal.StageFunnel;
import com.stagedsignal.backtester.domain.signal.StageId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serialises a run's trades, equity history, rejections, funnel and summary as one JSON document.
 */
@Component
@Slf4j
public class BacktestReportWriter {

    private final ObjectWriter writer;

    public BacktestReportWriter(ObjectMapper objectMapper) {
        this.writer = objectMapper.writerWithDefaultPrettyPrinter()
                .without(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public String toJson(BacktestEngine.BacktestResult result) {
        try {
            return writer.writeValueAsString(report(result));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize report for run {}", result.getRunId(), e);
            throw new RuntimeException("Failed to serialize backtest report", e);
        }
    }

    public void write(BacktestEngine.BacktestResult result, OutputStream out) throws IOException {
        writer.writeValue(out, report(result));
    }

    public void write(BacktestEngine.BacktestResult result, Path file) throws IOException {
        try (OutputStream out = Files.newOutputStream(file)) {
            write(result, out);
        }
        log.info("Report for run {} written to {}", result.getRunId(), file);
    }

    private Map<String, Object> report(BacktestEngine.BacktestResult result) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("runId", result.getRunId());
        report.put("status", result.getStatus());
        report.put("mode", result.getMode());
        report.put("profile", result.getProfileName());
        report.put("stepsCommitted", result.getStepsCommitted());
        report.put("finalEquity", result.getFinalEquity());
        report.put("summary", result.getPerformance());
        report.put("funnel", funnel(result.getFunnel()));
        report.put("trades", result.getTrades());
        report.put("equityHistory", result.getEquityHistory());
        report.put("rejections", result.getRejections());
        report.put("finalState", result.getFinalState());
        return report;
    }

    private Map<String, Object> funnel(Map<StageId, StageFunnel> funnel) {
        Map<String, Object> stages = new LinkedHashMap<>();
        if (funnel == null) {
            return stages;
        }
        funnel.forEach((stage, counts) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("input", counts.getInput());
            entry.put("passed", counts.getPassed());
            entry.put("skipped", counts.getSkipped());
            entry.put("passRate", counts.passRate());
            stages.put(stage.getCode(), entry);
        });
        return stages;
    }
}
