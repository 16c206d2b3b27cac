package com.stagedsignal.backtester.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stagedsignal.backtester.domain.BacktestEngine;
import com.stagedsignal.backtester.domain.EquityPoint;
import com.stagedsignal.backtester.domain.ReasonCode;
import com.stagedsignal.backtester.domain.RunMode;
import com.stagedsignal.backtester.domain.RunStatus;
import com.stagedsignal.backtester.domain.Trade;
import com.stagedsignal.backtester.domain.TradeType;
import com.stagedsignal.backtester.domain.signal.StageFunnel;
import com.stagedsignal.backtester.domain.signal.StageId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for BacktestReportWriter.
 */
class BacktestReportWriterTest {

    private static final LocalDateTime DAY = LocalDateTime.of(2024, 1, 5, 0, 0);

    private ObjectMapper objectMapper;
    private BacktestReportWriter reportWriter;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        reportWriter = new BacktestReportWriter(objectMapper);
    }

    @Test
    void testToJson_ContainsEverySection() throws Exception {
        // Act
        JsonNode report = objectMapper.readTree(reportWriter.toJson(result()));

        // Assert
        assertEquals("run-1", report.get("runId").asText());
        assertEquals("COMPLETED", report.get("status").asText());
        assertEquals("RETROSPECTIVE", report.get("mode").asText());
        assertEquals("default", report.get("profile").asText());
        assertEquals(2, report.get("stepsCommitted").asInt());
        assertEquals(1, report.get("trades").size());
        assertEquals("AAPL", report.get("trades").get(0).get("ticker").asText());
        assertTrue(report.get("trades").get(0).get("timestamp").asText().startsWith("2024-01-05"),
                "Timestamps should be written as ISO text");
        assertEquals(1, report.get("equityHistory").size());
        assertTrue(report.get("rejections").isArray());
    }

    @Test
    void testToJson_FunnelKeyedByStageCode() throws Exception {
        // Act
        JsonNode funnel = objectMapper.readTree(reportWriter.toJson(result())).get("funnel");

        // Assert
        assertEquals(4, funnel.get("RS").get("input").asLong());
        assertEquals(2, funnel.get("RS").get("passed").asLong());
        assertEquals(0.5, funnel.get("RS").get("passRate").asDouble(), 1e-9);
        assertEquals(0, funnel.get("D").get("passRate").asDouble(), 1e-9,
                "Stage with no input reports a zero pass rate");
    }

    @Test
    void testWrite_ToFile(@TempDir Path dir) throws Exception {
        // Arrange
        Path file = dir.resolve("report.json");

        // Act
        reportWriter.write(result(), file);

        // Assert
        JsonNode report = objectMapper.readTree(Files.readString(file));
        assertEquals("run-1", report.get("runId").asText());
    }

    private BacktestEngine.BacktestResult result() {
        Map<StageId, StageFunnel> funnel = new EnumMap<>(StageId.class);
        funnel.put(StageId.RELATIVE_STRENGTH, new StageFunnel(StageId.RELATIVE_STRENGTH, 4, 2, 0));
        funnel.put(StageId.DAILY, StageFunnel.empty(StageId.DAILY));

        return BacktestEngine.BacktestResult.builder()
                .runId("run-1")
                .status(RunStatus.COMPLETED)
                .profileName("default")
                .mode(RunMode.RETROSPECTIVE)
                .stepsCommitted(2)
                .trades(List.of(Trade.builder()
                        .sequence(1)
                        .positionId(1)
                        .ticker("AAPL")
                        .type(TradeType.ENTRY)
                        .quantity(10)
                        .price(new BigDecimal("100.0000"))
                        .timestamp(DAY)
                        .reason(ReasonCode.BREAKOUT_ENTRY)
                        .signalLabel("ONE_MONTH")
                        .build()))
                .equityHistory(List.of(EquityPoint.builder()
                        .timestamp(DAY)
                        .equity(new BigDecimal("100000.00"))
                        .cash(new BigDecimal("99000.00"))
                        .openPositions(1)
                        .realizedPnl(BigDecimal.ZERO)
                        .unrealizedPnl(BigDecimal.ZERO)
                        .build()))
                .rejections(List.of())
                .funnel(funnel)
                .finalEquity(new BigDecimal("100000.00"))
                .build();
    }
}
