package com.tradingassistant.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunTelemetryTest {

    @Test
    void summary_shouldContainStepCountsAndErrors() {
        RunTelemetry telemetry = new RunTelemetry("manual", Instant.parse("2026-01-02T00:00:00Z"));
        telemetry.startStep(RunTelemetry.STEP_FILTER);
        telemetry.endStep(RunTelemetry.STEP_FILTER, 10, 4, 0);
        telemetry.startStep(RunTelemetry.STEP_SCORE);
        telemetry.endStep(RunTelemetry.STEP_SCORE, 4, 3, 1, "ticker failed");
        telemetry.finish();

        String summary = telemetry.getSummary();
        assertTrue(summary.contains("trigger=manual"));
        assertTrue(summary.contains("started_at=2026-01-02T00:00:00Z"));
        assertTrue(summary.contains("errors_total=1"));
        assertTrue(summary.contains("FILTER elapsed_ms="));
        assertTrue(summary.contains("in=10 out=4 err=0"));
        assertTrue(summary.contains("note=ticker failed"));
        assertEquals(1, telemetry.errorsTotal());
    }

    @Test
    void stepRecords_shouldKeepInsertionOrderAndNormalizeNames() {
        RunTelemetry telemetry = new RunTelemetry(null, null);
        telemetry.startStep("rank");
        telemetry.endStep("rank", 3, 2, 0);
        telemetry.endStep(" ", 0, 0, 0);

        List<RunTelemetry.StepRecord> records = telemetry.stepRecords();
        assertEquals("RANK", records.get(0).name());
        assertEquals(2, records.get(0).itemsOut());
        assertEquals("UNKNOWN_STEP", records.get(1).name());
        assertEquals("manual", telemetry.trigger());
    }
}
