package com.tickerlink.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunTelemetryTest {

    @Test
    void summaryShouldContainRequiredFields() {
        RunTelemetry telemetry = new RunTelemetry("RECONCILE", Instant.parse("2024-06-10T00:00:00Z"));
        telemetry.startStep(RunTelemetry.STEP_HISTORY_FETCH);
        telemetry.endStep(RunTelemetry.STEP_HISTORY_FETCH, 3, 250, 1);
        telemetry.startStep(RunTelemetry.STEP_MERGE);
        telemetry.endStep(RunTelemetry.STEP_MERGE, 12, 9, 0);
        telemetry.channelScanned(250);
        telemetry.channelSkipped("c9", "HTTP 503");
        telemetry.finish();

        String summary = telemetry.getSummary();

        assertTrue(summary.contains("run_mode=RECONCILE"));
        assertTrue(summary.contains("total_elapsed_ms="));
        assertTrue(summary.contains("channels_scanned=1"));
        assertTrue(summary.contains("channels_skipped=1"));
        assertTrue(summary.contains("messages_scanned=250"));
        assertTrue(summary.contains("errors_total=1"));
        assertTrue(summary.contains("steps:"));
        assertTrue(summary.contains("HISTORY_FETCH elapsed_ms="));
        assertTrue(summary.contains("note=skipped c9: HTTP 503"));
    }

    @Test
    void endStep_shouldAccumulateRepeatedSteps() {
        RunTelemetry telemetry = new RunTelemetry(null, null);
        telemetry.startStep("extract");
        telemetry.endStep("extract", 2, 1, 0);
        telemetry.startStep("extract");
        telemetry.endStep("extract", 3, 2, 0);

        RunTelemetry.StepRecord step = telemetry.stepRecords().get(0);

        assertEquals("EXTRACT", step.name());
        assertEquals(5, step.itemsIn());
        assertEquals(3, step.itemsOut());
        assertEquals("RECONCILE", telemetry.runMode());
    }
}
