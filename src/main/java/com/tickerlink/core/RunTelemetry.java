package com.tickerlink.core;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Step timings and counters for one reconciliation or replay run.
 */
public final class RunTelemetry {
    public static final String STEP_HISTORY_FETCH = "HISTORY_FETCH";
    public static final String STEP_EXTRACT = "EXTRACT";
    public static final String STEP_MERGE = "MERGE";
    public static final String STEP_INDEX_LOAD = "INDEX_LOAD";
    public static final String STEP_LIVE_REPLAY = "LIVE_REPLAY";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final String runMode;
    private final Instant startedAt;
    private Instant finishedAt;

    private int channelsScanned;
    private int channelsSkipped;
    private int messagesScanned;
    private int errorsTotal;
    private boolean cancelled;

    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Deque<Long>> stepStartsNanos = new HashMap<>();

    public RunTelemetry(String runMode, Instant startedAt) {
        this.runMode = blankTo(runMode, "RECONCILE");
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
    }

    public synchronized String runMode() {
        return runMode;
    }

    public synchronized void startStep(String name) {
        String key = sanitizeStepName(name);
        steps.putIfAbsent(key, new StepStat(key));
        stepStartsNanos.computeIfAbsent(key, ignored -> new ArrayDeque<>()).push(System.nanoTime());
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount) {
        endStep(name, itemsIn, itemsOut, errorCount, "");
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount, String optionalNote) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        long startedNanos = 0L;
        Deque<Long> stack = stepStartsNanos.get(key);
        if (stack != null && !stack.isEmpty()) {
            startedNanos = stack.pop();
        }
        long elapsedMs = startedNanos <= 0L
                ? 0L
                : Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
        stat.elapsedMs += elapsedMs;
        stat.itemsIn += Math.max(0L, itemsIn);
        stat.itemsOut += Math.max(0L, itemsOut);
        stat.errorCount += Math.max(0L, errorCount);
        appendNote(stat, optionalNote);
        if (errorCount > 0L) {
            errorsTotal += (int) errorCount;
        }
    }

    public synchronized void channelScanned(int messages) {
        channelsScanned++;
        messagesScanned += Math.max(0, messages);
    }

    public synchronized void channelSkipped(String channelId, String reason) {
        channelsSkipped++;
        appendNote(steps.computeIfAbsent(STEP_HISTORY_FETCH, StepStat::new),
                "skipped " + channelId + ": " + blankTo(reason, "unknown"));
    }

    public synchronized void markCancelled() {
        cancelled = true;
    }

    public synchronized int errorsTotal() {
        return errorsTotal;
    }

    public synchronized void finish() {
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(stat.name, stat.elapsedMs, stat.itemsIn, stat.itemsOut, stat.errorCount, stat.optionalNote));
        }
        return out;
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("run_mode=").append(runMode).append('\n');
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(Math.max(0L, Duration.between(startedAt, end).toMillis())).append('\n');
        sb.append("channels_scanned=").append(channelsScanned).append('\n');
        sb.append("channels_skipped=").append(channelsSkipped).append('\n');
        sb.append("messages_scanned=").append(messagesScanned).append('\n');
        sb.append("errors_total=").append(errorsTotal).append('\n');
        sb.append("cancelled=").append(cancelled).append('\n');
        sb.append("steps:\n");
        for (StepStat stat : steps.values()) {
            sb.append(String.format(
                    Locale.US,
                    "  %s elapsed_ms=%d in=%d out=%d err=%d",
                    stat.name,
                    stat.elapsedMs,
                    stat.itemsIn,
                    stat.itemsOut,
                    stat.errorCount
            ));
            if (!stat.optionalNote.isBlank()) {
                sb.append(" note=").append(stat.optionalNote.trim());
            }
            sb.append('\n');
        }
        return sb.toString().trim();
    }

    private static void appendNote(StepStat stat, String optionalNote) {
        if (optionalNote == null || optionalNote.trim().isEmpty()) {
            return;
        }
        String note = optionalNote.trim();
        if (stat.optionalNote.isEmpty()) {
            stat.optionalNote = note;
        } else if (!stat.optionalNote.contains(note)) {
            stat.optionalNote = stat.optionalNote + "; " + note;
        }
    }

    private static String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private static String blankTo(String value, String fallback) {
        String text = value == null ? "" : value.trim();
        return text.isEmpty() ? fallback : text;
    }

    private static final class StepStat {
        private final String name;
        private long elapsedMs;
        private long itemsIn;
        private long itemsOut;
        private long errorCount;
        private String optionalNote;

        private StepStat(String name) {
            this.name = name;
            this.optionalNote = "";
        }
    }

    public record StepRecord(
            String name,
            long elapsedMs,
            long itemsIn,
            long itemsOut,
            long errorCount,
            String optionalNote
    ) {
    }
}
