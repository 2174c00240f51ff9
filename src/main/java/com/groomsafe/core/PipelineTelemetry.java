package com.groomsafe.core;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Step timings for a single assessment run. Never records message content.
 */
public final class PipelineTelemetry {
    public static final String STEP_EXTRACT = "EXTRACT";
    public static final String STEP_SCORE = "SCORE";
    public static final String STEP_EXPLAIN = "EXPLAIN";
    public static final String STEP_REPORT = "REPORT";

    private final UUID conversationId;
    private final Instant startedAt;
    private Instant finishedAt;
    private int errorsTotal;

    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Deque<Long>> stepStartsNanos = new HashMap<>();

    public PipelineTelemetry(UUID conversationId, Instant startedAt) {
        this.conversationId = conversationId;
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
    }

    public synchronized void startStep(String name) {
        String key = sanitizeStepName(name);
        steps.putIfAbsent(key, new StepStat(key));
        stepStartsNanos.computeIfAbsent(key, ignored -> new ArrayDeque<>()).push(System.nanoTime());
    }

    public synchronized void endStep(String name, long items, long errorCount) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        long startedNanos = 0L;
        Deque<Long> stack = stepStartsNanos.get(key);
        if (stack != null && !stack.isEmpty()) {
            startedNanos = stack.pop();
        }
        long elapsedMicros = startedNanos <= 0L
                ? 0L
                : Math.max(0L, (System.nanoTime() - startedNanos) / 1_000L);
        stat.elapsedMicros += elapsedMicros;
        stat.items += Math.max(0L, items);
        stat.errorCount += Math.max(0L, errorCount);
        if (errorCount > 0L) {
            errorsTotal += (int) errorCount;
        }
    }

    public synchronized void finish() {
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
    }

    public synchronized int errorsTotal() {
        return errorsTotal;
    }

    public synchronized long totalElapsedMs() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        return Math.max(0L, Duration.between(startedAt, end).toMillis());
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(stat.name, stat.elapsedMicros, stat.items, stat.errorCount));
        }
        return out;
    }

    /**
     * One line, suitable for a single INFO log entry.
     */
    public synchronized String summaryLine() {
        StringBuilder sb = new StringBuilder();
        sb.append("conversation=").append(conversationId);
        sb.append(" total_ms=").append(totalElapsedMs());
        sb.append(" errors=").append(errorsTotal);
        for (StepStat stat : steps.values()) {
            sb.append(String.format(Locale.US, " %s_us=%d", stat.name.toLowerCase(Locale.ROOT), stat.elapsedMicros));
        }
        return sb.toString();
    }

    private String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private static final class StepStat {
        private final String name;
        private long elapsedMicros;
        private long items;
        private long errorCount;

        private StepStat(String name) {
            this.name = name;
        }
    }

    public record StepRecord(String name, long elapsedMicros, long items, long errorCount) {
    }
}
