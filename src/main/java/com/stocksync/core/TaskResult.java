package com.stocksync.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Outcome of a scheduled callback or sync step. {@link TaskStatus#SKIPPED} means there was nothing to do.
 */
public record TaskResult(
        TaskStatus status,
        String reason,
        Map<String, Object> evidence
) {
    public TaskResult {
        status = status == null ? TaskStatus.FAILED : status;
        reason = reason == null ? "" : reason;
        Map<String, Object> copy = evidence == null ? Map.of() : new LinkedHashMap<>(evidence);
        copy.values().removeIf(v -> v == null);
        evidence = Collections.unmodifiableMap(copy);
    }

    public static TaskResult ok(String reason) {
        return new TaskResult(TaskStatus.OK, reason, Map.of());
    }

    public static TaskResult ok(String reason, Map<String, Object> evidence) {
        return new TaskResult(TaskStatus.OK, reason, evidence);
    }

    public static TaskResult skipped(String reason) {
        return new TaskResult(TaskStatus.SKIPPED, reason, Map.of());
    }

    public static TaskResult failed(String reason) {
        return new TaskResult(TaskStatus.FAILED, reason, Map.of());
    }

    public static TaskResult failed(String reason, Map<String, Object> evidence) {
        return new TaskResult(TaskStatus.FAILED, reason, evidence);
    }

    public boolean isSuccess() {
        return status != TaskStatus.FAILED;
    }

    public boolean isFailure() {
        return status == TaskStatus.FAILED;
    }

    public String toLogLine() {
        String details = evidence.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
        return "status=" + status + ", reason=" + reason + (details.isEmpty() ? "" : ", " + details);
    }
}
