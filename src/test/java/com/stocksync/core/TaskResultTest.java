package com.stocksync.core;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskResultTest {

    @Test
    void skippedCountsAsSuccess() {
        TaskResult result = TaskResult.skipped("no files to send");

        assertTrue(result.isSuccess());
        assertFalse(result.isFailure());
        assertEquals(TaskStatus.SKIPPED, result.status());
    }

    @Test
    void missingStatusMeansFailure() {
        TaskResult result = new TaskResult(null, null, null);

        assertTrue(result.isFailure());
        assertEquals("", result.reason());
        assertTrue(result.evidence().isEmpty());
    }

    @Test
    void logLineKeepsEvidenceOrderAndDropsNulls() {
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("scanned", 3);
        evidence.put("missing", null);
        evidence.put("transferred", 2);

        String line = TaskResult.ok("upload finished", evidence).toLogLine();

        assertEquals("status=OK, reason=upload finished, scanned=3, transferred=2", line);
    }

    @Test
    void evidenceIsDetachedFromCallerMap() {
        Map<String, Object> evidence = new HashMap<>();
        evidence.put("failed", 1);
        TaskResult result = TaskResult.failed("upload incomplete", evidence);

        evidence.put("failed", 5);

        assertEquals(1, result.evidence().get("failed"));
    }
}
