package com.stocksync.scheduler;

import com.stocksync.core.TaskResult;

/**
 * Callback invoked from the scheduler thread. Failures are reported through the result.
 */
@FunctionalInterface
public interface ScheduledTask {
    TaskResult run();
}
