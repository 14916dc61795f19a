package com.stocksync.scheduler;

import java.time.Duration;

/**
 * Inter-tick wait. Implementations may return early when a stop was requested.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
}
