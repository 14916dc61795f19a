package com.stocksync.scheduler;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Mutable post-job bookkeeping owned by one {@link TimeWindowScheduler}.
 */
public final class SchedulerState {
    private LocalDate lastPostJobCompletedDate;
    private Instant windowClosedAt;

    public SchedulerState() {
    }

    public SchedulerState(LocalDate lastPostJobCompletedDate, Instant windowClosedAt) {
        this.lastPostJobCompletedDate = lastPostJobCompletedDate;
        this.windowClosedAt = windowClosedAt;
    }

    public LocalDate lastPostJobCompletedDate() {
        return lastPostJobCompletedDate;
    }

    public Instant windowClosedAt() {
        return windowClosedAt;
    }

    void markPostJobCompleted(LocalDate date) {
        this.lastPostJobCompletedDate = date;
        this.windowClosedAt = null;
    }

    void clearPostJobCompleted() {
        this.lastPostJobCompletedDate = null;
    }

    void markWindowClosed(Instant at) {
        this.windowClosedAt = at;
    }

    void clearWindowClosed() {
        this.windowClosedAt = null;
    }

    boolean isDoneOn(LocalDate date) {
        return lastPostJobCompletedDate != null && lastPostJobCompletedDate.equals(date);
    }

    SchedulerState copy() {
        return new SchedulerState(lastPostJobCompletedDate, windowClosedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SchedulerState other)) {
            return false;
        }
        return Objects.equals(lastPostJobCompletedDate, other.lastPostJobCompletedDate)
                && Objects.equals(windowClosedAt, other.windowClosedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lastPostJobCompletedDate, windowClosedAt);
    }

    @Override
    public String toString() {
        return "SchedulerState{lastPostJobCompletedDate=" + lastPostJobCompletedDate
                + ", windowClosedAt=" + windowClosedAt + "}";
    }
}
