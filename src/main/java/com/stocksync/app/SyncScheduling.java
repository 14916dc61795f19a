package com.stocksync.app;

import com.stocksync.config.ScheduleConfig;
import com.stocksync.scheduler.SchedulerState;
import com.stocksync.scheduler.ScheduledTask;
import com.stocksync.scheduler.TimeWindowScheduler;
import com.stocksync.state.SchedulerStateStore;
import com.stocksync.sync.SyncOrchestrator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Wires a {@link TimeWindowScheduler} to the sync cycle: the main job and, when enabled,
 * a final sweep after the window closes.
 */
final class SyncScheduling {
    private static final Logger LOG = LogManager.getLogger(SyncScheduling.class);

    private SyncScheduling() {
    }

    static TimeWindowScheduler create(
            ScheduleConfig schedule,
            SyncOrchestrator orchestrator,
            boolean postExecutionEnabled,
            Path stateFile
    ) {
        ScheduledTask job = orchestrator::runCycle;
        ScheduledTask postJob = null;
        if (postExecutionEnabled) {
            postJob = () -> {
                LOG.info("Running final sweep after the execution window.");
                return orchestrator.runCycle();
            };
        }

        SchedulerState initial = null;
        Consumer<SchedulerState> listener = null;
        if (stateFile != null) {
            SchedulerStateStore store = new SchedulerStateStore(stateFile);
            initial = store.load();
            listener = state -> {
                try {
                    store.save(state);
                } catch (IOException e) {
                    LOG.error("Could not persist scheduler state to {}: {}", store.path(), e.getMessage(), e);
                }
            };
            LOG.info("Scheduler state persisted at {} ({}).", stateFile, initial);
        }
        return new TimeWindowScheduler(schedule, job, postJob, null, null, initial, listener);
    }
}
