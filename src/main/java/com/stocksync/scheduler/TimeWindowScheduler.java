package com.stocksync.scheduler;

import com.stocksync.config.ScheduleConfig;
import com.stocksync.core.TaskResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Tick-driven gate around a main job and a once-per-day post-window job.
 *
 * <p>Every tick runs the main job when the schedule is enabled, the month is allowed and the
 * time of day is inside the window. Independently, once the window is observed closed, the
 * post-job fires after {@code postExecutionDelayMinutes} and then not again until the next day.
 * All callbacks run on the calling thread, one at a time. {@link #requestStop()} ends the loop
 * after the current tick without interrupting a callback.
 */
public final class TimeWindowScheduler {
    private static final Logger LOG = LogManager.getLogger(TimeWindowScheduler.class);

    private final ScheduleConfig config;
    private final ScheduledTask job;
    private final ScheduledTask postJob;
    private final Clock clock;
    private final Sleeper sleeper;
    private final SchedulerState state;
    private final Consumer<SchedulerState> stateListener;
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    public TimeWindowScheduler(ScheduleConfig config, ScheduledTask job, ScheduledTask postJob) {
        this(config, job, postJob, null, null, null, null);
    }

    public TimeWindowScheduler(
            ScheduleConfig config,
            ScheduledTask job,
            ScheduledTask postJob,
            Clock clock,
            Sleeper sleeper,
            SchedulerState initialState,
            Consumer<SchedulerState> stateListener
    ) {
        if (config == null || job == null) {
            throw new IllegalArgumentException("schedule config and job are required");
        }
        this.config = config;
        this.job = job;
        this.postJob = postJob;
        this.clock = clock == null ? Clock.system(config.zone()) : clock;
        this.sleeper = sleeper == null ? this::awaitStop : sleeper;
        this.state = initialState == null ? new SchedulerState() : initialState.copy();
        this.stateListener = stateListener;
    }

    public boolean isWithinTimeWindow() {
        return config.isWithinWindow(now().toLocalTime());
    }

    public boolean isAllowedMonth() {
        return config.isAllowedMonth(now().getMonthValue());
    }

    public boolean shouldRun() {
        if (!config.enabled()) {
            return false;
        }
        if (!isAllowedMonth()) {
            return false;
        }
        return isWithinTimeWindow();
    }

    /**
     * Runs until {@link #requestStop()} or an interrupt. Returns normally in both cases;
     * unexpected runtime faults in the loop itself propagate.
     */
    public void start() {
        if (!config.enabled()) {
            LOG.info("Schedule disabled in configuration, scheduler not started.");
            return;
        }

        if (config.runImmediately() && shouldRun()) {
            LOG.info("Running first synchronization immediately.");
            invoke("main", job);
        }

        LOG.info("Schedule configured: {}, post_job={}", config.describe(), postJob == null ? "none" : "configured");

        Duration interval = Duration.ofMinutes(config.intervalMinutes());
        try {
            handlePostExecution();
            while (!isStopRequested()) {
                sleeper.sleep(interval);
                if (isStopRequested()) {
                    break;
                }
                tick();
            }
            LOG.info("Stop requested, scheduler stopped.");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("Interrupt received, scheduler stopping.");
        } catch (RuntimeException e) {
            LOG.error("Unexpected scheduler failure: {}", e.getMessage(), e);
            throw e;
        }
    }

    public void requestStop() {
        stopSignal.countDown();
    }

    public boolean isStopRequested() {
        return stopSignal.getCount() == 0L;
    }

    /**
     * One scheduler tick: main-job gate, then post-job policy.
     */
    public void tick() {
        runScheduledJob();
        handlePostExecution();
    }

    void runScheduledJob() {
        if (shouldRun()) {
            LOG.info("Starting scheduled execution.");
            invoke("main", job);
        } else {
            LOG.debug("Execution not allowed now (disabled, month or window).");
        }
    }

    void handlePostExecution() {
        if (postJob == null) {
            return;
        }
        SchedulerState before = state.copy();
        try {
            evaluatePostExecution();
        } finally {
            if (stateListener != null && !before.equals(state)) {
                stateListener.accept(state.copy());
            }
        }
    }

    private void evaluatePostExecution() {
        LocalDateTime now = now();
        LocalDate today = now.toLocalDate();

        if (state.isDoneOn(today)) {
            state.clearWindowClosed();
            return;
        }

        if (!config.enabled() || !config.isAllowedMonth(now.getMonthValue())) {
            return;
        }

        if (config.isWithinWindow(now.toLocalTime())) {
            if (state.windowClosedAt() != null) {
                LOG.debug("Execution window reopened, post-job timer reset.");
                state.clearWindowClosed();
            }
            if (state.lastPostJobCompletedDate() != null) {
                state.clearPostJobCompleted();
            }
            return;
        }

        Instant instant = clock.instant();
        if (state.windowClosedAt() == null) {
            LOG.info("Execution window closed, post-job due in {} minutes.", config.postExecutionDelayMinutes());
            state.markWindowClosed(instant);
            return;
        }

        Duration sinceClosure = Duration.between(state.windowClosedAt(), instant);
        if (sinceClosure.compareTo(Duration.ofMinutes(config.postExecutionDelayMinutes())) < 0) {
            return;
        }

        LOG.info("Post-execution delay of {} minutes elapsed, running post-job.", config.postExecutionDelayMinutes());
        TaskResult result = invoke("post", postJob);
        if (result.isSuccess()) {
            state.markPostJobCompleted(today);
            LOG.info("Post-job completed for {}.", today);
        } else {
            state.clearWindowClosed();
        }
    }

    private TaskResult invoke(String label, ScheduledTask task) {
        TaskResult result;
        try {
            result = task.run();
            if (result == null) {
                result = TaskResult.failed("callback returned no result");
            }
        } catch (RuntimeException e) {
            LOG.error("Error running {} job: {}", label, e.getMessage(), e);
            return TaskResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        if (result.isFailure()) {
            LOG.error("{} job failed: {}", label, result.toLogLine());
        } else {
            LOG.info("{} job finished: {}", label, result.toLogLine());
        }
        return result;
    }

    SchedulerState state() {
        return state.copy();
    }

    private void awaitStop(Duration duration) throws InterruptedException {
        stopSignal.await(Math.max(0L, duration.toMillis()), TimeUnit.MILLISECONDS);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
