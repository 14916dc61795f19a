package com.stocksync.app;

import com.stocksync.config.Config;
import com.stocksync.config.ScheduleConfig;
import com.stocksync.core.TaskResult;
import com.stocksync.db.Database;
import com.stocksync.db.MyBatisRecordSession;
import com.stocksync.scheduler.TimeWindowScheduler;
import com.stocksync.sync.DestinationCodeDao;
import com.stocksync.sync.SyncOrchestrator;
import com.stocksync.sync.SyncPlan;
import com.stocksync.transfer.SftpSettings;
import com.stocksync.transfer.SftpTransport;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionGroup;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

public final class StockSyncApplication {
    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_INTERRUPTED = 130;

    private static final int DEFAULT_SHUTDOWN_GRACE_MINUTES = 5;
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    private final boolean routeStdStreams;

    public StockSyncApplication() {
        this(true);
    }

    StockSyncApplication(boolean routeStdStreams) {
        this.routeStdStreams = routeStdStreams;
    }

    public static void main(String[] args) {
        int exit = new StockSyncApplication().run(args);
        // On 130 the JVM is already running shutdown hooks; System.exit would block on them.
        if (exit != EXIT_INTERRUPTED) {
            System.exit(exit);
        }
    }

    public int run(String[] args) {
        return run(args, Path.of(".").toAbsolutePath().normalize());
    }

    int run(String[] args, Path workingDir) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args == null ? new String[0] : args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("stock-sync", options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("stock-sync", options);
            return EXIT_OK;
        }

        Config config = Config.load(workingDir);
        if (routeStdStreams) {
            installLogRoutingIfNeeded(config);
        }
        Logger log = LogManager.getLogger(StockSyncApplication.class);

        ScheduleConfig schedule;
        SyncOrchestrator orchestrator;
        try {
            schedule = ScheduleConfig.fromConfig(config);
            shutdownGrace(config);
            orchestrator = buildOrchestrator(config, log);
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_USAGE;
        }

        try {
            if (cmd.hasOption("upload-only")) {
                return exitCodeOf(orchestrator.syncLocalToRemote());
            }
            if (cmd.hasOption("download-only")) {
                return exitCodeOf(orchestrator.syncRemoteToLocal());
            }
            if (cmd.hasOption("once") || !schedule.enabled()) {
                if (!schedule.enabled()) {
                    log.info("Schedule disabled, running a single synchronization cycle.");
                }
                return exitCodeOf(orchestrator.runCycle());
            }
            return runSchedule(config, schedule, orchestrator, log);
        } catch (Exception e) {
            log.fatal("FATAL: {}", e.getMessage(), e);
            return EXIT_FATAL;
        }
    }

    private SyncOrchestrator buildOrchestrator(Config config, Logger log) {
        SftpSettings sftp = SftpSettings.fromConfig(config);
        Database database = new Database(
                config.getString("db.url"),
                config.getString("db.user"),
                config.getString("db.pass"),
                config.getString("db.schema")
        );
        SyncPlan plan = SyncPlan.fromConfig(config);
        DestinationCodeDao codeDao = DestinationCodeDao.fromConfig(config);

        log.info("RUN_CONFIG sftp={} (host_key from {}), db={} schema={}, export={}, import={}, remote_base={}, passes={}",
                sftp.endpoint(),
                config.sourceOf("sftp.host_key"),
                database.maskedJdbcUrl(),
                database.schema(),
                plan.exportDir(),
                plan.importDir(),
                plan.remoteBasePath(),
                plan.passes().size());

        return new SyncOrchestrator(plan, SftpTransport.factory(sftp), MyBatisRecordSession.factory(database), codeDao);
    }

    private int runSchedule(Config config, ScheduleConfig schedule, SyncOrchestrator orchestrator, Logger log) {
        String stateFile = config.getString("schedule.state_file");
        TimeWindowScheduler scheduler = SyncScheduling.create(
                schedule,
                orchestrator,
                config.getBoolean("post_execution.enabled", true),
                stateFile.isEmpty() ? null : config.getPath("schedule.state_file")
        );

        Duration grace = shutdownGrace(config);
        Thread loopThread = Thread.currentThread();
        Thread hook = new Thread(() -> {
            scheduler.requestStop();
            try {
                // The JVM exits when the hook returns, cutting off any transfer still running.
                loopThread.join(grace.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "stock-sync-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        log.info("Schedule mode started. {}", schedule.describe());
        try {
            scheduler.start();
        } finally {
            if (!scheduler.isStopRequested()) {
                try {
                    Runtime.getRuntime().removeShutdownHook(hook);
                } catch (IllegalStateException e) {
                    log.debug("Shutdown already in progress: {}", e.getMessage());
                }
            }
        }

        if (scheduler.isStopRequested() || Thread.currentThread().isInterrupted()) {
            log.info("Scheduler stopped on shutdown request.");
            return EXIT_INTERRUPTED;
        }
        return EXIT_OK;
    }

    /**
     * How long a shutdown request waits for the current tick. Zero waits until the tick completes.
     */
    static Duration shutdownGrace(Config config) {
        int minutes = config.getInt("shutdown.grace_minutes", DEFAULT_SHUTDOWN_GRACE_MINUTES);
        if (minutes < 0) {
            throw new IllegalArgumentException("shutdown.grace_minutes must be >= 0: " + minutes);
        }
        return Duration.ofMinutes(minutes);
    }

    private int exitCodeOf(TaskResult result) {
        return result.isFailure() ? EXIT_FATAL : EXIT_OK;
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (StockSyncApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("log.dir");
                Files.createDirectories(logDir);
                System.setProperty("stocksync.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(StockSyncApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        OptionGroup modes = new OptionGroup();
        modes.addOption(Option.builder().longOpt("once").desc("run one full synchronization cycle (upload, then download) and exit").build());
        modes.addOption(Option.builder().longOpt("upload-only").desc("send local export files to SFTP once and exit").build());
        modes.addOption(Option.builder().longOpt("download-only").desc("poll remote inbound folders once and exit").build());
        options.addOptionGroup(modes);
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
