package com.stocksync.sync;

import com.stocksync.core.TaskResult;
import com.stocksync.db.RecordSession;
import com.stocksync.db.RecordSessionFactory;
import com.stocksync.routing.FileRoutingEngine;
import com.stocksync.routing.PassResult;
import com.stocksync.transfer.TransportException;
import com.stocksync.transfer.TransportFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One synchronization cycle: outbound passes, then inbound polling of the remote folders of every
 * destination code. Both halves share one transport session, opened only when there is work.
 */
public final class SyncOrchestrator {
    private static final Logger LOG = LogManager.getLogger(SyncOrchestrator.class);

    private final SyncPlan plan;
    private final TransportFactory transports;
    private final RecordSessionFactory records;
    private final DestinationCodeDao codeDao;

    public SyncOrchestrator(
            SyncPlan plan,
            TransportFactory transports,
            RecordSessionFactory records,
            DestinationCodeDao codeDao
    ) {
        this.plan = plan;
        this.transports = transports;
        this.records = records;
        this.codeDao = codeDao;
    }

    public TaskResult runCycle() {
        LOG.info("Synchronization cycle started.");
        TaskResult upload;
        TaskResult download;
        try (CycleTransport session = new CycleTransport(transports)) {
            upload = upload(session);
            download = download(session);
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("upload", upload.status());
        evidence.put("download", download.status());
        TaskResult result;
        if (upload.isFailure() || download.isFailure()) {
            result = TaskResult.failed("sync cycle incomplete", evidence);
        } else {
            result = TaskResult.ok("sync cycle finished", evidence);
        }
        LOG.info("Synchronization cycle finished: {}", result.toLogLine());
        return result;
    }

    public TaskResult syncLocalToRemote() {
        try (CycleTransport session = new CycleTransport(transports)) {
            return upload(session);
        }
    }

    public TaskResult syncRemoteToLocal() {
        try (CycleTransport session = new CycleTransport(transports)) {
            return download(session);
        }
    }

    private TaskResult upload(CycleTransport transport) {
        LOG.info("Starting local folder to SFTP synchronization.");
        try {
            Files.createDirectories(plan.exportDir());
            Files.createDirectories(plan.archiveDir());
            for (SyncPass pass : plan.passes()) {
                Files.createDirectories(pass.sourceDir());
            }
            if (!hasPendingFiles()) {
                LOG.info("No files found in the sync folders. Nothing to do.");
                return TaskResult.skipped("no files to send");
            }
        } catch (IOException e) {
            LOG.error("Cannot prepare local sync folders: {}", e.getMessage(), e);
            return TaskResult.failed("local folders unavailable: " + e.getMessage());
        }

        PassResult total = PassResult.empty("upload");
        try {
            FileRoutingEngine engine = new FileRoutingEngine(transport.get());
            for (SyncPass pass : plan.passes()) {
                LOG.info("Running pass {} over {}", pass.name(), pass.sourceDir());
                total = total.plus(engine.processFolder(pass.sourceDir(), pass.rules(), pass.archiveDir(), plan.remoteBasePath()));
            }
        } catch (TransportException e) {
            transport.discard();
            LOG.error("SFTP session failed, upload aborted: {}", e.getMessage(), e);
            return TaskResult.failed("transport session failed: " + e.getMessage(), evidenceOf(total));
        } catch (IOException e) {
            LOG.error("Local folder error during upload: {}", e.getMessage(), e);
            return TaskResult.failed("local folder error: " + e.getMessage(), evidenceOf(total));
        }

        LOG.info("Local folder synchronization finished. {}", total.toLogLine());
        return TaskResult.ok("upload finished", evidenceOf(total));
    }

    private TaskResult download(CycleTransport transport) {
        LOG.info("Starting SFTP to local folder synchronization.");
        List<String> codes;
        try (RecordSession session = records.open()) {
            codes = codeDao.listCodes(session);
        } catch (SQLException e) {
            LOG.error("Could not load destination codes: {}", e.getMessage(), e);
            return TaskResult.failed("database unavailable: " + e.getMessage());
        }
        if (codes.isEmpty()) {
            LOG.info("No destination codes returned. Nothing to download.");
            return TaskResult.skipped("no destination codes");
        }
        LOG.info("Polling remote folders for {} destination code(s).", codes.size());

        PassResult total = PassResult.empty("download");
        int codesDone = 0;
        try {
            Files.createDirectories(plan.importDir());
            FileRoutingEngine engine = new FileRoutingEngine(transport.get());
            for (String code : codes) {
                RemoteFolderTarget target = RemoteFolderTarget.forCode(plan.remoteBasePath(), code);
                for (String folder : target.folders()) {
                    total = total.plus(engine.downloadFolder(folder, plan.importDir()));
                }
                codesDone++;
            }
        } catch (TransportException e) {
            transport.discard();
            LOG.error("SFTP session failed after {}/{} code(s), remaining codes skipped: {}",
                    codesDone, codes.size(), e.getMessage(), e);
            Map<String, Object> evidence = evidenceOf(total);
            evidence.put("codes_done", codesDone);
            evidence.put("codes_total", codes.size());
            return TaskResult.failed("transport session failed: " + e.getMessage(), evidence);
        } catch (IOException e) {
            LOG.error("Local import folder error: {}", e.getMessage(), e);
            return TaskResult.failed("local folder error: " + e.getMessage(), evidenceOf(total));
        }

        Map<String, Object> evidence = evidenceOf(total);
        evidence.put("codes_total", codes.size());
        LOG.info("Remote folder synchronization finished. {}", total.toLogLine());
        return TaskResult.ok("download finished", evidence);
    }

    private boolean hasPendingFiles() throws IOException {
        for (SyncPass pass : plan.passes()) {
            if (!Files.isDirectory(pass.sourceDir())) {
                continue;
            }
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(pass.sourceDir())) {
                for (Path entry : stream) {
                    if (Files.isRegularFile(entry)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private static Map<String, Object> evidenceOf(PassResult result) {
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("scanned", result.scanned());
        evidence.put("skipped", result.skipped());
        evidence.put("transferred", result.transferred());
        evidence.put("failed", result.failed());
        evidence.put("finalized", result.finalized());
        return evidence;
    }
}
