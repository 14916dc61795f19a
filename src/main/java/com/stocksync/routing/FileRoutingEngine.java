package com.stocksync.routing;

import com.stocksync.transfer.FileTransport;
import com.stocksync.transfer.RemotePaths;
import com.stocksync.transfer.TransportException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Moves files between a local directory and the transport.
 *
 * <p>Outbound: files matching a routing rule are uploaded to {@code base/<destination>/out/<name>}
 * and moved to the archive directory only after a successful upload. Unmatched files stay put.
 * Inbound: every remote file is downloaded and deleted remotely only after a successful download.
 * A remote file whose name is already present locally is left on the server.
 */
public final class FileRoutingEngine {
    private static final Logger LOG = LogManager.getLogger(FileRoutingEngine.class);
    static final String OUTBOUND_LEAF = "out";

    private final FileTransport transport;

    public FileRoutingEngine(FileTransport transport) {
        this.transport = transport;
    }

    public PassResult processFolder(Path sourceDir, RoutingTable rules, Path archiveDir, String baseRemotePath)
            throws IOException {
        String label = "upload:" + sourceDir.getFileName();
        if (!Files.isDirectory(sourceDir)) {
            LOG.warn("Local sync directory {} does not exist, nothing to upload.", sourceDir);
            return PassResult.empty(label);
        }

        List<Path> files = listRegularFiles(sourceDir);
        LOG.info("Found {} file(s) in {}.", files.size(), sourceDir);

        int skipped = 0;
        int failed = 0;
        List<Path> uploaded = new ArrayList<>();
        for (Path file : files) {
            String filename = file.getFileName().toString();
            Optional<String> destination = rules.resolve(filename);
            if (destination.isEmpty()) {
                LOG.debug("File {} has no routing destination, left in place.", filename);
                skipped++;
                continue;
            }

            String remotePath = remotePathFor(baseRemotePath, destination.get(), filename);
            LOG.info("Processing {}: uploading to {}", filename, remotePath);
            if (transport.upload(file, remotePath)) {
                uploaded.add(file);
            } else {
                failed++;
                LOG.error("Upload failed for {} -> {}. File kept locally for the next cycle.", filename, remotePath);
            }
        }

        int archived = 0;
        int vanished = 0;
        if (!uploaded.isEmpty()) {
            Files.createDirectories(archiveDir);
        }
        for (Path file : uploaded) {
            Path target = archiveDir.resolve(file.getFileName().toString());
            try {
                Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
                archived++;
                LOG.info("Archived {} to {}", file.getFileName(), target);
            } catch (NoSuchFileException e) {
                vanished++;
                LOG.warn("File {} disappeared before it could be archived, skipping.", file);
            } catch (IOException e) {
                LOG.error("Failed to archive {}: {}", file, e.getMessage());
            }
        }

        PassResult result = new PassResult(label, files.size(), skipped, uploaded.size(), failed, archived, vanished);
        LOG.info(result.toLogLine());
        return result;
    }

    public PassResult downloadFolder(String remoteFolder, Path localDir) throws TransportException, IOException {
        String label = "download:" + remoteFolder;
        List<String> names = transport.list(remoteFolder);
        if (names.isEmpty()) {
            LOG.debug("No files in remote folder {}.", remoteFolder);
            return PassResult.empty(label);
        }

        Files.createDirectories(localDir);
        LOG.info("Found {} remote file(s) in {}.", names.size(), remoteFolder);

        int downloaded = 0;
        int failed = 0;
        int deleted = 0;
        for (String name : names) {
            String remotePath = RemotePaths.join(remoteFolder, name);
            Path target = localDir.resolve(name);
            if (Files.exists(target)) {
                failed++;
                LOG.error("Local file {} already exists and has not been consumed yet. Remote file {} kept for the next cycle.",
                        target, remotePath);
                continue;
            }
            if (!transport.download(remotePath, target)) {
                failed++;
                LOG.error("Download failed for {}. Remote file kept for the next cycle.", remotePath);
                continue;
            }
            downloaded++;
            if (transport.delete(remotePath)) {
                deleted++;
            } else {
                LOG.error("Downloaded {} but could not delete it remotely.", remotePath);
            }
        }

        PassResult result = new PassResult(label, names.size(), 0, downloaded, failed, deleted, 0);
        LOG.info(result.toLogLine());
        return result;
    }

    static String remotePathFor(String baseRemotePath, String destination, String filename) {
        return RemotePaths.join(baseRemotePath, destination, OUTBOUND_LEAF, filename);
    }

    static List<Path> listRegularFiles(Path dir) throws IOException {
        List<Path> out = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path entry : stream) {
                if (Files.isRegularFile(entry)) {
                    out.add(entry);
                }
            }
        }
        return out;
    }
}
