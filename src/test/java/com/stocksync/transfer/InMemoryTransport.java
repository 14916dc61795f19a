package com.stocksync.transfer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Remote file system kept in memory, with switchable per-file and listing failures.
 */
public final class InMemoryTransport implements FileTransport {
    private final Map<String, byte[]> remote = new TreeMap<>();
    private final Set<String> failingUploads = new HashSet<>();
    private final Set<String> failingDownloads = new HashSet<>();
    private final Set<String> failingListings = new HashSet<>();
    private final List<String> uploads = new ArrayList<>();
    private final List<String> listings = new ArrayList<>();
    private Consumer<Path> afterUpload = path -> { };
    private int closeCount;

    public InMemoryTransport putRemote(String remotePath, String content) {
        remote.put(remotePath, content.getBytes());
        return this;
    }

    public InMemoryTransport failUploadOf(String filename) {
        failingUploads.add(filename);
        return this;
    }

    public InMemoryTransport failDownloadOf(String filename) {
        failingDownloads.add(filename);
        return this;
    }

    public InMemoryTransport failListingOf(String remoteDir) {
        failingListings.add(remoteDir);
        return this;
    }

    public InMemoryTransport afterUpload(Consumer<Path> hook) {
        this.afterUpload = hook;
        return this;
    }

    public boolean hasRemote(String remotePath) {
        return remote.containsKey(remotePath);
    }

    public Set<String> remotePaths() {
        return remote.keySet();
    }

    public List<String> uploads() {
        return uploads;
    }

    public List<String> listings() {
        return listings;
    }

    public int closeCount() {
        return closeCount;
    }

    @Override
    public boolean upload(Path localPath, String remotePath) {
        uploads.add(remotePath);
        if (failingUploads.contains(RemotePaths.fileName(remotePath))) {
            return false;
        }
        try {
            remote.put(remotePath, Files.readAllBytes(localPath));
        } catch (IOException e) {
            return false;
        }
        afterUpload.accept(localPath);
        return true;
    }

    @Override
    public boolean download(String remotePath, Path localPath) {
        byte[] content = remote.get(remotePath);
        if (content == null || failingDownloads.contains(RemotePaths.fileName(remotePath))) {
            return false;
        }
        try {
            Files.write(localPath, content, StandardOpenOption.CREATE_NEW);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    @Override
    public List<String> list(String remoteDir) throws TransportException {
        listings.add(remoteDir);
        if (failingListings.contains(remoteDir)) {
            throw new TransportException("connection reset while listing " + remoteDir);
        }
        List<String> out = new ArrayList<>();
        for (String path : remote.keySet()) {
            if (RemotePaths.parent(path).equals(remoteDir)) {
                out.add(RemotePaths.fileName(path));
            }
        }
        return out;
    }

    @Override
    public boolean delete(String remotePath) {
        return remote.remove(remotePath) != null;
    }

    @Override
    public void close() {
        closeCount++;
    }
}
