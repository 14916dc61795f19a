package com.stocksync.transfer;

import java.nio.file.Path;
import java.util.List;

/**
 * Open transfer session. Per-file operations report failure through their return value;
 * {@link #list(String)} throws when the session itself is unusable.
 */
public interface FileTransport extends AutoCloseable {

    boolean upload(Path localPath, String remotePath);

    boolean download(String remotePath, Path localPath);

    /**
     * Names of the regular files directly inside {@code remoteDir}; empty when the directory does not exist.
     */
    List<String> list(String remoteDir) throws TransportException;

    boolean delete(String remotePath);

    @Override
    void close();
}
