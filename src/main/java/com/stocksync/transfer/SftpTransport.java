package com.stocksync.transfer;

import com.jcraft.jsch.ChannelSftp;
import com.jcraft.jsch.HostKey;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Log4j2Logger;
import com.jcraft.jsch.Session;
import com.jcraft.jsch.SftpATTRS;
import com.jcraft.jsch.SftpException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.Vector;

/**
 * JSch-backed SFTP session with a pinned host key and password authentication.
 */
public final class SftpTransport implements FileTransport {
    private static final Logger LOG = LogManager.getLogger(SftpTransport.class);
    private static final String PART_SUFFIX = ".part";

    static {
        JSch.setLogger(new Log4j2Logger());
    }

    private final SftpSettings settings;
    private final Session session;
    private final ChannelSftp channel;

    private SftpTransport(SftpSettings settings, Session session, ChannelSftp channel) {
        this.settings = settings;
        this.session = session;
        this.channel = channel;
    }

    public static TransportFactory factory(SftpSettings settings) {
        return () -> connect(settings);
    }

    public static SftpTransport connect(SftpSettings settings) throws TransportException {
        Session connectedSession = null;
        ChannelSftp connectedChannel = null;
        LOG.info("Connecting to SFTP server {}:{}...", settings.host(), settings.port());
        try {
            JSch jsch = new JSch();
            HostKey expected = HostKeys.parse(settings.host(), settings.port(), settings.hostKey());
            jsch.getHostKeyRepository().add(expected, null);

            connectedSession = jsch.getSession(settings.user(), settings.host(), settings.port());
            connectedSession.setPassword(settings.password());
            Properties sessionConfig = new Properties();
            sessionConfig.setProperty("StrictHostKeyChecking", "yes");
            sessionConfig.setProperty("PreferredAuthentications", "password,keyboard-interactive");
            connectedSession.setConfig(sessionConfig);

            int timeoutMillis = settings.timeoutSeconds() * 1_000;
            connectedSession.setTimeout(timeoutMillis);
            connectedSession.connect(timeoutMillis);

            connectedChannel = (ChannelSftp) connectedSession.openChannel("sftp");
            connectedChannel.connect(timeoutMillis);
        } catch (JSchException | IllegalArgumentException e) {
            if (connectedChannel != null) {
                connectedChannel.disconnect();
            }
            if (connectedSession != null) {
                connectedSession.disconnect();
            }
            LOG.error("SFTP connection to {} failed: {}", settings.endpoint(), e.getMessage());
            throw new TransportException("SFTP connection failed: " + settings.endpoint(), e);
        }
        LOG.info("SFTP connection established.");
        return new SftpTransport(settings, connectedSession, connectedChannel);
    }

    @Override
    public boolean upload(Path localPath, String remotePath) {
        try {
            ensureRemoteDirectory(RemotePaths.parent(remotePath));
            channel.put(localPath.toString(), remotePath, ChannelSftp.OVERWRITE);
            LOG.info("Uploaded {} to {}", localPath, remotePath);
            return true;
        } catch (SftpException e) {
            LOG.error("Upload of {} to {} failed: {}", localPath, remotePath, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean download(String remotePath, Path localPath) {
        Path part = localPath.resolveSibling(localPath.getFileName() + PART_SUFFIX);
        try {
            channel.get(remotePath, part.toString());
            Files.move(part, localPath);
            LOG.info("Downloaded {} to {}", remotePath, localPath);
            return true;
        } catch (SftpException | IOException e) {
            LOG.error("Download of {} to {} failed: {}", remotePath, localPath, e.getMessage());
            deleteQuietly(part);
            return false;
        }
    }

    @Override
    public List<String> list(String remoteDir) throws TransportException {
        Vector<ChannelSftp.LsEntry> entries;
        try {
            entries = channel.ls(remoteDir);
        } catch (SftpException e) {
            if (isNoSuchFileError(e)) {
                return List.of();
            }
            throw new TransportException("SFTP listing failed for " + remoteDir + ": " + e.getMessage(), e);
        }
        List<String> out = new ArrayList<>();
        for (ChannelSftp.LsEntry entry : entries) {
            SftpATTRS attrs = entry.getAttrs();
            if (attrs != null && attrs.isReg()) {
                out.add(entry.getFilename());
            }
        }
        return out;
    }

    @Override
    public boolean delete(String remotePath) {
        try {
            channel.rm(remotePath);
            return true;
        } catch (SftpException e) {
            LOG.error("Remote delete of {} failed: {}", remotePath, e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        if (channel != null && channel.isConnected()) {
            channel.disconnect();
        }
        if (session != null && session.isConnected()) {
            session.disconnect();
        }
        LOG.info("SFTP connection to {} closed.", settings.host());
    }

    private void ensureRemoteDirectory(String remoteDirectory) throws SftpException {
        if (remoteDirectory.isEmpty() || "/".equals(remoteDirectory)) {
            return;
        }
        StringBuilder current = new StringBuilder(remoteDirectory.startsWith("/") ? "/" : "");
        for (String part : remoteDirectory.split("/")) {
            if (part.isBlank()) {
                continue;
            }
            if (current.length() > 0 && current.charAt(current.length() - 1) != '/') {
                current.append('/');
            }
            current.append(part);
            String path = current.toString();
            try {
                channel.stat(path);
            } catch (SftpException e) {
                if (!isNoSuchFileError(e)) {
                    throw e;
                }
                channel.mkdir(path);
            }
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Could not remove partial download {}: {}", path, e.getMessage());
        }
    }

    private static boolean isNoSuchFileError(SftpException exception) {
        return exception.id == ChannelSftp.SSH_FX_NO_SUCH_FILE;
    }
}
