package com.stocksync.transfer;

import com.stocksync.config.Config;

/**
 * Connection settings for {@link SftpTransport}. The host key is validated on construction.
 */
public record SftpSettings(
        String host,
        int port,
        String user,
        String password,
        String hostKey,
        int timeoutSeconds
) {
    public SftpSettings {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("missing required config: sftp.host");
        }
        if (user == null || user.isBlank()) {
            throw new IllegalArgumentException("missing required config: sftp.user");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("sftp.port out of range: " + port);
        }
        host = host.trim();
        user = user.trim();
        password = password == null ? "" : password;
        timeoutSeconds = timeoutSeconds <= 0 ? 30 : timeoutSeconds;
        HostKeys.parse(host, port, hostKey);
    }

    public static SftpSettings fromConfig(Config config) {
        return new SftpSettings(
                config.getString("sftp.host"),
                config.getInt("sftp.port", 22),
                config.getString("sftp.user"),
                config.getString("sftp.password", ""),
                config.getString("sftp.host_key"),
                config.getInt("sftp.timeout_sec", 30)
        );
    }

    public String endpoint() {
        return "sftp://" + user + "@" + host + ":" + port;
    }

    @Override
    public String toString() {
        return "SftpSettings{" + endpoint() + ", timeout_sec=" + timeoutSeconds + "}";
    }
}
