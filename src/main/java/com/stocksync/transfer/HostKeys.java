package com.stocksync.transfer;

import com.jcraft.jsch.HostKey;
import com.jcraft.jsch.JSchException;

import java.util.Base64;
import java.util.Locale;

/**
 * Parses a pinned host key written as {@code <algorithm> <bits> <base64>}.
 */
public final class HostKeys {
    private HostKeys() {
    }

    public static HostKey parse(String host, int port, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("sftp.host_key must be set (format: '<algorithm> <bits> <base64>')");
        }
        String[] parts = raw.trim().split("\\s+");
        if (parts.length < 3) {
            throw new IllegalArgumentException("sftp.host_key must look like '<algorithm> <bits> <base64>', got " + parts.length + " field(s)");
        }
        int type = typeOf(parts[0]);
        byte[] key;
        try {
            key = Base64.getDecoder().decode(parts[2]);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("sftp.host_key is not valid base64", e);
        }
        try {
            return new HostKey(knownHostsName(host, port), type, key);
        } catch (JSchException e) {
            throw new IllegalArgumentException("sftp.host_key could not be loaded: " + e.getMessage(), e);
        }
    }

    static String knownHostsName(String host, int port) {
        return port == 22 ? host : "[" + host + "]:" + port;
    }

    private static int typeOf(String algorithm) {
        switch (algorithm.toLowerCase(Locale.ROOT)) {
            case "ssh-rsa":
                return HostKey.SSHRSA;
            case "ssh-dss":
                return HostKey.SSHDSS;
            case "ssh-ed25519":
                return HostKey.ED25519;
            case "ecdsa-sha2-nistp256":
                return HostKey.ECDSA256;
            case "ecdsa-sha2-nistp384":
                return HostKey.ECDSA384;
            case "ecdsa-sha2-nistp521":
                return HostKey.ECDSA521;
            default:
                throw new IllegalArgumentException("unknown host key algorithm: " + algorithm);
        }
    }
}
