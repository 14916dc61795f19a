package com.stocksync.transfer;

import java.util.StringJoiner;

public final class RemotePaths {
    private RemotePaths() {
    }

    /**
     * Joins path segments with '/', collapsing duplicate and backslash separators.
     * A leading '/' on the first segment is kept.
     */
    public static String join(String... segments) {
        StringJoiner joiner = new StringJoiner("/");
        boolean absolute = false;
        boolean first = true;
        for (String segment : segments) {
            if (segment == null) {
                continue;
            }
            String normalized = segment.trim().replace('\\', '/');
            if (first && normalized.startsWith("/")) {
                absolute = true;
            }
            first = false;
            for (String part : normalized.split("/")) {
                if (!part.isEmpty()) {
                    joiner.add(part);
                }
            }
        }
        return (absolute ? "/" : "") + joiner;
    }

    public static String parent(String remotePath) {
        int idx = remotePath.lastIndexOf('/');
        if (idx < 0) {
            return "";
        }
        if (idx == 0) {
            return "/";
        }
        return remotePath.substring(0, idx);
    }

    public static String fileName(String remotePath) {
        int idx = remotePath.lastIndexOf('/');
        return idx < 0 ? remotePath : remotePath.substring(idx + 1);
    }
}
