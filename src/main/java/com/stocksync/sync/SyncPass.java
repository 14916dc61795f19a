package com.stocksync.sync;

import com.stocksync.routing.RoutingTable;

import java.nio.file.Path;

/**
 * One outbound unit: a source directory, its routing rules and the archive directory.
 */
public record SyncPass(String name, Path sourceDir, RoutingTable rules, Path archiveDir) {
    public SyncPass {
        if (sourceDir == null || archiveDir == null) {
            throw new IllegalArgumentException("sync pass " + name + " needs source and archive directories");
        }
        rules = rules == null ? new RoutingTable(null) : rules;
        name = name == null || name.isBlank() ? sourceDir.getFileName().toString() : name;
    }
}
