package com.stocksync.sync;

import com.stocksync.transfer.RemotePaths;

import java.util.List;

/**
 * Remote inbound folders polled for one destination code.
 */
public record RemoteFolderTarget(String code, List<String> folders) {
    static final String INBOUND_LEAF = "in";
    static final String RETURNS_FOLDER = "recolhas";

    public RemoteFolderTarget {
        folders = List.copyOf(folders);
    }

    /**
     * {@code <base>/<code>/in} and {@code <base>/<code>/recolhas/in}.
     */
    public static RemoteFolderTarget forCode(String basePath, String code) {
        return new RemoteFolderTarget(code, List.of(
                RemotePaths.join(basePath, code, INBOUND_LEAF),
                RemotePaths.join(basePath, code, RETURNS_FOLDER, INBOUND_LEAF)
        ));
    }
}
