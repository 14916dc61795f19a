package com.stocksync.sync;

import com.stocksync.config.Config;
import com.stocksync.routing.RoutingTable;

import java.nio.file.Path;
import java.util.List;

/**
 * Static layout of a sync cycle: local directories, outbound passes and the remote base path.
 */
public record SyncPlan(
        Path exportDir,
        Path archiveDir,
        Path importDir,
        String remoteBasePath,
        List<SyncPass> passes
) {
    public static final String DEFAULT_MAIN_RULES =
            "EDIEE(\\d{2}) => E{code}; RECE(\\d{2}) => E{code}; ^STOCKTOTAL => Magento; ^STOCKLOJA_ => StockporLoja";
    public static final String DEFAULT_RETURNS_RULES = "RECE(\\d{2}) => E{code}/recolhas";
    public static final String DEFAULT_RETURNS_SUBDIR = "recolhas";

    public SyncPlan {
        passes = List.copyOf(passes);
        remoteBasePath = remoteBasePath == null ? "" : remoteBasePath.trim();
    }

    public static SyncPlan fromConfig(Config config) {
        Path exportDir = config.getPath("sync.local.export_dir");
        Path archiveDir = config.getPath("sync.local.archive_dir");
        return of(
                exportDir,
                archiveDir,
                config.getPath("sync.local.import_dir"),
                config.getString("sftp.sync_base_path"),
                config.getString("sync.returns_subdir", DEFAULT_RETURNS_SUBDIR),
                RoutingTable.parse(config.getString("sync.rules.main")),
                RoutingTable.parse(config.getString("sync.rules.returns"))
        );
    }

    /**
     * Main export folder first, then its returns sub-folder, both archiving to the same directory.
     */
    public static SyncPlan of(
            Path exportDir,
            Path archiveDir,
            Path importDir,
            String remoteBasePath,
            String returnsSubdir,
            RoutingTable mainRules,
            RoutingTable returnsRules
    ) {
        SyncPass main = new SyncPass("main", exportDir, mainRules, archiveDir);
        if (returnsRules == null || returnsRules.isEmpty() || returnsSubdir == null || returnsSubdir.isBlank()) {
            return new SyncPlan(exportDir, archiveDir, importDir, remoteBasePath, List.of(main));
        }
        SyncPass returns = new SyncPass("returns", exportDir.resolve(returnsSubdir.trim()), returnsRules, archiveDir);
        return new SyncPlan(exportDir, archiveDir, importDir, remoteBasePath, List.of(main, returns));
    }
}
