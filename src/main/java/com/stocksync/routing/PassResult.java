package com.stocksync.routing;

import java.util.Locale;

/**
 * Counters for one outbound or inbound pass.
 */
public record PassResult(
        String label,
        int scanned,
        int skipped,
        int transferred,
        int failed,
        int finalized,
        int vanished
) {
    public static PassResult empty(String label) {
        return new PassResult(label, 0, 0, 0, 0, 0, 0);
    }

    public boolean hasFailures() {
        return failed > 0;
    }

    public PassResult plus(PassResult other) {
        return new PassResult(
                label,
                scanned + other.scanned,
                skipped + other.skipped,
                transferred + other.transferred,
                failed + other.failed,
                finalized + other.finalized,
                vanished + other.vanished
        );
    }

    public String toLogLine() {
        return String.format(
                Locale.US,
                "SYNC_PASS label=%s scanned=%d skipped=%d transferred=%d failed=%d finalized=%d vanished=%d",
                label,
                scanned,
                skipped,
                transferred,
                failed,
                finalized,
                vanished
        );
    }
}
