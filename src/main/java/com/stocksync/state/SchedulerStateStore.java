package com.stocksync.state;

import com.stocksync.scheduler.SchedulerState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * JSON file holding the post-job bookkeeping so a restart does not repeat a finished post-job.
 */
public final class SchedulerStateStore {
    private static final Logger LOG = LogManager.getLogger(SchedulerStateStore.class);
    private static final String KEY_COMPLETED = "lastPostJobCompletedDate";
    private static final String KEY_CLOSED_AT = "windowClosedAt";

    private final Path path;

    public SchedulerStateStore(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

    public SchedulerState load() {
        if (!Files.exists(path)) {
            return new SchedulerState();
        }
        try {
            JSONObject o = new JSONObject(Files.readString(path, StandardCharsets.UTF_8));
            String completed = o.optString(KEY_COMPLETED, "");
            String closedAt = o.optString(KEY_CLOSED_AT, "");
            return new SchedulerState(
                    completed.isEmpty() ? null : LocalDate.parse(completed),
                    closedAt.isEmpty() ? null : Instant.parse(closedAt)
            );
        } catch (IOException | JSONException | DateTimeParseException e) {
            LOG.warn("Ignoring unreadable scheduler state file {}: {}", path, e.getMessage());
            return new SchedulerState();
        }
    }

    public void save(SchedulerState state) throws IOException {
        JSONObject o = new JSONObject();
        if (state.lastPostJobCompletedDate() != null) {
            o.put(KEY_COMPLETED, state.lastPostJobCompletedDate().toString());
        }
        if (state.windowClosedAt() != null) {
            o.put(KEY_CLOSED_AT, state.windowClosedAt().toString());
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, o.toString(2), StandardCharsets.UTF_8);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
    }
}
