package com.stocksync.config;

import com.stocksync.sync.SyncPlan;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

/**
 * Layered key/value configuration: environment, local {@code config.properties},
 * classpath {@code config.properties}, then built-in defaults.
 */
public final class Config {

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Map<String, String> env;
    private final Path workingDir;

    private Config(Path workingDir, Map<String, String> env) {
        this.workingDir = workingDir;
        this.env = env == null ? Map.of() : env;
    }

    public static Config load(Path workingDir) {
        return load(workingDir, System.getenv());
    }

    public static Config load(Path workingDir, Map<String, String> env) {
        Config config = new Config(workingDir, env);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException ignored) {
            // Ignore broken classpath config and continue with defaults/local file.
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                System.err.println("WARN: failed to read config.properties: " + e.getMessage());
            }
        }

        return config;
    }

    /**
     * Build Config from an explicit map, skipping files. Environment lookups are disabled.
     */
    public static Config fromMap(Path workingDir, Map<String, String> values) {
        Config config = new Config(workingDir, Map.of());
        if (values != null) {
            config.overrideProps.putAll(values);
            config.props.putAll(values);
        }
        return config;
    }

    public Path workingDir() {
        return workingDir;
    }

    public String getString(String key) {
        String fromEnv = nonBlank(env.get(envName(key)));
        if (!fromEnv.isEmpty()) {
            return fromEnv;
        }
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key, boolean fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public int getInt(String key, int fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid integer for " + key + ": " + value, e);
        }
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String token : value.split("[,;]")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    /**
     * Entries under {@code prefix.}, keyed by the remainder and sorted by key (case-insensitive).
     * Environment variables named {@code PREFIX_<REST>} add entries keyed by {@code REST}.
     */
    public Map<String, String> getByPrefix(String prefix) {
        String head = prefix.endsWith(".") ? prefix : prefix + ".";
        Map<String, String> out = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (String name : props.stringPropertyNames()) {
            if (name.startsWith(head) && name.length() > head.length()) {
                String value = getString(name);
                if (!value.isEmpty()) {
                    out.put(name.substring(head.length()), value);
                }
            }
        }
        String envHead = envName(head);
        for (Map.Entry<String, String> e : env.entrySet()) {
            String name = e.getKey();
            if (name.startsWith(envHead) && name.length() > envHead.length()) {
                String value = nonBlank(e.getValue());
                if (!value.isEmpty()) {
                    out.putIfAbsent(name.substring(envHead.length()), value);
                }
            }
        }
        return out;
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        return value;
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(env.get(envName(key))).isEmpty()) {
            return "env";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    static String envName(String key) {
        if (key == null) {
            return "";
        }
        return key.trim().replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
    }

    private static String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        String t = raw.trim();
        return t.isEmpty() ? "" : t;
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> m = new HashMap<>();
        m.put("schedule.enabled", "false");
        m.put("schedule.months", "1,2,3,4,5,6,7,8,9,10,11,12");
        m.put("schedule.start_time", "00:00");
        m.put("schedule.end_time", "23:59");
        m.put("schedule.interval_minutes", "15");
        m.put("schedule.run_immediately", "false");
        m.put("post_execution.enabled", "true");
        m.put("post_execution.delay_minutes", "60");

        m.put("sync.local.export_dir", "export");
        m.put("sync.local.archive_dir", "export/archive");
        m.put("sync.local.import_dir", "import");
        m.put("sync.returns_subdir", "recolhas");
        m.put("sync.rules.main", SyncPlan.DEFAULT_MAIN_RULES);
        m.put("sync.rules.returns", SyncPlan.DEFAULT_RETURNS_RULES);

        m.put("sftp.port", "22");
        m.put("sftp.timeout_sec", "30");
        m.put("sftp.sync_base_path", "exportx3/automation");

        m.put("db.schema", "dbo");
        m.put("codes.table", "FACILITY");
        m.put("codes.column", "FCY_0");

        m.put("shutdown.grace_minutes", "5");
        m.put("log.dir", "logs");
        return m;
    }
}
