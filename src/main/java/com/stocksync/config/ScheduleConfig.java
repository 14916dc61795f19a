package com.stocksync.config;

import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable schedule gate: months, daily window, tick interval and post-window delay.
 */
public record ScheduleConfig(
        boolean enabled,
        Set<Integer> allowedMonths,
        LocalTime windowStart,
        LocalTime windowEnd,
        int intervalMinutes,
        boolean runImmediately,
        int postExecutionDelayMinutes,
        ZoneId zone
) {
    public static final int DEFAULT_POST_EXECUTION_DELAY_MINUTES = 60;

    private static final DateTimeFormatter TIME_FMT = DateTimeFormatter.ofPattern("H:mm");
    private static final DateTimeFormatter DISPLAY_FMT = DateTimeFormatter.ofPattern("HH:mm");

    public ScheduleConfig {
        if (allowedMonths == null) {
            throw new IllegalArgumentException("schedule.months must not be null");
        }
        for (Integer month : allowedMonths) {
            if (month == null || month < 1 || month > 12) {
                throw new IllegalArgumentException("schedule.months must be within 1..12, got " + month);
            }
        }
        if (windowStart == null || windowEnd == null) {
            throw new IllegalArgumentException("schedule window start/end must be set");
        }
        if (intervalMinutes <= 0) {
            throw new IllegalArgumentException("schedule.interval_minutes must be > 0, got " + intervalMinutes);
        }
        if (postExecutionDelayMinutes < 0) {
            throw new IllegalArgumentException("post_execution.delay_minutes must be >= 0, got " + postExecutionDelayMinutes);
        }
        allowedMonths = Collections.unmodifiableSet(new TreeSet<>(allowedMonths));
        zone = zone == null ? ZoneId.systemDefault() : zone;
    }

    public static ScheduleConfig fromConfig(Config config) {
        return of(
                config.getBoolean("schedule.enabled", false),
                config.getList("schedule.months"),
                config.getString("schedule.start_time"),
                config.getString("schedule.end_time"),
                config.getInt("schedule.interval_minutes", 15),
                config.getBoolean("schedule.run_immediately", false),
                config.getInt("post_execution.delay_minutes", DEFAULT_POST_EXECUTION_DELAY_MINUTES),
                config.getString("schedule.zone", "")
        );
    }

    public static ScheduleConfig of(
            boolean enabled,
            List<String> months,
            String startTime,
            String endTime,
            int intervalMinutes,
            boolean runImmediately,
            int postExecutionDelayMinutes,
            String zone
    ) {
        return new ScheduleConfig(
                enabled,
                parseMonths(months),
                parseTime("schedule.start_time", startTime),
                parseTime("schedule.end_time", endTime),
                intervalMinutes,
                runImmediately,
                postExecutionDelayMinutes,
                parseZone(zone)
        );
    }

    /**
     * Window membership, both bounds inclusive. A start after the end spans midnight.
     */
    public boolean isWithinWindow(LocalTime now) {
        if (!windowStart.isAfter(windowEnd)) {
            return !now.isBefore(windowStart) && !now.isAfter(windowEnd);
        }
        return !now.isBefore(windowStart) || !now.isAfter(windowEnd);
    }

    public boolean isAllowedMonth(int month) {
        return allowedMonths.contains(month);
    }

    public String describe() {
        return "months=" + allowedMonths.stream().map(String::valueOf).collect(Collectors.joining(","))
                + ", window=" + DISPLAY_FMT.format(windowStart) + "-" + DISPLAY_FMT.format(windowEnd)
                + ", interval_min=" + intervalMinutes
                + ", run_immediately=" + runImmediately
                + ", post_delay_min=" + postExecutionDelayMinutes
                + ", zone=" + zone
                + ", enabled=" + enabled;
    }

    private static Set<Integer> parseMonths(List<String> tokens) {
        Set<Integer> out = new TreeSet<>();
        if (tokens == null) {
            return out;
        }
        for (String token : tokens) {
            try {
                out.add(Integer.parseInt(token.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid month in schedule.months: " + token, e);
            }
        }
        return out;
    }

    private static ZoneId parseZone(String zone) {
        if (zone == null || zone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(zone.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("invalid schedule.zone: " + zone, e);
        }
    }

    private static LocalTime parseTime(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        try {
            return LocalTime.parse(value.trim(), TIME_FMT);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid time for " + key + " (expected HH:MM): " + value, e);
        }
    }
}
