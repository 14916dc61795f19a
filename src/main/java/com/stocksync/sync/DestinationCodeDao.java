package com.stocksync.sync;

import com.stocksync.config.Config;
import com.stocksync.db.RecordQuery;
import com.stocksync.db.RecordSession;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lists the active destination (site/warehouse) codes used to derive inbound remote folders.
 */
public final class DestinationCodeDao {
    private static final Pattern PLAIN_INTEGER = Pattern.compile("-?(0|[1-9][0-9]{0,8})");
    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String table;
    private final String column;
    private final Map<String, Object> filters;

    public DestinationCodeDao(String table, String column, Map<String, Object> filters) {
        this.table = requireName("codes.table", table);
        this.column = requireName("codes.column", column);
        this.filters = filters == null ? Map.of() : new LinkedHashMap<>(filters);
    }

    public static DestinationCodeDao fromConfig(Config config) {
        return of(
                config.getString("codes.table", "FACILITY"),
                config.getString("codes.column", "FCY_0"),
                config.getByPrefix("codes.filter")
        );
    }

    /**
     * Builds the DAO from raw filter strings, see {@link #filterValue(String)}.
     */
    public static DestinationCodeDao of(String table, String column, Map<String, String> rawFilters) {
        Map<String, Object> filters = new LinkedHashMap<>();
        if (rawFilters != null) {
            for (Map.Entry<String, String> e : rawFilters.entrySet()) {
                if (e.getValue() != null && !e.getValue().isBlank()) {
                    filters.put(e.getKey(), filterValue(e.getValue()));
                }
            }
        }
        return new DestinationCodeDao(table, column, filters);
    }

    public RecordQuery buildQuery(String schema) {
        String qualified = schema == null || schema.isBlank() ? table : schema + "." + table;
        RecordQuery query = RecordQuery.from("SELECT " + column + " FROM " + qualified);
        for (Map.Entry<String, Object> e : filters.entrySet()) {
            query.where(e.getKey(), e.getValue());
        }
        return query.orderBy(column + " ASC");
    }

    public List<String> listCodes(RecordSession session) throws SQLException {
        List<Map<String, Object>> rows = session.fetch(buildQuery(session.schema()));
        Set<String> codes = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            Object value = valueOf(row);
            if (value == null) {
                continue;
            }
            String code = value.toString().trim();
            if (!code.isEmpty()) {
                codes.add(code);
            }
        }
        return new ArrayList<>(codes);
    }

    private Object valueOf(Map<String, Object> row) {
        if (row == null) {
            return null;
        }
        if (row.containsKey(column)) {
            return row.get(column);
        }
        for (Map.Entry<String, Object> e : row.entrySet()) {
            if (e.getKey() != null && e.getKey().equalsIgnoreCase(column)) {
                return e.getValue();
            }
        }
        return null;
    }

    private static String requireName(String key, String value) {
        String trimmed = value == null ? "" : value.trim();
        if (!NAME.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("invalid " + key + ": " + value);
        }
        return trimmed;
    }

    /**
     * Comma lists become IN filters, plain integers are bound as numbers.
     */
    static Object filterValue(String raw) {
        if (raw.contains(",")) {
            List<Object> values = new ArrayList<>();
            for (String token : raw.split(",")) {
                String t = token.trim();
                if (!t.isEmpty()) {
                    values.add(scalar(t));
                }
            }
            return values;
        }
        return scalar(raw.trim());
    }

    private static Object scalar(String value) {
        return PLAIN_INTEGER.matcher(value).matches() ? (Object) Integer.valueOf(value) : value;
    }
}
