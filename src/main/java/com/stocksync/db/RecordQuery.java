package com.stocksync.db;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.IntFunction;
import java.util.regex.Pattern;

/**
 * Read query: a base {@code SELECT ... FROM ...} plus equality/IN filters, GROUP BY and ORDER BY.
 * Identifiers are validated, values always travel as bound parameters.
 */
public final class RecordQuery {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");
    private static final Pattern HAS_WHERE = Pattern.compile("(?is).*\\bwhere\\b.*");

    private final String base;
    private final Map<String, Object> where = new LinkedHashMap<>();
    private final List<String> groupBy = new ArrayList<>();
    private final List<String> orderBy = new ArrayList<>();

    private RecordQuery(String base) {
        this.base = base.trim();
    }

    public static RecordQuery from(String base) {
        if (base == null || base.isBlank()) {
            throw new IllegalArgumentException("query base must not be blank");
        }
        return new RecordQuery(base);
    }

    /**
     * Equality filter, or IN when {@code value} is a collection.
     */
    public RecordQuery where(String column, Object value) {
        where.put(identifier(column), value instanceof Collection<?> c ? List.copyOf(c) : value);
        return this;
    }

    public RecordQuery groupBy(String... columns) {
        for (String column : columns) {
            groupBy.add(identifier(column));
        }
        return this;
    }

    /**
     * Accepts {@code column} or {@code column ASC|DESC}.
     */
    public RecordQuery orderBy(String... fields) {
        for (String field : fields) {
            String[] parts = field.trim().split("\\s+");
            String column = identifier(parts[0]);
            if (parts.length > 1) {
                String direction = parts[1].toUpperCase(Locale.ROOT);
                if (!direction.equals("ASC") && !direction.equals("DESC")) {
                    throw new IllegalArgumentException("invalid sort direction: " + parts[1]);
                }
                orderBy.add(column + " " + direction);
            } else {
                orderBy.add(column);
            }
        }
        return this;
    }

    /**
     * SQL with JDBC {@code ?} placeholders.
     */
    public String toSql() {
        return render(i -> "?");
    }

    /**
     * SQL with MyBatis placeholders bound against {@link #getParameters()}.
     */
    public String toMyBatisSql() {
        return render(i -> "#{parameters[" + i + "]}");
    }

    public List<Object> getParameters() {
        List<Object> out = new ArrayList<>();
        for (Object value : where.values()) {
            if (value instanceof List<?> list) {
                out.addAll(list);
            } else {
                out.add(value);
            }
        }
        return out;
    }

    private String render(IntFunction<String> placeholder) {
        StringBuilder sql = new StringBuilder(base);
        int index = 0;
        if (!where.isEmpty()) {
            List<String> conditions = new ArrayList<>();
            for (Map.Entry<String, Object> e : where.entrySet()) {
                if (e.getValue() instanceof List<?> list) {
                    if (list.isEmpty()) {
                        conditions.add("1 = 0");
                        continue;
                    }
                    List<String> marks = new ArrayList<>();
                    for (int i = 0; i < list.size(); i++) {
                        marks.add(placeholder.apply(index++));
                    }
                    conditions.add(e.getKey() + " IN (" + String.join(", ", marks) + ")");
                } else {
                    conditions.add(e.getKey() + " = " + placeholder.apply(index++));
                }
            }
            sql.append(HAS_WHERE.matcher(base).matches() ? " AND " : " WHERE ");
            sql.append(String.join(" AND ", conditions));
        }
        if (!groupBy.isEmpty()) {
            sql.append(" GROUP BY ").append(String.join(", ", groupBy));
        }
        if (!orderBy.isEmpty()) {
            sql.append(" ORDER BY ").append(String.join(", ", orderBy));
        }
        return sql.toString();
    }

    private static String identifier(String name) {
        String trimmed = name == null ? "" : name.trim();
        if (!IDENTIFIER.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("invalid column name: " + name);
        }
        return trimmed;
    }

    @Override
    public String toString() {
        return toSql() + " " + getParameters();
    }
}
