package com.stocksync.sync;

import com.stocksync.db.RecordQuery;
import com.stocksync.db.RecordSession;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Returns canned rows for every query and records what was asked.
 */
final class FakeRecordSession implements RecordSession {
    private final List<Map<String, Object>> rows;
    private final List<RecordQuery> queries = new ArrayList<>();
    private boolean closed;

    FakeRecordSession(List<Map<String, Object>> rows) {
        this.rows = rows;
    }

    static FakeRecordSession withCodes(String column, String... codes) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (String code : codes) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(column, code);
            rows.add(row);
        }
        return new FakeRecordSession(rows);
    }

    @Override
    public List<Map<String, Object>> fetch(RecordQuery query) {
        queries.add(query);
        return rows;
    }

    @Override
    public String schema() {
        return "dbo";
    }

    @Override
    public void close() {
        closed = true;
    }

    List<RecordQuery> queries() {
        return queries;
    }

    boolean isClosed() {
        return closed;
    }
}
