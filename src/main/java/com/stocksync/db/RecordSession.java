package com.stocksync.db;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * One open connection to the relational store, released by {@link #close()}.
 */
public interface RecordSession extends AutoCloseable {

    List<Map<String, Object>> fetch(RecordQuery query) throws SQLException;

    /**
     * Schema prefix for table names in query bases.
     */
    String schema();

    @Override
    void close() throws SQLException;
}
