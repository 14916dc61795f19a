package com.stocksync.db;

import java.sql.SQLException;

@FunctionalInterface
public interface RecordSessionFactory {
    RecordSession open() throws SQLException;
}
