package com.stocksync.db;

import com.stocksync.db.mybatis.MyBatisSupport;
import com.stocksync.db.mybatis.RecordMapper;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link RecordSession} running {@link RecordQuery} through MyBatis on a single JDBC connection.
 */
public final class MyBatisRecordSession implements RecordSession {
    private static final Logger SQL_LOG = LogManager.getLogger("SQL");
    private static final Logger LOG = LogManager.getLogger(MyBatisRecordSession.class);

    private final Connection connection;
    private final SqlSession session;
    private final String schema;

    private MyBatisRecordSession(Connection connection, SqlSession session, String schema) {
        this.connection = connection;
        this.session = session;
        this.schema = schema;
    }

    public static RecordSessionFactory factory(Database database) {
        return () -> open(database);
    }

    public static MyBatisRecordSession open(Database database) throws SQLException {
        Connection conn = database.connect();
        try {
            SqlSession session = MyBatisSupport.openSession(conn);
            LOG.info("Database connection established.");
            return new MyBatisRecordSession(conn, session, database.schema());
        } catch (RuntimeException e) {
            conn.close();
            throw e;
        }
    }

    @Override
    public List<Map<String, Object>> fetch(RecordQuery query) throws SQLException {
        SQL_LOG.info("Executing query: {}", query.toSql());
        SQL_LOG.info("With parameters: {}", query.getParameters());
        try {
            List<Map<String, Object>> rows = session.getMapper(RecordMapper.class).select(query);
            return rows == null ? List.of() : new ArrayList<>(rows);
        } catch (PersistenceException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SQLException sql) {
                throw sql;
            }
            throw new SQLException("query failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String schema() {
        return schema;
    }

    @Override
    public void close() throws SQLException {
        try {
            session.close();
        } finally {
            connection.close();
            LOG.info("Database connection closed.");
        }
    }
}
