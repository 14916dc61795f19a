package com.stocksync.db.mybatis;

import org.apache.ibatis.session.Configuration;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionFactory;
import org.apache.ibatis.session.SqlSessionFactoryBuilder;

import java.sql.Connection;

/**
 * Centralized MyBatis bootstrap for record mappers.
 */
public final class MyBatisSupport {
    private static final SqlSessionFactory FACTORY = buildFactory();

    private MyBatisSupport() {
    }

    public static SqlSession openSession(Connection connection) {
        return FACTORY.openSession(connection);
    }

    static Configuration configuration() {
        return FACTORY.getConfiguration();
    }

    private static SqlSessionFactory buildFactory() {
        Configuration config = new Configuration();
        config.setCallSettersOnNulls(true);
        config.setReturnInstanceForEmptyRow(true);

        config.addMapper(RecordMapper.class);

        return new SqlSessionFactoryBuilder().build(config);
    }
}
