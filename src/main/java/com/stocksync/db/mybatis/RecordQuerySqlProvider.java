package com.stocksync.db.mybatis;

import com.stocksync.db.RecordQuery;

public final class RecordQuerySqlProvider {
    public static String select(RecordQuery query) {
        return query.toMyBatisSql();
    }
}
