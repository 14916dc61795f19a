package com.stocksync.db.mybatis;

import com.stocksync.db.RecordQuery;
import org.apache.ibatis.annotations.SelectProvider;

import java.util.List;
import java.util.Map;

public interface RecordMapper {
    @SelectProvider(type = RecordQuerySqlProvider.class, method = "select")
    List<Map<String, Object>> select(RecordQuery query);
}
