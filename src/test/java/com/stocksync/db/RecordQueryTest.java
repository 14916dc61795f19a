package com.stocksync.db;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RecordQueryTest {

    @Test
    void rendersFiltersGroupingAndOrdering() {
        RecordQuery query = RecordQuery.from("SELECT STOFCY_0, SUM(QTYSTU_0) FROM dbo.STOCK")
                .where("STOFCY_0", List.of("E07", "E08"))
                .where("STA_0", "A")
                .groupBy("STOFCY_0")
                .orderBy("STOFCY_0 desc");

        assertEquals("SELECT STOFCY_0, SUM(QTYSTU_0) FROM dbo.STOCK WHERE STOFCY_0 IN (?, ?) AND STA_0 = ?"
                + " GROUP BY STOFCY_0 ORDER BY STOFCY_0 DESC", query.toSql());
        assertEquals(List.of("E07", "E08", "A"), query.getParameters());
    }

    @Test
    void appendsToExistingWhereClause() {
        RecordQuery query = RecordQuery.from("SELECT FCY_0 FROM FACILITY WHERE ENAFLG_0 = 2").where("LEGCPY_0", "GN");

        assertEquals("SELECT FCY_0 FROM FACILITY WHERE ENAFLG_0 = 2 AND LEGCPY_0 = ?", query.toSql());
    }

    @Test
    void emptyInListMatchesNothing() {
        RecordQuery query = RecordQuery.from("SELECT FCY_0 FROM FACILITY").where("FCY_0", List.of());

        assertEquals("SELECT FCY_0 FROM FACILITY WHERE 1 = 0", query.toSql());
        assertEquals(List.of(), query.getParameters());
    }

    @Test
    void myBatisPlaceholdersIndexParameters() {
        RecordQuery query = RecordQuery.from("SELECT FCY_0 FROM FACILITY")
                .where("LEGCPY_0", List.of("GN", "PT"))
                .where("f.WRHFLG_0", 2);

        assertEquals("SELECT FCY_0 FROM FACILITY WHERE LEGCPY_0 IN (#{parameters[0]}, #{parameters[1]})"
                + " AND f.WRHFLG_0 = #{parameters[2]}", query.toMyBatisSql());
    }

    @Test
    void unsafeIdentifiersAreRejected() {
        RecordQuery query = RecordQuery.from("SELECT FCY_0 FROM FACILITY");

        assertThrows(IllegalArgumentException.class, () -> query.where("FCY_0 = 1 OR 1", "x"));
        assertThrows(IllegalArgumentException.class, () -> query.groupBy("a.b.c"));
        assertThrows(IllegalArgumentException.class, () -> query.orderBy("FCY_0 SIDEWAYS"));
        assertThrows(IllegalArgumentException.class, () -> RecordQuery.from(" "));
    }
}
