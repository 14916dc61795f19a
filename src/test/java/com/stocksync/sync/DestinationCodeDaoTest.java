package com.stocksync.sync;

import com.stocksync.config.Config;
import com.stocksync.db.RecordQuery;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DestinationCodeDaoTest {

    @Test
    void queryUsesSchemaFiltersAndOrdering() {
        Config config = Config.fromMap(Path.of("."), Map.of(
                "codes.filter.LEGCPY_0", "GN",
                "codes.filter.WRHFLG_0", "2"
        ));

        RecordQuery query = DestinationCodeDao.fromConfig(config).buildQuery("dbo");

        assertEquals("SELECT FCY_0 FROM dbo.FACILITY WHERE LEGCPY_0 = ? AND WRHFLG_0 = ? ORDER BY FCY_0 ASC", query.toSql());
        assertEquals(List.of("GN", 2), query.getParameters());
    }

    @Test
    void commaListBecomesInFilter() {
        DestinationCodeDao dao = DestinationCodeDao.of("FACILITY", "FCY_0", Map.of("LEGCPY_0", "GN, PT"));

        RecordQuery query = dao.buildQuery("");

        assertEquals("SELECT FCY_0 FROM FACILITY WHERE LEGCPY_0 IN (?, ?) ORDER BY FCY_0 ASC", query.toSql());
        assertEquals(List.of("GN", "PT"), query.getParameters());
    }

    @Test
    void filterValueKeepsLeadingZeroCodesAsText() {
        assertEquals(7, DestinationCodeDao.filterValue("7"));
        assertEquals("007", DestinationCodeDao.filterValue("007"));
        assertEquals(Arrays.asList(1, "B2"), DestinationCodeDao.filterValue("1,B2,"));
    }

    @Test
    void codesAreTrimmedDedupedAndBlanksDropped() throws Exception {
        List<Map<String, Object>> rows = new ArrayList<>();
        rows.add(row("fcy_0", " E07 "));
        rows.add(row("FCY_0", "E08"));
        rows.add(row("FCY_0", "E07"));
        rows.add(row("FCY_0", "  "));
        rows.add(row("FCY_0", null));
        FakeRecordSession session = new FakeRecordSession(rows);

        List<String> codes = DestinationCodeDao.of("FACILITY", "FCY_0", Map.of()).listCodes(session);

        assertEquals(List.of("E07", "E08"), codes);
        assertEquals("SELECT FCY_0 FROM dbo.FACILITY ORDER BY FCY_0 ASC", session.queries().get(0).toSql());
    }

    @Test
    void unsafeTableOrColumnIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> DestinationCodeDao.of("FACILITY; DROP TABLE x", "FCY_0", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> DestinationCodeDao.of("FACILITY", "", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> DestinationCodeDao.of("FACILITY", "FCY_0", Map.of("bad column", "x")).buildQuery("dbo"));
    }

    private static Map<String, Object> row(String column, Object value) {
        Map<String, Object> row = new HashMap<>();
        row.put(column, value);
        return row;
    }
}
