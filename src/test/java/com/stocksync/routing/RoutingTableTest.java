package com.stocksync.routing;

import com.stocksync.sync.SyncPlan;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RoutingTableTest {

    private final RoutingTable rules = RoutingTable.parse("EDIEE(\\d{2}) => E{code}; RECE(\\d{2}) => E{code}");

    @Test
    void codeIsCapturedIntoDestination() {
        assertEquals(Optional.of("E07"), rules.resolve("EDIEE07_x.csv"));
        assertEquals(Optional.of("E12"), rules.resolve("RECE12_20260310.txt"));
    }

    @Test
    void unmatchedFilenameHasNoDestination() {
        assertTrue(rules.resolve("NOMATCH.txt").isEmpty());
        assertTrue(rules.resolve("EDIEE7_single_digit.csv").isEmpty());
        assertTrue(rules.resolve("").isEmpty());
    }

    @Test
    void matchingIsCaseInsensitiveAndAnywhereInName() {
        assertEquals(Optional.of("E03"), rules.resolve("export_ediee03.csv"));
    }

    @Test
    void firstMatchingRuleWins() {
        RoutingTable table = new RoutingTable(List.of(
                RoutingRule.of("RECE(\\d{2})", "E{code}"),
                RoutingRule.of("RECE", "Returns")
        ));

        assertEquals(Optional.of("E05"), table.resolve("RECE05.csv"));
        assertEquals(Optional.of("Returns"), table.resolve("RECEX.csv"));
    }

    @Test
    void matchWithoutCodeStopsTheSearch() {
        RoutingTable table = RoutingTable.parse("EDIEE(\\d{2})?_ => E{code}; EDIEE => Fallback");

        assertEquals(Optional.of("E07"), table.resolve("EDIEE07_a.csv"));
        assertTrue(table.resolve("EDIEE_a.csv").isEmpty());
        assertEquals(Optional.of("Fallback"), table.resolve("EDIEE-a.csv"));
    }

    @Test
    void defaultRulesRouteFixedDestinations() {
        RoutingTable defaults = RoutingTable.parse(SyncPlan.DEFAULT_MAIN_RULES);

        assertEquals(4, defaults.rules().size());
        assertEquals(Optional.of("Magento"), defaults.resolve("STOCKTOTAL_20260310.csv"));
        assertEquals(Optional.of("StockporLoja"), defaults.resolve("STOCKLOJA_E07.csv"));
        assertTrue(defaults.resolve("OLD_STOCKTOTAL.csv").isEmpty());
        assertEquals(Optional.of("E07/recolhas"), RoutingTable.parse(SyncPlan.DEFAULT_RETURNS_RULES).resolve("RECE07.csv"));
    }

    @Test
    void templateSlashesAreTrimmed() {
        RoutingRule rule = RoutingRule.of("^INV", "/Invoices/");

        assertEquals("Invoices", rule.destinationTemplate());
        assertEquals("^INV => Invoices", rule.toString());
    }

    @Test
    void malformedRulesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> RoutingRule.of("^STOCK", "E{code}"));
        assertThrows(IllegalArgumentException.class, () -> RoutingRule.of("EDIEE(\\d{2}", "E{code}"));
        assertThrows(IllegalArgumentException.class, () -> RoutingRule.of(" ", "E{code}"));
        assertThrows(IllegalArgumentException.class, () -> RoutingTable.parse("EDIEE(\\d{2}) -> E{code}"));
        assertThrows(IllegalArgumentException.class, () -> RoutingTable.parse("EDIEE(\\d{2}) =>  "));
    }

    @Test
    void blankSpecGivesEmptyTable() {
        assertTrue(RoutingTable.parse("  ").isEmpty());
        assertTrue(RoutingTable.parse(null).resolve("EDIEE07.csv").isEmpty());
    }
}
