package com.stocksync.routing;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered routing rules. The first rule whose pattern matches a filename decides its destination,
 * including the decision that it has none.
 */
public final class RoutingTable {
    private static final String ENTRY_SEPARATOR = ";";
    private static final String ARROW = "=>";

    private final List<RoutingRule> rules;

    public RoutingTable(List<RoutingRule> rules) {
        this.rules = List.copyOf(rules == null ? List.of() : rules);
    }

    /**
     * Parses {@code pattern => template; pattern => template}.
     */
    public static RoutingTable parse(String spec) {
        List<RoutingRule> out = new ArrayList<>();
        if (spec == null || spec.isBlank()) {
            return new RoutingTable(out);
        }
        for (String entry : spec.split(ENTRY_SEPARATOR)) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int arrow = trimmed.indexOf(ARROW);
            if (arrow <= 0) {
                throw new IllegalArgumentException("routing rule must look like 'pattern => destination': " + trimmed);
            }
            out.add(RoutingRule.of(trimmed.substring(0, arrow), trimmed.substring(arrow + ARROW.length())));
        }
        return new RoutingTable(out);
    }

    public Optional<String> resolve(String filename) {
        if (filename == null || filename.isEmpty()) {
            return Optional.empty();
        }
        for (RoutingRule rule : rules) {
            if (rule.matches(filename)) {
                return rule.resolve(filename);
            }
        }
        return Optional.empty();
    }

    public List<RoutingRule> rules() {
        return rules;
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @Override
    public String toString() {
        return rules.toString();
    }
}
