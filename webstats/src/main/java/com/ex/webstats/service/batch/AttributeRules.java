package com.ex.webstats.service.batch;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Session attributes a combined scan can serve, and the row filter each chart applies
 * to its own grouped output. Adding a batchable dimension means adding a row here.
 */
public final class AttributeRules {
    private AttributeRules(){}

    /** Value label for null/empty attribute values. */
    public static final String UNKNOWN_VALUE = "Ukjent";

    public record Rule(String attribute, Predicate<String> keep) {
        public static Rule keepAll(String attribute) {
            return new Rule(attribute, v -> true);
        }
    }

    private static final Map<String, Rule> RULES = new LinkedHashMap<>();
    static {
        register(Rule.keepAll("country"));
        register(Rule.keepAll("language"));
        // device charts carry "WHERE device NOT LIKE '%x%'", which NULL fails too
        register(new Rule("device", v -> v != null && !v.contains("x")));
        register(Rule.keepAll("os"));
        register(Rule.keepAll("browser"));
        register(Rule.keepAll("screen"));
    }

    private static void register(Rule rule) {
        RULES.put(rule.attribute(), rule);
    }

    public static Optional<Rule> forAttribute(String attribute) {
        return Optional.ofNullable(attribute == null ? null : RULES.get(attribute));
    }

    public static boolean isBatchable(String attribute) {
        return attribute != null && RULES.containsKey(attribute);
    }

    /** In declaration order. */
    public static List<String> attributes() {
        return List.copyOf(RULES.keySet());
    }
}
