package ai.pyperf.issues;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of issue categories. Each category carries the severity its rule always emits; adding one is a schema
 * change.
 */
public enum IssueCategory {
    REPEATED_QUERY_IN_LOOP("repeated-query-in-loop", Severity.HIGH),
    BLOCKING_IO_IN_ASYNC("blocking-io-in-async", Severity.CRITICAL),
    INEFFICIENT_LOOP("inefficient-loop", Severity.MEDIUM),
    MEMORY_LOAD("memory-load", Severity.MEDIUM),
    EXCEPTION_IN_LOOP("exception-in-loop", Severity.MEDIUM),
    TYPE_CONVERSION_IN_LOOP("type-conversion-in-loop", Severity.MEDIUM),
    GLOBAL_MUTATION("global-mutation", Severity.MEDIUM);

    private final String wireName;
    private final Severity defaultSeverity;

    IssueCategory(String wireName, Severity defaultSeverity) {
        this.wireName = wireName;
        this.defaultSeverity = defaultSeverity;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }

    /** Accepts the wire name or the enum constant name, case-insensitively. */
    public static IssueCategory fromWireName(String value) {
        var trimmed = value.trim();
        for (var c : values()) {
            if (c.wireName.equalsIgnoreCase(trimmed) || c.name().equalsIgnoreCase(trimmed)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown issue category: " + value);
    }
}
