package ai.pyperf.issues;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Totally ordered severity. Declaration order is most to least severe. */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Larger is more severe. */
    public int rank() {
        return values().length - ordinal();
    }

    public boolean isAtLeast(Severity other) {
        return rank() >= other.rank();
    }

    public static Severity fromWireName(String value) {
        for (var s : values()) {
            if (s.wireName().equalsIgnoreCase(value.trim())) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }
}
