package ai.pyperf.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One ordered (predicate, classification) pair of a {@link Classifier}.
 *
 * @param label the classification returned when the pattern matches, e.g. an ORM framework or an async replacement
 */
public record CatalogEntry(MatchTarget target, NamePattern pattern, String label) {

    @JsonCreator
    public static CatalogEntry fromJson(
            @JsonProperty(value = "target", required = true) MatchTarget target,
            @JsonProperty(value = "match", required = true) MatchKind match,
            @JsonProperty(value = "pattern", required = true) String pattern,
            @JsonProperty(value = "label", required = true) String label,
            @JsonProperty("ignoreCase") boolean ignoreCase) {
        return new CatalogEntry(target, NamePattern.of(match, pattern, ignoreCase), label);
    }

    public static CatalogEntry resolved(NamePattern pattern, String label) {
        return new CatalogEntry(MatchTarget.RESOLVED, pattern, label);
    }

    public static CatalogEntry written(NamePattern pattern, String label) {
        return new CatalogEntry(MatchTarget.WRITTEN, pattern, label);
    }
}
