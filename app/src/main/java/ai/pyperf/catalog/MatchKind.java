package ai.pyperf.catalog;

/** How a {@link NamePattern} compares its text with a call name. */
public enum MatchKind {
    EXACT,
    PREFIX,
    SUFFIX,
    CONTAINS,
    REGEX
}
