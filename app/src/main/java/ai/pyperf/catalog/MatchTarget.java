package ai.pyperf.catalog;

/** Which name of a call a catalog entry is tested against. */
public enum MatchTarget {
    /** The fully-qualified name produced by name resolution. */
    RESOLVED,
    /** The callee text as written, used only when resolution produced nothing. */
    WRITTEN
}
