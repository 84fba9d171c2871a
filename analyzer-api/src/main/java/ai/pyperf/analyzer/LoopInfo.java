package ai.pyperf.analyzer;

import org.jetbrains.annotations.Nullable;

/**
 * A loop or loop-equivalent construct.
 *
 * @param enclosingFunction innermost enclosing function, null for module-level loops
 * @param nestingLevel number of loops enclosing this one, counted across nested function definitions
 */
public record LoopInfo(
        LoopKind kind,
        int lineNumber,
        int endLineNumber,
        @Nullable String enclosingFunction,
        int nestingLevel,
        boolean inAsyncFunction) {

    public LoopInfo {
        if (nestingLevel < 0) {
            throw new IllegalArgumentException("Negative nesting level: " + nestingLevel);
        }
    }

    /** True when {@code other} lies within this loop's line range and is nested deeper. */
    public boolean encloses(LoopInfo other) {
        return other.nestingLevel > nestingLevel
                && other.lineNumber >= lineNumber
                && other.endLineNumber <= endLineNumber;
    }
}
