package ai.pyperf.analyzer;

import org.jetbrains.annotations.Nullable;

/**
 * A string-building assignment inside a loop whose target outlives the loop body.
 *
 * @param augmented true for {@code target += ...}, false for {@code target = target + ...}
 * @param loopLine first line of the innermost enclosing loop
 */
public record ConcatenationInfo(
        String target,
        int lineNumber,
        int endLineNumber,
        @Nullable String enclosingFunction,
        int loopLine,
        boolean augmented) {}
