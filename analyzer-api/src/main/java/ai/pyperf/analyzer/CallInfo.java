package ai.pyperf.analyzer;

import org.jetbrains.annotations.Nullable;

/**
 * A call site.
 *
 * @param functionName the callee expression as written, with whitespace removed
 * @param resolvedName fully-qualified callee, present only when it could be determined statically
 */
public record CallInfo(
        String functionName,
        int lineNumber,
        @Nullable String enclosingFunction,
        boolean inLoop,
        boolean inAsyncFunction,
        @Nullable String resolvedName) {}
