package ai.pyperf.analyzer;

import org.jetbrains.annotations.Nullable;

public record TryStatementInfo(
        int lineNumber, int endLineNumber, @Nullable String enclosingFunction, boolean inLoop) {}
