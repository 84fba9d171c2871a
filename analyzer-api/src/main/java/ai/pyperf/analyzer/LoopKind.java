package ai.pyperf.analyzer;

public enum LoopKind {
    /** {@code for} / {@code async for} iteration. */
    FOR,
    /** {@code while} conditional repetition. */
    WHILE,
    /** One {@code for} clause of a comprehension or generator expression. */
    COMPREHENSION
}
