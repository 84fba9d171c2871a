package ai.pyperf.analyzer;

import java.util.List;

/**
 * Implemented by analyzers that expose the structural model of a single source unit. Every accessor returns the same
 * immutable list on each call.
 */
public interface StructureProvider {

    List<FunctionInfo> functions();

    List<LoopInfo> loops();

    List<ImportInfo> imports();

    List<CallInfo> calls();

    default List<ConcatenationInfo> concatenations() {
        return List.of();
    }

    default List<TryStatementInfo> tryStatements() {
        return List.of();
    }

    default List<GlobalStatementInfo> globalStatements() {
        return List.of();
    }

    /**
     * Returns the literal text of lines {@code startLine..endLine} (1-based, inclusive) joined with {@code \n}. The
     * range is clamped to the source; an empty range yields the empty string.
     */
    String sourceSegment(int startLine, int endLine);
}
