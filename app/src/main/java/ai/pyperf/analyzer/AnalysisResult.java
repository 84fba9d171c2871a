package ai.pyperf.analyzer;

import java.util.List;

/** Everything extracted from one source unit, in source order. Built once, never modified. */
public record AnalysisResult(
        List<FunctionInfo> functions,
        List<LoopInfo> loops,
        List<ImportInfo> imports,
        List<CallInfo> calls,
        List<ConcatenationInfo> concatenations,
        List<TryStatementInfo> tryStatements,
        List<GlobalStatementInfo> globalStatements) {

    public AnalysisResult {
        functions = List.copyOf(functions);
        loops = List.copyOf(loops);
        imports = List.copyOf(imports);
        calls = List.copyOf(calls);
        concatenations = List.copyOf(concatenations);
        tryStatements = List.copyOf(tryStatements);
        globalStatements = List.copyOf(globalStatements);
    }
}
