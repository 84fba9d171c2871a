package ai.pyperf.analyzer;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Structural model of one Python source unit. All analysis happens in the constructor; the instance is immutable
 * afterwards and may be shared between threads.
 */
public final class PythonStructureAnalyzer implements StructureProvider {

    private final SourceContent content;
    private final String moduleName;
    private final @Nullable Path path;
    private final AnalysisResult result;

    public PythonStructureAnalyzer(ParsedSource parsed) {
        this.content = parsed.content();
        this.moduleName = parsed.moduleName();
        this.path = parsed.path();
        this.result = StructureExtractor.analyze(parsed);
    }

    public static PythonStructureAnalyzer of(SourceInput input)
            throws SourceSyntaxException, SourceNotFoundException, SourceUnreadableException {
        return new PythonStructureAnalyzer(PythonParser.parse(input));
    }

    public static PythonStructureAnalyzer forSource(String text) throws SourceSyntaxException {
        return new PythonStructureAnalyzer(PythonParser.parse(text));
    }

    public static PythonStructureAnalyzer forFile(Path file)
            throws SourceSyntaxException, SourceNotFoundException, SourceUnreadableException {
        return of(SourceInput.ofPath(file));
    }

    public String moduleName() {
        return moduleName;
    }

    public @Nullable Path path() {
        return path;
    }

    public AnalysisResult result() {
        return result;
    }

    @Override
    public List<FunctionInfo> functions() {
        return result.functions();
    }

    @Override
    public List<LoopInfo> loops() {
        return result.loops();
    }

    @Override
    public List<ImportInfo> imports() {
        return result.imports();
    }

    @Override
    public List<CallInfo> calls() {
        return result.calls();
    }

    @Override
    public List<ConcatenationInfo> concatenations() {
        return result.concatenations();
    }

    @Override
    public List<TryStatementInfo> tryStatements() {
        return result.tryStatements();
    }

    @Override
    public List<GlobalStatementInfo> globalStatements() {
        return result.globalStatements();
    }

    @Override
    public String sourceSegment(int startLine, int endLine) {
        return content.lineRange(startLine, endLine);
    }

    public List<FunctionInfo> asyncFunctions() {
        return functions().stream().filter(FunctionInfo::async).toList();
    }

    /** Functions whose definition starts within {@code startLine..endLine}. */
    public List<FunctionInfo> functionsInRange(int startLine, int endLine) {
        return functions().stream()
                .filter(f -> f.lineNumber() >= startLine && f.lineNumber() <= endLine)
                .toList();
    }

    public List<LoopInfo> loopsInFunction(@Nullable String functionName) {
        return loops().stream()
                .filter(l -> Objects.equals(l.enclosingFunction(), functionName))
                .toList();
    }

    /** Deepest loop nesting in the unit: 0 without loops, 1 for a single loop level. */
    public int maxLoopNestingDepth() {
        return loops().stream().mapToInt(l -> l.nestingLevel() + 1).max().orElse(0);
    }

    @Override
    public String toString() {
        return "PythonStructureAnalyzer[" + moduleName + "]";
    }
}
