package ai.pyperf.checker;

import ai.pyperf.analyzer.CallInfo;
import ai.pyperf.analyzer.LoopInfo;
import ai.pyperf.analyzer.PythonStructureAnalyzer;
import ai.pyperf.analyzer.SourceInput;
import ai.pyperf.analyzer.SourceNotFoundException;
import ai.pyperf.analyzer.SourceSyntaxException;
import ai.pyperf.analyzer.SourceUnreadableException;
import ai.pyperf.analyzer.StructureProvider;
import ai.pyperf.catalog.PatternCatalog;
import ai.pyperf.config.CheckerConfig;
import ai.pyperf.issues.IssueCategory;
import ai.pyperf.issues.IssueSummary;
import ai.pyperf.issues.PerformanceIssue;
import ai.pyperf.issues.Severity;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Runs the detection rules over the structural model of one source unit. Every rule is an independent pure function
 * of the model and the catalog; {@link #checkAll()} is computed once, at construction, and returned as the same
 * immutable list afterwards.
 */
public final class PerformanceChecker {
    private static final Logger logger = LogManager.getLogger(PerformanceChecker.class);

    /** Severity (critical first), then line. {@link List#sort} is stable, so equal keys keep rule order. */
    public static final Comparator<PerformanceIssue> ISSUE_ORDER =
            Comparator.comparing(PerformanceIssue::severity).thenComparingInt(PerformanceIssue::lineNumber);

    private final StructureProvider structure;
    private final PatternCatalog catalog;
    private final CheckerConfig config;
    private final List<PerformanceIssue> allIssues;

    public PerformanceChecker(StructureProvider structure) {
        this(structure, CheckerConfig.defaults());
    }

    public PerformanceChecker(StructureProvider structure, CheckerConfig config) {
        this(structure, config.catalog(), config);
    }

    public PerformanceChecker(StructureProvider structure, PatternCatalog catalog, CheckerConfig config) {
        this.structure = structure;
        this.catalog = catalog;
        this.config = config;
        this.allIssues = runEnabledRules();
    }

    public static PerformanceChecker forSource(String source) throws SourceSyntaxException {
        return new PerformanceChecker(PythonStructureAnalyzer.forSource(source));
    }

    public static PerformanceChecker forFile(Path file)
            throws SourceSyntaxException, SourceNotFoundException, SourceUnreadableException {
        return new PerformanceChecker(PythonStructureAnalyzer.forFile(file));
    }

    /**
     * Accepts exactly one of source text or a file path.
     *
     * @throws IllegalArgumentException when both or neither are given
     */
    public static PerformanceChecker create(@Nullable String source, @Nullable Path file)
            throws SourceSyntaxException, SourceNotFoundException, SourceUnreadableException {
        return of(SourceInput.of(source, file), CheckerConfig.defaults());
    }

    public static PerformanceChecker of(SourceInput input, CheckerConfig config)
            throws SourceSyntaxException, SourceNotFoundException, SourceUnreadableException {
        return new PerformanceChecker(PythonStructureAnalyzer.of(input), config);
    }

    private List<PerformanceIssue> runEnabledRules() {
        var issues = new ArrayList<PerformanceIssue>();
        addIfEnabled(issues, IssueCategory.REPEATED_QUERY_IN_LOOP, this::checkRepeatedQueries);
        addIfEnabled(issues, IssueCategory.BLOCKING_IO_IN_ASYNC, this::checkBlockingIoInAsync);
        addIfEnabled(issues, IssueCategory.INEFFICIENT_LOOP, this::checkInefficientLoops);
        addIfEnabled(issues, IssueCategory.MEMORY_LOAD, this::checkMemoryLoads);
        addIfEnabled(issues, IssueCategory.EXCEPTION_IN_LOOP, this::checkExceptionsInLoops);
        addIfEnabled(issues, IssueCategory.TYPE_CONVERSION_IN_LOOP, this::checkTypeConversionsInLoops);
        addIfEnabled(issues, IssueCategory.GLOBAL_MUTATION, this::checkGlobalMutations);
        issues.sort(ISSUE_ORDER);
        logger.debug("Found {} issues in {}", issues.size(), structure);
        return List.copyOf(issues);
    }

    private void addIfEnabled(
            List<PerformanceIssue> issues, IssueCategory category, Supplier<List<PerformanceIssue>> rule) {
        if (config.isEnabled(category)) {
            issues.addAll(rule.get());
        } else {
            logger.debug("Skipping disabled rule {}", category.wireName());
        }
    }

    /** All enabled rules, sorted by severity then line. */
    public List<PerformanceIssue> checkAll() {
        return allIssues;
    }

    // ---------------------------------------------------------------------------------------------------------
    // Rules
    // ---------------------------------------------------------------------------------------------------------

    /** ORM and database calls made once per loop iteration. */
    public List<PerformanceIssue> checkRepeatedQueries() {
        var issues = new ArrayList<PerformanceIssue>();
        for (var call : structure.calls()) {
            if (!call.inLoop()) {
                continue;
            }
            catalog.ormFramework(call.functionName(), call.resolvedName())
                    .ifPresent(framework -> issues.add(callIssue(
                            IssueCategory.REPEATED_QUERY_IN_LOOP,
                            call,
                            "Potential N+1 query: %s called inside a loop".formatted(call.functionName()),
                            catalog.ormSuggestion(framework))));
        }
        return List.copyOf(issues);
    }

    /** Synchronous I/O inside {@code async def} bodies. */
    public List<PerformanceIssue> checkBlockingIoInAsync() {
        var issues = new ArrayList<PerformanceIssue>();
        for (var call : structure.calls()) {
            if (!call.inAsyncFunction() || !catalog.isBlockingIo(call.functionName(), call.resolvedName())) {
                continue;
            }
            var suggestion = catalog.asyncAlternative(call.functionName(), call.resolvedName())
                    .map(alt -> "Replace with %s and use await".formatted(alt))
                    .orElse("Replace with async alternative");
            issues.add(callIssue(
                    IssueCategory.BLOCKING_IO_IN_ASYNC,
                    call,
                    "Blocking I/O call '%s' in async function blocks event loop".formatted(call.functionName()),
                    suggestion));
        }
        return List.copyOf(issues);
    }

    /**
     * String building by repeated concatenation inside loops, and loops nested at least
     * {@link CheckerConfig#nestedLoopThreshold()} deep. Each chain of nested loops is reported once, at its deepest
     * loop.
     */
    public List<PerformanceIssue> checkInefficientLoops() {
        var issues = new ArrayList<PerformanceIssue>();
        var category = IssueCategory.INEFFICIENT_LOOP;

        for (var concat : structure.concatenations()) {
            issues.add(new PerformanceIssue(
                    category,
                    category.defaultSeverity(),
                    concat.lineNumber(),
                    concat.endLineNumber(),
                    "String concatenation in loop creates new string object each iteration",
                    "Use list.append() and ''.join(list) or io.StringIO for better performance",
                    snippet(concat.lineNumber(), concat.endLineNumber()),
                    concat.enclosingFunction()));
        }

        var loops = structure.loops();
        for (var loop : loops) {
            int depth = loop.nestingLevel() + 1;
            if (depth < config.nestedLoopThreshold() || enclosesAnother(loop, loops)) {
                continue;
            }
            issues.add(new PerformanceIssue(
                    category,
                    category.defaultSeverity(),
                    loop.lineNumber(),
                    loop.endLineNumber(),
                    "Deeply nested loop (depth %d) has O(n^%d) complexity".formatted(depth, depth),
                    "Consider if the algorithm can be optimized with better data structures or caching",
                    snippet(loop.lineNumber(), loop.endLineNumber()),
                    loop.enclosingFunction()));
        }
        return List.copyOf(issues);
    }

    private static boolean enclosesAnother(LoopInfo loop, List<LoopInfo> loops) {
        for (var other : loops) {
            if (other != loop && loop.encloses(other)) {
                return true;
            }
        }
        return false;
    }

    /** Calls that pull a whole file or serialized structure into memory. */
    public List<PerformanceIssue> checkMemoryLoads() {
        var issues = new ArrayList<PerformanceIssue>();
        for (var call : structure.calls()) {
            catalog.memoryLoadKind(call.functionName(), call.resolvedName())
                    .ifPresent(kind -> issues.add(callIssue(
                            IssueCategory.MEMORY_LOAD,
                            call,
                            catalog.memoryDescription(kind, call.functionName()),
                            catalog.memorySuggestion(kind))));
        }
        return List.copyOf(issues);
    }

    public List<PerformanceIssue> checkExceptionsInLoops() {
        var issues = new ArrayList<PerformanceIssue>();
        var category = IssueCategory.EXCEPTION_IN_LOOP;
        for (var tryStatement : structure.tryStatements()) {
            if (!tryStatement.inLoop()) {
                continue;
            }
            issues.add(new PerformanceIssue(
                    category,
                    category.defaultSeverity(),
                    tryStatement.lineNumber(),
                    tryStatement.endLineNumber(),
                    "Try/except block inside loop incurs exception handling overhead on each iteration",
                    "Move try/except outside the loop, or use conditional checks (if/else) for expected cases",
                    snippet(tryStatement.lineNumber(), tryStatement.endLineNumber()),
                    tryStatement.enclosingFunction()));
        }
        return List.copyOf(issues);
    }

    public List<PerformanceIssue> checkTypeConversionsInLoops() {
        var issues = new ArrayList<PerformanceIssue>();
        for (var call : structure.calls()) {
            if (call.inLoop() && catalog.isTypeConversion(call.functionName(), call.resolvedName())) {
                issues.add(callIssue(
                        IssueCategory.TYPE_CONVERSION_IN_LOOP,
                        call,
                        "Type conversion '%s()' called inside loop creates new objects each iteration"
                                .formatted(call.functionName()),
                        "If converting the same value repeatedly, move the conversion outside the loop"));
            }
        }
        return List.copyOf(issues);
    }

    /** {@code global} declarations inside functions; module-level declarations are harmless. */
    public List<PerformanceIssue> checkGlobalMutations() {
        var issues = new ArrayList<PerformanceIssue>();
        var category = IssueCategory.GLOBAL_MUTATION;
        for (var global : structure.globalStatements()) {
            if (global.enclosingFunction() == null) {
                continue;
            }
            issues.add(new PerformanceIssue(
                    category,
                    category.defaultSeverity(),
                    global.lineNumber(),
                    global.lineNumber(),
                    "Function modifies global variable(s): " + String.join(", ", global.names()),
                    "Pass values as parameters and return results instead of using global state",
                    snippet(global.lineNumber(), global.lineNumber()),
                    global.enclosingFunction()));
        }
        return List.copyOf(issues);
    }

    // ---------------------------------------------------------------------------------------------------------
    // Filters and summary
    // ---------------------------------------------------------------------------------------------------------

    public List<PerformanceIssue> issuesBySeverity(Severity severity) {
        return allIssues.stream().filter(i -> i.severity() == severity).toList();
    }

    public List<PerformanceIssue> issuesByCategory(IssueCategory category) {
        return allIssues.stream().filter(i -> i.category() == category).toList();
    }

    /** Issues at {@code minimum} severity or above, in {@link #checkAll()} order. */
    public List<PerformanceIssue> issuesAtLeast(Severity minimum) {
        return allIssues.stream().filter(i -> i.severity().isAtLeast(minimum)).toList();
    }

    public List<PerformanceIssue> criticalIssues() {
        return issuesBySeverity(Severity.CRITICAL);
    }

    public boolean hasIssues() {
        return !allIssues.isEmpty();
    }

    public IssueSummary summary() {
        return IssueSummary.of(allIssues);
    }

    public StructureProvider structure() {
        return structure;
    }

    public CheckerConfig config() {
        return config;
    }

    // ---------------------------------------------------------------------------------------------------------

    private PerformanceIssue callIssue(IssueCategory category, CallInfo call, String description, String suggestion) {
        return new PerformanceIssue(
                category,
                category.defaultSeverity(),
                call.lineNumber(),
                call.lineNumber(),
                description,
                suggestion,
                snippet(call.lineNumber(), call.lineNumber()),
                call.enclosingFunction());
    }

    private @Nullable String snippet(int startLine, int endLine) {
        int last = Math.min(endLine, startLine + config.snippetMaxLines() - 1);
        var text = structure.sourceSegment(startLine, last);
        return text.isBlank() ? null : text;
    }
}
