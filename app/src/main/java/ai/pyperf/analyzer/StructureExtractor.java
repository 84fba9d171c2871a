package ai.pyperf.analyzer;

import static ai.pyperf.analyzer.ASTTraversalUtils.endLine;
import static ai.pyperf.analyzer.ASTTraversalUtils.extractNodeText;
import static ai.pyperf.analyzer.ASTTraversalUtils.field;
import static ai.pyperf.analyzer.ASTTraversalUtils.findAllNodesByType;
import static ai.pyperf.analyzer.ASTTraversalUtils.namedChildren;
import static ai.pyperf.analyzer.ASTTraversalUtils.startLine;
import static ai.pyperf.analyzer.ASTTraversalUtils.startsWithKeyword;
import static ai.pyperf.analyzer.PythonNodeTypes.*;

import ai.pyperf.analyzer.ContextWalker.WalkContext;
import ai.pyperf.analyzer.PythonNameResolver.Binding;
import ai.pyperf.analyzer.PythonNameResolver.BindingKind;
import com.google.common.base.CharMatcher;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.function.ToIntFunction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Builds the {@link AnalysisResult} of a parsed module in a single walk. Each kind of record is collected into its
 * own list; lists are returned sorted by line.
 */
public final class StructureExtractor implements ContextWalker.Visitor {
    private static final Logger log = LogManager.getLogger(StructureExtractor.class);

    private final SourceContent content;
    private final PythonNameResolver resolver;

    private final List<FunctionInfo> functions = new ArrayList<>();
    private final List<LoopInfo> loops = new ArrayList<>();
    private final List<ImportInfo> imports = new ArrayList<>();
    private final List<CallInfo> calls = new ArrayList<>();
    private final List<ConcatenationInfo> concatenations = new ArrayList<>();
    private final List<TryStatementInfo> tryStatements = new ArrayList<>();
    private final List<GlobalStatementInfo> globalStatements = new ArrayList<>();

    private StructureExtractor(SourceContent content, PythonNameResolver resolver) {
        this.content = content;
        this.resolver = resolver;
    }

    public static AnalysisResult analyze(ParsedSource parsed) {
        var resolver = PythonNameResolver.build(parsed);
        var extractor = new StructureExtractor(parsed.content(), resolver);
        ContextWalker.walk(parsed.root(), resolver, extractor);
        var result = extractor.toResult();
        log.debug(
                "Extracted {} functions, {} loops, {} imports, {} calls from {}",
                result.functions().size(),
                result.loops().size(),
                result.imports().size(),
                result.calls().size(),
                parsed.moduleName());
        return result;
    }

    private AnalysisResult toResult() {
        return new AnalysisResult(
                sortedByLine(functions, FunctionInfo::lineNumber),
                sortedByLine(loops, LoopInfo::lineNumber),
                sortedByLine(imports, ImportInfo::lineNumber),
                sortedByLine(calls, CallInfo::lineNumber),
                sortedByLine(concatenations, ConcatenationInfo::lineNumber),
                sortedByLine(tryStatements, TryStatementInfo::lineNumber),
                sortedByLine(globalStatements, GlobalStatementInfo::lineNumber));
    }

    private static <T> List<T> sortedByLine(List<T> records, ToIntFunction<T> line) {
        var copy = new ArrayList<>(records);
        copy.sort(Comparator.comparingInt(line));
        return copy;
    }

    @Override
    public void onNode(TSNode node, WalkContext ctx) {
        switch (node.getType()) {
            case FUNCTION_DEFINITION -> functions.add(describeFunction(node, ctx));
            case CALL -> describeCall(node, ctx);
            case IMPORT_STATEMENT, IMPORT_FROM_STATEMENT, FUTURE_IMPORT_STATEMENT ->
                imports.addAll(PythonImports.describe(node, content));
            case TRY_STATEMENT -> tryStatements.add(
                    new TryStatementInfo(startLine(node), endLine(node), ctx.enclosingFunction(), ctx.inLoop()));
            case GLOBAL_STATEMENT -> {
                var names = namedChildren(node).stream()
                        .filter(n -> IDENTIFIER.equals(n.getType()))
                        .map(this::text)
                        .toList();
                globalStatements.add(new GlobalStatementInfo(names, startLine(node), ctx.enclosingFunction()));
            }
            case AUGMENTED_ASSIGNMENT -> describeAugmentedConcatenation(node, ctx);
            case ASSIGNMENT -> describeSelfConcatenation(node, ctx);
            default -> {
                // other nodes carry nothing to extract
            }
        }
    }

    @Override
    public void onLoop(TSNode loopNode, LoopKind kind, WalkContext outer, WalkContext inner) {
        var frame = Objects.requireNonNull(inner.innermostLoop());
        loops.add(new LoopInfo(
                kind, frame.line(), frame.endLine(), outer.enclosingFunction(), frame.nestingLevel(), outer.inAsync()));
    }

    // ---------------------------------------------------------------------------------------------------------
    // Functions
    // ---------------------------------------------------------------------------------------------------------

    private FunctionInfo describeFunction(TSNode node, WalkContext ctx) {
        var name = text(field(node, FIELD_NAME));
        var scope = resolver.scopeOf(node, ctx.scope());

        var parameters = new ArrayList<String>();
        var types = new LinkedHashMap<String, String>();
        var params = field(node, FIELD_PARAMETERS);
        if (params != null) {
            for (var p : namedChildren(params)) {
                var paramName = parameterName(p);
                if (paramName == null) {
                    continue;
                }
                parameters.add(paramName);
                var annotation = field(p, FIELD_TYPE);
                if (annotation != null) {
                    types.put(paramName, text(annotation));
                }
            }
        }
        scope.variableTypes().forEach(types::putIfAbsent);

        var returnType = field(node, FIELD_RETURN_TYPE);
        return new FunctionInfo(
                name,
                startLine(node),
                endLine(node),
                startsWithKeyword(node, ASYNC_KEYWORD),
                parameters,
                decoratorsOf(node),
                returnType == null ? null : text(returnType),
                docstringOf(node),
                types);
    }

    /** Plain, typed and defaulted parameters; {@code *args}, {@code **kwargs} and separators are skipped. */
    private @Nullable String parameterName(TSNode param) {
        return switch (param.getType()) {
            case IDENTIFIER -> text(param);
            case TYPED_PARAMETER -> {
                var children = namedChildren(param);
                yield !children.isEmpty() && IDENTIFIER.equals(children.get(0).getType())
                        ? text(children.get(0))
                        : null;
            }
            case DEFAULT_PARAMETER, TYPED_DEFAULT_PARAMETER -> {
                var nameNode = field(param, FIELD_NAME);
                yield nameNode == null ? null : text(nameNode);
            }
            default -> null;
        };
    }

    private List<String> decoratorsOf(TSNode function) {
        var parent = function.getParent();
        if (ASTTraversalUtils.isAbsent(parent) || !DECORATED_DEFINITION.equals(parent.getType())) {
            return List.of();
        }
        var decorators = new ArrayList<String>();
        for (var child : namedChildren(parent)) {
            if (!DECORATOR.equals(child.getType())) {
                continue;
            }
            var expressions = namedChildren(child);
            if (expressions.isEmpty()) {
                continue;
            }
            var expr = expressions.get(0);
            if (CALL.equals(expr.getType())) {
                var fn = field(expr, FIELD_FUNCTION);
                decorators.add(fn == null ? text(expr) : compact(text(fn)));
            } else {
                decorators.add(compact(text(expr)));
            }
        }
        return decorators;
    }

    private @Nullable String docstringOf(TSNode function) {
        var body = field(function, FIELD_BODY);
        if (body == null) {
            return null;
        }
        var statements = namedChildren(body);
        if (statements.isEmpty() || !EXPRESSION_STATEMENT.equals(statements.get(0).getType())) {
            return null;
        }
        var exprs = namedChildren(statements.get(0));
        if (exprs.size() != 1 || !STRING.equals(exprs.get(0).getType())) {
            return null;
        }
        var parts = findAllNodesByType(exprs.get(0), STRING_CONTENT);
        var sb = new StringBuilder();
        for (var part : parts) {
            sb.append(content.substringFrom(part));
        }
        return sb.toString().strip();
    }

    // ---------------------------------------------------------------------------------------------------------
    // Calls
    // ---------------------------------------------------------------------------------------------------------

    private void describeCall(TSNode call, WalkContext ctx) {
        var fn = field(call, FIELD_FUNCTION);
        if (fn == null) {
            return;
        }
        var type = fn.getType();
        if (!IDENTIFIER.equals(type) && !ATTRIBUTE.equals(type)) {
            return;
        }
        calls.add(new CallInfo(
                compact(text(fn)),
                startLine(call),
                ctx.enclosingFunction(),
                ctx.inLoop(),
                ctx.inAsync(),
                resolver.resolveCallee(fn, ctx.scope())));
    }

    // ---------------------------------------------------------------------------------------------------------
    // String building
    // ---------------------------------------------------------------------------------------------------------

    private void describeAugmentedConcatenation(TSNode node, WalkContext ctx) {
        if (!ctx.inLoop()) {
            return;
        }
        var operator = field(node, FIELD_OPERATOR);
        if (operator == null || !"+=".equals(operator.getType())) {
            return;
        }
        var target = field(node, FIELD_LEFT);
        if (target != null && buildsStringOutsideLoop(target, field(node, FIELD_RIGHT), ctx)) {
            addConcatenation(node, target, ctx, true);
        }
    }

    /**
     * {@code x = x + ...} where the right-hand side starts with the target itself. {@code x + a + b} parses as
     * {@code (x + a) + b}, so the leftmost operand of the {@code +} chain is compared.
     */
    private void describeSelfConcatenation(TSNode node, WalkContext ctx) {
        if (!ctx.inLoop()) {
            return;
        }
        var target = field(node, FIELD_LEFT);
        var value = field(node, FIELD_RIGHT);
        if (target == null || !isPlus(value)) {
            return;
        }
        var leftmost = field(value, FIELD_LEFT);
        while (isPlus(leftmost)) {
            leftmost = field(leftmost, FIELD_LEFT);
        }
        if (leftmost == null || !compact(text(leftmost)).equals(compact(text(target)))) {
            return;
        }
        if (buildsStringOutsideLoop(target, field(value, FIELD_RIGHT), ctx)) {
            addConcatenation(node, target, ctx, false);
        }
    }

    private static boolean isPlus(@Nullable TSNode node) {
        if (node == null || !BINARY_OPERATOR.equals(node.getType())) {
            return false;
        }
        var operator = field(node, FIELD_OPERATOR);
        return operator != null && "+".equals(operator.getType());
    }

    /**
     * A name target qualifies when it was bound before the innermost loop (or is a parameter) and is known to be a
     * string there, or its type is unknown and the appended value is a string. Attribute targets qualify when the
     * appended value is a string.
     */
    private boolean buildsStringOutsideLoop(TSNode target, @Nullable TSNode appended, WalkContext ctx) {
        var loop = Objects.requireNonNull(ctx.innermostLoop());
        var scope = ctx.scope();
        if (ATTRIBUTE.equals(target.getType())) {
            return resolver.isStringValued(appended, scope);
        }
        if (!IDENTIFIER.equals(target.getType())) {
            return false;
        }

        var outside = new ArrayList<Binding>();
        for (var b : resolver.visibleBindings(text(target), scope)) {
            if (b.kind() == BindingKind.PARAMETER || b.line() < loop.line()) {
                outside.add(b);
            }
        }
        if (outside.isEmpty()) {
            return false;
        }
        var knownTypes = outside.stream()
                .map(Binding::inferredType)
                .filter(Objects::nonNull)
                .toList();
        if (knownTypes.contains(PythonNameResolver.STR)) {
            return true;
        }
        if (!knownTypes.isEmpty()) {
            return false;
        }
        return resolver.isStringValued(appended, scope);
    }

    private void addConcatenation(TSNode node, TSNode target, WalkContext ctx, boolean augmented) {
        var loop = Objects.requireNonNull(ctx.innermostLoop());
        concatenations.add(new ConcatenationInfo(
                compact(text(target)), startLine(node), endLine(node), ctx.enclosingFunction(), loop.line(), augmented));
    }

    private String text(@Nullable TSNode node) {
        return extractNodeText(node, content);
    }

    private static String compact(String text) {
        return CharMatcher.whitespace().removeFrom(text);
    }
}
