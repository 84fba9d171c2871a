package ai.pyperf.analyzer;

import static ai.pyperf.analyzer.ASTTraversalUtils.extractNodeText;
import static ai.pyperf.analyzer.ASTTraversalUtils.field;
import static ai.pyperf.analyzer.ASTTraversalUtils.namedChildren;
import static ai.pyperf.analyzer.ASTTraversalUtils.startLine;
import static ai.pyperf.analyzer.PythonNodeTypes.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Best-effort static name resolution for a single module. A pre-pass records the bindings of every scope (imports,
 * definitions, assignments, parameters, loop and {@code with} targets); lookups then follow Python's
 * local/enclosing/global/builtin order, with class bodies invisible to the functions nested in them.
 *
 * <p>Resolution never fails loudly: anything that cannot be determined statically (relative or wildcard imports,
 * chains through calls or subscripts, plain local variables of unknown type) yields {@code null}.
 */
public final class PythonNameResolver {
    private static final Logger log = LogManager.getLogger(PythonNameResolver.class);

    public static final String BUILTINS_MODULE = "builtins";
    public static final String LAMBDA_NAME = "<lambda>";

    static final Set<String> BUILTIN_NAMES = Set.of(
            "abs", "aiter", "all", "anext", "any", "ascii", "bin", "bool", "breakpoint", "bytearray", "bytes",
            "callable", "chr", "classmethod", "compile", "complex", "delattr", "dict", "dir", "divmod", "enumerate",
            "eval", "exec", "filter", "float", "format", "frozenset", "getattr", "globals", "hasattr", "hash", "help",
            "hex", "id", "input", "int", "isinstance", "issubclass", "iter", "len", "list", "locals", "map", "max",
            "memoryview", "min", "next", "object", "oct", "open", "ord", "pow", "print", "property", "range", "repr",
            "reversed", "round", "set", "setattr", "slice", "sorted", "staticmethod", "str", "sum", "super", "tuple",
            "type", "vars", "zip", "__import__");

    static final Set<String> BUILTIN_TYPES = Set.of(
            "str", "int", "float", "bool", "complex", "list", "dict", "set", "frozenset", "tuple", "bytes", "bytearray");

    public static final String STR = "str";

    public enum ScopeKind {
        MODULE,
        FUNCTION,
        CLASS
    }

    public enum BindingKind {
        IMPORT,
        DEFINITION,
        LOCAL,
        PARAMETER
    }

    /**
     * A name bound in a scope.
     *
     * @param target fully-qualified path for imports and definitions; null for relative imports and variables
     * @param inferredType best-effort type of a variable, e.g. {@code str} or {@code requests.Session}
     */
    public record Binding(
            String name, BindingKind kind, int line, @Nullable String target, @Nullable String inferredType) {

        boolean isVariable() {
            return kind == BindingKind.LOCAL || kind == BindingKind.PARAMETER;
        }
    }

    /** A lexical scope. Populated during {@link #build(ParsedSource)} and read-only afterwards. */
    public static final class Scope {
        private final ScopeKind kind;
        private final String name;
        private final String qualifiedName;
        private final @Nullable Scope parent;
        private final Map<String, List<Binding>> bindings = new LinkedHashMap<>();
        private final Set<String> globals = new HashSet<>();

        private Scope(ScopeKind kind, String name, @Nullable Scope parent) {
            this.kind = kind;
            this.name = name;
            this.parent = parent;
            this.qualifiedName = parent == null ? name : parent.qualifiedName + "." + name;
        }

        public ScopeKind kind() {
            return kind;
        }

        public String name() {
            return name;
        }

        public String qualifiedName() {
            return qualifiedName;
        }

        public @Nullable Scope parent() {
            return parent;
        }

        /** Bindings of {@code name} made directly in this scope, in source order. */
        public List<Binding> bindings(String name) {
            return List.copyOf(bindings.getOrDefault(name, List.of()));
        }

        public boolean declaresGlobal(String name) {
            return globals.contains(name);
        }

        /** First inferred type of each variable bound in this scope. */
        public Map<String, String> variableTypes() {
            var types = new LinkedHashMap<String, String>();
            bindings.forEach((n, list) -> list.stream()
                    .filter(Binding::isVariable)
                    .map(Binding::inferredType)
                    .filter(t -> t != null)
                    .findFirst()
                    .ifPresent(t -> types.put(n, t)));
            return types;
        }

        private void bind(Binding binding) {
            bindings.computeIfAbsent(binding.name(), k -> new ArrayList<>()).add(binding);
        }

        @Override
        public String toString() {
            return "Scope[" + kind + " " + qualifiedName + "]";
        }
    }

    private final SourceContent content;
    private final String moduleName;
    private final Scope moduleScope;
    private final Map<String, Scope> scopesByNode = new HashMap<>();

    private PythonNameResolver(SourceContent content, String moduleName) {
        this.content = content;
        this.moduleName = moduleName;
        this.moduleScope = new Scope(ScopeKind.MODULE, moduleName, null);
    }

    public static PythonNameResolver build(ParsedSource parsed) {
        var resolver = new PythonNameResolver(parsed.content(), parsed.moduleName());
        resolver.collect(parsed.root(), resolver.moduleScope);
        log.debug(
                "Collected {} scopes and {} module-level names for {}",
                resolver.scopesByNode.size() + 1,
                resolver.moduleScope.bindings.size(),
                parsed.moduleName());
        return resolver;
    }

    public String moduleName() {
        return moduleName;
    }

    SourceContent content() {
        return content;
    }

    public Scope moduleScope() {
        return moduleScope;
    }

    /** The scope opened by a function, lambda or class node. */
    public Scope scopeOf(TSNode scopeNode, Scope enclosing) {
        var scope = scopesByNode.get(nodeKey(scopeNode));
        if (scope == null) {
            log.warn("No scope recorded for {} at line {}", scopeNode.getType(), startLine(scopeNode));
            return enclosing;
        }
        return scope;
    }

    // ---------------------------------------------------------------------------------------------------------
    // Lookup
    // ---------------------------------------------------------------------------------------------------------

    /** The binding {@code name} refers to from {@code scope}, if any scope on the lookup chain binds it. */
    public Optional<Binding> lookup(String name, Scope scope) {
        var visible = visibleBindings(name, scope);
        if (visible.isEmpty()) {
            return Optional.empty();
        }
        Binding preferred = visible.get(visible.size() - 1);
        for (var b : visible) {
            if (!b.isVariable()) {
                preferred = b;
            }
        }
        return Optional.of(preferred);
    }

    /** Bindings of {@code name} in the innermost scope on the lookup chain that binds it. */
    public List<Binding> visibleBindings(String name, Scope scope) {
        Scope current = scope.declaresGlobal(name) ? moduleScope : scope;
        while (current != null) {
            if (current == scope || current.kind != ScopeKind.CLASS) {
                var found = current.bindings.get(name);
                if (found != null && !found.isEmpty()) {
                    return List.copyOf(found);
                }
            }
            current = current.parent;
        }
        return List.of();
    }

    /** Fully-qualified name of a bare identifier, or null when it is a variable or unknown. */
    public @Nullable String resolveName(String name, Scope scope) {
        var binding = lookup(name, scope);
        if (binding.isPresent()) {
            var b = binding.get();
            return b.isVariable() ? null : b.target();
        }
        return BUILTIN_NAMES.contains(name) ? BUILTINS_MODULE + "." + name : null;
    }

    /**
     * Fully-qualified name of a callee expression. Identifiers resolve through {@link #resolveName}; attribute chains
     * resolve their base identifier (through its import, definition, or the inferred type of a variable) and append
     * the attribute path. Anything else is unresolved.
     */
    public @Nullable String resolveCallee(TSNode expr, Scope scope) {
        var type = expr.getType();
        if (IDENTIFIER.equals(type)) {
            return resolveName(text(expr), scope);
        }
        if (!ATTRIBUTE.equals(type)) {
            return null;
        }

        var parts = new ArrayDeque<String>();
        TSNode current = expr;
        while (ATTRIBUTE.equals(current.getType())) {
            var attr = field(current, FIELD_ATTRIBUTE);
            var obj = field(current, FIELD_OBJECT);
            if (attr == null || obj == null) {
                return null;
            }
            parts.addFirst(text(attr));
            current = obj;
        }
        if (!IDENTIFIER.equals(current.getType())) {
            return null;
        }

        var prefix = qualifiedBase(text(current), scope);
        return prefix == null ? null : prefix + "." + String.join(".", parts);
    }

    private @Nullable String qualifiedBase(String base, Scope scope) {
        var binding = lookup(base, scope);
        if (binding.isEmpty()) {
            return BUILTIN_NAMES.contains(base) ? BUILTINS_MODULE + "." + base : null;
        }
        if (!binding.get().isVariable()) {
            return binding.get().target();
        }
        var inferred = variableType(base, scope);
        if (inferred == null) {
            return null;
        }
        if (BUILTIN_TYPES.contains(inferred)) {
            return BUILTINS_MODULE + "." + inferred;
        }
        return inferred.contains(".") ? inferred : null;
    }

    /** First inferred type among the visible variable bindings of {@code name}. */
    public @Nullable String variableType(String name, Scope scope) {
        for (var b : visibleBindings(name, scope)) {
            if (b.isVariable() && b.inferredType() != null) {
                return b.inferredType();
            }
        }
        return null;
    }

    // ---------------------------------------------------------------------------------------------------------
    // Type inference
    // ---------------------------------------------------------------------------------------------------------

    /**
     * Best-effort type of an expression: literal types, {@code str} for string-building operations and string
     * methods, builtin constructor names, and the qualified name of resolved class constructors.
     */
    public @Nullable String inferType(@Nullable TSNode expr, Scope scope) {
        if (expr == null) {
            return null;
        }
        return switch (expr.getType()) {
            case STRING, CONCATENATED_STRING -> STR;
            case INTEGER -> "int";
            case FLOAT -> "float";
            case TRUE, FALSE -> "bool";
            case NONE -> "None";
            case LIST, LIST_COMPREHENSION -> "list";
            case DICTIONARY, DICTIONARY_COMPREHENSION -> "dict";
            case SET, SET_COMPREHENSION -> "set";
            case TUPLE -> "tuple";
            case GENERATOR_EXPRESSION -> "generator";
            case PARENTHESIZED_EXPRESSION -> {
                var inner = namedChildren(expr);
                yield inner.size() == 1 ? inferType(inner.get(0), scope) : null;
            }
            case ASSIGNMENT -> inferType(field(expr, FIELD_RIGHT), scope);
            case BINARY_OPERATOR -> inferBinaryType(expr, scope);
            case IDENTIFIER -> variableType(text(expr), scope);
            case CALL -> inferCallType(expr, scope);
            default -> null;
        };
    }

    public boolean isStringValued(@Nullable TSNode expr, Scope scope) {
        return STR.equals(inferType(expr, scope));
    }

    private @Nullable String inferBinaryType(TSNode expr, Scope scope) {
        var operator = field(expr, FIELD_OPERATOR);
        if (operator == null) {
            return null;
        }
        var op = operator.getType();
        var left = inferType(field(expr, FIELD_LEFT), scope);
        var right = inferType(field(expr, FIELD_RIGHT), scope);
        if (("+".equals(op) || "*".equals(op)) && (STR.equals(left) || STR.equals(right))) {
            return STR;
        }
        if ("%".equals(op) && STR.equals(left)) {
            return STR;
        }
        if (left != null && left.equals(right) && Set.of("int", "float", "list", "tuple").contains(left)) {
            return left;
        }
        return null;
    }

    private @Nullable String inferCallType(TSNode call, Scope scope) {
        var fn = field(call, FIELD_FUNCTION);
        if (fn == null) {
            return null;
        }
        if (ATTRIBUTE.equals(fn.getType()) && isStringValued(field(fn, FIELD_OBJECT), scope)) {
            return STR;
        }
        var resolved = resolveCallee(fn, scope);
        if (resolved == null) {
            return null;
        }
        if (resolved.startsWith(BUILTINS_MODULE + ".")) {
            var simple = resolved.substring(BUILTINS_MODULE.length() + 1);
            return BUILTIN_TYPES.contains(simple) ? simple : null;
        }
        var last = resolved.substring(resolved.lastIndexOf('.') + 1);
        return !last.isEmpty() && Character.isUpperCase(last.charAt(0)) ? resolved : null;
    }

    /** Type named by an annotation: builtin types by simple name, resolvable names qualified, else the text. */
    private String annotationType(TSNode annotation, Scope scope) {
        var expr = annotation;
        if (TYPE.equals(annotation.getType())) {
            var inner = namedChildren(annotation);
            if (inner.size() == 1) {
                expr = inner.get(0);
            }
        }
        var resolved = resolveCallee(expr, scope);
        if (resolved == null) {
            return text(annotation);
        }
        if (resolved.startsWith(BUILTINS_MODULE + ".")) {
            var simple = resolved.substring(BUILTINS_MODULE.length() + 1);
            if (BUILTIN_TYPES.contains(simple)) {
                return simple;
            }
        }
        return resolved;
    }

    // ---------------------------------------------------------------------------------------------------------
    // Binding collection
    // ---------------------------------------------------------------------------------------------------------

    private void collect(TSNode node, Scope scope) {
        switch (node.getType()) {
            case FUNCTION_DEFINITION -> collectFunction(node, scope);
            case LAMBDA -> collectLambda(node, scope);
            case CLASS_DEFINITION -> collectClass(node, scope);
            case IMPORT_STATEMENT, IMPORT_FROM_STATEMENT, FUTURE_IMPORT_STATEMENT -> bindImports(node, scope);
            case ASSIGNMENT -> {
                bindAssignment(node, scope);
                collectChildren(node, scope);
            }
            case FOR_STATEMENT, FOR_IN_CLAUSE -> {
                bindTargets(field(node, FIELD_LEFT), scope, null);
                collectChildren(node, scope);
            }
            case AS_PATTERN, EXCEPT_CLAUSE -> {
                bindTargets(field(node, FIELD_ALIAS), scope, null);
                collectChildren(node, scope);
            }
            case NAMED_EXPRESSION -> {
                bindTargets(field(node, FIELD_NAME), scope, inferType(field(node, FIELD_VALUE), scope));
                collectChildren(node, scope);
            }
            case GLOBAL_STATEMENT -> {
                for (var child : namedChildren(node)) {
                    if (IDENTIFIER.equals(child.getType())) {
                        scope.globals.add(text(child));
                    }
                }
            }
            default -> collectChildren(node, scope);
        }
    }

    private void collectChildren(TSNode node, Scope scope) {
        for (var child : namedChildren(node)) {
            collect(child, scope);
        }
    }

    private void collectFunction(TSNode node, Scope scope) {
        var nameNode = field(node, FIELD_NAME);
        var name = text(nameNode);
        scope.bind(new Binding(name, BindingKind.DEFINITION, startLine(node), scope.qualifiedName + "." + name, null));

        var functionScope = new Scope(ScopeKind.FUNCTION, name, scope);
        scopesByNode.put(nodeKey(node), functionScope);

        var params = field(node, FIELD_PARAMETERS);
        if (params != null) {
            bindParameters(params, functionScope, scope);
        }
        var body = field(node, FIELD_BODY);
        if (body != null) {
            collect(body, functionScope);
        }
    }

    private void collectLambda(TSNode node, Scope scope) {
        var lambdaScope = new Scope(ScopeKind.FUNCTION, LAMBDA_NAME, scope);
        scopesByNode.put(nodeKey(node), lambdaScope);

        var params = field(node, FIELD_PARAMETERS);
        if (params != null) {
            bindParameters(params, lambdaScope, scope);
        }
        var body = field(node, FIELD_BODY);
        if (body != null) {
            collect(body, lambdaScope);
        }
    }

    private void collectClass(TSNode node, Scope scope) {
        var name = text(field(node, FIELD_NAME));
        scope.bind(new Binding(name, BindingKind.DEFINITION, startLine(node), scope.qualifiedName + "." + name, null));

        var classScope = new Scope(ScopeKind.CLASS, name, scope);
        scopesByNode.put(nodeKey(node), classScope);

        var bases = field(node, FIELD_SUPERCLASSES);
        if (bases != null) {
            collect(bases, scope);
        }
        var body = field(node, FIELD_BODY);
        if (body != null) {
            collect(body, classScope);
        }
    }

    /** Parameters bind in the function scope; default values and annotations belong to the enclosing scope. */
    private void bindParameters(TSNode params, Scope functionScope, Scope enclosing) {
        for (var p : namedChildren(params)) {
            int line = startLine(p);
            switch (p.getType()) {
                case IDENTIFIER -> functionScope.bind(parameter(text(p), line, null));
                case TYPED_PARAMETER -> {
                    var typeNode = field(p, FIELD_TYPE);
                    var type = typeNode == null ? null : annotationType(typeNode, enclosing);
                    var first = namedChildren(p).isEmpty() ? null : namedChildren(p).get(0);
                    if (first != null && IDENTIFIER.equals(first.getType())) {
                        functionScope.bind(parameter(text(first), line, type));
                    } else if (first != null) {
                        bindSplat(first, functionScope);
                    }
                }
                case DEFAULT_PARAMETER, TYPED_DEFAULT_PARAMETER -> {
                    var typeNode = field(p, FIELD_TYPE);
                    var value = field(p, FIELD_VALUE);
                    var type = typeNode != null ? annotationType(typeNode, enclosing) : inferType(value, enclosing);
                    var nameNode = field(p, FIELD_NAME);
                    if (nameNode != null) {
                        functionScope.bind(parameter(text(nameNode), line, type));
                    }
                    if (value != null) {
                        collect(value, enclosing);
                    }
                }
                case LIST_SPLAT_PATTERN, DICTIONARY_SPLAT_PATTERN -> bindSplat(p, functionScope);
                default -> {
                    // keyword and positional separators bind nothing
                }
            }
        }
    }

    private void bindSplat(TSNode splat, Scope functionScope) {
        for (var child : namedChildren(splat)) {
            if (IDENTIFIER.equals(child.getType())) {
                functionScope.bind(parameter(text(child), startLine(child), null));
            }
        }
    }

    private static Binding parameter(String name, int line, @Nullable String type) {
        return new Binding(name, BindingKind.PARAMETER, line, null, type);
    }

    private void bindImports(TSNode node, Scope scope) {
        for (var info : PythonImports.describe(node, content)) {
            int line = info.lineNumber();
            if (!info.fromImport()) {
                var alias = info.aliases().get(info.module());
                if (alias != null) {
                    scope.bind(new Binding(alias, BindingKind.IMPORT, line, info.module(), null));
                } else {
                    var top = info.module().split("\\.", 2)[0];
                    scope.bind(new Binding(top, BindingKind.IMPORT, line, top, null));
                }
                continue;
            }
            for (var imported : info.names()) {
                if (PythonImports.WILDCARD.equals(imported)) {
                    continue;
                }
                var bound = info.aliases().getOrDefault(imported, imported);
                var target = info.resolvedModule() == null ? null : info.resolvedModule() + "." + imported;
                scope.bind(new Binding(bound, BindingKind.IMPORT, line, target, null));
            }
        }
    }

    private void bindAssignment(TSNode node, Scope scope) {
        var left = field(node, FIELD_LEFT);
        if (left == null) {
            return;
        }
        var typeNode = field(node, FIELD_TYPE);
        String type = null;
        if (IDENTIFIER.equals(left.getType())) {
            type = typeNode != null ? annotationType(typeNode, scope) : inferType(field(node, FIELD_RIGHT), scope);
        }
        bindTargets(left, scope, type);
    }

    private void bindTargets(@Nullable TSNode target, Scope scope, @Nullable String type) {
        if (target == null) {
            return;
        }
        switch (target.getType()) {
            case IDENTIFIER -> scope.bind(new Binding(text(target), BindingKind.LOCAL, startLine(target), null, type));
            case PATTERN_LIST,
                    TUPLE_PATTERN,
                    LIST_PATTERN,
                    TUPLE,
                    LIST,
                    AS_PATTERN_TARGET,
                    PARENTHESIZED_EXPRESSION,
                    LIST_SPLAT_PATTERN -> {
                for (var child : namedChildren(target)) {
                    bindTargets(child, scope, null);
                }
            }
            default -> {
                // attribute and subscript targets do not bind names
            }
        }
    }

    private String text(@Nullable TSNode node) {
        return extractNodeText(node, content);
    }

    private static String nodeKey(TSNode node) {
        return node.getStartByte() + ":" + node.getEndByte() + ":" + node.getType();
    }
}
