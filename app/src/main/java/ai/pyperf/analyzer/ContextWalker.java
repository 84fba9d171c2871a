package ai.pyperf.analyzer;

import static ai.pyperf.analyzer.ASTTraversalUtils.endLine;
import static ai.pyperf.analyzer.ASTTraversalUtils.field;
import static ai.pyperf.analyzer.ASTTraversalUtils.namedChildren;
import static ai.pyperf.analyzer.ASTTraversalUtils.startLine;
import static ai.pyperf.analyzer.ASTTraversalUtils.startsWithKeyword;
import static ai.pyperf.analyzer.PythonNodeTypes.*;

import ai.pyperf.analyzer.PythonNameResolver.Scope;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Explicit recursive walk over a module that hands every named node to a {@link Visitor} together with the lexical
 * context it executes in. Contexts are immutable; entering a function, class or loop derives a new one.
 */
final class ContextWalker {

    /** Receives nodes in document order, each with the context it is evaluated in. */
    interface Visitor {
        void onNode(TSNode node, WalkContext context);

        /**
         * Called once per loop, before its body is walked.
         *
         * @param outer the context the loop statement itself appears in
         * @param inner the context of the loop body
         */
        default void onLoop(TSNode loopNode, LoopKind kind, WalkContext outer, WalkContext inner) {}
    }

    /** Position of the innermost loop enclosing a node. */
    record LoopFrame(LoopKind kind, int line, int endLine, int nestingLevel) {}

    record WalkContext(
            Scope scope,
            @Nullable String enclosingFunction,
            boolean inAsync,
            int loopDepth,
            @Nullable LoopFrame innermostLoop) {

        static WalkContext moduleLevel(Scope moduleScope) {
            return new WalkContext(moduleScope, null, false, 0, null);
        }

        boolean inLoop() {
            return loopDepth > 0;
        }

        WalkContext enterLoop(LoopFrame frame) {
            return new WalkContext(scope, enclosingFunction, inAsync, loopDepth + 1, frame);
        }

        /** Loop depth carries into nested functions; only the async flag is the function's own. */
        WalkContext enterFunction(Scope functionScope, String name, boolean async) {
            return new WalkContext(functionScope, name, async, loopDepth, innermostLoop);
        }

        WalkContext enterClass(Scope classScope) {
            return new WalkContext(classScope, enclosingFunction, inAsync, loopDepth, innermostLoop);
        }
    }

    private final PythonNameResolver resolver;
    private final Visitor visitor;

    private ContextWalker(PythonNameResolver resolver, Visitor visitor) {
        this.resolver = resolver;
        this.visitor = visitor;
    }

    static void walk(TSNode root, PythonNameResolver resolver, Visitor visitor) {
        var walker = new ContextWalker(resolver, visitor);
        walker.walk(root, WalkContext.moduleLevel(resolver.moduleScope()));
    }

    private void walk(@Nullable TSNode node, WalkContext ctx) {
        if (node == null) {
            return;
        }
        var type = node.getType();
        switch (type) {
            case FUNCTION_DEFINITION -> walkFunction(node, ctx);
            case LAMBDA -> walkLambda(node, ctx);
            case CLASS_DEFINITION -> walkClass(node, ctx);
            case FOR_STATEMENT -> walkFor(node, ctx);
            case WHILE_STATEMENT -> walkWhile(node, ctx);
            default -> {
                if (COMPREHENSIONS.contains(type)) {
                    walkComprehension(node, ctx);
                } else {
                    visitor.onNode(node, ctx);
                    walkChildren(node, ctx);
                }
            }
        }
    }

    private void walkChildren(TSNode node, WalkContext ctx) {
        for (var child : namedChildren(node)) {
            walk(child, ctx);
        }
    }

    private void walkFunction(TSNode node, WalkContext ctx) {
        visitor.onNode(node, ctx);
        var name = ASTTraversalUtils.extractNodeText(field(node, FIELD_NAME), resolver.content());
        var inner = ctx.enterFunction(resolver.scopeOf(node, ctx.scope()), name, startsWithKeyword(node, ASYNC_KEYWORD));

        var params = field(node, FIELD_PARAMETERS);
        if (params != null) {
            walk(params, ctx);
        }
        walk(field(node, FIELD_RETURN_TYPE), ctx);
        walk(field(node, FIELD_BODY), inner);
    }

    private void walkLambda(TSNode node, WalkContext ctx) {
        visitor.onNode(node, ctx);
        var inner = ctx.enterFunction(resolver.scopeOf(node, ctx.scope()), PythonNameResolver.LAMBDA_NAME, false);
        walk(field(node, FIELD_PARAMETERS), ctx);
        walk(field(node, FIELD_BODY), inner);
    }

    private void walkClass(TSNode node, WalkContext ctx) {
        visitor.onNode(node, ctx);
        walk(field(node, FIELD_SUPERCLASSES), ctx);
        walk(field(node, FIELD_BODY), ctx.enterClass(resolver.scopeOf(node, ctx.scope())));
    }

    private void walkFor(TSNode node, WalkContext ctx) {
        visitor.onNode(node, ctx);
        var inner = ctx.enterLoop(frame(node, LoopKind.FOR, ctx));
        visitor.onLoop(node, LoopKind.FOR, ctx, inner);

        walk(field(node, FIELD_LEFT), ctx);
        walk(field(node, FIELD_RIGHT), ctx);
        walk(field(node, FIELD_BODY), inner);
        walk(field(node, FIELD_ALTERNATIVE), ctx);
    }

    private void walkWhile(TSNode node, WalkContext ctx) {
        visitor.onNode(node, ctx);
        var inner = ctx.enterLoop(frame(node, LoopKind.WHILE, ctx));
        visitor.onLoop(node, LoopKind.WHILE, ctx, inner);

        walk(field(node, FIELD_CONDITION), inner);
        walk(field(node, FIELD_BODY), inner);
        walk(field(node, FIELD_ALTERNATIVE), ctx);
    }

    /**
     * Each {@code for} clause opens one loop level. The first iterable runs in the enclosing context; every later
     * clause, condition and the element expression run inside the clauses before them.
     */
    private void walkComprehension(TSNode node, WalkContext ctx) {
        visitor.onNode(node, ctx);
        var current = ctx;
        @Nullable TSNode body = null;
        var deferred = new ArrayList<TSNode>();
        for (var child : namedChildren(node)) {
            var type = child.getType();
            if (FOR_IN_CLAUSE.equals(type)) {
                walkDeferred(deferred, current);
                visitor.onNode(child, current);
                var iterables = iterablesOf(child);
                for (var iterable : iterables) {
                    walk(iterable, current);
                }
                var frame = new LoopFrame(LoopKind.COMPREHENSION, startLine(child), endLine(node), current.loopDepth());
                var inner = current.enterLoop(frame);
                visitor.onLoop(child, LoopKind.COMPREHENSION, current, inner);
                walk(field(child, FIELD_LEFT), inner);
                current = inner;
            } else if (IF_CLAUSE.equals(type)) {
                deferred.add(child);
            } else if (body == null) {
                body = child;
            } else {
                deferred.add(child);
            }
        }
        walkDeferred(deferred, current);
        walk(body, current);
    }

    private void walkDeferred(List<TSNode> deferred, WalkContext ctx) {
        for (var node : deferred) {
            walk(node, ctx);
        }
        deferred.clear();
    }

    private static List<TSNode> iterablesOf(TSNode forInClause) {
        return ASTTraversalUtils.fieldChildren(forInClause, FIELD_RIGHT);
    }

    private static LoopFrame frame(TSNode node, LoopKind kind, WalkContext outer) {
        return new LoopFrame(kind, startLine(node), endLine(node), outer.loopDepth());
    }
}
