package ai.pyperf.analyzer;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Null-safe helpers over tree-sitter nodes shared by the resolver and the extractor. Line numbers returned here are
 * 1-based.
 */
public final class ASTTraversalUtils {

    private ASTTraversalUtils() {}

    /** Recursively finds the first node matching the given predicate, in document order. */
    public static @Nullable TSNode findNodeRecursive(@Nullable TSNode rootNode, Predicate<TSNode> predicate) {
        if (isAbsent(rootNode)) {
            return null;
        }

        if (predicate.test(rootNode)) {
            return rootNode;
        }

        for (int i = 0; i < rootNode.getChildCount(); i++) {
            var result = findNodeRecursive(rootNode.getChild(i), predicate);
            if (result != null) {
                return result;
            }
        }

        return null;
    }

    /** Recursively finds all nodes matching the given predicate. */
    public static List<TSNode> findAllNodesRecursive(TSNode rootNode, Predicate<TSNode> predicate) {
        var results = new ArrayList<TSNode>();
        findAllNodesRecursiveInternal(rootNode, predicate, results);
        return results;
    }

    private static void findAllNodesRecursiveInternal(
            @Nullable TSNode node, Predicate<TSNode> predicate, List<TSNode> results) {
        if (isAbsent(node)) {
            return;
        }

        if (predicate.test(node)) {
            results.add(node);
        }

        for (int i = 0; i < node.getChildCount(); i++) {
            findAllNodesRecursiveInternal(node.getChild(i), predicate, results);
        }
    }

    public static boolean isAbsent(@Nullable TSNode node) {
        return node == null || node.isNull();
    }

    /** The child stored under {@code fieldName}, or null when the field is not present. */
    public static @Nullable TSNode field(TSNode node, String fieldName) {
        var child = node.getChildByFieldName(fieldName);
        return isAbsent(child) ? null : child;
    }

    /** Named children in order, skipping comments. */
    public static List<TSNode> namedChildren(TSNode node) {
        var children = new ArrayList<TSNode>(node.getNamedChildCount());
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            var child = node.getNamedChild(i);
            if (!isAbsent(child) && !PythonNodeTypes.COMMENT.equals(child.getType())) {
                children.add(child);
            }
        }
        return children;
    }

    /** Named children stored under {@code fieldName}; a field may repeat, e.g. the names of a from-import. */
    public static List<TSNode> fieldChildren(TSNode node, String fieldName) {
        var children = new ArrayList<TSNode>();
        for (int i = 0; i < node.getChildCount(); i++) {
            if (fieldName.equals(node.getFieldNameForChild(i))) {
                var child = node.getChild(i);
                if (!isAbsent(child)) {
                    children.add(child);
                }
            }
        }
        return children;
    }

    /** True when the first token of the node is the given anonymous keyword, e.g. {@code async}. */
    public static boolean startsWithKeyword(TSNode node, String keyword) {
        if (node.getChildCount() == 0) {
            return false;
        }
        var first = node.getChild(0);
        return !isAbsent(first) && !first.isNamed() && keyword.equals(first.getType());
    }

    public static int startLine(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    public static int endLine(TSNode node) {
        return Math.max(node.getEndPoint().getRow() + 1, startLine(node));
    }

    /** Extracts trimmed text from a node. */
    public static String extractNodeText(@Nullable TSNode node, SourceContent sourceContent) {
        return sourceContent.substringFrom(node).trim();
    }

    /** Finds all nodes of a specific type within the AST. */
    public static List<TSNode> findAllNodesByType(TSNode rootNode, String nodeType) {
        return findAllNodesRecursive(rootNode, node -> nodeType.equals(node.getType()));
    }
}
