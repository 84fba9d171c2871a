package ai.pyperf.analyzer;

import static ai.pyperf.analyzer.ASTTraversalUtils.extractNodeText;
import static ai.pyperf.analyzer.ASTTraversalUtils.field;
import static ai.pyperf.analyzer.ASTTraversalUtils.fieldChildren;
import static ai.pyperf.analyzer.ASTTraversalUtils.namedChildren;
import static ai.pyperf.analyzer.ASTTraversalUtils.startLine;
import static ai.pyperf.analyzer.PythonNodeTypes.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/** Converts import statement nodes into {@link ImportInfo} records. */
final class PythonImports {

    static final String WILDCARD = "*";
    static final String FUTURE_MODULE = "__future__";

    private PythonImports() {}

    /**
     * {@code import a, b as c} yields one record per module; {@code from m import x, y as z} yields a single record.
     * Other node types yield nothing.
     */
    static List<ImportInfo> describe(TSNode node, SourceContent sc) {
        return switch (node.getType()) {
            case IMPORT_STATEMENT -> describePlainImport(node, sc);
            case IMPORT_FROM_STATEMENT -> List.of(describeFromImport(node, sc));
            case FUTURE_IMPORT_STATEMENT -> List.of(describeFutureImport(node, sc));
            default -> List.of();
        };
    }

    private static List<ImportInfo> describePlainImport(TSNode node, SourceContent sc) {
        var result = new ArrayList<ImportInfo>();
        int line = startLine(node);
        for (var child : fieldChildren(node, FIELD_NAME)) {
            if (ALIASED_IMPORT.equals(child.getType())) {
                var module = dotted(field(child, FIELD_NAME), sc);
                var alias = extractNodeText(field(child, FIELD_ALIAS), sc);
                result.add(new ImportInfo(module, List.of(module), line, false, Map.of(module, alias), module));
            } else {
                var module = dotted(child, sc);
                result.add(new ImportInfo(module, List.of(module), line, false, Map.of(), module));
            }
        }
        return result;
    }

    private static ImportInfo describeFromImport(TSNode node, SourceContent sc) {
        var moduleNode = field(node, FIELD_MODULE_NAME);
        var module = dotted(moduleNode, sc);
        boolean relative = moduleNode != null && RELATIVE_IMPORT.equals(moduleNode.getType());

        var names = new ArrayList<String>();
        var aliases = new LinkedHashMap<String, String>();
        for (var child : fieldChildren(node, FIELD_NAME)) {
            if (ALIASED_IMPORT.equals(child.getType())) {
                var name = dotted(field(child, FIELD_NAME), sc);
                names.add(name);
                aliases.put(name, extractNodeText(field(child, FIELD_ALIAS), sc));
            } else {
                names.add(dotted(child, sc));
            }
        }
        for (var child : namedChildren(node)) {
            if (WILDCARD_IMPORT.equals(child.getType())) {
                names.add(WILDCARD);
            }
        }

        return new ImportInfo(module, names, startLine(node), true, aliases, relative ? null : module);
    }

    /** {@code from __future__ import x} has its own node type with no module field. */
    private static ImportInfo describeFutureImport(TSNode node, SourceContent sc) {
        var names = new ArrayList<String>();
        var aliases = new LinkedHashMap<String, String>();
        for (var child : fieldChildren(node, FIELD_NAME)) {
            if (ALIASED_IMPORT.equals(child.getType())) {
                var name = dotted(field(child, FIELD_NAME), sc);
                names.add(name);
                aliases.put(name, extractNodeText(field(child, FIELD_ALIAS), sc));
            } else {
                names.add(dotted(child, sc));
            }
        }
        return new ImportInfo(FUTURE_MODULE, names, startLine(node), true, aliases, FUTURE_MODULE);
    }

    private static String dotted(@Nullable TSNode node, SourceContent sc) {
        return extractNodeText(node, sc).replaceAll("\\s+", "");
    }
}
