package ai.pyperf.analyzer;

import static ai.pyperf.analyzer.ASTTraversalUtils.findNodeRecursive;
import static ai.pyperf.analyzer.ASTTraversalUtils.startLine;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSParser;
import org.treesitter.TreeSitterPython;

/** Front end: turns source text or a file into a tree-sitter Python tree, rejecting text with syntax errors. */
public final class PythonParser {
    private static final Logger log = LogManager.getLogger(PythonParser.class);

    public static final String MAIN_MODULE = "__main__";

    private PythonParser() {}

    public static ParsedSource parse(SourceInput input)
            throws SourceSyntaxException, SourceNotFoundException, SourceUnreadableException {
        var path = input.path();
        if (path != null) {
            return parse(readFile(path), moduleNameOf(path), path);
        }
        return parse(input.text(), MAIN_MODULE, null);
    }

    public static ParsedSource parse(String text) throws SourceSyntaxException {
        return parse(text, MAIN_MODULE, null);
    }

    private static ParsedSource parse(String text, String moduleName, @Nullable Path path) throws SourceSyntaxException {
        var content = SourceContent.of(text);
        var parser = new TSParser();
        parser.setLanguage(new TreeSitterPython());
        var tree = parser.parseString(null, content.text());
        var root = tree.getRootNode();

        if (root.hasError()) {
            var bad = findNodeRecursive(root, n -> PythonNodeTypes.ERROR.equals(n.getType()) || n.isMissing());
            int line = bad == null ? 1 : startLine(bad);
            log.debug("Rejecting {} ({} bytes): syntax error near line {}", moduleName, content.byteLength(), line);
            throw new SourceSyntaxException(line);
        }
        // the grammar still accepts Python 2 print and exec statements
        var legacy = findNodeRecursive(root, n -> PythonNodeTypes.PYTHON2_STATEMENTS.contains(n.getType()));
        if (legacy != null) {
            int line = startLine(legacy);
            log.debug("Rejecting {}: Python 2 {} near line {}", moduleName, legacy.getType(), line);
            throw new SourceSyntaxException(line);
        }

        log.debug("Parsed {} ({} bytes, {} lines)", moduleName, content.byteLength(), content.lineCount());
        return new ParsedSource(tree, content, moduleName, path);
    }

    private static String readFile(Path path) throws SourceNotFoundException, SourceUnreadableException {
        if (!Files.isRegularFile(path)) {
            throw new SourceNotFoundException(path);
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            throw new SourceUnreadableException(path, true, e);
        } catch (IOException e) {
            throw new SourceUnreadableException(path, false, e);
        }
    }

    static String moduleNameOf(Path path) {
        var fileName = path.getFileName();
        if (fileName == null) {
            return MAIN_MODULE;
        }
        var name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
