package ai.pyperf.analyzer;

import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

/**
 * A successfully parsed source unit. Holds the tree so that nodes obtained from {@link #root()} stay valid while the
 * instance is reachable.
 *
 * @param moduleName file stem for path input, {@code __main__} for raw text
 */
public record ParsedSource(TSTree tree, SourceContent content, String moduleName, @Nullable Path path) {

    public TSNode root() {
        return tree.getRootNode();
    }
}
