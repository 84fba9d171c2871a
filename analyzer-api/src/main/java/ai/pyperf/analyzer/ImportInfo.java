package ai.pyperf.analyzer;

import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * One {@code import} or {@code from ... import} statement. A plain import listing several modules yields one record
 * per module.
 *
 * @param aliases imported name to alias, only for names imported with {@code as}
 * @param resolvedModule absolute module path, null for relative imports
 */
public record ImportInfo(
        String module,
        List<String> names,
        int lineNumber,
        boolean fromImport,
        Map<String, String> aliases,
        @Nullable String resolvedModule) {

    public ImportInfo {
        names = List.copyOf(names);
        aliases = Map.copyOf(aliases);
    }
}
