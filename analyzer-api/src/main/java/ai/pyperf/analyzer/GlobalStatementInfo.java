package ai.pyperf.analyzer;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/** A {@code global} declaration; {@code enclosingFunction} is null at module level. */
public record GlobalStatementInfo(List<String> names, int lineNumber, @Nullable String enclosingFunction) {
    public GlobalStatementInfo {
        names = List.copyOf(names);
    }
}
