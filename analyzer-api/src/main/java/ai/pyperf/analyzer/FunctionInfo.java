package ai.pyperf.analyzer;

import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * A {@code def} or {@code async def} found in a source unit. Methods and nested functions are reported under their
 * simple name.
 *
 * @param inferredTypes parameter annotations and best-effort local variable types, keyed by name
 */
public record FunctionInfo(
        String name,
        int lineNumber,
        int endLineNumber,
        boolean async,
        List<String> parameters,
        List<String> decorators,
        @Nullable String returnAnnotation,
        @Nullable String docstring,
        Map<String, String> inferredTypes) {

    public FunctionInfo {
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Function name must not be empty");
        }
        if (endLineNumber < lineNumber) {
            throw new IllegalArgumentException(
                    "End line %d precedes start line %d for %s".formatted(endLineNumber, lineNumber, name));
        }
        parameters = List.copyOf(parameters);
        decorators = List.copyOf(decorators);
        inferredTypes = Map.copyOf(inferredTypes);
    }
}
