package ai.pyperf.analyzer;

import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;

/** Exactly one of raw source text or a file path. */
public record SourceInput(@Nullable String text, @Nullable Path path) {

    public SourceInput {
        if (text != null && path != null) {
            throw new IllegalArgumentException("Provide either source text or a file path, not both");
        }
        if (text == null && path == null) {
            throw new IllegalArgumentException("Either source text or a file path must be provided");
        }
    }

    public static SourceInput of(@Nullable String text, @Nullable Path path) {
        return new SourceInput(text, path);
    }

    public static SourceInput ofText(String text) {
        return new SourceInput(text, null);
    }

    public static SourceInput ofPath(Path path) {
        return new SourceInput(null, path);
    }
}
