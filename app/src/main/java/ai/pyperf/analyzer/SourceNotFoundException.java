package ai.pyperf.analyzer;

import java.nio.file.Path;

/** The supplied path does not exist or is not a regular file. */
public final class SourceNotFoundException extends AnalysisException {
    private final Path path;

    public SourceNotFoundException(Path path) {
        super("File not found: " + path);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
