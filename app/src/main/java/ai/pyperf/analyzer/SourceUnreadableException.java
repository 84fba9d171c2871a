package ai.pyperf.analyzer;

import java.nio.file.Path;

/** The file exists but its bytes could not be read or are not valid UTF-8. */
public final class SourceUnreadableException extends AnalysisException {
    private final Path path;
    private final boolean undecodable;

    public SourceUnreadableException(Path path, boolean undecodable, Throwable cause) {
        super((undecodable ? "File is not valid UTF-8: " : "File could not be read: ") + path, cause);
        this.path = path;
        this.undecodable = undecodable;
    }

    public Path path() {
        return path;
    }

    /** True when the bytes were read but failed to decode as UTF-8. */
    public boolean undecodable() {
        return undecodable;
    }
}
