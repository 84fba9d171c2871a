package ai.pyperf.analyzer;

/**
 * Fatal failure of a single analysis run caused by its input. Messages are safe to surface to callers: they never
 * contain source text.
 */
public abstract sealed class AnalysisException extends Exception
        permits SourceSyntaxException, SourceNotFoundException, SourceUnreadableException {

    protected AnalysisException(String message) {
        super(message);
    }

    protected AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
