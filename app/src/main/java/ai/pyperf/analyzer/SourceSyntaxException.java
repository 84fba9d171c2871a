package ai.pyperf.analyzer;

/** The source text does not parse as Python. */
public final class SourceSyntaxException extends AnalysisException {
    private final int line;

    public SourceSyntaxException(int line) {
        super("Source could not be parsed: invalid syntax near line " + line);
        this.line = line;
    }

    /** 1-based line of the first syntax error. */
    public int line() {
        return line;
    }
}
