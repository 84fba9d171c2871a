package ai.pyperf.catalog;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.jetbrains.annotations.Nullable;

/** A single name predicate. Regular expressions are compiled once and matched with {@code find()}. */
public final class NamePattern {
    private final MatchKind kind;
    private final String text;
    private final boolean ignoreCase;
    private final @Nullable Pattern regex;

    private NamePattern(MatchKind kind, String text, boolean ignoreCase) {
        if (text.isEmpty()) {
            throw new IllegalArgumentException("Pattern text must not be empty");
        }
        this.kind = kind;
        this.ignoreCase = ignoreCase;
        this.text = ignoreCase && kind != MatchKind.REGEX ? text.toLowerCase(Locale.ROOT) : text;
        if (kind == MatchKind.REGEX) {
            try {
                this.regex = Pattern.compile(text, ignoreCase ? Pattern.CASE_INSENSITIVE : 0);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid catalog regex: " + text, e);
            }
        } else {
            this.regex = null;
        }
    }

    public static NamePattern of(MatchKind kind, String text) {
        return new NamePattern(kind, text, false);
    }

    public static NamePattern of(MatchKind kind, String text, boolean ignoreCase) {
        return new NamePattern(kind, text, ignoreCase);
    }

    public static NamePattern exact(String text) {
        return of(MatchKind.EXACT, text);
    }

    public static NamePattern suffix(String text) {
        return of(MatchKind.SUFFIX, text);
    }

    public static NamePattern contains(String text) {
        return of(MatchKind.CONTAINS, text);
    }

    public boolean matches(String name) {
        var candidate = ignoreCase && kind != MatchKind.REGEX ? name.toLowerCase(Locale.ROOT) : name;
        return switch (kind) {
            case EXACT -> candidate.equals(text);
            case PREFIX -> candidate.startsWith(text);
            case SUFFIX -> candidate.endsWith(text);
            case CONTAINS -> candidate.contains(text);
            case REGEX -> Objects.requireNonNull(regex).matcher(candidate).find();
        };
    }

    public MatchKind kind() {
        return kind;
    }

    public String text() {
        return regex != null ? regex.pattern() : text;
    }

    public boolean ignoreCase() {
        return ignoreCase;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (!(o instanceof NamePattern that)) return false;
        return kind == that.kind && ignoreCase == that.ignoreCase && text().equals(that.text());
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text(), ignoreCase);
    }

    @Override
    public String toString() {
        return kind + (ignoreCase ? "(i)" : "") + "[" + text() + "]";
    }
}
