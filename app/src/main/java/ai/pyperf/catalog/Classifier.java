package ai.pyperf.catalog;

import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Ordered list of catalog entries. A call is classified by the first entry that matches: entries targeting the
 * resolved name when resolution succeeded, entries targeting the written name otherwise. A resolved call that no
 * resolved entry matches stays unclassified.
 */
public final class Classifier {
    private final String name;
    private final List<CatalogEntry> entries;

    public Classifier(String name, List<CatalogEntry> entries) {
        this.name = name;
        this.entries = List.copyOf(entries);
    }

    public Optional<String> classify(String writtenName, @Nullable String resolvedName) {
        var target = resolvedName != null ? MatchTarget.RESOLVED : MatchTarget.WRITTEN;
        var candidate = resolvedName != null ? resolvedName : writtenName;
        for (var entry : entries) {
            if (entry.target() == target && entry.pattern().matches(candidate)) {
                return Optional.of(entry.label());
            }
        }
        return Optional.empty();
    }

    public boolean matches(String writtenName, @Nullable String resolvedName) {
        return classify(writtenName, resolvedName).isPresent();
    }

    public String name() {
        return name;
    }

    public List<CatalogEntry> entries() {
        return entries;
    }

    @Override
    public String toString() {
        return "Classifier[" + name + ", " + entries.size() + " entries]";
    }
}
