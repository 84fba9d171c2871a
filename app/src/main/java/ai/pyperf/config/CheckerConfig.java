package ai.pyperf.config;

import ai.pyperf.catalog.PatternCatalog;
import ai.pyperf.issues.IssueCategory;
import com.google.common.base.Splitter;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Properties;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Tunables of the rule engine. Values come from {@value #DEFAULTS_RESOURCE} on the classpath, then an optional
 * override file, then {@code pyperf.*} system properties, each layer overriding the previous one.
 *
 * @param nestedLoopThreshold loop depth (1 = a single loop) at which nesting is reported
 * @param snippetMaxLines maximum number of lines quoted for multi-line findings
 * @param disabledCategories categories whose rules are skipped by {@code checkAll}
 * @param catalogResource classpath resource holding the pattern catalog
 */
public record CheckerConfig(
        int nestedLoopThreshold, int snippetMaxLines, Set<IssueCategory> disabledCategories, String catalogResource) {
    private static final Logger logger = LogManager.getLogger(CheckerConfig.class);

    public static final String DEFAULTS_RESOURCE = "pyperf.properties";
    public static final String SYSTEM_PROPERTY_PREFIX = "pyperf.";

    public static final String NESTED_LOOP_THRESHOLD = "nestedLoopThreshold";
    public static final String SNIPPET_MAX_LINES = "snippetMaxLines";
    public static final String DISABLED_CATEGORIES = "disabledCategories";
    public static final String CATALOG_RESOURCE = "catalogResource";

    private static final CheckerConfig BUILT_IN = new CheckerConfig(3, 3, Set.of(), PatternCatalog.DEFAULT_RESOURCE);

    public CheckerConfig {
        if (nestedLoopThreshold < 1) {
            throw new IllegalArgumentException(NESTED_LOOP_THRESHOLD + " must be at least 1: " + nestedLoopThreshold);
        }
        if (snippetMaxLines < 1) {
            throw new IllegalArgumentException(SNIPPET_MAX_LINES + " must be at least 1: " + snippetMaxLines);
        }
        disabledCategories = disabledCategories.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(disabledCategories));
    }

    /** Classpath defaults overlaid with system properties. */
    public static CheckerConfig defaults() {
        return fromProperties(layered(null));
    }

    /** Like {@link #defaults()}, with {@code overrideFile} applied between the classpath defaults and system properties. */
    public static CheckerConfig load(@Nullable Path overrideFile) throws IOException {
        if (overrideFile != null && !Files.isRegularFile(overrideFile)) {
            throw new IOException("Configuration file not found: " + overrideFile);
        }
        return fromProperties(layered(overrideFile));
    }

    public boolean isEnabled(IssueCategory category) {
        return !disabledCategories.contains(category);
    }

    public PatternCatalog catalog() {
        return catalogResource.equals(PatternCatalog.DEFAULT_RESOURCE)
                ? PatternCatalog.defaults()
                : PatternCatalog.fromResource(catalogResource);
    }

    public CheckerConfig withNestedLoopThreshold(int threshold) {
        return new CheckerConfig(threshold, snippetMaxLines, disabledCategories, catalogResource);
    }

    public CheckerConfig withDisabledCategories(Set<IssueCategory> categories) {
        return new CheckerConfig(nestedLoopThreshold, snippetMaxLines, categories, catalogResource);
    }

    /** Reads the known keys from {@code props}; absent keys keep their built-in values. */
    public static CheckerConfig fromProperties(Properties props) {
        int threshold = intValue(props, NESTED_LOOP_THRESHOLD, BUILT_IN.nestedLoopThreshold());
        int snippetLines = intValue(props, SNIPPET_MAX_LINES, BUILT_IN.snippetMaxLines());
        var disabled = EnumSet.noneOf(IssueCategory.class);
        var rawDisabled = props.getProperty(DISABLED_CATEGORIES, "");
        for (var name : Splitter.on(',').trimResults().omitEmptyStrings().split(rawDisabled)) {
            try {
                disabled.add(IssueCategory.fromWireName(name));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                        "Invalid value for " + DISABLED_CATEGORIES + ": unknown category '" + name + "'", e);
            }
        }
        var catalog = props.getProperty(CATALOG_RESOURCE, BUILT_IN.catalogResource()).trim();
        return new CheckerConfig(threshold, snippetLines, disabled, catalog);
    }

    private static int intValue(Properties props, String key, int fallback) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": '" + raw + "' is not an integer", e);
        }
    }

    private static Properties layered(@Nullable Path overrideFile) {
        var props = new Properties();
        try (InputStream in = CheckerConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                logger.debug("No {} on the classpath, using built-in defaults", DEFAULTS_RESOURCE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }

        if (overrideFile != null) {
            try (var reader = Files.newBufferedReader(overrideFile)) {
                props.load(reader);
                logger.debug("Applied configuration overrides from {}", overrideFile);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        for (var name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PROPERTY_PREFIX)) {
                props.setProperty(name.substring(SYSTEM_PROPERTY_PREFIX.length()), System.getProperty(name));
            }
        }
        return props;
    }
}
