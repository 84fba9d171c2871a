package ai.pyperf.catalog;

import static ai.pyperf.catalog.CatalogDefinition.orEmpty;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Read-only tables that classify calls as ORM queries, blocking I/O, whole-structure loads or type conversions, plus
 * the remediation text attached to each classification. The bundled tables live in
 * {@value #DEFAULT_RESOURCE}.
 */
public final class PatternCatalog {
    private static final Logger log = LogManager.getLogger(PatternCatalog.class);

    public static final String DEFAULT_RESOURCE = "catalog/performance-patterns.json";

    public static final String GENERIC_ORM = "generic";
    public static final String OTHER_LOAD = "other";

    private static final ObjectMapper MAPPER =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Classifier ormQueries;
    private final Classifier blockingIo;
    private final Classifier asyncAlternatives;
    private final Classifier memoryLoads;
    private final Classifier typeConversions;
    private final Map<String, String> ormSuggestions;
    private final Map<String, String> memorySuggestions;
    private final Map<String, String> memoryDescriptions;

    private static final class DefaultHolder {
        private static final PatternCatalog INSTANCE = fromResource(DEFAULT_RESOURCE);
    }

    private PatternCatalog(CatalogDefinition definition) {
        this.ormQueries = new Classifier("ormQueries", orEmpty(definition.ormQueries()));
        this.blockingIo = new Classifier("blockingIo", orEmpty(definition.blockingIo()));
        this.asyncAlternatives = new Classifier("asyncAlternatives", orEmpty(definition.asyncAlternatives()));
        this.memoryLoads = new Classifier("memoryLoads", orEmpty(definition.memoryLoads()));
        this.typeConversions = new Classifier("typeConversions", orEmpty(definition.typeConversions()));
        this.ormSuggestions = Map.copyOf(orEmpty(definition.ormSuggestions()));
        this.memorySuggestions = Map.copyOf(orEmpty(definition.memorySuggestions()));
        this.memoryDescriptions = Map.copyOf(orEmpty(definition.memoryDescriptions()));
    }

    /** The bundled catalog, loaded on first use. */
    public static PatternCatalog defaults() {
        return DefaultHolder.INSTANCE;
    }

    public static PatternCatalog load(InputStream in) throws IOException {
        return new PatternCatalog(MAPPER.readValue(in, CatalogDefinition.class));
    }

    /** Loads a catalog from the classpath; a missing or malformed resource is an {@link UncheckedIOException}. */
    public static PatternCatalog fromResource(String resource) {
        try (InputStream in = PatternCatalog.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) throw new IOException("Resource not found: " + resource);
            var catalog = load(in);
            log.debug("Loaded pattern catalog {}: {}", resource, catalog);
            return catalog;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    // ORM queries

    /** The ORM framework a call queries through ({@code django}, {@code sqlalchemy} or {@code generic}). */
    public Optional<String> ormFramework(String functionName, @Nullable String resolvedName) {
        return ormQueries.classify(functionName, resolvedName);
    }

    public boolean isOrmQuery(String functionName, @Nullable String resolvedName) {
        return ormQueries.matches(functionName, resolvedName);
    }

    public String ormSuggestion(String framework) {
        return ormSuggestions.getOrDefault(framework, ormSuggestions.getOrDefault(GENERIC_ORM, ""));
    }

    // Blocking I/O

    public boolean isBlockingIo(String functionName, @Nullable String resolvedName) {
        return blockingIo.matches(functionName, resolvedName);
    }

    public Optional<String> asyncAlternative(String functionName, @Nullable String resolvedName) {
        return asyncAlternatives.classify(functionName, resolvedName);
    }

    // Memory loads

    /** Kind of whole-structure load: {@code json}, {@code pickle}, {@code readlines}, {@code read} or {@code other}. */
    public Optional<String> memoryLoadKind(String functionName, @Nullable String resolvedName) {
        return memoryLoads.classify(functionName, resolvedName);
    }

    public boolean isMemoryIntensive(String functionName, @Nullable String resolvedName) {
        return memoryLoads.matches(functionName, resolvedName);
    }

    public String memorySuggestion(String kind) {
        return memorySuggestions.getOrDefault(kind, memorySuggestions.getOrDefault(OTHER_LOAD, ""));
    }

    /** Issue description for a load of the given kind; {@code %s} in the template receives the operation name. */
    public String memoryDescription(String kind, String operation) {
        var template = memoryDescriptions.getOrDefault(kind, memoryDescriptions.get(OTHER_LOAD));
        if (template == null) {
            return "Memory-intensive operation %s() loads large amount of data into memory".formatted(operation);
        }
        return template.formatted(operation);
    }

    // Type conversions

    public boolean isTypeConversion(String functionName, @Nullable String resolvedName) {
        return typeConversions.matches(functionName, resolvedName);
    }

    public Classifier ormQueries() {
        return ormQueries;
    }

    public Classifier blockingIo() {
        return blockingIo;
    }

    public Classifier asyncAlternatives() {
        return asyncAlternatives;
    }

    public Classifier memoryLoads() {
        return memoryLoads;
    }

    public Classifier typeConversions() {
        return typeConversions;
    }

    @Override
    public String toString() {
        return "PatternCatalog[orm=%d, blocking=%d, async=%d, memory=%d, conversions=%d]"
                .formatted(
                        ormQueries.entries().size(),
                        blockingIo.entries().size(),
                        asyncAlternatives.entries().size(),
                        memoryLoads.entries().size(),
                        typeConversions.entries().size());
    }
}
