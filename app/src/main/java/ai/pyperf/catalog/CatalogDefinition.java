package ai.pyperf.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/** JSON shape of a catalog resource. Missing sections read as empty. */
@JsonIgnoreProperties(ignoreUnknown = true)
record CatalogDefinition(
        @Nullable List<CatalogEntry> ormQueries,
        @Nullable List<CatalogEntry> blockingIo,
        @Nullable List<CatalogEntry> asyncAlternatives,
        @Nullable List<CatalogEntry> memoryLoads,
        @Nullable List<CatalogEntry> typeConversions,
        @Nullable Map<String, String> ormSuggestions,
        @Nullable Map<String, String> memorySuggestions,
        @Nullable Map<String, String> memoryDescriptions) {

    static <T> List<T> orEmpty(@Nullable List<T> list) {
        return list == null ? List.of() : list;
    }

    static Map<String, String> orEmpty(@Nullable Map<String, String> map) {
        return map == null ? Map.of() : map;
    }
}
