package ai.pyperf.catalog;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.junit.jupiter.api.Test;

public class PatternCatalogTest {

    private final PatternCatalog catalog = PatternCatalog.defaults();

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testDefaultsAreSharedAndPopulated() {
        assertSame(catalog, PatternCatalog.defaults());
        assertFalse(catalog.ormQueries().entries().isEmpty());
        assertFalse(catalog.blockingIo().entries().isEmpty());
        assertFalse(catalog.asyncAlternatives().entries().isEmpty());
        assertFalse(catalog.memoryLoads().entries().isEmpty());
        assertFalse(catalog.typeConversions().entries().isEmpty());
    }

    @Test
    void testOrmFrameworks() {
        assertEquals(Optional.of("django"), catalog.ormFramework("Product.objects.get", null));
        assertEquals(
                Optional.of("django"),
                catalog.ormFramework("Product.objects.filter", "shop.models.Product.objects.filter"));
        assertEquals(Optional.of("sqlalchemy"), catalog.ormFramework("session.query", null));
        assertEquals(Optional.of("sqlalchemy"), catalog.ormFramework("User.query.filter_by", null));
        assertEquals(Optional.of("generic"), catalog.ormFramework("cursor.execute", null));
        assertEquals(Optional.of("generic"), catalog.ormFramework("xs.all", null));

        assertFalse(catalog.isOrmQuery("numpy.all", "numpy.all"));
        assertFalse(catalog.isOrmQuery("cache.get", null));
        assertFalse(catalog.isOrmQuery("print", "builtins.print"));
    }

    @Test
    void testOrmSuggestions() {
        assertTrue(catalog.ormSuggestion("django").contains("select_related()"));
        assertTrue(catalog.ormSuggestion("sqlalchemy").contains("joinedload()"));
        assertEquals(catalog.ormSuggestion("generic"), catalog.ormSuggestion("peewee"));
    }

    @Test
    void testBlockingIoAndAlternatives() {
        assertTrue(catalog.isBlockingIo("open", "builtins.open"));
        assertTrue(catalog.isBlockingIo("sleep", "time.sleep"));
        assertTrue(catalog.isBlockingIo("requests.get", "requests.get"));
        assertTrue(catalog.isBlockingIo("s.get", "requests.Session.get"));
        assertTrue(catalog.isBlockingIo("Requests.get", null));
        assertTrue(catalog.isBlockingIo("subprocess.run", "subprocess.run"));
        assertFalse(catalog.isBlockingIo("asyncio.sleep", "asyncio.sleep"));
        assertFalse(catalog.isBlockingIo("open", "aiofiles.open"));

        assertEquals(Optional.of("aiofiles.open"), catalog.asyncAlternative("open", "builtins.open"));
        assertEquals(Optional.of("asyncio.sleep"), catalog.asyncAlternative("time.sleep", "time.sleep"));
        assertEquals(
                Optional.of("aiohttp.ClientSession.get"), catalog.asyncAlternative("requests.get", "requests.get"));
        assertEquals(
                Optional.of("aiohttp.ClientSession"), catalog.asyncAlternative("requests.patch", "requests.patch"));
        assertEquals(
                Optional.of("asyncio.create_subprocess_exec"),
                catalog.asyncAlternative("subprocess.run", "subprocess.run"));
        assertTrue(catalog.asyncAlternative("os.read", "os.read").isEmpty());
    }

    @Test
    void testMemoryLoads() {
        assertEquals(Optional.of("json"), catalog.memoryLoadKind("json.load", "json.load"));
        assertEquals(Optional.of("pickle"), catalog.memoryLoadKind("pickle.load", null));
        assertEquals(Optional.of("readlines"), catalog.memoryLoadKind("f.readlines", null));
        assertEquals(Optional.of("read"), catalog.memoryLoadKind("f.read", null));
        assertEquals(Optional.of("other"), catalog.memoryLoadKind("yaml.safe_load", "yaml.safe_load"));
        assertFalse(catalog.isMemoryIntensive("json.loads", "json.loads"));
        assertFalse(catalog.isMemoryIntensive("thread", null));

        assertEquals(
                "Loading entire JSON file with json.load() loads all data into memory",
                catalog.memoryDescription("json", "json.load"));
        assertEquals(
                "Memory-intensive operation loader() loads large amount of data into memory",
                catalog.memoryDescription("unknown", "loader"));
        assertTrue(catalog.memorySuggestion("json").contains("ijson"));
        assertEquals(catalog.memorySuggestion("other"), catalog.memorySuggestion("unknown"));
    }

    @Test
    void testTypeConversions() {
        assertTrue(catalog.isTypeConversion("int", "builtins.int"));
        assertTrue(catalog.isTypeConversion("str", null));
        assertFalse(catalog.isTypeConversion("int", "numpy.int"));
        assertFalse(catalog.isTypeConversion("len", "builtins.len"));
    }

    @Test
    void testLoadCustomCatalog() throws IOException {
        var custom = PatternCatalog.load(json(
                """
                {
                  "ormQueries": [
                    { "target": "WRITTEN", "match": "SUFFIX", "pattern": ".fetch_rows", "label": "custom" }
                  ],
                  "ormSuggestions": { "custom": "Batch the rows" },
                  "unknownSection": []
                }
                """));

        assertEquals(Optional.of("custom"), custom.ormFramework("db.fetch_rows", null));
        assertEquals("Batch the rows", custom.ormSuggestion("custom"));
        assertTrue(custom.blockingIo().entries().isEmpty());
        assertFalse(custom.isBlockingIo("open", "builtins.open"));
        assertEquals("", custom.memorySuggestion("json"));
    }

    @Test
    void testMalformedCatalogs() {
        assertThrows(
                IOException.class,
                () -> PatternCatalog.load(json(
                        """
                        { "ormQueries": [ { "target": "WRITTEN", "match": "REGEX", "pattern": "(", "label": "x" } ] }
                        """)));
        assertThrows(
                IOException.class,
                () -> PatternCatalog.load(json(
                        """
                        { "ormQueries": [ { "target": "WRITTEN", "match": "GLOB", "pattern": "x", "label": "x" } ] }
                        """)));
        assertThrows(
                IOException.class,
                () -> PatternCatalog.load(json("{ \"ormQueries\": [ { \"target\": \"WRITTEN\" } ] }")));
        assertThrows(UncheckedIOException.class, () -> PatternCatalog.fromResource("catalog/missing.json"));
    }
}
