package ai.pyperf.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public final class PythonParserTest {

    @Test
    void testParsesTextAsMainModule() throws Exception {
        var parsed = PythonParser.parse(SourceInput.ofText("x = 1\n"));

        assertEquals(PythonParser.MAIN_MODULE, parsed.moduleName());
        assertNull(parsed.path());
        assertEquals("module", parsed.root().getType());
        assertFalse(parsed.root().hasError());
    }

    @Test
    void testModuleNameIsFileStem(@TempDir Path dir) throws Exception {
        var file = dir.resolve("billing_service.py");
        Files.writeString(file, "def charge():\n    pass\n");

        var parsed = PythonParser.parse(SourceInput.ofPath(file));

        assertEquals("billing_service", parsed.moduleName());
        assertEquals(file, parsed.path());
    }

    @Test
    void testSyntaxErrorDoesNotEchoSource() {
        var source = "def secret_token_handler(:\n    pass\n";

        var ex = assertThrows(SourceSyntaxException.class, () -> PythonParser.parse(source));

        assertTrue(ex.getMessage().startsWith("Source could not be parsed"), ex.getMessage());
        assertFalse(ex.getMessage().contains("secret_token_handler"));
        assertTrue(ex.line() >= 1);
    }

    @Test
    void testMissingFileIsResourceError(@TempDir Path dir) {
        var missing = dir.resolve("nope.py");

        var ex = assertThrows(SourceNotFoundException.class, () -> PythonParser.parse(SourceInput.ofPath(missing)));

        assertEquals(missing, ex.path());
    }

    @Test
    void testDirectoryIsResourceError(@TempDir Path dir) {
        assertThrows(SourceNotFoundException.class, () -> PythonParser.parse(SourceInput.ofPath(dir)));
    }

    @Test
    void testPython2StatementsAreSyntaxErrors() throws Exception {
        var print = assertThrows(SourceSyntaxException.class, () -> PythonParser.parse("x = 1\nprint \"hello\"\n"));
        assertEquals(2, print.line());

        var exec = assertThrows(SourceSyntaxException.class, () -> PythonParser.parse("exec \"x = 1\"\n"));
        assertEquals(1, exec.line());

        assertFalse(PythonParser.parse("print(\"hello\")\nexec(\"x = 1\")\n").root().hasError());
    }

    @Test
    void testUndecodableFileIsUnreadable(@TempDir Path dir) throws Exception {
        var file = dir.resolve("latin1.py");
        Files.write(file, new byte[] {'x', ' ', '=', ' ', '"', (byte) 0xff, (byte) 0xfe, '"', '\n'});

        var ex = assertThrows(SourceUnreadableException.class, () -> PythonParser.parse(SourceInput.ofPath(file)));

        assertEquals(file, ex.path());
        assertTrue(ex.undecodable());
        assertTrue(ex.getMessage().startsWith("File is not valid UTF-8"), ex.getMessage());
    }

    @Test
    void testByteOrderMarkIsStripped() throws Exception {
        var parsed = PythonParser.parse("\uFEFFimport os\n");

        assertEquals("import os\n", parsed.content().text());
        assertFalse(parsed.root().hasError());
    }

    @Test
    void testEmptySourceParses() throws Exception {
        var parsed = PythonParser.parse("");

        assertEquals(0, parsed.root().getNamedChildCount());
    }
}
