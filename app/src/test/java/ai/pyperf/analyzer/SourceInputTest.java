package ai.pyperf.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

public final class SourceInputTest {

    @Test
    void testRejectsBothTextAndPath() {
        var ex = assertThrows(IllegalArgumentException.class, () -> SourceInput.of("x = 1", Path.of("a.py")));
        assertTrue(ex.getMessage().contains("not both"));
    }

    @Test
    void testRejectsNeither() {
        assertThrows(IllegalArgumentException.class, () -> SourceInput.of(null, null));
    }

    @Test
    void testAcceptsExactlyOne() {
        assertEquals("x = 1", SourceInput.ofText("x = 1").text());
        assertEquals(Path.of("a.py"), SourceInput.ofPath(Path.of("a.py")).path());
    }
}
