package ai.pyperf.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class LoopInfoTest {

    @Test
    void testEnclosesDeeperLoopInRange() {
        var outer = new LoopInfo(LoopKind.FOR, 2, 10, "f", 0, false);
        var inner = new LoopInfo(LoopKind.WHILE, 4, 6, "f", 1, false);

        assertTrue(outer.encloses(inner));
        assertFalse(inner.encloses(outer));
        assertFalse(outer.encloses(outer));
    }

    @Test
    void testEnclosesLoopOfNestedFunction() {
        var outer = new LoopInfo(LoopKind.FOR, 2, 10, "f", 0, false);
        var nested = new LoopInfo(LoopKind.FOR, 4, 6, "g", 1, false);
        var sibling = new LoopInfo(LoopKind.FOR, 12, 14, "f", 1, false);

        assertTrue(outer.encloses(nested));
        assertFalse(outer.encloses(sibling));
    }

    @Test
    void testRejectsNegativeNesting() {
        assertThrows(IllegalArgumentException.class, () -> new LoopInfo(LoopKind.FOR, 1, 1, null, -1, false));
    }

    @Test
    void testFunctionInfoValidation() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new FunctionInfo("f", 5, 4, false, List.of(), List.of(), null, null, Map.of()));
        assertThrows(
                IllegalArgumentException.class,
                () -> new FunctionInfo("", 1, 1, false, List.of(), List.of(), null, null, Map.of()));
    }
}
