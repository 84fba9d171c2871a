package ai.pyperf.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import ai.pyperf.analyzer.PythonNameResolver.BindingKind;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public final class PythonNameResolverTest {

    /** Resolved name per written callee; the last call with a given written name wins. */
    private static Map<String, @Nullable String> resolvedCalls(String source) throws Exception {
        var resolved = new HashMap<String, @Nullable String>();
        for (var call : PythonStructureAnalyzer.forSource(source).calls()) {
            resolved.put(call.functionName(), call.resolvedName());
        }
        return resolved;
    }

    @Test
    void testImportsAndDefinitions() throws Exception {
        var source =
                """
                import os.path
                import json
                import numpy as np
                from requests import Session as S
                from .local import helper
                from pkg.star import *

                class Repo:
                    def save(self):
                        json.dumps({})

                def run():
                    s = S()
                    s.get("u")
                    np.array([1])
                    os.path.join("a", "b")
                    helper()
                    starred()
                    open("f")
                    Repo().save()
                """;
        var calls = resolvedCalls(source);

        assertEquals("json.dumps", calls.get("json.dumps"));
        assertEquals("requests.Session", calls.get("S"));
        assertEquals("requests.Session.get", calls.get("s.get"));
        assertEquals("numpy.array", calls.get("np.array"));
        assertEquals("os.path.join", calls.get("os.path.join"));
        assertEquals("builtins.open", calls.get("open"));
        assertEquals("__main__.Repo", calls.get("Repo"));

        assertTrue(calls.containsKey("helper"));
        assertNull(calls.get("helper"), "relative imports stay unresolved");
        assertNull(calls.get("starred"), "wildcard imports bind nothing");
        assertNull(calls.get("Repo().save"), "chains through calls stay unresolved");
    }

    @Test
    void testInferredLocalTypes() throws Exception {
        var source =
                """
                def clean(items: list, name: str):
                    text = "abc"
                    text.upper()
                    name.strip()
                    items.append(1)
                    count = len(items)
                    count.bit_length()
                    joined = ", ".join(items)
                    joined.split()
                    unknown.method()
                """;
        var calls = resolvedCalls(source);

        assertEquals("builtins.str.upper", calls.get("text.upper"));
        assertEquals("builtins.str.strip", calls.get("name.strip"));
        assertEquals("builtins.list.append", calls.get("items.append"));
        assertEquals("builtins.str.split", calls.get("joined.split"));
        assertNull(calls.get("count.bit_length"), "len() result type is not inferred");
        assertNull(calls.get("unknown.method"));
    }

    @Test
    void testClassScopeIsInvisibleToMethods() throws Exception {
        var source =
                """
                class Config:
                    loader = open
                    value = loader("x")

                    def reload(self):
                        return loader("y")
                """;
        var analyzer = PythonStructureAnalyzer.forSource(source);
        var loaderCalls = analyzer.calls().stream()
                .filter(c -> c.functionName().equals("loader"))
                .toList();

        assertEquals(2, loaderCalls.size());
        assertNull(loaderCalls.get(0).resolvedName(), "a class attribute is a variable, not an import");
        assertNull(loaderCalls.get(1).resolvedName());
        assertEquals("reload", loaderCalls.get(1).enclosingFunction());
    }

    @Test
    void testShadowedBuiltinIsUnresolved() throws Exception {
        var source =
                """
                def process(open):
                    return open("x")

                def other():
                    return open("y")
                """;
        var analyzer = PythonStructureAnalyzer.forSource(source);
        var opens = analyzer.calls();

        assertNull(opens.get(0).resolvedName());
        assertEquals("builtins.open", opens.get(1).resolvedName());
    }

    @Test
    void testGlobalDeclarationLooksUpModuleScope() throws Exception {
        var parsed = PythonParser.parse(
                """
                import time as clock

                def tick():
                    global clock
                    clock.sleep(1)
                """);
        var resolver = PythonNameResolver.build(parsed);
        var module = resolver.moduleScope();

        var binding = resolver.lookup("clock", module).orElseThrow();
        assertEquals(BindingKind.IMPORT, binding.kind());
        assertEquals("time", binding.target());
        assertEquals("time.sleep", PythonStructureAnalyzer.forSource(parsed.content().text())
                .calls()
                .get(0)
                .resolvedName());
    }

    @Test
    void testModuleNameQualifiesDefinitions(@TempDir Path dir) throws Exception {
        var file = dir.resolve("orders.py");
        Files.writeString(file, "def total():\n    pass\n\ntotal()\n");

        var analyzer = PythonStructureAnalyzer.forFile(file);

        assertEquals("orders", analyzer.moduleName());
        assertEquals("orders.total", analyzer.calls().get(0).resolvedName());
    }

    @Test
    void testLiteralTypeInference() throws Exception {
        var parsed = PythonParser.parse(
                """
                a = "x" + name
                b = 3
                c = [1, 2]
                d = {k: v for k, v in pairs}
                e = (b)
                f = "%s" % b
                g = str(b)
                h = b + b
                """);
        var resolver = PythonNameResolver.build(parsed);
        var module = resolver.moduleScope();

        assertEquals("str", resolver.variableType("a", module));
        assertEquals("int", resolver.variableType("b", module));
        assertEquals("list", resolver.variableType("c", module));
        assertEquals("dict", resolver.variableType("d", module));
        assertEquals("int", resolver.variableType("e", module));
        assertEquals("str", resolver.variableType("f", module));
        assertEquals("str", resolver.variableType("g", module));
        assertEquals("int", resolver.variableType("h", module));
        assertNull(resolver.variableType("k", module));
    }
}
