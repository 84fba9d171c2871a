package ai.pyperf.cli;

import static org.junit.jupiter.api.Assertions.*;

import ai.pyperf.issues.IssueCategory;
import ai.pyperf.issues.Severity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import picocli.CommandLine;

public class PerfCheckCliTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String ASYNC_SOURCE =
            """
            import json
            import time

            async def poll(path):
                time.sleep(1)
                return json.load(path)
            """;

    @TempDir
    Path dir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        var cmd = new CommandLine(new PerfCheckCli());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private Path write(String name, String source) throws IOException {
        var file = dir.resolve(name);
        Files.writeString(file, source);
        return file;
    }

    private JsonNode output() throws IOException {
        return MAPPER.readTree(out.toString());
    }

    @Test
    void testReportsIssuesForOneFile() throws Exception {
        var file = write("poll.py", ASYNC_SOURCE);

        assertEquals(PerfCheckCli.EXIT_OK, run(file.toString()));

        var report = output();
        assertEquals(file.toString(), report.get("file").asText());
        assertEquals(2, report.get("issues").size());
        assertEquals("blocking-io-in-async", report.get("issues").get(0).get("category").asText());
        assertEquals("memory-load", report.get("issues").get(1).get("category").asText());
        assertEquals(2, report.get("summary").get("total_issues").asInt());
        assertEquals("", err.toString());
    }

    @Test
    void testFiltersAndSummaryOnly() throws Exception {
        var file = write("poll.py", ASYNC_SOURCE);

        assertEquals(PerfCheckCli.EXIT_OK, run("--min-severity", "high", "--summary-only", file.toString()));

        var report = output();
        assertFalse(report.has("issues"));
        assertEquals(1, report.get("summary").get("total_issues").asInt());
        assertEquals(1, report.get("summary").get("by_severity").get("critical").asInt());
    }

    @Test
    void testCategoryFilter() throws Exception {
        var file = write("poll.py", ASYNC_SOURCE);

        assertEquals(PerfCheckCli.EXIT_OK, run("--category", "memory-load", file.toString()));

        var issues = output().get("issues");
        assertEquals(1, issues.size());
        assertEquals("memory-load", issues.get(0).get("category").asText());
    }

    @Test
    void testFailOnThreshold() throws Exception {
        var file = write("poll.py", ASYNC_SOURCE);
        var clean = write("clean.py", "x = 1\n");

        assertEquals(PerfCheckCli.EXIT_THRESHOLD_REACHED, run("--fail-on", "critical", file.toString()));
        assertEquals(PerfCheckCli.EXIT_OK, run("--fail-on", "low", clean.toString()));
        assertEquals(
                PerfCheckCli.EXIT_OK,
                run("--fail-on", "critical", "--category", "memory-load", file.toString()));
    }

    @Test
    void testSeveralFilesProduceAnArray() throws Exception {
        var first = write("poll.py", ASYNC_SOURCE);
        var second = write("clean.py", "x = 1\n");

        assertEquals(PerfCheckCli.EXIT_OK, run(first.toString(), second.toString()));

        var reports = output();
        assertTrue(reports.isArray());
        assertEquals(2, reports.size());
        assertEquals(0, reports.get(1).get("issues").size());
    }

    @Test
    void testMissingAndBrokenFilesAreReportedDistinctly() throws Exception {
        var good = write("clean.py", "x = 1\n");
        var broken = write("broken.py", "def broken(:\n    pass\n");
        var missing = dir.resolve("missing.py");

        int code = run(good.toString(), broken.toString(), missing.toString());

        assertEquals(PerfCheckCli.EXIT_ANALYSIS_ERROR, code);
        assertTrue(err.toString().contains(missing + ": not found"), err.toString());
        assertTrue(err.toString().contains(broken + ": syntax error near line"), err.toString());
        assertFalse(err.toString().contains("def broken"));
        assertEquals(good.toString(), output().get("file").asText());
    }

    @Test
    void testUndecodableFileIsNotReportedAsMissing() throws Exception {
        var latin1 = dir.resolve("latin1.py");
        Files.write(latin1, new byte[] {'s', ' ', '=', ' ', '"', (byte) 0xe9, '"', '\n'});

        assertEquals(PerfCheckCli.EXIT_ANALYSIS_ERROR, run(latin1.toString()));
        assertTrue(err.toString().contains(latin1 + ": not valid UTF-8"), err.toString());
        assertFalse(err.toString().contains("not found"), err.toString());
        assertEquals("", out.toString());
    }

    @Test
    void testConfigFile() throws Exception {
        var file = write("poll.py", ASYNC_SOURCE);
        var config = write("pyperf.properties", "disabledCategories=blocking-io-in-async\n");

        assertEquals(PerfCheckCli.EXIT_OK, run("--config", config.toString(), file.toString()));
        assertEquals(1, output().get("issues").size());
    }

    @Test
    void testBadConfigFile() throws Exception {
        var file = write("poll.py", ASYNC_SOURCE);
        var config = write("pyperf.properties", "nestedLoopThreshold=many\n");

        assertEquals(PerfCheckCli.EXIT_ANALYSIS_ERROR, run("--config", config.toString(), file.toString()));
        assertTrue(err.toString().contains("nestedLoopThreshold"), err.toString());
        assertEquals("", out.toString());
    }

    @ParameterizedTest
    @CsvSource({"critical, CRITICAL", "HIGH, HIGH", " medium , MEDIUM", "low, LOW"})
    void testSeverityConverter(String raw, Severity expected) {
        assertEquals(expected, new PerfCheckCli.SeverityConverter().convert(raw));
    }

    @ParameterizedTest
    @CsvSource({"repeated-query-in-loop, REPEATED_QUERY_IN_LOOP", "global_mutation, GLOBAL_MUTATION"})
    void testCategoryConverter(String raw, IssueCategory expected) {
        assertEquals(expected, new PerfCheckCli.CategoryConverter().convert(raw));
    }

    @Test
    void testUnknownOptionValuesAreUsageErrors() throws Exception {
        var file = write("poll.py", ASYNC_SOURCE);

        assertEquals(CommandLine.ExitCode.USAGE, run("--min-severity", "urgent", file.toString()));
        assertTrue(err.toString().contains("urgent"), err.toString());
        assertThrows(
                CommandLine.TypeConversionException.class,
                () -> new PerfCheckCli.CategoryConverter().convert("slow-code"));
    }
}
