package ai.pyperf.cli;

import ai.pyperf.analyzer.SourceInput;
import ai.pyperf.analyzer.SourceNotFoundException;
import ai.pyperf.analyzer.SourceSyntaxException;
import ai.pyperf.analyzer.SourceUnreadableException;
import ai.pyperf.checker.IssueReportWriter;
import ai.pyperf.checker.IssueReportWriter.FileReport;
import ai.pyperf.checker.PerformanceChecker;
import ai.pyperf.config.CheckerConfig;
import ai.pyperf.issues.IssueCategory;
import ai.pyperf.issues.PerformanceIssue;
import ai.pyperf.issues.Severity;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "pyperf",
        mixinStandardHelpOptions = true,
        version = "pyperf 0.3.0",
        description = "Reports performance anti-patterns in Python source files as JSON.")
public final class PerfCheckCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(PerfCheckCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_ANALYSIS_ERROR = 1;
    public static final int EXIT_THRESHOLD_REACHED = 2;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(arity = "1..*", paramLabel = "FILE", description = "Python files to analyze.")
    private List<Path> files = new ArrayList<>();

    @CommandLine.Option(
            names = "--min-severity",
            converter = SeverityConverter.class,
            description = "Only report issues at this severity or above (critical, high, medium, low).")
    private @Nullable Severity minSeverity;

    @CommandLine.Option(
            names = "--category",
            converter = CategoryConverter.class,
            description = "Only report issues of this category, e.g. repeated-query-in-loop. Can be repeated.")
    private List<IssueCategory> categories = new ArrayList<>();

    @CommandLine.Option(names = "--summary-only", description = "Print only the summary of each file.")
    private boolean summaryOnly;

    @CommandLine.Option(names = "--config", description = "Properties file overriding the bundled defaults.")
    private @Nullable Path configFile;

    @CommandLine.Option(
            names = "--fail-on",
            converter = SeverityConverter.class,
            description = "Exit with status 2 when a reported issue is at this severity or above.")
    private @Nullable Severity failOn;

    @CommandLine.Option(names = "--pretty", description = "Indent the JSON output.")
    private boolean pretty;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PerfCheckCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws IOException {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        CheckerConfig config;
        try {
            config = CheckerConfig.load(configFile);
        } catch (IOException | UncheckedIOException | IllegalArgumentException e) {
            err.println("pyperf: configuration error: " + e.getMessage());
            return EXIT_ANALYSIS_ERROR;
        }

        var reports = new ArrayList<FileReport>();
        boolean failed = false;
        boolean thresholdReached = false;
        for (var file : files) {
            try {
                var checker = PerformanceChecker.of(SourceInput.ofPath(file), config);
                var issues = select(checker.checkAll());
                reports.add(FileReport.of(file.toString(), issues, summaryOnly));
                if (failOn != null && issues.stream().anyMatch(i -> i.severity().isAtLeast(failOn))) {
                    thresholdReached = true;
                }
            } catch (SourceNotFoundException e) {
                err.println("pyperf: " + file + ": not found");
                failed = true;
            } catch (SourceUnreadableException e) {
                logger.debug("Cannot read {}", file, e);
                err.println("pyperf: " + file + (e.undecodable() ? ": not valid UTF-8" : ": unreadable"));
                failed = true;
            } catch (SourceSyntaxException e) {
                err.println("pyperf: " + file + ": syntax error near line " + e.line());
                failed = true;
            }
        }

        if (!reports.isEmpty()) {
            new IssueReportWriter(pretty).write(reports, out);
        }
        if (failed) {
            return EXIT_ANALYSIS_ERROR;
        }
        return thresholdReached ? EXIT_THRESHOLD_REACHED : EXIT_OK;
    }

    private List<PerformanceIssue> select(List<PerformanceIssue> issues) {
        var wanted = categories.isEmpty() ? EnumSet.allOf(IssueCategory.class) : EnumSet.copyOf(categories);
        return issues.stream()
                .filter(i -> minSeverity == null || i.severity().isAtLeast(minSeverity))
                .filter(i -> wanted.contains(i.category()))
                .toList();
    }

    public static final class SeverityConverter implements CommandLine.ITypeConverter<Severity> {
        @Override
        public Severity convert(String value) {
            try {
                return Severity.fromWireName(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    public static final class CategoryConverter implements CommandLine.ITypeConverter<IssueCategory> {
        @Override
        public IssueCategory convert(String value) {
            try {
                return IssueCategory.fromWireName(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }
}
