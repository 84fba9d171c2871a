package ai.pyperf.checker;

import ai.pyperf.issues.IssueSummary;
import ai.pyperf.issues.PerformanceIssue;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.Writer;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Serializes issues and summaries to the JSON shapes consumed by request handlers. */
public final class IssueReportWriter {

    /**
     * Findings for one analyzed file.
     *
     * @param issues null when only the summary was requested
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"file", "issues", "summary"})
    public record FileReport(
            @JsonProperty("file") String file,
            @JsonProperty("issues") @Nullable List<PerformanceIssue> issues,
            @JsonProperty("summary") IssueSummary summary) {

        public static FileReport of(String file, List<PerformanceIssue> issues, boolean summaryOnly) {
            return new FileReport(file, summaryOnly ? null : List.copyOf(issues), IssueSummary.of(issues));
        }
    }

    private final ObjectMapper mapper;

    public IssueReportWriter(boolean pretty) {
        this.mapper = new ObjectMapper().configure(SerializationFeature.INDENT_OUTPUT, pretty);
    }

    public String toJson(PerformanceIssue issue) throws JsonProcessingException {
        return mapper.writeValueAsString(issue);
    }

    public String toJson(IssueSummary summary) throws JsonProcessingException {
        return mapper.writeValueAsString(summary);
    }

    public String toJson(List<PerformanceIssue> issues) throws JsonProcessingException {
        return mapper.writeValueAsString(issues);
    }

    /** A single report is written as an object, several as an array. */
    public void write(List<FileReport> reports, Writer out) throws IOException {
        Object value = reports.size() == 1 ? reports.get(0) : reports;
        out.write(mapper.writeValueAsString(value));
        out.write(System.lineSeparator());
        out.flush();
    }
}
