package ai.pyperf.issues;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jetbrains.annotations.Nullable;

/** A detected performance problem. Serializes to the snake_case shape consumed by request handlers. */
@JsonPropertyOrder({
    "category",
    "severity",
    "line_number",
    "end_line_number",
    "description",
    "suggestion",
    "code_snippet",
    "function_name"
})
public record PerformanceIssue(
        @JsonProperty("category") IssueCategory category,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("line_number") int lineNumber,
        @JsonProperty("end_line_number") int endLineNumber,
        @JsonProperty("description") String description,
        @JsonProperty("suggestion") String suggestion,
        @JsonProperty("code_snippet") @Nullable String codeSnippet,
        @JsonProperty("function_name") @Nullable String functionName) {}
