package ai.pyperf.issues;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Issue counts. Both maps list every severity and every category (zero counts included) keyed by wire name, in
 * declaration order, and each sums to {@link #totalIssues()}.
 */
@JsonPropertyOrder({"total_issues", "by_severity", "by_category"})
public record IssueSummary(
        @JsonProperty("total_issues") int totalIssues,
        @JsonProperty("by_severity") Map<String, Integer> bySeverity,
        @JsonProperty("by_category") Map<String, Integer> byCategory) {

    public IssueSummary {
        bySeverity = Collections.unmodifiableMap(new LinkedHashMap<>(bySeverity));
        byCategory = Collections.unmodifiableMap(new LinkedHashMap<>(byCategory));
    }

    public static IssueSummary of(Collection<PerformanceIssue> issues) {
        var severityCounts = new EnumMap<Severity, Integer>(Severity.class);
        var categoryCounts = new EnumMap<IssueCategory, Integer>(IssueCategory.class);
        for (var issue : issues) {
            severityCounts.merge(issue.severity(), 1, Integer::sum);
            categoryCounts.merge(issue.category(), 1, Integer::sum);
        }

        var bySeverity = new LinkedHashMap<String, Integer>();
        for (var s : Severity.values()) {
            bySeverity.put(s.wireName(), severityCounts.getOrDefault(s, 0));
        }
        var byCategory = new LinkedHashMap<String, Integer>();
        for (var c : IssueCategory.values()) {
            byCategory.put(c.wireName(), categoryCounts.getOrDefault(c, 0));
        }
        return new IssueSummary(issues.size(), bySeverity, byCategory);
    }

    @JsonIgnore
    public int count(Severity severity) {
        return bySeverity.getOrDefault(severity.wireName(), 0);
    }

    @JsonIgnore
    public int count(IssueCategory category) {
        return byCategory.getOrDefault(category.wireName(), 0);
    }
}
