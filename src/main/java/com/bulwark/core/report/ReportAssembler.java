package com.bulwark.core.report;

import com.bulwark.core.check.IssueLog;
import com.bulwark.core.config.AuditProperties;
import com.bulwark.core.model.AggregateReport;
import com.bulwark.core.model.CheckComparison;
import com.bulwark.core.model.CheckResult;
import com.bulwark.core.model.ComparisonStatus;
import com.bulwark.core.model.ComparisonSummary;
import com.bulwark.core.model.Issue;
import com.bulwark.core.model.Priority;
import com.bulwark.core.model.PriorityAction;
import com.bulwark.core.model.Recommendation;
import com.bulwark.core.model.ReportSection;
import com.bulwark.core.model.ScoreSummary;
import com.bulwark.core.model.Severity;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Composes check results, the score summary and ranked actions into an
 * immutable {@link AggregateReport}. Performs no I/O.
 */
@Service
public class ReportAssembler {

    static final String SUMMARY = "Summary";
    static final String CHECK_SCORES = "Check Scores";
    static final String PRIORITY_ACTIONS = "Priority Actions";
    static final String DETAILED_FINDINGS = "Detailed Findings";

    private final AuditProperties properties;

    public ReportAssembler(AuditProperties properties) {
        this.properties = properties;
    }

    public AggregateReport assemble(Instant timestamp,
                                    List<CheckResult> results,
                                    ScoreSummary summary,
                                    List<CheckComparison> comparisons,
                                    List<PriorityAction> actions) {
        var byName = new LinkedHashMap<String, CheckResult>();
        var log = new IssueLog();
        for (CheckResult result : results) {
            byName.put(result.name(), result);
            log.append(result);
        }

        var sections = List.of(
                summarySection(summary, log, comparisons, actions),
                checkScoresSection(results, comparisons),
                prioritySection(actions),
                findingsSection(byName, comparisons));

        return new AggregateReport(timestamp, byName, summary, log.issues(), log.recommendations(),
                comparisons, actions, sections);
    }

    private ReportSection summarySection(ScoreSummary summary, IssueLog log,
                                         List<CheckComparison> comparisons, List<PriorityAction> actions) {
        var lines = new ArrayList<String>();
        lines.add("- **Overall Score**: " + summary.total() + "/" + summary.max()
                + " (" + fmt(summary.percentage()) + "%)");
        lines.add("- **Status**: " + summary.band().name() + " - " + summary.band().verdict());
        lines.add("- **Issues**: " + log.count(Severity.CRITICAL) + " critical, "
                + log.count(Severity.HIGH) + " high, "
                + log.count(Severity.MEDIUM) + " medium, "
                + log.count(Severity.WARNING) + " warning");
        lines.add("- **Recommendations**: " + log.recommendations().size());
        var movement = ComparisonSummary.of(comparisons, actions);
        lines.add("- **Checks**: " + movement.improved() + " improved, "
                + movement.declined() + " declined, "
                + movement.unchanged() + " unchanged, "
                + movement.missing() + " missing");
        lines.add("- **Priority Actions**: " + movement.highPriorityActions() + " high, "
                + movement.mediumPriorityActions() + " medium");
        return new ReportSection(SUMMARY, lines);
    }

    private ReportSection checkScoresSection(List<CheckResult> results, List<CheckComparison> comparisons) {
        var lines = new ArrayList<String>();
        lines.add("| Check | Score | Baseline | Change | Status |");
        lines.add("|-------|-------|----------|--------|--------|");
        Map<String, String> displayNames = new LinkedHashMap<>();
        results.forEach(r -> displayNames.put(r.name(), r.displayName()));
        for (CheckComparison c : comparisons) {
            String name = displayNames.getOrDefault(c.check(), c.check());
            lines.add("| " + name + " | " + fmt(c.currentScore()) + "/10 | " + fmt(c.baselineScore())
                    + "/10 | " + change(c.diff()) + " | " + c.status().label() + " |");
        }
        return new ReportSection(CHECK_SCORES, lines);
    }

    private ReportSection prioritySection(List<PriorityAction> actions) {
        var lines = new ArrayList<String>();
        if (actions.isEmpty()) {
            lines.add("No priority actions required. All security checks are performing well.");
            return new ReportSection(PRIORITY_ACTIONS, lines);
        }
        Priority current = null;
        for (PriorityAction action : actions) {
            if (action.priority() != current) {
                current = action.priority();
                if (!lines.isEmpty()) {
                    lines.add("");
                }
                lines.add("### " + capitalize(current.label()) + " Priority");
                lines.add("");
            }
            lines.add("- **" + action.check() + "**: " + action.action().title()
                    + " (current " + fmt(action.currentScore())
                    + ", baseline " + fmt(action.baselineScore())
                    + ", change " + change(action.diff()) + ")");
            lines.add("  - Reason: " + action.reason());
        }
        return new ReportSection(PRIORITY_ACTIONS, lines);
    }

    private ReportSection findingsSection(Map<String, CheckResult> results, List<CheckComparison> comparisons) {
        int threshold = properties.getRanking().getImproveThreshold();
        var lines = new ArrayList<String>();
        for (CheckComparison c : comparisons) {
            boolean regressed = c.status() == ComparisonStatus.DECLINED || c.status() == ComparisonStatus.MISSING;
            if (!regressed && c.currentScore() >= threshold) {
                continue;
            }
            if (!lines.isEmpty()) {
                lines.add("");
            }
            CheckResult result = results.get(c.check());
            lines.add("### " + (result != null ? result.displayName() : c.check()));
            lines.add("");
            lines.add("- **Current Score**: " + fmt(c.currentScore()) + "/10");
            lines.add("- **Baseline Score**: " + fmt(c.baselineScore()) + "/10");
            lines.add("- **Change**: " + change(c.diff()) + " (" + c.status().label() + ")");
            lines.add("- **Current Reason**: " + c.reason());
            if (!c.baselineReason().isEmpty() && !c.baselineReason().equals(c.reason())) {
                lines.add("- **Baseline Reason**: " + c.baselineReason());
            }
            if (result == null) {
                continue;
            }
            for (Issue issue : result.issues()) {
                lines.add("- [" + issue.severity().label().toUpperCase(Locale.ROOT) + "] "
                        + issue.component() + ": " + issue.message()
                        + (issue.recommendation().isEmpty() ? "" : " -> " + issue.recommendation()));
            }
            for (Recommendation recommendation : result.recommendations()) {
                lines.add("- [RECOMMENDATION] " + recommendation.component() + ": " + recommendation.message());
            }
        }
        if (lines.isEmpty()) {
            lines.add("All checks are at or above the fair threshold.");
        }
        return new ReportSection(DETAILED_FINDINGS, lines);
    }

    static String fmt(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    static String change(double diff) {
        return (diff > 0 ? "+" : "") + fmt(diff);
    }

    private static String capitalize(String s) {
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
