package com.bulwark.core.report;

import com.bulwark.core.config.AuditProperties;
import com.bulwark.core.model.AggregateReport;
import com.bulwark.core.model.Baseline;
import com.bulwark.core.model.CheckResult;
import com.bulwark.core.model.Issue;
import com.bulwark.core.model.Recommendation;
import com.bulwark.core.model.ReportSection;
import com.bulwark.core.model.Severity;
import com.bulwark.core.model.StatusBand;
import com.bulwark.core.ranking.PriorityRanker;
import com.bulwark.core.scoring.ScoreAggregator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReportAssemblerTest {

    static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final AuditProperties properties = new AuditProperties();
    private final ReportAssembler assembler = new ReportAssembler(properties);
    private final PriorityRanker ranker = new PriorityRanker(properties);

    static List<CheckResult> sampleResults() {
        return List.of(
                new CheckResult("file_permissions", "File Permissions", 8,
                        List.of(new Issue("FilePermissions", Severity.WARNING,
                                ".env is readable by others (permissions: 644)", "Run: chmod 600 /p/.env")),
                        List.of()),
                new CheckResult("environment_variables", "Environment Variables", 6,
                        List.of(new Issue("HardcodedSecrets", Severity.CRITICAL,
                                "Hardcoded token found in src/main.rs", "Move secrets to environment variables")),
                        List.of(new Recommendation("MCP Server", "Create .env.example with example configuration"))));
    }

    private AggregateReport assemble(List<CheckResult> results, Baseline baseline) {
        var comparisons = ranker.compare(results, baseline);
        return assembler.assemble(NOW, results, new ScoreAggregator().aggregate(results),
                comparisons, ranker.rank(comparisons));
    }

    @Test
    @DisplayName("issues and recommendations are merged in registration order")
    void mergesInOrder() {
        var report = assemble(sampleResults(), null);

        assertEquals(List.of("FilePermissions", "HardcodedSecrets"),
                report.issues().stream().map(Issue::component).toList());
        assertEquals(1, report.recommendations().size());
        assertEquals(1, report.criticalIssues().size());
        assertEquals(14, report.totalScore());
        assertEquals(20, report.maxScore());
        assertEquals(StatusBand.FAIR, report.band());
    }

    @Test
    @DisplayName("sections come in a fixed order")
    void sectionOrder() {
        var report = assemble(sampleResults(), null);
        assertEquals(List.of("Summary", "Check Scores", "Priority Actions", "Detailed Findings"),
                report.sections().stream().map(ReportSection::title).toList());
    }

    @Test
    @DisplayName("detailed findings cover checks below seven and regressions")
    void detailedFindings() {
        var report = assemble(sampleResults(), null);
        var findings = report.sections().get(3).lines();

        assertTrue(findings.contains("### Environment Variables"));
        assertFalse(findings.contains("### File Permissions"));
        assertTrue(findings.stream().anyMatch(l -> l.contains("[CRITICAL] HardcodedSecrets")));

        var regressed = assemble(sampleResults(), new Baseline(Map.of("file_permissions", 10.0), Map.of()));
        assertTrue(regressed.sections().get(3).lines().contains("### File Permissions"));
    }

    @Test
    @DisplayName("baseline reason is shown only when it differs from the current one")
    void baselineReasonInFindings() {
        var baseline = new Baseline(
                Map.of("environment_variables", 9.0, "file_permissions", 10.0),
                Map.of("environment_variables", "No secrets detected",
                        "file_permissions", ".env is readable by others (permissions: 644)"));
        var findings = assemble(sampleResults(), baseline).sections().get(3).lines();

        assertTrue(findings.contains("- **Baseline Reason**: No secrets detected"));
        assertEquals(1, findings.stream().filter(l -> l.startsWith("- **Baseline Reason**")).count());
    }

    @Test
    @DisplayName("summary counts check movements and action priorities")
    void comparisonSummary() {
        var baseline = new Baseline(
                Map.of("file_permissions", 10.0, "environment_variables", 6.0, "Code-Review", 8.0),
                Map.of());
        var report = assemble(sampleResults(), baseline);

        var summary = report.comparisonSummary();
        assertEquals(0, summary.improved());
        assertEquals(1, summary.declined());
        assertEquals(1, summary.unchanged());
        assertEquals(1, summary.missing());
        assertEquals(1, summary.highPriorityActions());
        assertEquals(1, summary.mediumPriorityActions());

        assertTrue(report.sections().get(0).lines()
                .contains("- **Checks**: 0 improved, 1 declined, 1 unchanged, 1 missing"));
        assertTrue(report.sections().get(0).lines().contains("- **Priority Actions**: 1 high, 1 medium"));

        @SuppressWarnings("unchecked")
        var json = (Map<String, Object>) report.toMap().get("summary");
        assertEquals(List.of("improved_checks", "declined_checks", "unchanged_checks", "missing_checks",
                "high_priority_actions", "medium_priority_actions"), List.copyOf(json.keySet()));
        assertEquals(1, json.get("missing_checks"));
    }

    @Test
    @DisplayName("empty priority section says so")
    void noActions() {
        var report = assemble(sampleResults(), null);
        assertEquals(List.of("No priority actions required. All security checks are performing well."),
                report.sections().get(2).lines());
    }

    @Test
    @DisplayName("toMap exposes the stable keys in order")
    void toMapKeys() {
        var map = assemble(sampleResults(), null).toMap();

        assertEquals(List.of("timestamp", "overall_status", "scores", "issues", "recommendations",
                "overall_score", "max_score", "percentage", "priority_actions", "summary"),
                List.copyOf(map.keySet()));
        assertEquals("2026-03-01T12:00:00Z", map.get("timestamp"));
        assertEquals("fair", map.get("overall_status"));
        assertEquals(70.0, map.get("percentage"));

        @SuppressWarnings("unchecked")
        var scores = (Map<String, Object>) map.get("scores");
        assertEquals(List.of("file_permissions", "environment_variables"), List.copyOf(scores.keySet()));

        @SuppressWarnings("unchecked")
        var issues = (List<Map<String, Object>>) map.get("issues");
        assertEquals("critical", issues.get(1).get("severity"));
    }

    @Test
    @DisplayName("report collections are immutable")
    void immutable() {
        var report = assemble(sampleResults(), null);
        assertThrows(UnsupportedOperationException.class, () -> report.issues().clear());
        assertThrows(UnsupportedOperationException.class, () -> report.results().clear());
        assertThrows(UnsupportedOperationException.class, () -> report.scores().clear());
    }
}
