package com.bulwark.core.engine;

import com.bulwark.core.check.AuthenticationCheck;
import com.bulwark.core.check.Check;
import com.bulwark.core.check.CheckRunner;
import com.bulwark.core.check.CiSecurityCheck;
import com.bulwark.core.check.DependencySecurityCheck;
import com.bulwark.core.check.FilePermissionsCheck;
import com.bulwark.core.check.HardcodedSecretsCheck;
import com.bulwark.core.check.InputValidationCheck;
import com.bulwark.core.check.LoggingSecurityCheck;
import com.bulwark.core.check.RateLimitingCheck;
import com.bulwark.core.config.AuditProperties;
import com.bulwark.core.metrics.AuditMetrics;
import com.bulwark.core.model.ActionType;
import com.bulwark.core.model.Baseline;
import com.bulwark.core.model.Severity;
import com.bulwark.core.ranking.PriorityRanker;
import com.bulwark.core.report.ReportAssembler;
import com.bulwark.core.scoring.ScoreAggregator;
import com.bulwark.core.snapshot.InMemorySnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuditEngineTest {

    private static final Instant NOW = Instant.parse("2026-05-04T10:15:30Z");

    private SimpleMeterRegistry registry;
    private AuditEngine engine;

    static List<Check> allChecks() {
        return List.of(
                new FilePermissionsCheck(),
                new HardcodedSecretsCheck(),
                new AuthenticationCheck(),
                new RateLimitingCheck(),
                new InputValidationCheck(),
                new LoggingSecurityCheck(),
                new DependencySecurityCheck(new ObjectMapper()),
                new CiSecurityCheck());
    }

    /** A reasonably hardened two-component project. */
    static InMemorySnapshot hardenedProject() {
        return new InMemorySnapshot()
                .file(".env", "TELEGRAM_BOT_TOKEN=", "rw-------")
                .file("config.example.toml", "")
                .file("Cargo.lock", "")
                .file("src/utils/security.rs", """
                        pub struct SecurityManager;
                        const VAR: &str = "TELEGRAM_ALLOWED_USERS";
                        fn rate_limit() {}
                        fn sanitize(s: &str) {}
                        """)
                .file("mcp-server/.env.example", "MCP_API_KEYS=")
                .file("mcp-server/package-lock.json", "{}")
                .file("mcp-server/package.json", """
                        {"scripts": {"audit": "npm audit"},
                         "dependencies": {"helmet": "7", "express-rate-limit": "7", "joi": "17"}}
                        """)
                .file("mcp-server/src/security.ts", "export function authenticate() { process.env.MCP_API_KEYS; }")
                .file(".github/workflows/security-enhanced.yml", "permissions: read-all")
                .file(".github/workflows/scorecard.yml", "permissions: read-all")
                .file(".github/workflows/slsa-provenance.yml", "permissions: read-all");
    }

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        var metrics = new AuditMetrics(registry);
        var properties = new AuditProperties();
        engine = new AuditEngine(
                new CheckRunner(allChecks(), metrics),
                new ScoreAggregator(),
                new PriorityRanker(properties),
                new ReportAssembler(properties),
                Clock.fixed(NOW, ZoneOffset.UTC),
                metrics);
    }

    @Test
    @DisplayName("hardened project scores full marks")
    void hardenedProjectScoresFull() {
        var report = engine.run(hardenedProject());

        assertEquals(80, report.totalScore());
        assertEquals(80, report.maxScore());
        assertEquals(100.0, report.percentage());
        assertTrue(report.issues().isEmpty());
        assertEquals(NOW, report.timestamp());
        assertEquals(List.of("file_permissions", "environment_variables", "authentication", "rate_limiting",
                "input_validation", "logging_security", "dependency_security", "ci_security"),
                List.copyOf(report.scores().keySet()));
    }

    @Test
    @DisplayName("empty project reports every gap")
    void emptyProject() {
        var report = engine.run(new InMemorySnapshot());

        assertEquals(10 + 8 + 0 + 0 + 0 + 10 + 0 + 0, report.totalScore());
        assertEquals("critical", report.band().label());
        assertTrue(report.issues().stream().anyMatch(i -> i.component().equals("MCPAuth")));
        assertTrue(report.issues().stream().anyMatch(i -> i.component().equals("CI/CD")));
    }

    @Test
    @DisplayName("running twice yields identical reports")
    void idempotent() {
        var snapshot = hardenedProject().file("src/main.rs", "let token = \"abcdefghijklmnopqrstuvwxyz\";");
        var first = engine.run(snapshot);
        var second = engine.run(snapshot);

        assertEquals(first, second);
        assertEquals(first.toMap(), second.toMap());
    }

    @Test
    @DisplayName("a malformed manifest fails one check and the rest still run")
    void failingCheckDoesNotAbort() {
        var report = engine.run(hardenedProject().file("mcp-server/package.json", "{oops"));

        assertEquals(0, report.scores().get("dependency_security"));
        assertEquals(10, report.scores().get("ci_security"));
        var systemErrors = report.issues().stream().filter(i -> i.component().equals("SystemError")).toList();
        assertEquals(1, systemErrors.size());
        assertEquals(Severity.CRITICAL, systemErrors.get(0).severity());
        assertTrue(systemErrors.get(0).message().startsWith("Check failed: Dependency Security - "));
    }

    @Test
    @DisplayName("baseline checks missing from the run become restore actions")
    void baselineRegression() {
        var baseline = new Baseline(Map.of("Code-Review", 8.0), Map.of());
        var report = engine.run(hardenedProject(), baseline);

        assertEquals(1, report.actions().size());
        assertEquals(ActionType.RESTORE_CHECK, report.actions().get(0).action());
        assertEquals(-8.0, report.actions().get(0).diff());
    }

    @Test
    @DisplayName("records run metrics and clears MDC")
    void recordsRunMetrics() {
        engine.run(new InMemorySnapshot());

        assertEquals(1.0, registry.find("bulwark.runs.total").tag("status", "critical").counter().count());
        assertNotNull(registry.find("bulwark.issues.total").tag("severity", "high").counter());
        assertNull(MDC.get("runId"));
    }
}
