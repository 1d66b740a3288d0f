package com.bulwark.core.check;

import com.bulwark.core.model.Severity;
import com.bulwark.core.pattern.Rule;

import java.util.List;
import java.util.Set;

/**
 * Declarative rule tables for the registered checks: which files each check
 * looks at, which patterns deduct points, and which markers prove a
 * capability is present.
 * <p>
 * Paths are relative to a component sub-root ({@link #BRIDGE} or
 * {@link #SERVER}); {@code **} in a glob crosses directories.
 */
public final class CheckRules {

    public static final String BRIDGE = "bridge";
    public static final String SERVER = "server";

    /** A file or glob inside a component. */
    public record ScanTarget(String component, String path) {}

    /** A file whose absence produces a recommendation. */
    public record ExampleConfig(String component, String path, String label) {}

    /** A file whose presence earns points and whose absence is an issue. */
    public record RequiredFile(
        String component,
        String path,
        int weight,
        String issueComponent,
        String message,
        String recommendation
    ) {}

    private CheckRules() {}

    // ── File permissions ─────────────────────────────────────────────

    public static final int PERMISSION_DEDUCTION = 2;

    public static final List<ScanTarget> SENSITIVE_FILES = List.of(
            new ScanTarget(BRIDGE, ".env"),
            new ScanTarget(BRIDGE, "config.toml"),
            new ScanTarget(SERVER, ".env"),
            new ScanTarget(SERVER, "config.json")
    );

    // ── Hardcoded secrets ────────────────────────────────────────────

    /** Reading a value through this idiom marks the whole file as safe. */
    public static final String ENV_ACCESS_MARKER = "process.env";

    public static final int SECRET_DEDUCTION = 3;
    public static final int MISSING_EXAMPLE_DEDUCTION = 1;

    public static final List<Rule> SECRET_RULES = List.of(
            Rule.of("token\\s*=\\s*[\"'][^\"']{20,}[\"']", "Hardcoded token", SECRET_DEDUCTION)
                    .withSafeMarker(ENV_ACCESS_MARKER),
            Rule.of("key\\s*=\\s*[\"'][^\"']{16,}[\"']", "Hardcoded key", SECRET_DEDUCTION)
                    .withSafeMarker(ENV_ACCESS_MARKER),
            Rule.of("password\\s*=\\s*[\"'][^\"']{8,}[\"']", "Hardcoded password", SECRET_DEDUCTION)
                    .withSafeMarker(ENV_ACCESS_MARKER),
            Rule.of("secret\\s*=\\s*[\"'][^\"']{12,}[\"']", "Hardcoded secret", SECRET_DEDUCTION)
                    .withSafeMarker(ENV_ACCESS_MARKER)
    );

    public static final List<ScanTarget> SECRET_SCAN_TARGETS = List.of(
            new ScanTarget(BRIDGE, "src/**.rs"),
            new ScanTarget(BRIDGE, "src/**.ts"),
            new ScanTarget(SERVER, "src/**.rs"),
            new ScanTarget(SERVER, "src/**.ts")
    );

    public static final List<ExampleConfig> EXAMPLE_CONFIGS = List.of(
            new ExampleConfig(BRIDGE, "config.example.toml", "Bridge"),
            new ExampleConfig(SERVER, ".env.example", "MCP Server")
    );

    // ── Logging hygiene ──────────────────────────────────────────────

    public static final int LOGGING_DEDUCTION = 2;

    public static final List<Rule> LOGGING_RULES = List.of(
            Rule.of("log.*password", "Password in logs", LOGGING_DEDUCTION),
            Rule.of("log.*token", "Token in logs", LOGGING_DEDUCTION),
            Rule.of("log.*key", "Key in logs", LOGGING_DEDUCTION),
            Rule.of("println!.*password", "Password in Rust logs", LOGGING_DEDUCTION),
            Rule.of("console\\.log.*password", "Password in JS logs", LOGGING_DEDUCTION)
    );

    public static final List<ScanTarget> LOGGING_SCAN_TARGETS = List.of(
            new ScanTarget(BRIDGE, "src/**.rs"),
            new ScanTarget(SERVER, "src/**.ts")
    );

    // ── Presence checks ──────────────────────────────────────────────

    public static final int COMPONENT_WEIGHT = 5;

    public static final List<PresenceRequirement> AUTHENTICATION = List.of(
            new PresenceRequirement(BRIDGE, "Bridge",
                    List.of(MarkerProbe.anyOf(
                            List.of("src/telegram/handlers.rs", "src/utils/security.rs"),
                            "TELEGRAM_ALLOWED_USERS", "user_id")),
                    COMPONENT_WEIGHT, "BridgeAuth", Severity.WARNING,
                    "Bridge authentication may not be properly configured",
                    "Ensure TELEGRAM_ALLOWED_USERS is set"),
            new PresenceRequirement(SERVER, "MCP Server",
                    List.of(MarkerProbe.anyOf(
                            List.of("src/security.ts", "src/index.ts"),
                            "MCP_API_KEYS", "authenticate")),
                    COMPONENT_WEIGHT, "MCPAuth", Severity.WARNING,
                    "MCP Server authentication may not be properly configured",
                    "Ensure MCP_API_KEYS is configured")
    );

    public static final List<PresenceRequirement> RATE_LIMITING = List.of(
            new PresenceRequirement(BRIDGE, "Bridge",
                    List.of(MarkerProbe.anyOfIgnoringCase(
                            List.of("src/utils/security.rs", "src/telegram/handlers.rs"),
                            "rate_limit", "throttle")),
                    COMPONENT_WEIGHT, "BridgeRateLimit", Severity.MEDIUM,
                    "Bridge rate limiting not found",
                    "Implement rate limiting for user requests"),
            new PresenceRequirement(SERVER, "MCP Server",
                    List.of(MarkerProbe.allOfIgnoringCase(
                            List.of("src/security.ts", "package.json"),
                            "rate", "limit")),
                    COMPONENT_WEIGHT, "MCPRateLimit", Severity.MEDIUM,
                    "MCP Server rate limiting not found",
                    "Implement rate limiting for API requests")
    );

    public static final List<PresenceRequirement> INPUT_VALIDATION = List.of(
            new PresenceRequirement(BRIDGE, "Bridge",
                    List.of(MarkerProbe.anyOf(
                            List.of("src/**.rs"),
                            "sanitize", "validate", "SecurityManager")),
                    COMPONENT_WEIGHT, "BridgeValidation", Severity.HIGH,
                    "Bridge input validation not comprehensive",
                    "Implement comprehensive input sanitization"),
            new PresenceRequirement(SERVER, "MCP Server",
                    List.of(
                            MarkerProbe.anyOfIgnoringCase(List.of("package.json"), "joi", "validator"),
                            MarkerProbe.anyOfIgnoringCase(List.of("src/**.ts"), "validate", "sanitize")),
                    COMPONENT_WEIGHT, "MCPValidation", Severity.HIGH,
                    "MCP Server input validation not found",
                    "Implement input validation with Joi or similar")
    );

    // ── Dependency pinning ───────────────────────────────────────────

    public static final List<RequiredFile> LOCKFILES = List.of(
            new RequiredFile(BRIDGE, "Cargo.lock", 2, "BridgeDeps",
                    "Cargo.lock not found", "Run cargo build to generate Cargo.lock"),
            new RequiredFile(SERVER, "package-lock.json", 2, "MCPDeps",
                    "package-lock.json not found", "Run npm install to generate package-lock.json")
    );

    public static final String PACKAGE_MANIFEST = "package.json";
    public static final String AUDIT_SCRIPT_MARKER = "audit";
    public static final int AUDIT_SCRIPT_WEIGHT = 3;
    public static final Set<String> SECURITY_DEPENDENCIES = Set.of("helmet", "express-rate-limit");
    public static final int SECURITY_DEPENDENCY_WEIGHT = 3;

    // ── CI hardening ─────────────────────────────────────────────────

    public static final String WORKFLOWS_DIR = ".github/workflows";

    public static final List<String> SECURITY_WORKFLOWS = List.of(
            "security-enhanced.yml",
            "scorecard.yml",
            "slsa-provenance.yml"
    );

    public static final int SECURITY_WORKFLOW_WEIGHT = 3;
    public static final String PERMISSIONS_MARKER = "permissions:";
    public static final int PERMISSIONS_WEIGHT = 1;
}
