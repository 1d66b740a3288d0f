package com.bulwark.core.check;

import com.bulwark.core.model.Severity;
import com.bulwark.core.snapshot.ProjectSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Iterator;

/**
 * Awards points for pinned dependencies (lockfiles), npm audit scripts, and
 * security middleware in the server manifest.
 * <p>
 * A manifest that exists but is not valid JSON aborts the check with a
 * {@link CheckExecutionException}.
 */
@Component
@Order(7)
public class DependencySecurityCheck extends AbstractCheck {

    private static final Logger log = LoggerFactory.getLogger(DependencySecurityCheck.class);

    private final ObjectMapper objectMapper;

    public DependencySecurityCheck(ObjectMapper objectMapper) {
        super("dependency_security", "Dependency Security");
        this.objectMapper = objectMapper;
    }

    @Override
    protected int score(ProjectSnapshot snapshot, IssueLog issues) {
        int score = 0;

        for (var lockfile : CheckRules.LOCKFILES) {
            String path = snapshot.resolve(lockfile.component(), lockfile.path());
            if (snapshot.exists(path)) {
                score += lockfile.weight();
                log.info("{} present", path);
            } else {
                issues.issue(lockfile.issueComponent(), Severity.MEDIUM,
                        lockfile.message(), lockfile.recommendation());
            }
        }

        String manifestPath = snapshot.resolve(CheckRules.SERVER, CheckRules.PACKAGE_MANIFEST);
        if (!snapshot.exists(manifestPath)) {
            return score;
        }
        var content = readQuietly(snapshot, manifestPath);
        if (content.isEmpty()) {
            return score;
        }
        JsonNode manifest = parseManifest(manifestPath, content.get());

        if (hasAuditScript(manifest)) {
            score += CheckRules.AUDIT_SCRIPT_WEIGHT;
            log.info("MCP Server: Audit scripts configured");
        } else {
            issues.recommend("MCPDeps", "Add npm audit scripts to package.json");
        }

        if (hasSecurityDependency(manifest)) {
            score += CheckRules.SECURITY_DEPENDENCY_WEIGHT;
            log.info("MCP Server: Security dependencies found");
        } else {
            issues.recommend("MCPDeps", "Consider adding security dependencies like helmet");
        }
        return score;
    }

    private JsonNode parseManifest(String path, String content) {
        try {
            return objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new CheckExecutionException("Invalid JSON in " + path + ": " + e.getOriginalMessage(), e);
        }
    }

    private static boolean hasAuditScript(JsonNode manifest) {
        Iterator<String> scripts = manifest.path("scripts").fieldNames();
        while (scripts.hasNext()) {
            if (scripts.next().contains(CheckRules.AUDIT_SCRIPT_MARKER)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasSecurityDependency(JsonNode manifest) {
        JsonNode dependencies = manifest.path("dependencies");
        return CheckRules.SECURITY_DEPENDENCIES.stream().anyMatch(dependencies::has);
    }
}
