package com.bulwark.core.check;

import com.bulwark.core.model.Issue;
import com.bulwark.core.model.Severity;
import com.bulwark.core.snapshot.InMemorySnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CiSecurityCheckTest {

    private final CiSecurityCheck check = new CiSecurityCheck();

    @Test
    @DisplayName("no workflows directory is a medium issue")
    void noWorkflows() {
        var result = check.evaluate(new InMemorySnapshot());

        assertEquals(0, result.score());
        assertEquals(List.of(new Issue("CI/CD", Severity.MEDIUM,
                "No CI/CD workflows found", "Set up GitHub Actions workflows for security")), result.issues());
    }

    @Test
    @DisplayName("empty workflows directory recommends every security workflow")
    void emptyWorkflowsDirectory() {
        var result = check.evaluate(new InMemorySnapshot().directory(".github/workflows"));

        assertEquals(0, result.score());
        assertTrue(result.issues().isEmpty());
        assertEquals(3, result.recommendations().size());
        assertEquals("Consider adding scorecard.yml security workflow", result.recommendations().get(1).message());
    }

    @Test
    @DisplayName("permissions blocks earn a point per workflow")
    void permissionsBlocks() {
        var result = check.evaluate(new InMemorySnapshot()
                .file(".github/workflows/ci.yml", "permissions:\n  contents: read\n")
                .file(".github/workflows/release.yml", "on: push\n")
                .file(".github/workflows/sub/nested.yml", "permissions: {}\n"));

        assertEquals(1, result.score());
    }

    @Test
    @DisplayName("score is capped at ten")
    void capped() {
        var snapshot = new InMemorySnapshot();
        for (String workflow : CheckRules.SECURITY_WORKFLOWS) {
            snapshot.file(".github/workflows/" + workflow, "permissions: read-all\n");
        }
        snapshot.file(".github/workflows/ci.yml", "permissions:\n");

        var result = check.evaluate(snapshot);

        assertEquals(10, result.score());
        assertTrue(result.recommendations().isEmpty());
    }
}
