package com.bulwark.core.check;

import com.bulwark.core.model.CheckResult;
import com.bulwark.core.model.Severity;
import com.bulwark.core.snapshot.ProjectSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Awards points for dedicated security workflows and for workflows that
 * declare explicit token permissions. Capped at the maximum score.
 */
@Component
@Order(8)
public class CiSecurityCheck extends AbstractCheck {

    private static final Logger log = LoggerFactory.getLogger(CiSecurityCheck.class);

    public CiSecurityCheck() {
        super("ci_security", "CI/CD Security");
    }

    @Override
    protected int score(ProjectSnapshot snapshot, IssueLog issues) {
        if (!snapshot.exists(CheckRules.WORKFLOWS_DIR)) {
            issues.issue("CI/CD", Severity.MEDIUM,
                    "No CI/CD workflows found",
                    "Set up GitHub Actions workflows for security");
            return 0;
        }

        int score = 0;
        for (String workflow : CheckRules.SECURITY_WORKFLOWS) {
            if (snapshot.exists(CheckRules.WORKFLOWS_DIR + "/" + workflow)) {
                score += CheckRules.SECURITY_WORKFLOW_WEIGHT;
                log.info("Security workflow: {}", workflow);
            } else {
                issues.recommend("CI/CD", "Consider adding " + workflow + " security workflow");
            }
        }

        // direct children only; '*' does not cross directories
        for (String file : snapshot.find(CheckRules.WORKFLOWS_DIR + "/*.yml")) {
            if (readQuietly(snapshot, file).map(c -> c.contains(CheckRules.PERMISSIONS_MARKER)).orElse(false)) {
                score += CheckRules.PERMISSIONS_WEIGHT;
                log.info("{}: Permissions specified", file);
            }
        }
        return Math.min(score, CheckResult.MAX_SCORE);
    }
}
