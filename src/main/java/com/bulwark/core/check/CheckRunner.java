package com.bulwark.core.check;

import com.bulwark.core.logging.MdcContext;
import com.bulwark.core.metrics.AuditMetrics;
import com.bulwark.core.model.CheckResult;
import com.bulwark.core.model.Issue;
import com.bulwark.core.model.Severity;
import com.bulwark.core.snapshot.ProjectSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the registered checks one after another, in registration order.
 * <p>
 * A check that throws never aborts the run: its result becomes a score of
 * zero with a single {@code SystemError} critical issue.
 */
@Service
public class CheckRunner {

    private static final Logger log = LoggerFactory.getLogger(CheckRunner.class);

    private final List<Check> checks;
    private final AuditMetrics metrics;

    public CheckRunner(List<Check> checks, @Autowired(required = false) AuditMetrics metrics) {
        this.checks = List.copyOf(checks);
        this.metrics = metrics;
    }

    public List<Check> checks() {
        return checks;
    }

    public List<CheckResult> run(ProjectSnapshot snapshot) {
        var results = new ArrayList<CheckResult>(checks.size());
        for (Check check : checks) {
            results.add(runOne(check, snapshot));
        }
        return results;
    }

    private CheckResult runOne(Check check, ProjectSnapshot snapshot) {
        MdcContext.setCheck(check.name());
        long start = System.currentTimeMillis();
        try {
            log.info("Checking {}...", check.displayName());
            CheckResult result = check.evaluate(snapshot);
            log.info("{}: {}/{}", check.displayName(), result.score(), CheckResult.MAX_SCORE);
            if (metrics != null) {
                metrics.recordCheckScore(check.name(), result.score());
            }
            return result;
        } catch (RuntimeException e) {
            log.error("Check {} failed: {}", check.name(), e.getMessage(), e);
            if (metrics != null) {
                metrics.recordCheckFailure(check.name());
                metrics.recordCheckScore(check.name(), CheckResult.MIN_SCORE);
            }
            var issue = new Issue("SystemError", Severity.CRITICAL,
                    "Check failed: " + check.displayName() + " - " + describe(e),
                    "Investigate the failure and rerun the audit");
            return CheckResult.failed(check.name(), check.displayName(), issue);
        } finally {
            if (metrics != null) {
                metrics.recordCheckDuration(check.name(), System.currentTimeMillis() - start);
            }
            MdcContext.clearCheck();
        }
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
