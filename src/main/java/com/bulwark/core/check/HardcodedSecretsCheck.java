package com.bulwark.core.check;

import com.bulwark.core.model.CheckResult;
import com.bulwark.core.model.Severity;
import com.bulwark.core.pattern.PatternMatcher;
import com.bulwark.core.pattern.Rule;
import com.bulwark.core.snapshot.ProjectSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;

/**
 * Scans component sources for secrets assigned as string literals, and
 * checks that each component ships an example configuration file.
 * <p>
 * A file that reads anything through {@link CheckRules#ENV_ACCESS_MARKER}
 * is not flagged at all, wherever the marker sits in the file.
 */
@Component
@Order(2)
public class HardcodedSecretsCheck extends AbstractCheck {

    private static final Logger log = LoggerFactory.getLogger(HardcodedSecretsCheck.class);

    public HardcodedSecretsCheck() {
        super("environment_variables", "Environment Variables");
    }

    @Override
    protected int score(ProjectSnapshot snapshot, IssueLog issues) {
        int score = CheckResult.MAX_SCORE;

        for (String file : filesFor(snapshot, CheckRules.SECRET_SCAN_TARGETS)) {
            var content = readQuietly(snapshot, file);
            if (content.isEmpty()) {
                continue;
            }
            for (Rule rule : PatternMatcher.match(content.get(), CheckRules.SECRET_RULES)) {
                score -= rule.weight();
                issues.issue("HardcodedSecrets", Severity.CRITICAL,
                        rule.description() + " found in " + file,
                        "Move secrets to environment variables");
            }
        }

        for (var example : CheckRules.EXAMPLE_CONFIGS) {
            String path = snapshot.resolve(example.component(), example.path());
            if (snapshot.exists(path)) {
                log.info("{}: Environment example file found", example.label());
            } else {
                score -= CheckRules.MISSING_EXAMPLE_DEDUCTION;
                issues.recommend(example.label(),
                        "Create " + Paths.get(path).getFileName() + " with example configuration");
            }
        }
        return score;
    }
}
