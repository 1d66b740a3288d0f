package com.bulwark.core.check;

import com.bulwark.core.model.CheckResult;
import com.bulwark.core.model.Severity;
import com.bulwark.core.pattern.PatternMatcher;
import com.bulwark.core.pattern.Rule;
import com.bulwark.core.snapshot.ProjectSnapshot;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Deducts for log statements that appear to print credentials. Each
 * (file, rule) pair counts once, regardless of how many lines match.
 */
@Component
@Order(6)
public class LoggingSecurityCheck extends AbstractCheck {

    public LoggingSecurityCheck() {
        super("logging_security", "Logging Security");
    }

    @Override
    protected int score(ProjectSnapshot snapshot, IssueLog issues) {
        int score = CheckResult.MAX_SCORE;
        for (String file : filesFor(snapshot, CheckRules.LOGGING_SCAN_TARGETS)) {
            var content = readQuietly(snapshot, file);
            if (content.isEmpty()) {
                continue;
            }
            for (Rule rule : PatternMatcher.match(content.get(), CheckRules.LOGGING_RULES)) {
                score -= rule.weight();
                issues.issue("LoggingSecurity", Severity.MEDIUM,
                        rule.description() + " in " + file,
                        "Remove sensitive data from logs");
            }
        }
        return score;
    }
}
