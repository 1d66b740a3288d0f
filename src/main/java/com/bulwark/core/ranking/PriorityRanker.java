package com.bulwark.core.ranking;

import com.bulwark.core.config.AuditProperties;
import com.bulwark.core.model.ActionType;
import com.bulwark.core.model.Baseline;
import com.bulwark.core.model.CheckComparison;
import com.bulwark.core.model.CheckResult;
import com.bulwark.core.model.ComparisonStatus;
import com.bulwark.core.model.Priority;
import com.bulwark.core.model.PriorityAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Compares a run against a baseline and turns regressions and weak
 * security-critical checks into ordered remediation actions.
 */
@Service
public class PriorityRanker {

    private static final Logger log = LoggerFactory.getLogger(PriorityRanker.class);

    static final String MISSING_REASON = "Check not found in current results";
    static final String NO_ISSUES_REASON = "No issues found";

    private final AuditProperties properties;

    public PriorityRanker(AuditProperties properties) {
        this.properties = properties;
    }

    /**
     * Builds one comparison per current check, followed by one per baseline
     * check absent from the run.
     *
     * @param baseline previous scores, or {@code null} when there is none
     */
    public List<CheckComparison> compare(List<CheckResult> results, Baseline baseline) {
        var comparisons = new ArrayList<CheckComparison>();
        if (baseline == null) {
            for (CheckResult result : results) {
                comparisons.add(new CheckComparison(result.name(), result.score(), result.score(),
                        0.0, ComparisonStatus.UNCHANGED, reasonFor(result), ""));
            }
            return comparisons;
        }

        Set<String> seen = new HashSet<>();
        for (CheckResult result : results) {
            seen.add(result.name());
            double current = result.score();
            double previous = baseline.scores().getOrDefault(result.name(), 0.0);
            double diff = current - previous;
            comparisons.add(new CheckComparison(result.name(), current, previous, diff,
                    statusFor(diff), reasonFor(result), baseline.reasonFor(result.name())));
        }
        baseline.scores().forEach((check, previous) -> {
            if (!seen.contains(check)) {
                comparisons.add(new CheckComparison(check, 0.0, previous, -previous,
                        ComparisonStatus.MISSING, MISSING_REASON, baseline.reasonFor(check)));
            }
        });
        return comparisons;
    }

    /**
     * Derives actions from comparisons, sorted by priority then by diff
     * (largest decline first). Ties keep comparison order.
     */
    public List<PriorityAction> rank(List<CheckComparison> comparisons) {
        var critical = Set.copyOf(properties.getRanking().getSecurityCriticalChecks());
        int threshold = properties.getRanking().getImproveThreshold();

        var actions = new ArrayList<PriorityAction>();
        for (CheckComparison c : comparisons) {
            boolean securityCritical = critical.contains(c.check());
            switch (c.status()) {
                case DECLINED -> actions.add(action(c,
                        securityCritical ? Priority.HIGH : Priority.MEDIUM, ActionType.INVESTIGATE_DECLINE));
                case MISSING -> actions.add(action(c, Priority.HIGH, ActionType.RESTORE_CHECK));
                default -> {
                    if (c.currentScore() < threshold && securityCritical) {
                        actions.add(action(c, Priority.MEDIUM, ActionType.IMPROVE_SECURITY));
                    }
                }
            }
        }
        // List.sort is stable
        actions.sort(Comparator.comparingInt((PriorityAction a) -> a.priority().rank())
                .thenComparingDouble(PriorityAction::diff));
        log.debug("Ranked {} priority actions from {} comparisons", actions.size(), comparisons.size());
        return actions;
    }

    private static PriorityAction action(CheckComparison c, Priority priority, ActionType type) {
        return new PriorityAction(c.check(), priority, type,
                c.currentScore(), c.baselineScore(), c.diff(), c.reason());
    }

    private static ComparisonStatus statusFor(double diff) {
        if (diff > 0) {
            return ComparisonStatus.IMPROVED;
        }
        if (diff < 0) {
            return ComparisonStatus.DECLINED;
        }
        return ComparisonStatus.UNCHANGED;
    }

    private static String reasonFor(CheckResult result) {
        if (!result.issues().isEmpty()) {
            return result.issues().get(0).message();
        }
        return NO_ISSUES_REASON;
    }
}
