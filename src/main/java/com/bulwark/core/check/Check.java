package com.bulwark.core.check;

import com.bulwark.core.model.CheckResult;
import com.bulwark.core.snapshot.ProjectSnapshot;

/**
 * One security-category evaluator.
 * <p>
 * Implementations must not mutate the snapshot or reach outside it. Any
 * unchecked exception escaping {@link #evaluate} is converted by
 * {@link CheckRunner} into a critical system-error issue.
 */
public interface Check {

    /** Stable key used in reports, e.g. {@code "rate_limiting"}. */
    String name();

    /** Human-readable name, e.g. {@code "Rate Limiting"}. */
    String displayName();

    CheckResult evaluate(ProjectSnapshot snapshot);
}
