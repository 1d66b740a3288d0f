package com.bulwark.core.check;

import com.bulwark.core.snapshot.ProjectSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * A check that starts at zero and earns points for each
 * {@link PresenceRequirement} it can verify. Unmet requirements become issues.
 */
public abstract class PresenceCheck extends AbstractCheck {

    private static final Logger log = LoggerFactory.getLogger(PresenceCheck.class);

    private final List<PresenceRequirement> requirements;

    protected PresenceCheck(String name, String displayName, List<PresenceRequirement> requirements) {
        super(name, displayName);
        this.requirements = List.copyOf(requirements);
    }

    @Override
    protected int score(ProjectSnapshot snapshot, IssueLog issues) {
        int score = 0;
        for (PresenceRequirement requirement : requirements) {
            if (isMet(snapshot, requirement)) {
                score += requirement.weight();
                log.info("{}: {} configured", requirement.label(), displayName());
            } else {
                issues.issue(requirement.issueComponent(), requirement.severity(),
                        requirement.message(), requirement.recommendation());
            }
        }
        return score;
    }

    private boolean isMet(ProjectSnapshot snapshot, PresenceRequirement requirement) {
        for (MarkerProbe probe : requirement.probes()) {
            if (probe(snapshot, requirement.component(), probe)) {
                return true;
            }
        }
        return false;
    }
}
