package com.automate.FindingSync.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Local triage workflow, independent of the upstream issue status.
 * Nothing returns to NEW; terminal states can be reopened to ACKNOWLEDGED or IN_PROGRESS.
 */
public enum LocalStatus {
    NEW,
    ACKNOWLEDGED,
    IN_PROGRESS,
    RESOLVED,
    FALSE_POSITIVE,
    WONTFIX;

    private static final Set<LocalStatus> TERMINAL = EnumSet.of(RESOLVED, FALSE_POSITIVE, WONTFIX);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean canTransitionTo(LocalStatus target) {
        if (target == null || target == this) return false;
        if (target == NEW) return false;
        if (isTerminal()) {
            return target == ACKNOWLEDGED || target == IN_PROGRESS;
        }
        return true;
    }
}
