package com.eainde.research.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a {@link PipelineRun}.
 *
 * <pre>
 * ACCEPTED → PLANNING → RESEARCH → REPORT → COMPLETED
 *     └──────────┴──────────┴─────────┴──→ FAILED
 * </pre>
 */
public enum RunStatus {
    ACCEPTED,
    PLANNING,
    RESEARCH,
    REPORT,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(RunStatus next) {
        return allowedNext().contains(next);
    }

    private Set<RunStatus> allowedNext() {
        switch (this) {
            case ACCEPTED:
                return EnumSet.of(PLANNING, FAILED);
            case PLANNING:
                return EnumSet.of(RESEARCH, FAILED);
            case RESEARCH:
                return EnumSet.of(REPORT, FAILED);
            case REPORT:
                return EnumSet.of(COMPLETED, FAILED);
            default:
                return EnumSet.noneOf(RunStatus.class);
        }
    }
}
