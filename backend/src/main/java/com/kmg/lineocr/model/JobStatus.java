package com.kmg.lineocr.model;

import java.util.EnumSet;
import java.util.Set;

public enum JobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    COMPLETED_WITH_ERRORS,
    FAILED,
    CANCELED;

    private static final Set<JobStatus> RETRYABLE = EnumSet.of(COMPLETED_WITH_ERRORS, FAILED, CANCELED);

    public boolean isActive() {
        return this == QUEUED || this == RUNNING;
    }

    public boolean isTerminal() {
        return !isActive();
    }

    public boolean isRetryable() {
        return RETRYABLE.contains(this);
    }

    /**
     * A run starts from {@code QUEUED} (initial run) or from a retryable terminal status (retry run);
     * a running job may only end in a terminal status.
     */
    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case QUEUED -> next == RUNNING || next == CANCELED || next == FAILED;
            case RUNNING -> next.isTerminal();
            case COMPLETED_WITH_ERRORS, FAILED, CANCELED -> next == RUNNING;
            case COMPLETED -> false;
        };
    }
}
