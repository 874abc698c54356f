package com.kmg.lineocr.model;

public enum JobPhase {
    QUEUED,
    AUTHENTICATING,
    CONVERTING,
    RECOGNIZING,
    RETRYING,
    COMPLETED,
    COMPLETED_WITH_ERRORS,
    FAILED,
    CANCELED;

    public static JobPhase terminalFor(JobStatus status) {
        return switch (status) {
            case COMPLETED -> COMPLETED;
            case COMPLETED_WITH_ERRORS -> COMPLETED_WITH_ERRORS;
            case FAILED -> FAILED;
            case CANCELED -> CANCELED;
            case QUEUED, RUNNING -> throw new IllegalArgumentException("Not a terminal status: " + status);
        };
    }
}
