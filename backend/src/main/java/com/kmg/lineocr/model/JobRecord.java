package com.kmg.lineocr.model;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Point-in-time snapshot of one job. Only {@code JobStore} produces these.
 */
public record JobRecord(
        String id,
        JobStatus status,
        JobPhase phase,
        int progress,
        String message,
        JobOptions options,
        int pagesTotal,
        int convertDone,
        int pagesDone,
        int retryTotal,
        int retryDone,
        int rowsTotal,
        List<Integer> failedPages,
        List<String> imagePaths,
        String resultLocation,
        boolean cancelRequested,
        String lastError,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        OffsetDateTime startedAt,
        OffsetDateTime endedAt,
        long version
) {
    public JobRecord {
        failedPages = failedPages == null ? List.of() : List.copyOf(failedPages);
        imagePaths = imagePaths == null ? List.of() : List.copyOf(imagePaths);
    }

    public boolean canCancel() {
        return status.isActive();
    }

    public boolean canRetry() {
        return status.isRetryable() && !failedPages.isEmpty();
    }
}
