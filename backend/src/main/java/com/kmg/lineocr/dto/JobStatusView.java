package com.kmg.lineocr.dto;

import java.util.List;

public record JobStatusView(
        String id,
        String status,
        String phase,
        int progress,
        String message,
        String inputMode,
        String layout,
        String outputName,
        int pagesTotal,
        int convertDone,
        int pagesDone,
        int retryTotal,
        int retryDone,
        int rowsTotal,
        int failedPagesCount,
        List<Integer> failedPages,
        boolean canCancel,
        boolean canRetry,
        boolean downloadAvailable,
        String lastError,
        String createdAt,
        String updatedAt,
        String startedAt,
        String endedAt
) {
}
