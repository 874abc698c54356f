package com.kmg.lineocr.model;

import java.util.List;

/**
 * Result of recognizing one page: either its ordered rows, or the reason it failed.
 */
public record PageOutcome(int pageNo, List<ResultRow> rows, String failureReason) {

    public PageOutcome {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static PageOutcome success(int pageNo, List<ResultRow> rows) {
        return new PageOutcome(pageNo, rows, null);
    }

    public static PageOutcome failure(int pageNo, String reason) {
        return new PageOutcome(pageNo, List.of(), reason == null || reason.isBlank() ? "recognition failed" : reason);
    }

    public boolean succeeded() {
        return failureReason == null;
    }
}
