package com.kmg.lineocr.dto;

public record JobEvent(
        String type,
        String jobId,
        String message,
        String timestamp,
        Object payload
) {
}
