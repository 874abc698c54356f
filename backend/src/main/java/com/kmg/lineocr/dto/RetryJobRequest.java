package com.kmg.lineocr.dto;

public record RetryJobRequest(
        String apiKey,
        String secretKey,
        String layout
) {
    @Override
    public String toString() {
        return "RetryJobRequest[layout=" + layout + "]";
    }
}
