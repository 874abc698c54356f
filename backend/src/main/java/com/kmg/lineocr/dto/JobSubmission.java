package com.kmg.lineocr.dto;

/**
 * Start options shared by upload and local-path submissions. Blank values fall back to configured defaults.
 */
public record JobSubmission(
        String inputMode,
        String apiKey,
        String secretKey,
        String layout,
        String languageHint,
        Integer dpi
) {
    @Override
    public String toString() {
        return "JobSubmission[inputMode=" + inputMode + ", layout=" + layout + ", languageHint=" + languageHint
                + ", dpi=" + dpi + "]";
    }
}
