package com.kmg.lineocr.dto;

import jakarta.validation.constraints.NotBlank;

public record LocalJobRequest(
        String inputMode,
        @NotBlank String path,
        String apiKey,
        String secretKey,
        String layout,
        String languageHint,
        Integer dpi
) {
    public JobSubmission toSubmission() {
        return new JobSubmission(inputMode, apiKey, secretKey, layout, languageHint, dpi);
    }

    @Override
    public String toString() {
        return "LocalJobRequest[inputMode=" + inputMode + ", path=" + path + ", layout=" + layout + "]";
    }
}
