package com.kmg.lineocr.model;

/**
 * Immutable submission options of a job. {@code sourcePath} is a PDF file or an image folder.
 */
public record JobOptions(
        InputMode inputMode,
        String sourcePath,
        LayoutMode layout,
        String languageHint,
        int dpi,
        String outputName
) {
}
