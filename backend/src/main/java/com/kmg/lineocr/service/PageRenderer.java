package com.kmg.lineocr.service;

import com.kmg.lineocr.model.JobOptions;

import java.nio.file.Path;

/**
 * Turns a submitted document into one raster image per page.
 */
public interface PageRenderer {

    /**
     * Opens the job's source for page-by-page rendering into {@code imagesDir}.
     */
    PageSource open(JobOptions options, Path imagesDir);

    interface PageSource extends AutoCloseable {
        int pageCount();

        /**
         * Renders the zero-based page and returns the written image file.
         */
        Path render(int pageIndex);

        @Override
        void close();
    }

    class ConversionFailedException extends RuntimeException {
        public ConversionFailedException(String message) {
            super(message);
        }

        public ConversionFailedException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
