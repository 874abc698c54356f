package com.kmg.lineocr.service;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings shared by initial and retry runs.
 *
 * @param runsDir         parent of every job's working directory
 * @param flushEveryPages the recognizing loop re-persists its partial result set after this many pages
 * @param pageInterval    pause between two page requests to the recognizer
 */
public record RunSettings(Path runsDir, int flushEveryPages, Duration pageInterval) {

    public RunSettings {
        if (flushEveryPages < 1) {
            throw new IllegalArgumentException("flushEveryPages must be positive");
        }
        pageInterval = pageInterval == null || pageInterval.isNegative() ? Duration.ZERO : pageInterval;
    }

    public Path imagesDir(String jobId) {
        return runsDir.resolve(jobId).resolve("images");
    }

    /**
     * Sleeps for the page interval. Returns early when the token is canceled.
     */
    void pauseBetweenPages(CancellationToken token) throws InterruptedException {
        long remaining = pageInterval.toMillis();
        while (remaining > 0 && !token.isCancellationRequested()) {
            long slice = Math.min(remaining, 250L);
            Thread.sleep(slice);
            remaining -= slice;
        }
    }
}
