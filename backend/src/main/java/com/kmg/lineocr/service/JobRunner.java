package com.kmg.lineocr.service;

import com.kmg.lineocr.model.*;
import com.kmg.lineocr.repo.ResultCsvStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.*;

/**
 * Drives one job from {@code queued} to a terminal status: authenticate, render every page, then recognize
 * every page. A page that fails recognition is recorded and the loop moves on; authentication and conversion
 * failures end the job. Cancellation is observed before each page is rendered and before each page is
 * recognized.
 */
@Component
public class JobRunner {
    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final JobStore store;
    private final PageRenderer renderer;
    private final PageRecognizer pageRecognizer;
    private final ResultCsvStore resultStore;
    private final EventService events;
    private final RunSettings settings;

    public JobRunner(
            JobStore store,
            PageRenderer renderer,
            PageRecognizer pageRecognizer,
            ResultCsvStore resultStore,
            EventService events,
            RunSettings settings
    ) {
        this.store = store;
        this.renderer = renderer;
        this.pageRecognizer = pageRecognizer;
        this.resultStore = resultStore;
        this.events = events;
        this.settings = settings;
    }

    /**
     * Runs the job on the calling thread and returns its terminal snapshot. Never throws once the job has
     * been moved to {@code running}.
     */
    public JobRecord run(String jobId, RecognizerCredentials credentials) {
        JobRecord job = store.beginRun(jobId);
        log.info("Job {} started: {} input, layout {}, {} dpi", jobId, job.options().inputMode().code(),
                job.options().layout().code(), job.options().dpi());
        events.publish(EventService.JOB_STARTED, jobId, "Job started", null);

        RunState state = new RunState(Path.of(job.resultLocation()));
        try {
            return execute(job, credentials, store.cancellationToken(jobId), state);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Job {} interrupted", jobId);
            return abort(jobId, state, "Job interrupted", "Interrupted while waiting between pages");
        } catch (RuntimeException e) {
            log.error("Job {} failed unexpectedly: {}", jobId, e.getMessage(), e);
            return abort(jobId, state, "Job failed: " + e.getMessage(), e.toString());
        }
    }

    private JobRecord execute(JobRecord job, RecognizerCredentials credentials, CancellationToken token, RunState state)
            throws InterruptedException {
        String jobId = job.id();
        JobOptions options = job.options();
        if (token.isCancellationRequested()) {
            return cancel(jobId, state);
        }

        RecognizerSession session;
        try {
            session = pageRecognizer.authenticate(credentials);
        } catch (TextRecognizer.AuthenticationFailedException e) {
            log.warn("Job {} authentication failed: {}", jobId, e.getMessage());
            return store.finish(jobId, JobStatus.FAILED, List.of(), 0, "Authentication failed: " + e.getMessage(), e.getMessage());
        }
        if (token.isCancellationRequested()) {
            return cancel(jobId, state);
        }

        enterPhase(jobId, JobPhase.CONVERTING, Progress.AUTHENTICATED, "Converting pages");
        List<Path> images;
        try {
            images = convert(job, token, state);
        } catch (PageRenderer.ConversionFailedException e) {
            log.warn("Job {} conversion failed: {}", jobId, e.getMessage());
            return store.finish(jobId, JobStatus.FAILED, List.of(), 0, "Conversion failed: " + e.getMessage(), e.getMessage());
        }
        if (images == null) {
            return cancel(jobId, state);
        }
        if (images.isEmpty()) {
            return store.finish(jobId, JobStatus.FAILED, List.of(), 0, "Document has no pages", "Document has no pages");
        }
        store.recordImages(jobId, images.stream().map(Path::toString).toList());

        int total = images.size();
        enterPhase(jobId, JobPhase.RECOGNIZING, Progress.RECOGNITION_START, "Recognizing " + total + " page(s)");
        state.recognitionBegun = true;
        for (int i = 0; i < total; i++) {
            if (i > 0) {
                settings.pauseBetweenPages(token);
            }
            if (token.isCancellationRequested()) {
                return cancel(jobId, state);
            }

            int pageNo = i + 1;
            PageOutcome outcome = pageRecognizer.recognize(pageNo, images.get(i), session, options.languageHint(), options.layout());
            state.record(outcome);
            if (state.attempted % settings.flushEveryPages() == 0 && state.attempted < total) {
                persist(state);
            }

            String message = "Recognized page " + pageNo + "/" + total
                    + (outcome.succeeded() ? "" : " (failed: " + outcome.failureReason() + ")");
            store.recordPage(jobId, state.attempted, state.rows.size(), Progress.recognition(state.attempted, total), message);
            events.publish(EventService.PAGE_PROGRESS, jobId, message, Map.of(
                    "pageNo", pageNo,
                    "pagesTotal", total,
                    "succeeded", outcome.succeeded()
            ));
        }

        persist(state);
        JobStatus terminal = state.failed.isEmpty() ? JobStatus.COMPLETED : JobStatus.COMPLETED_WITH_ERRORS;
        String message = state.failed.isEmpty()
                ? "Completed: " + state.rows.size() + " line(s) from " + total + " page(s)"
                : "Completed with " + state.failed.size() + " failed page(s)";
        log.info("Job {} {}: {} row(s), failed pages {}", jobId, terminal, state.rows.size(), state.failed);
        return store.finish(jobId, terminal, state.failed, state.rows.size(), message, null);
    }

    /**
     * Renders every page. Returns {@code null} when a cancel request is observed before a page.
     */
    private List<Path> convert(JobRecord job, CancellationToken token, RunState state) {
        String jobId = job.id();
        List<Path> images = new ArrayList<>();
        try (PageRenderer.PageSource source = renderer.open(job.options(), settings.imagesDir(jobId))) {
            int total = source.pageCount();
            store.startConversion(jobId, total);
            state.pagesTotal = total;
            for (int i = 0; i < total; i++) {
                if (token.isCancellationRequested()) {
                    return null;
                }
                images.add(source.render(i));
                int done = i + 1;
                store.recordConversion(jobId, done, Progress.conversion(done, total), "Converted page " + done + "/" + total);
                log.debug("Job {} converted page {}/{}", jobId, done, total);
            }
        }
        return images;
    }

    private void enterPhase(String jobId, JobPhase phase, int progress, String message) {
        store.enterPhase(jobId, phase, progress, message);
        events.publish(EventService.JOB_PHASE, jobId, message, Map.of("phase", phase.name()));
        log.info("Job {} entered {}", jobId, phase);
    }

    private JobRecord cancel(String jobId, RunState state) {
        if (state.attempted > 0) {
            persist(state);
        }
        log.info("Job {} canceled after {} page(s)", jobId, state.attempted);
        return store.finish(jobId, JobStatus.CANCELED, state.unfinishedPages(), state.rows.size(),
                "Canceled after " + state.attempted + " page(s)", null);
    }

    private JobRecord abort(String jobId, RunState state, String message, String error) {
        if (state.attempted > 0) {
            try {
                persist(state);
            } catch (RuntimeException e) {
                log.warn("Job {} could not persist partial rows, keeping the last {} written: {}",
                        jobId, state.persistedRows, e.getMessage());
                state.rollBackToLastWrite();
            }
        }
        return store.finish(jobId, JobStatus.FAILED, state.unfinishedPages(), state.rows.size(), message, error);
    }

    private void persist(RunState state) {
        resultStore.write(state.resultPath, state.rows);
        state.persistedPages = state.attempted;
        state.persistedRows = state.rows.size();
    }

    private static final class RunState {
        private final Path resultPath;
        private final List<ResultRow> rows = new ArrayList<>();
        private final SortedSet<Integer> failed = new TreeSet<>();
        private int pagesTotal;
        private int attempted;
        private boolean recognitionBegun;
        private int persistedPages;
        private int persistedRows;

        private RunState(Path resultPath) {
            this.resultPath = resultPath;
        }

        void record(PageOutcome outcome) {
            attempted++;
            if (outcome.succeeded()) {
                rows.addAll(outcome.rows());
            } else {
                failed.add(outcome.pageNo());
            }
        }

        /**
         * Matches the rows to what the result file holds after the last successful write; pages attempted
         * since then are lost and count as failed.
         */
        void rollBackToLastWrite() {
            rows.subList(persistedRows, rows.size()).clear();
            for (int page = persistedPages + 1; page <= attempted; page++) {
                failed.add(page);
            }
        }

        /**
         * Pages that failed plus pages never attempted, once recognition has begun; empty before that.
         */
        SortedSet<Integer> unfinishedPages() {
            SortedSet<Integer> pages = new TreeSet<>();
            if (!recognitionBegun) {
                return pages;
            }
            pages.addAll(failed);
            for (int page = attempted + 1; page <= pagesTotal; page++) {
                pages.add(page);
            }
            return pages;
        }
    }
}
