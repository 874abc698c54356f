package com.kmg.lineocr.service;

import com.kmg.lineocr.model.*;
import com.kmg.lineocr.repo.ResultCsvStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Re-attempts only the failed pages of a finished job, reusing the page images of its first run, and merges
 * the recovered rows into the persisted result set. The result file is always rewritten whole: rows of every
 * attempted page are removed before the fresh rows are added, so a page never appears twice.
 */
@Component
public class RetryRunner {
    private static final Logger log = LoggerFactory.getLogger(RetryRunner.class);

    private final JobStore store;
    private final PageRecognizer pageRecognizer;
    private final ResultCsvStore resultStore;
    private final EventService events;
    private final RunSettings settings;

    public RetryRunner(
            JobStore store,
            PageRecognizer pageRecognizer,
            ResultCsvStore resultStore,
            EventService events,
            RunSettings settings
    ) {
        this.store = store;
        this.pageRecognizer = pageRecognizer;
        this.resultStore = resultStore;
        this.events = events;
        this.settings = settings;
    }

    /**
     * Runs a retry that {@link JobStore#beginRetry} already claimed.
     *
     * @param layout layout for the retried pages; {@code null} keeps the job's own
     */
    public JobRecord run(String jobId, RecognizerCredentials credentials, LayoutMode layout) {
        JobRecord job = store.get(jobId);
        if (job.status() != JobStatus.RUNNING || job.phase() != JobPhase.RETRYING) {
            throw new InvalidJobStateException("Job " + jobId + " was not claimed for a retry");
        }
        List<Integer> pages = job.failedPages();
        log.info("Job {} retry started for page(s) {}", jobId, pages);

        try {
            return execute(job, credentials, layout == null ? job.options().layout() : layout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Job {} retry interrupted", jobId);
            return store.finish(jobId, JobStatus.FAILED, pages, job.rowsTotal(), "Retry interrupted",
                    "Interrupted while waiting between pages");
        } catch (RuntimeException e) {
            log.error("Job {} retry failed unexpectedly: {}", jobId, e.getMessage(), e);
            return store.finish(jobId, JobStatus.FAILED, pages, job.rowsTotal(), "Retry failed: " + e.getMessage(), e.toString());
        }
    }

    private JobRecord execute(JobRecord job, RecognizerCredentials credentials, LayoutMode layout) throws InterruptedException {
        String jobId = job.id();
        List<Integer> pages = job.failedPages();
        List<String> imagePaths = job.imagePaths();
        CancellationToken token = store.cancellationToken(jobId);

        RecognizerSession session;
        try {
            session = pageRecognizer.authenticate(credentials);
        } catch (TextRecognizer.AuthenticationFailedException e) {
            log.warn("Job {} retry authentication failed: {}", jobId, e.getMessage());
            return store.finish(jobId, JobStatus.FAILED, pages, job.rowsTotal(), "Authentication failed: " + e.getMessage(), e.getMessage());
        }

        int total = pages.size();
        store.enterPhase(jobId, JobPhase.RETRYING, Progress.retry(0, total), "Retrying " + total + " page(s)");

        Map<Integer, List<ResultRow>> recovered = new TreeMap<>();
        SortedSet<Integer> stillFailed = new TreeSet<>();
        int attempted = 0;
        boolean canceled = false;
        for (int pageNo : pages) {
            if (attempted > 0) {
                settings.pauseBetweenPages(token);
            }
            if (token.isCancellationRequested()) {
                canceled = true;
                break;
            }

            PageOutcome outcome = recognize(pageNo, imagePaths, session, job.options().languageHint(), layout);
            attempted++;
            if (outcome.succeeded()) {
                recovered.put(pageNo, outcome.rows());
            } else {
                stillFailed.add(pageNo);
            }

            String message = "Retried page " + pageNo + " (" + attempted + "/" + total + ")"
                    + (outcome.succeeded() ? "" : ", failed again");
            store.recordRetry(jobId, attempted, Progress.retry(attempted, total), message);
            events.publish(EventService.PAGE_PROGRESS, jobId, message, Map.of(
                    "pageNo", pageNo,
                    "retryTotal", total,
                    "succeeded", outcome.succeeded()
            ));
        }

        int rowsTotal = job.rowsTotal();
        if (attempted > 0) {
            Path resultPath = Path.of(job.resultLocation());
            List<ResultRow> merged = merge(resultStore.read(resultPath), pages.subList(0, attempted), recovered);
            resultStore.write(resultPath, merged);
            rowsTotal = merged.size();
        }
        stillFailed.addAll(pages.subList(attempted, total));

        if (canceled) {
            log.info("Job {} retry canceled after {} of {} page(s)", jobId, attempted, total);
            return store.finish(jobId, JobStatus.CANCELED, stillFailed, rowsTotal,
                    "Retry canceled after " + attempted + " of " + total + " page(s)", null);
        }
        JobStatus terminal = stillFailed.isEmpty() ? JobStatus.COMPLETED : JobStatus.COMPLETED_WITH_ERRORS;
        log.info("Job {} retry finished {}: recovered {}, still failed {}", jobId, terminal, recovered.keySet(), stillFailed);
        String message = stillFailed.isEmpty()
                ? "Retry recovered all " + total + " page(s)"
                : "Retry recovered " + recovered.size() + " of " + total + " page(s)";
        return store.finish(jobId, terminal, stillFailed, rowsTotal, message, null);
    }

    private PageOutcome recognize(int pageNo, List<String> imagePaths, RecognizerSession session, String languageHint,
                                  LayoutMode layout) {
        int index = pageNo - 1;
        if (index < 0 || index >= imagePaths.size()) {
            return PageOutcome.failure(pageNo, "No rendered image for page " + pageNo);
        }
        return pageRecognizer.recognize(pageNo, Path.of(imagePaths.get(index)), session, languageHint, layout);
    }

    /**
     * Drops every existing row of the replaced pages, adds the recovered rows and orders the whole set by
     * page then line.
     */
    static List<ResultRow> merge(List<ResultRow> existing, Collection<Integer> replacedPages,
                                 Map<Integer, List<ResultRow>> recovered) {
        Set<Integer> replaced = new HashSet<>(replacedPages);
        List<ResultRow> merged = existing.stream()
                .filter(row -> !replaced.contains(row.pageNo()))
                .collect(Collectors.toCollection(ArrayList::new));
        recovered.forEach((pageNo, rows) -> {
            if (replaced.contains(pageNo)) {
                merged.addAll(rows);
            }
        });
        merged.sort(ResultRow.PAGE_LINE_ORDER);
        return merged;
    }
}
