package com.kmg.lineocr.service;

import com.kmg.lineocr.model.*;
import com.kmg.lineocr.repo.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Owns every job's mutable state. All reads and writes go through one lock that is held only for the map
 * access itself; snapshots are mirrored to {@link JobRepository} after the lock is released.
 * <p>
 * Runners never touch job state directly: they call the update methods below, which also enforce the
 * status transitions allowed by {@link JobStatus#canTransitionTo}.
 */
@Component
public class JobStore {
    private static final Logger log = LoggerFactory.getLogger(JobStore.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Entry> jobs = new HashMap<>();
    private final JobRepository repository;

    public JobStore(JobRepository repository) {
        this.repository = repository;
    }

    public JobRecord create(String jobId, JobOptions options, String resultLocation) {
        JobRecord snapshot;
        lock.lock();
        try {
            if (jobs.containsKey(jobId)) {
                throw new IllegalArgumentException("Duplicate job id: " + jobId);
            }
            Entry entry = new Entry(jobId, options, resultLocation, now());
            jobs.put(jobId, entry);
            snapshot = entry.toRecord();
        } finally {
            lock.unlock();
        }
        persist(snapshot);
        return snapshot;
    }

    /**
     * Restores snapshots read back from the database at startup.
     */
    public void load(Collection<JobRecord> records) {
        lock.lock();
        try {
            for (JobRecord record : records) {
                jobs.putIfAbsent(record.id(), Entry.from(record));
            }
        } finally {
            lock.unlock();
        }
    }

    public Optional<JobRecord> find(String jobId) {
        lock.lock();
        try {
            Entry entry = jobs.get(jobId);
            return entry == null ? Optional.empty() : Optional.of(entry.toRecord());
        } finally {
            lock.unlock();
        }
    }

    public JobRecord get(String jobId) {
        return find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public List<JobRecord> list() {
        lock.lock();
        try {
            return jobs.values().stream()
                    .map(Entry::toRecord)
                    .sorted(Comparator.comparing(JobRecord::createdAt).reversed())
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    public CancellationToken cancellationToken(String jobId) {
        return () -> {
            lock.lock();
            try {
                Entry entry = jobs.get(jobId);
                return entry != null && entry.cancelRequested;
            } finally {
                lock.unlock();
            }
        };
    }

    public JobRecord requestCancel(String jobId) {
        return update(jobId, entry -> {
            if (!entry.status.isActive()) {
                throw new InvalidJobStateException("Job " + jobId + " cannot be canceled in status " + entry.status);
            }
            entry.cancelRequested = true;
            entry.message = "Cancel requested";
        });
    }

    /**
     * Moves a queued job into its initial run.
     */
    public JobRecord beginRun(String jobId) {
        return update(jobId, entry -> {
            if (entry.status != JobStatus.QUEUED) {
                throw new InvalidJobStateException("Job " + jobId + " is not queued: " + entry.status);
            }
            transition(entry, JobStatus.RUNNING);
            entry.phase = JobPhase.AUTHENTICATING;
            entry.progress = 0;
            entry.message = "Connecting to the recognition service";
            entry.startedAt = entry.updatedAt;
        });
    }

    /**
     * Atomically checks that a retry is legal and claims the job for it, so two retries can never run at once.
     */
    public JobRecord beginRetry(String jobId) {
        return update(jobId, entry -> {
            if (entry.status.isActive()) {
                throw new InvalidJobStateException("Job " + jobId + " is still " + entry.status.name().toLowerCase());
            }
            if (!entry.status.isRetryable() || entry.failedPages.isEmpty()) {
                throw new InvalidJobStateException("Job " + jobId + " has no failed pages to retry");
            }
            transition(entry, JobStatus.RUNNING);
            entry.phase = JobPhase.RETRYING;
            entry.cancelRequested = false;
            entry.progress = 0;
            entry.retryTotal = entry.failedPages.size();
            entry.retryDone = 0;
            entry.lastError = null;
            entry.endedAt = null;
            entry.startedAt = entry.updatedAt;
            entry.message = "Retrying " + entry.failedPages.size() + " failed page(s)";
        });
    }

    public JobRecord enterPhase(String jobId, JobPhase phase, int progress, String message) {
        return update(jobId, entry -> {
            requireRunning(entry);
            entry.phase = phase;
            advanceProgress(entry, progress);
            entry.message = message;
        });
    }

    public JobRecord startConversion(String jobId, int pagesTotal) {
        return update(jobId, entry -> {
            requireRunning(entry);
            if (pagesTotal < 0) {
                throw new IllegalArgumentException("pagesTotal must not be negative");
            }
            entry.pagesTotal = pagesTotal;
            entry.convertDone = 0;
            entry.pagesDone = 0;
        });
    }

    public JobRecord recordConversion(String jobId, int convertDone, int progress, String message) {
        return update(jobId, entry -> {
            requireRunning(entry);
            if (convertDone > entry.pagesTotal) {
                throw new IllegalArgumentException("convertDone exceeds pagesTotal");
            }
            entry.convertDone = convertDone;
            advanceProgress(entry, progress);
            entry.message = message;
        });
    }

    /**
     * Fixes the rendered page images. They are written once and later reused by retries.
     */
    public JobRecord recordImages(String jobId, List<String> imagePaths) {
        return update(jobId, entry -> {
            requireRunning(entry);
            if (!entry.imagePaths.isEmpty()) {
                throw new IllegalStateException("Page images of job " + jobId + " are already fixed");
            }
            entry.imagePaths = List.copyOf(imagePaths);
        });
    }

    public JobRecord recordPage(String jobId, int pagesDone, int rowsTotal, int progress, String message) {
        return update(jobId, entry -> {
            requireRunning(entry);
            if (pagesDone > entry.pagesTotal) {
                throw new IllegalArgumentException("pagesDone exceeds pagesTotal");
            }
            entry.pagesDone = pagesDone;
            entry.rowsTotal = rowsTotal;
            advanceProgress(entry, progress);
            entry.message = message;
        });
    }

    public JobRecord recordRetry(String jobId, int retryDone, int progress, String message) {
        return update(jobId, entry -> {
            requireRunning(entry);
            if (retryDone > entry.retryTotal) {
                throw new IllegalArgumentException("retryDone exceeds retryTotal");
            }
            entry.retryDone = retryDone;
            advanceProgress(entry, progress);
            entry.message = message;
        });
    }

    /**
     * Ends the current run. Completed runs report 100%; failed and canceled runs keep the progress they reached.
     */
    public JobRecord finish(String jobId, JobStatus terminal, Collection<Integer> failedPages, int rowsTotal,
                            String message, String lastError) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        return update(jobId, entry -> {
            transition(entry, terminal);
            entry.phase = JobPhase.terminalFor(terminal);
            entry.failedPages = new TreeSet<>(failedPages).stream().toList();
            entry.rowsTotal = rowsTotal;
            if (terminal == JobStatus.COMPLETED || terminal == JobStatus.COMPLETED_WITH_ERRORS) {
                entry.progress = 100;
            }
            entry.message = message;
            entry.lastError = lastError;
            entry.endedAt = entry.updatedAt;
        });
    }

    private JobRecord update(String jobId, Consumer<Entry> change) {
        JobRecord snapshot;
        lock.lock();
        try {
            Entry entry = jobs.get(jobId);
            if (entry == null) {
                throw new JobNotFoundException(jobId);
            }
            Entry draft = entry.copy();
            draft.updatedAt = now();
            change.accept(draft);
            draft.version = entry.version + 1;
            jobs.put(jobId, draft);
            snapshot = draft.toRecord();
        } finally {
            lock.unlock();
        }
        persist(snapshot);
        return snapshot;
    }

    private void persist(JobRecord snapshot) {
        try {
            repository.save(snapshot);
        } catch (DataAccessException e) {
            log.warn("Failed to persist snapshot of job {} (version {}): {}", snapshot.id(), snapshot.version(), e.getMessage());
        }
    }

    private static void transition(Entry entry, JobStatus next) {
        if (!entry.status.canTransitionTo(next)) {
            throw new InvalidJobStateException("Illegal transition " + entry.status + " -> " + next + " for job " + entry.id);
        }
        entry.status = next;
    }

    private static void requireRunning(Entry entry) {
        if (entry.status != JobStatus.RUNNING) {
            throw new InvalidJobStateException("Job " + entry.id + " is not running: " + entry.status);
        }
    }

    private static void advanceProgress(Entry entry, int progress) {
        entry.progress = Math.max(entry.progress, Math.min(100, Math.max(0, progress)));
    }

    private static OffsetDateTime now() {
        return OffsetDateTime.now(ZoneOffset.UTC);
    }

    private static final class Entry {
        private final String id;
        private final JobOptions options;
        private final String resultLocation;
        private final OffsetDateTime createdAt;
        private JobStatus status = JobStatus.QUEUED;
        private JobPhase phase = JobPhase.QUEUED;
        private int progress;
        private String message = "Job created";
        private int pagesTotal;
        private int convertDone;
        private int pagesDone;
        private int retryTotal;
        private int retryDone;
        private int rowsTotal;
        private List<Integer> failedPages = List.of();
        private List<String> imagePaths = List.of();
        private boolean cancelRequested;
        private String lastError;
        private OffsetDateTime updatedAt;
        private OffsetDateTime startedAt;
        private OffsetDateTime endedAt;
        private long version;

        private Entry(String id, JobOptions options, String resultLocation, OffsetDateTime createdAt) {
            this.id = id;
            this.options = options;
            this.resultLocation = resultLocation;
            this.createdAt = createdAt;
            this.updatedAt = createdAt;
        }

        static Entry from(JobRecord record) {
            Entry entry = new Entry(record.id(), record.options(), record.resultLocation(), record.createdAt());
            entry.status = record.status();
            entry.phase = record.phase();
            entry.progress = record.progress();
            entry.message = record.message();
            entry.pagesTotal = record.pagesTotal();
            entry.convertDone = record.convertDone();
            entry.pagesDone = record.pagesDone();
            entry.retryTotal = record.retryTotal();
            entry.retryDone = record.retryDone();
            entry.rowsTotal = record.rowsTotal();
            entry.failedPages = record.failedPages();
            entry.imagePaths = record.imagePaths();
            entry.cancelRequested = record.cancelRequested();
            entry.lastError = record.lastError();
            entry.updatedAt = record.updatedAt();
            entry.startedAt = record.startedAt();
            entry.endedAt = record.endedAt();
            entry.version = record.version();
            return entry;
        }

        Entry copy() {
            return from(toRecord());
        }

        JobRecord toRecord() {
            return new JobRecord(
                    id,
                    status,
                    phase,
                    progress,
                    message,
                    options,
                    pagesTotal,
                    convertDone,
                    pagesDone,
                    retryTotal,
                    retryDone,
                    rowsTotal,
                    failedPages,
                    imagePaths,
                    resultLocation,
                    cancelRequested,
                    lastError,
                    createdAt,
                    updatedAt,
                    startedAt,
                    endedAt,
                    version
            );
        }
    }
}
