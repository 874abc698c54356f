package com.kmg.lineocr.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.lineocr.config.LineOcrProperties;
import com.kmg.lineocr.dto.JobStatusView;
import com.kmg.lineocr.dto.JobSubmission;
import com.kmg.lineocr.dto.RetryJobRequest;
import com.kmg.lineocr.model.*;
import com.kmg.lineocr.repo.JobRepository;
import com.kmg.lineocr.repo.ResultCsvStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.*;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Control surface for jobs: start, inspect, cancel, retry and download. Every run is submitted to the job
 * executor; this class only validates input and claims jobs through {@link JobStore}.
 */
@Service
public class JobService {
    private static final Logger log = LoggerFactory.getLogger(JobService.class);
    private static final Pattern UNSAFE_NAME_CHARS = Pattern.compile("[^\\w.\\-]+", Pattern.UNICODE_CHARACTER_CLASS);

    private final JobStore store;
    private final JobRunner jobRunner;
    private final RetryRunner retryRunner;
    private final CredentialResolver credentialResolver;
    private final ResultCsvStore resultStore;
    private final JobRepository jobRepository;
    private final EventService eventService;
    private final LineOcrProperties properties;
    private final RunSettings settings;
    private final ObjectMapper objectMapper;
    private final ExecutorService jobExecutor;

    public JobService(
            JobStore store,
            JobRunner jobRunner,
            RetryRunner retryRunner,
            CredentialResolver credentialResolver,
            ResultCsvStore resultStore,
            JobRepository jobRepository,
            EventService eventService,
            LineOcrProperties properties,
            RunSettings settings,
            ObjectMapper objectMapper,
            @Qualifier("jobExecutor") ExecutorService jobExecutor
    ) {
        this.store = store;
        this.jobRunner = jobRunner;
        this.retryRunner = retryRunner;
        this.credentialResolver = credentialResolver;
        this.resultStore = resultStore;
        this.jobRepository = jobRepository;
        this.eventService = eventService;
        this.properties = properties;
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.jobExecutor = jobExecutor;
    }

    public String startUpload(JobSubmission submission, MultipartFile pdfFile, List<MultipartFile> imageFiles) {
        InputMode mode = parseInputMode(submission.inputMode());
        RunOptions runOptions = resolveRunOptions(submission);
        List<MultipartFile> uploads = selectUploads(mode, pdfFile, imageFiles);
        RecognizerCredentials credentials = credentialResolver.resolve(submission.apiKey(), submission.secretKey());

        String jobId = UUID.randomUUID().toString();
        Path source = storeUploads(mode, uploads, settings.runsDir().resolve(jobId).resolve("input"));
        String outputName = outputName(mode, mode == InputMode.PDF ? safeFileName(pdfFile.getOriginalFilename(), "document.pdf") : null);
        JobOptions options = new JobOptions(mode, source.toString(), runOptions.layout(), runOptions.languageHint(),
                runOptions.dpi(), outputName);
        return launch(jobId, options, credentials);
    }

    public String startLocal(JobSubmission submission, String path) {
        InputMode mode = parseInputMode(submission.inputMode());
        RunOptions runOptions = resolveRunOptions(submission);
        Path source = resolveLocalSource(mode, path);
        RecognizerCredentials credentials = credentialResolver.resolve(submission.apiKey(), submission.secretKey());

        String jobId = UUID.randomUUID().toString();
        String outputName = outputName(mode, mode == InputMode.PDF ? source.getFileName().toString() : null);
        JobOptions options = new JobOptions(mode, source.toString(), runOptions.layout(), runOptions.languageHint(),
                runOptions.dpi(), outputName);
        return launch(jobId, options, credentials);
    }

    public JobStatusView getJob(String jobId) {
        return toView(store.get(jobId));
    }

    public List<JobStatusView> listJobs() {
        return store.list().stream()
                .map(this::toView)
                .toList();
    }

    public void cancelJob(String jobId) {
        store.requestCancel(jobId);
        log.info("Job {} cancel requested", jobId);
    }

    public String retryJob(String jobId, RetryJobRequest request) {
        JobRecord job = store.get(jobId);
        if (job.status().isActive()) {
            throw new InvalidJobStateException("Job " + jobId + " is still " + job.status().name().toLowerCase(Locale.ROOT));
        }
        if (!job.canRetry()) {
            throw new InvalidJobStateException("Job " + jobId + " has no failed pages to retry");
        }
        String requestedLayout = request == null ? null : request.layout();
        LayoutMode layout = requestedLayout == null || requestedLayout.isBlank() ? null : parseLayout(requestedLayout);
        RecognizerCredentials credentials = request == null
                ? credentialResolver.resolve(null, null)
                : credentialResolver.resolve(request.apiKey(), request.secretKey());

        JobRecord claimed = store.beginRetry(jobId);
        List<Integer> pages = claimed.failedPages();
        int rowsTotal = claimed.rowsTotal();
        OffsetDateTime claimedAt = claimed.startedAt();
        log.info("Job {} retry launched for {} page(s)", jobId, pages.size());
        eventService.publish(EventService.RETRY_STARTED, jobId, "Retry started", Map.of("failedPages", pages));

        submit(jobId, "retry",
                () -> retryRunner.run(jobId, credentials, layout),
                current -> current.phase() == JobPhase.RETRYING && Objects.equals(current.startedAt(), claimedAt),
                () -> store.finish(jobId, JobStatus.FAILED, pages, rowsTotal, "Could not schedule retry", "Job executor rejected the retry"));
        return jobId;
    }

    public ResultDownload download(String jobId) {
        JobRecord job = store.get(jobId);
        if (!job.status().isTerminal()) {
            throw new InvalidJobStateException("Job " + jobId + " has not finished yet");
        }
        Path file = Path.of(job.resultLocation());
        if (!Files.isRegularFile(file)) {
            throw new InvalidJobStateException("Job " + jobId + " produced no result rows");
        }
        return new ResultDownload(file, job.options().outputName());
    }

    /**
     * Loads every persisted job. Runs that were active when the process stopped are marked failed; pages of an
     * interrupted recognizing run that never reached the result file become its failed pages.
     */
    public void recoverAfterRestart() {
        List<JobRecord> jobs = jobRepository.findAll();
        store.load(jobs);
        int interrupted = 0;
        for (JobRecord job : jobs) {
            if (!job.status().isActive()) {
                continue;
            }
            Interruption interruption = interruption(job);
            store.finish(job.id(), JobStatus.FAILED, interruption.failedPages(), interruption.rowsTotal(),
                    "Application restarted", "Application restarted before the run finished");
            interrupted++;
        }
        log.info("Loaded {} job(s); {} interrupted run(s) marked failed", jobs.size(), interrupted);
    }

    private String launch(String jobId, JobOptions options, RecognizerCredentials credentials) {
        Path resultPath = settings.runsDir().resolve(jobId).resolve(jobId + "_ocr.csv");
        store.create(jobId, options, resultPath.toString());
        log.info("Job {} created: {} {}", jobId, options.inputMode().code(), options.sourcePath());
        eventService.publish(EventService.JOB_CREATED, jobId, "Job created", Map.of("jobId", jobId));

        submit(jobId, "initial",
                () -> jobRunner.run(jobId, credentials),
                current -> current.phase() != JobPhase.RETRYING,
                () -> store.finish(jobId, JobStatus.FAILED, List.of(), 0, "Could not schedule job", "Job executor rejected the job"));
        return jobId;
    }

    private void submit(String jobId, String runType, Supplier<JobRecord> run, Predicate<JobRecord> ownsRun,
                        Runnable onRejected) {
        try {
            jobExecutor.submit(() -> execute(jobId, runType, run, ownsRun));
        } catch (RejectedExecutionException e) {
            log.error("Job {} could not be scheduled: {}", jobId, e.getMessage());
            onRejected.run();
            throw new InvalidJobStateException("Job executor is not accepting work");
        }
    }

    /**
     * Runs one claimed run and reports how it ended. A run that returns a terminal snapshot is done; otherwise
     * the job is failed only while {@code ownsRun} still matches, so a retry claimed after this run finished is
     * left to its own runner.
     */
    private void execute(String jobId, String runType, Supplier<JobRecord> run, Predicate<JobRecord> ownsRun) {
        OffsetDateTime startedAt = OffsetDateTime.now(ZoneOffset.UTC);
        JobRecord result = null;
        try {
            result = run.get();
        } catch (RuntimeException e) {
            log.error("{} run of job {} ended with an unexpected error: {}", runType, jobId, e.getMessage(), e);
        } finally {
            JobRecord end = result != null && result.status().isTerminal()
                    ? result
                    : reconcileRunningJobIfNeeded(jobId, ownsRun);
            writeReport(end, runType, startedAt);
            eventService.publish(EventService.JOB_FINISHED, jobId, end.message(), Map.of(
                    "status", lower(end.status()),
                    "rowsTotal", end.rowsTotal(),
                    "failedPages", end.failedPages()
            ));
        }
    }

    private JobRecord reconcileRunningJobIfNeeded(String jobId, Predicate<JobRecord> ownsRun) {
        JobRecord current = store.get(jobId);
        if (current.status() != JobStatus.RUNNING) {
            return current;
        }
        if (!ownsRun.test(current)) {
            log.info("Job {} was claimed by a newer run; leaving it running", jobId);
            return current;
        }
        log.warn("Job {} was left running after its run ended; marking it failed", jobId);
        Interruption interruption = interruption(current);
        String error = current.lastError() != null ? current.lastError() : "Run ended unexpectedly";
        return store.finish(jobId, JobStatus.FAILED, interruption.failedPages(), interruption.rowsTotal(),
                "Run ended unexpectedly", error);
    }

    /**
     * What survives of a run that stopped without reaching a terminal status. A recognizing run keeps only the
     * pages already flushed to the result file; a retry run keeps its original failed pages.
     */
    private Interruption interruption(JobRecord job) {
        List<ResultRow> persisted;
        try {
            persisted = resultStore.read(Path.of(job.resultLocation()));
        } catch (UncheckedIOException e) {
            log.warn("Job {} result file is unreadable: {}", job.id(), e.getMessage());
            persisted = List.of();
        }
        if (job.status() == JobStatus.RUNNING && job.phase() == JobPhase.RECOGNIZING) {
            // The result file is the only record of finished pages, so a blank page with no rows is retried too.
            Set<Integer> persistedPages = persisted.stream().map(ResultRow::pageNo).collect(Collectors.toSet());
            List<Integer> failed = new ArrayList<>();
            for (int page = 1; page <= job.pagesTotal(); page++) {
                if (!persistedPages.contains(page)) {
                    failed.add(page);
                }
            }
            return new Interruption(failed, persisted.size());
        }
        if (job.status() == JobStatus.RUNNING && job.phase() == JobPhase.RETRYING) {
            return new Interruption(job.failedPages(), persisted.size());
        }
        return new Interruption(List.of(), persisted.size());
    }

    private JobStatusView toView(JobRecord job) {
        JobOptions options = job.options();
        return new JobStatusView(
                job.id(),
                lower(job.status()),
                job.phase().name().toLowerCase(Locale.ROOT),
                job.progress(),
                job.message(),
                options.inputMode().code(),
                options.layout().code(),
                options.outputName(),
                job.pagesTotal(),
                job.convertDone(),
                job.pagesDone(),
                job.retryTotal(),
                job.retryDone(),
                job.rowsTotal(),
                job.failedPages().size(),
                job.failedPages(),
                job.canCancel(),
                job.canRetry(),
                isDownloadAvailable(job),
                job.lastError(),
                toText(job.createdAt()),
                toText(job.updatedAt()),
                toText(job.startedAt()),
                toText(job.endedAt())
        );
    }

    private boolean isDownloadAvailable(JobRecord job) {
        return job.status().isTerminal()
                && job.resultLocation() != null
                && Files.isRegularFile(Path.of(job.resultLocation()));
    }

    private RunOptions resolveRunOptions(JobSubmission submission) {
        LayoutMode layout = parseLayout(submission.layout());
        LineOcrProperties.Render render = properties.getRender();
        int dpi = submission.dpi() == null ? render.getDefaultDpi() : submission.dpi();
        if (dpi < render.getMinDpi() || dpi > render.getMaxDpi()) {
            throw new InvalidJobInputException("dpi must be between " + render.getMinDpi() + " and " + render.getMaxDpi() + ": " + dpi);
        }
        String languageHint = submission.languageHint() == null || submission.languageHint().isBlank()
                ? properties.getRecognizer().getDefaultLanguage()
                : submission.languageHint().strip();
        return new RunOptions(layout, languageHint, dpi);
    }

    private static InputMode parseInputMode(String value) {
        try {
            return InputMode.fromCode(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidJobInputException(e.getMessage(), e);
        }
    }

    private static LayoutMode parseLayout(String value) {
        try {
            return LayoutMode.fromCode(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidJobInputException("layout must be auto, horizontal or vertical-rtl: " + value, e);
        }
    }

    private static List<MultipartFile> selectUploads(InputMode mode, MultipartFile pdfFile, List<MultipartFile> imageFiles) {
        if (mode == InputMode.PDF) {
            if (pdfFile == null || pdfFile.isEmpty()) {
                throw new InvalidJobInputException("pdf_file is required for input_mode=pdf");
            }
            if (!isPdfName(safeFileName(pdfFile.getOriginalFilename(), ""))) {
                throw new InvalidJobInputException("pdf_file must be a PDF document");
            }
            return List.of(pdfFile);
        }

        List<MultipartFile> images = imageFiles == null ? List.of() : imageFiles.stream()
                .filter(file -> file != null && !file.isEmpty())
                .filter(file -> PageRenderService.isSupportedImage(Path.of(safeFileName(file.getOriginalFilename(), "upload"))))
                .toList();
        if (images.isEmpty()) {
            throw new InvalidJobInputException("image_files must contain at least one supported image ("
                    + String.join(", ", new TreeSet<>(PageRenderService.SUPPORTED_IMAGES)) + ")");
        }
        return images;
    }

    private static Path resolveLocalSource(InputMode mode, String path) {
        if (path == null || path.isBlank()) {
            throw new InvalidJobInputException("path is required");
        }
        Path source;
        try {
            source = Path.of(path.strip()).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new InvalidJobInputException("Invalid path: " + path, e);
        }

        if (mode == InputMode.PDF) {
            if (!Files.isRegularFile(source)) {
                throw new InvalidJobInputException("PDF not found: " + source);
            }
            if (!isPdfName(source.getFileName().toString())) {
                throw new InvalidJobInputException("Not a PDF document: " + source);
            }
            return source;
        }
        if (!Files.isDirectory(source)) {
            throw new InvalidJobInputException("Image folder not found: " + source);
        }
        if (PageRenderService.listSupportedImages(source).isEmpty()) {
            throw new InvalidJobInputException("Image folder has no supported images: " + source);
        }
        return source;
    }

    /**
     * Writes the uploads into the job's input directory and returns the job source: the PDF file, or the
     * directory holding the images.
     */
    private static Path storeUploads(InputMode mode, List<MultipartFile> uploads, Path inputDir) {
        try {
            Files.createDirectories(inputDir);
            if (mode == InputMode.PDF) {
                Path target = inputDir.resolve(safeFileName(uploads.get(0).getOriginalFilename(), "document.pdf"));
                uploads.get(0).transferTo(target);
                return target;
            }
            Set<String> used = new HashSet<>();
            for (MultipartFile upload : uploads) {
                String name = uniqueName(safeFileName(upload.getOriginalFilename(), "image.png"), used);
                upload.transferTo(inputDir.resolve(name));
            }
            return inputDir;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store uploaded files in " + inputDir, e);
        }
    }

    static String safeFileName(String originalName, String fallback) {
        if (originalName == null) {
            return fallback;
        }
        String name = originalName;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        name = UNSAFE_NAME_CHARS.matcher(name.strip()).replaceAll("_");
        if (name.isBlank() || name.chars().allMatch(ch -> ch == '.')) {
            return fallback;
        }
        return name;
    }

    private static String uniqueName(String name, Set<String> used) {
        if (used.add(name.toLowerCase(Locale.ROOT))) {
            return name;
        }
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String ext = dot > 0 ? name.substring(dot) : "";
        int n = 2;
        String candidate;
        do {
            candidate = base + "_" + n++ + ext;
        } while (!used.add(candidate.toLowerCase(Locale.ROOT)));
        return candidate;
    }

    static String outputName(InputMode mode, String pdfName) {
        if (mode == InputMode.IMAGES || pdfName == null) {
            return "images_ocr.csv";
        }
        int dot = pdfName.lastIndexOf('.');
        String stem = dot > 0 ? pdfName.substring(0, dot) : pdfName;
        return stem + "_ocr.csv";
    }

    private static boolean isPdfName(String name) {
        return name.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private void writeReport(JobRecord job, String runType, OffsetDateTime startedAt) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("jobId", job.id());
        report.put("run", runType);
        report.put("status", lower(job.status()));
        report.put("inputMode", job.options().inputMode().code());
        report.put("source", job.options().sourcePath());
        report.put("layout", job.options().layout().code());
        report.put("pagesTotal", job.pagesTotal());
        report.put("pagesDone", job.pagesDone());
        report.put("retryTotal", job.retryTotal());
        report.put("retryDone", job.retryDone());
        report.put("rowsTotal", job.rowsTotal());
        report.put("failedPages", job.failedPages());
        report.put("message", job.message());
        report.put("lastError", job.lastError());
        report.put("resultLocation", job.resultLocation());
        report.put("startedAt", startedAt.toString());
        report.put("endedAt", OffsetDateTime.now(ZoneOffset.UTC).toString());
        try {
            Path reportDir = Path.of(properties.getOutput().getReportDir());
            Files.createDirectories(reportDir);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(reportDir.resolve(job.id() + ".json").toFile(), report);
        } catch (IOException e) {
            log.warn("Failed to write report for {}: {}", job.id(), e.getMessage());
        }
    }

    private static String lower(JobStatus status) {
        return status.name().toLowerCase(Locale.ROOT);
    }

    private static String toText(Object value) {
        return value == null ? null : value.toString();
    }

    public record ResultDownload(Path file, String fileName) {
    }

    private record RunOptions(LayoutMode layout, String languageHint, int dpi) {
    }

    private record Interruption(List<Integer> failedPages, int rowsTotal) {
    }
}
