package com.kmg.lineocr.api;

import com.kmg.lineocr.dto.*;
import com.kmg.lineocr.service.JobService;
import jakarta.validation.Valid;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;

@RestController
@RequestMapping("/api/jobs")
public class JobController {
    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final JobService jobService;

    public JobController(JobService jobService) {
        this.jobService = jobService;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public CreateJobResponse createJob(
            @RequestParam(name = "input_mode", required = false) String inputMode,
            @RequestParam(name = "pdf_file", required = false) MultipartFile pdfFile,
            @RequestParam(name = "image_files", required = false) List<MultipartFile> imageFiles,
            @RequestParam(name = "api_key", required = false) String apiKey,
            @RequestParam(name = "secret_key", required = false) String secretKey,
            @RequestParam(name = "layout", required = false) String layout,
            @RequestParam(name = "language_type", required = false) String languageType,
            @RequestParam(name = "dpi", required = false) Integer dpi
    ) {
        JobSubmission submission = new JobSubmission(inputMode, apiKey, secretKey, layout, languageType, dpi);
        return new CreateJobResponse(jobService.startUpload(submission, pdfFile, imageFiles));
    }

    @PostMapping(path = "/local", consumes = MediaType.APPLICATION_JSON_VALUE)
    public CreateJobResponse createLocalJob(@Valid @RequestBody LocalJobRequest request) {
        return new CreateJobResponse(jobService.startLocal(request.toSubmission(), request.path()));
    }

    @GetMapping
    public List<JobStatusView> listJobs() {
        return jobService.listJobs();
    }

    @GetMapping("/{id}")
    public JobStatusView getJob(@PathVariable String id) {
        return jobService.getJob(id);
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<Void> cancel(@PathVariable String id) {
        jobService.cancelJob(id);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{id}/retry")
    public CreateJobResponse retry(@PathVariable String id, @RequestBody(required = false) RetryJobRequest request) {
        return new CreateJobResponse(jobService.retryJob(id, request));
    }

    @GetMapping("/{id}/download")
    public ResponseEntity<Resource> download(@PathVariable String id) {
        JobService.ResultDownload download = jobService.download(id);
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(download.fileName(), StandardCharsets.UTF_8)
                .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .contentType(TEXT_CSV)
                .body(new FileSystemResource(download.file()));
    }
}
