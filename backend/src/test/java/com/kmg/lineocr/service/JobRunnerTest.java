package com.kmg.lineocr.service;

import com.kmg.lineocr.layout.LayoutClassifier;
import com.kmg.lineocr.layout.LayoutThresholds;
import com.kmg.lineocr.layout.LineSorter;
import com.kmg.lineocr.model.*;
import com.kmg.lineocr.repo.JobRepository;
import com.kmg.lineocr.repo.ResultCsvStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class JobRunnerTest {
    private static final RecognizerCredentials CREDENTIALS = new RecognizerCredentials("ak", "sk", null);

    @TempDir
    Path tempDir;

    private JobRepository repository;
    private JobStore store;
    private ResultCsvStore resultStore;
    private ScriptedTextRecognizer recognizer;

    @BeforeEach
    void setUp() {
        repository = mock(JobRepository.class);
        store = new JobStore(repository);
        resultStore = new ResultCsvStore();
        recognizer = new ScriptedTextRecognizer();
    }

    @Test
    void recognizesEveryPageInOrder() {
        String jobId = createJob("job-ok");

        JobRecord done = runner(new FakePageRenderer(3), 10).run(jobId, CREDENTIALS);

        assertEquals(JobStatus.COMPLETED, done.status());
        assertEquals(JobPhase.COMPLETED, done.phase());
        assertEquals(100, done.progress());
        assertEquals(3, done.pagesTotal());
        assertEquals(3, done.convertDone());
        assertEquals(3, done.pagesDone());
        assertEquals(6, done.rowsTotal());
        assertTrue(done.failedPages().isEmpty());
        assertEquals(3, done.imagePaths().size());
        assertFalse(done.canRetry());

        List<ResultRow> rows = resultStore.read(resultPath(jobId));
        assertEquals(6, rows.size());
        ResultRow first = rows.get(0);
        assertEquals("page_1.png", first.sourceImage());
        assertEquals(1, first.pageNo());
        assertEquals(1, first.lineNo());
        assertEquals("p1-a", first.text());
        assertEquals(LayoutMode.HORIZONTAL, first.layout());
        assertEquals("0.9900", first.confidence());
        assertEquals("p1-b", rows.get(1).text());
        assertEquals(2, rows.get(1).lineNo());
        assertEquals("p3-b", rows.get(5).text());
    }

    @Test
    void failedPagesAreRecordedAndTheLoopContinues() {
        recognizer.failOn(2, 4);
        String jobId = createJob("job-partial");

        JobRecord done = runner(new FakePageRenderer(5), 10).run(jobId, CREDENTIALS);

        assertEquals(JobStatus.COMPLETED_WITH_ERRORS, done.status());
        assertEquals(List.of(2, 4), done.failedPages());
        assertEquals(5, done.pagesDone());
        assertEquals(done.pagesTotal(), done.pagesDone());
        assertEquals(List.of(1, 2, 3, 4, 5), recognizer.recognizedPages());
        assertEquals(6, done.rowsTotal());
        assertTrue(done.canRetry());

        long succeededPages = resultStore.read(resultPath(jobId)).stream().map(ResultRow::pageNo).distinct().count();
        assertEquals(done.pagesTotal(), done.failedPages().size() + succeededPages);
    }

    @Test
    void authenticationFailureEndsTheJobBeforeAnyPageWork() {
        recognizer.failAuthentication();
        String jobId = createJob("job-auth");

        JobRecord done = runner(new FakePageRenderer(3), 10).run(jobId, CREDENTIALS);

        assertEquals(JobStatus.FAILED, done.status());
        assertEquals(0, done.pagesDone());
        assertEquals(0, done.rowsTotal());
        assertTrue(done.failedPages().isEmpty());
        assertFalse(done.canRetry());
        assertNotNull(done.lastError());
        assertTrue(recognizer.recognizedPages().isEmpty());
        assertFalse(Files.exists(resultPath(jobId)));
    }

    @Test
    void conversionFailureEndsTheJobBeforeRecognition() {
        String jobId = createJob("job-convert");

        JobRecord done = runner(new FakePageRenderer(4, 3), 10).run(jobId, CREDENTIALS);

        assertEquals(JobStatus.FAILED, done.status());
        assertEquals(2, done.convertDone());
        assertEquals(0, done.pagesDone());
        assertTrue(done.failedPages().isEmpty());
        assertTrue(done.imagePaths().isEmpty());
        assertTrue(recognizer.recognizedPages().isEmpty());
        assertTrue(done.message().contains("corrupt page 3"));
    }

    @Test
    void cancelDuringRecognitionKeepsRowsOfFinishedPages() {
        String jobId = createJob("job-cancel");
        recognizer.afterPage(page -> {
            if (page == 2) {
                store.requestCancel(jobId);
            }
        });

        JobRecord done = runner(new FakePageRenderer(6), 10).run(jobId, CREDENTIALS);

        assertEquals(JobStatus.CANCELED, done.status());
        assertEquals(2, done.pagesDone());
        assertEquals(4, done.rowsTotal());
        assertEquals(List.of(3, 4, 5, 6), done.failedPages());
        assertTrue(done.canRetry());
        assertTrue(done.progress() < 100);
        assertEquals(List.of(1, 2), recognizer.recognizedPages());

        List<ResultRow> rows = resultStore.read(resultPath(jobId));
        assertEquals(List.of(1, 1, 2, 2), rows.stream().map(ResultRow::pageNo).toList());
    }

    @Test
    void cancelBeforeStartNeverTouchesPages() {
        String jobId = createJob("job-cancel-early");
        store.requestCancel(jobId);

        JobRecord done = runner(new FakePageRenderer(3), 10).run(jobId, CREDENTIALS);

        assertEquals(JobStatus.CANCELED, done.status());
        assertEquals(0, done.pagesTotal());
        assertTrue(done.failedPages().isEmpty());
        assertFalse(Files.exists(resultPath(jobId)));
    }

    @Test
    void partialResultsAreFlushedWhileRecognizing() {
        String jobId = createJob("job-flush");
        List<Integer> rowsSeenAtPageThree = new ArrayList<>();
        recognizer.afterPage(page -> {
            if (page == 3) {
                rowsSeenAtPageThree.add(resultStore.read(resultPath(jobId)).size());
            }
        });

        runner(new FakePageRenderer(5), 2).run(jobId, CREDENTIALS);

        assertEquals(List.of(4), rowsSeenAtPageThree);
    }

    @Test
    void failedFinalWriteReportsTheRowsOfTheLastFlush() {
        resultStore = spy(new ResultCsvStore());
        doCallRealMethod()
                .doThrow(new UncheckedIOException("disk full", new IOException("disk full")))
                .when(resultStore).write(any(), any());
        String jobId = createJob("job-disk-full");

        JobRecord done = runner(new FakePageRenderer(3), 2).run(jobId, CREDENTIALS);

        assertEquals(JobStatus.FAILED, done.status());
        assertEquals(List.of(3), done.failedPages());
        assertEquals(4, done.rowsTotal());
        assertEquals(done.rowsTotal(), resultStore.read(resultPath(jobId)).size());
        assertTrue(done.canRetry());
    }

    @Test
    void progressNeverDecreasesAndCountersStayBounded() {
        recognizer.failOn(2);
        String jobId = createJob("job-progress");

        runner(new FakePageRenderer(4), 10).run(jobId, CREDENTIALS);

        ArgumentCaptor<JobRecord> saved = ArgumentCaptor.forClass(JobRecord.class);
        verify(repository, atLeastOnce()).save(saved.capture());
        int previous = 0;
        long previousVersion = -1;
        for (JobRecord snapshot : saved.getAllValues()) {
            assertTrue(snapshot.progress() >= previous, "progress went back to " + snapshot.progress());
            assertTrue(snapshot.version() > previousVersion);
            assertTrue(snapshot.pagesDone() <= snapshot.pagesTotal());
            previous = snapshot.progress();
            previousVersion = snapshot.version();
        }
        assertEquals(100, previous);
    }

    @Test
    void onlyQueuedJobsCanBeRun() {
        String jobId = createJob("job-twice");
        JobRunner runner = runner(new FakePageRenderer(1), 10);
        runner.run(jobId, CREDENTIALS);

        assertThrows(InvalidJobStateException.class, () -> runner.run(jobId, CREDENTIALS));
    }

    private JobRunner runner(PageRenderer renderer, int flushEveryPages) {
        PageRecognizer pageRecognizer = new PageRecognizer(
                recognizer,
                new LayoutClassifier(LayoutThresholds.defaults()),
                new LineSorter(LayoutThresholds.defaults())
        );
        return new JobRunner(store, renderer, pageRecognizer, resultStore, new EventService(),
                new RunSettings(tempDir, flushEveryPages, Duration.ZERO));
    }

    private String createJob(String jobId) {
        JobOptions options = new JobOptions(InputMode.PDF, tempDir.resolve("doc.pdf").toString(), LayoutMode.AUTO,
                "CHN_ENG", 300, "doc_ocr.csv");
        store.create(jobId, options, resultPath(jobId).toString());
        return jobId;
    }

    private Path resultPath(String jobId) {
        return tempDir.resolve(jobId).resolve(jobId + "_ocr.csv");
    }
}
