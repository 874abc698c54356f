package com.kmg.lineocr.repo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.lineocr.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JobRepositoryTest {
    private static final OffsetDateTime CREATED = OffsetDateTime.of(2024, 5, 1, 9, 30, 0, 0, ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private JobRepository repository;

    @BeforeEach
    void setUp() {
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + tempDir.resolve("jobs.db"));
        repository = new JobRepository(new JdbcTemplate(dataSource), new ObjectMapper());
        repository.initializeSchema();
    }

    @Test
    void savedSnapshotIsReadBackUnchanged() {
        JobRecord job = job("a", JobStatus.COMPLETED_WITH_ERRORS, 4, CREATED);

        repository.save(job);

        assertEquals(job, repository.findById("a").orElseThrow());
    }

    @Test
    void olderVersionNeverOverwritesNewer() {
        repository.save(job("a", JobStatus.RUNNING, 1, CREATED));
        repository.save(job("a", JobStatus.COMPLETED_WITH_ERRORS, 3, CREATED));
        repository.save(job("a", JobStatus.RUNNING, 2, CREATED));

        JobRecord stored = repository.findById("a").orElseThrow();
        assertEquals(3, stored.version());
        assertEquals(JobStatus.COMPLETED_WITH_ERRORS, stored.status());
    }

    @Test
    void findAllListsNewestFirst() {
        repository.save(job("old", JobStatus.COMPLETED_WITH_ERRORS, 1, CREATED));
        repository.save(job("new", JobStatus.COMPLETED_WITH_ERRORS, 1, CREATED.plusHours(1)));
        repository.save(job("seconds-later", JobStatus.COMPLETED_WITH_ERRORS, 1, CREATED.plusSeconds(15)));
        repository.save(job("same-second", JobStatus.COMPLETED_WITH_ERRORS, 1, CREATED.plusSeconds(15).plusNanos(100_000_000)));

        assertEquals(List.of("new", "same-second", "seconds-later", "old"), repository.findAll().stream().map(JobRecord::id).toList());
        assertTrue(repository.findById("missing").isEmpty());
    }

    private static JobRecord job(String id, JobStatus status, long version, OffsetDateTime createdAt) {
        JobOptions options = new JobOptions(InputMode.IMAGES, "/data/runs/" + id + "/input", LayoutMode.VERTICAL_RTL,
                "JAP", 200, "images_ocr.csv");
        return new JobRecord(
                id,
                status,
                status == JobStatus.RUNNING ? JobPhase.RECOGNIZING : JobPhase.COMPLETED_WITH_ERRORS,
                60,
                "Recognized page 2/3",
                options,
                3,
                3,
                2,
                0,
                0,
                4,
                List.of(2),
                List.of("/data/runs/" + id + "/images/1.png", "/data/runs/" + id + "/images/2.png", "/data/runs/" + id + "/images/3.png"),
                "/data/runs/" + id + "/" + id + "_ocr.csv",
                false,
                null,
                createdAt,
                createdAt.plusMinutes(2),
                createdAt.plusSeconds(1),
                status == JobStatus.RUNNING ? null : createdAt.plusMinutes(2),
                version
        );
    }
}
