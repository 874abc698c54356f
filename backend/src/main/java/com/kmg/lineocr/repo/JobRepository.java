package com.kmg.lineocr.repo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.lineocr.model.*;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Durable mirror of job snapshots. The in-memory {@code JobStore} is authoritative while the process runs;
 * this table lets status, download and retry survive a restart.
 */
@Repository
public class JobRepository {
    private static final TypeReference<List<Integer>> INT_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<JobRecord> jobMapper;

    public JobRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.jobMapper = this::mapJob;
    }

    public void initializeSchema() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS jobs (
              id TEXT PRIMARY KEY,
              status TEXT NOT NULL,
              phase TEXT NOT NULL,
              progress INTEGER NOT NULL DEFAULT 0,
              message TEXT,
              input_mode TEXT NOT NULL,
              source_path TEXT NOT NULL,
              layout TEXT NOT NULL,
              language_hint TEXT NOT NULL,
              dpi INTEGER NOT NULL,
              output_name TEXT NOT NULL,
              pages_total INTEGER NOT NULL DEFAULT 0,
              convert_done INTEGER NOT NULL DEFAULT 0,
              pages_done INTEGER NOT NULL DEFAULT 0,
              retry_total INTEGER NOT NULL DEFAULT 0,
              retry_done INTEGER NOT NULL DEFAULT 0,
              rows_total INTEGER NOT NULL DEFAULT 0,
              failed_pages_json TEXT NOT NULL DEFAULT '[]',
              image_paths_json TEXT NOT NULL DEFAULT '[]',
              result_location TEXT,
              cancel_requested INTEGER NOT NULL DEFAULT 0,
              last_error TEXT,
              created_at TEXT NOT NULL,
              updated_at TEXT NOT NULL,
              started_at TEXT,
              ended_at TEXT,
              version INTEGER NOT NULL DEFAULT 0
            )
            """);
    }

    /**
     * Inserts or replaces the stored snapshot unless a newer version is already stored.
     */
    public void save(JobRecord job) {
        JobOptions options = job.options();
        jdbcTemplate.update(
                """
                INSERT INTO jobs(id, status, phase, progress, message, input_mode, source_path, layout, language_hint,
                                 dpi, output_name, pages_total, convert_done, pages_done, retry_total, retry_done,
                                 rows_total, failed_pages_json, image_paths_json, result_location, cancel_requested,
                                 last_error, created_at, updated_at, started_at, ended_at, version)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT(id) DO UPDATE SET
                       status = excluded.status,
                       phase = excluded.phase,
                       progress = excluded.progress,
                       message = excluded.message,
                       pages_total = excluded.pages_total,
                       convert_done = excluded.convert_done,
                       pages_done = excluded.pages_done,
                       retry_total = excluded.retry_total,
                       retry_done = excluded.retry_done,
                       rows_total = excluded.rows_total,
                       failed_pages_json = excluded.failed_pages_json,
                       image_paths_json = excluded.image_paths_json,
                       result_location = excluded.result_location,
                       cancel_requested = excluded.cancel_requested,
                       last_error = excluded.last_error,
                       updated_at = excluded.updated_at,
                       started_at = excluded.started_at,
                       ended_at = excluded.ended_at,
                       version = excluded.version
                 WHERE excluded.version > jobs.version
                """,
                job.id(),
                job.status().name(),
                job.phase().name(),
                job.progress(),
                job.message(),
                options.inputMode().name(),
                options.sourcePath(),
                options.layout().name(),
                options.languageHint(),
                options.dpi(),
                options.outputName(),
                job.pagesTotal(),
                job.convertDone(),
                job.pagesDone(),
                job.retryTotal(),
                job.retryDone(),
                job.rowsTotal(),
                writeJson(job.failedPages()),
                writeJson(job.imagePaths()),
                job.resultLocation(),
                job.cancelRequested() ? 1 : 0,
                job.lastError(),
                SqlTime.toText(job.createdAt()),
                SqlTime.toText(job.updatedAt()),
                SqlTime.toText(job.startedAt()),
                SqlTime.toText(job.endedAt()),
                job.version()
        );
    }

    public Optional<JobRecord> findById(String id) {
        List<JobRecord> rows = jdbcTemplate.query("SELECT * FROM jobs WHERE id = ?", jobMapper, id);
        return rows.stream().findFirst();
    }

    public List<JobRecord> findAll() {
        return jdbcTemplate.query("SELECT * FROM jobs ORDER BY created_at DESC", jobMapper);
    }

    private JobRecord mapJob(ResultSet rs, int rowNum) throws SQLException {
        JobOptions options = new JobOptions(
                InputMode.valueOf(rs.getString("input_mode")),
                rs.getString("source_path"),
                LayoutMode.valueOf(rs.getString("layout")),
                rs.getString("language_hint"),
                rs.getInt("dpi"),
                rs.getString("output_name")
        );
        return new JobRecord(
                rs.getString("id"),
                JobStatus.valueOf(rs.getString("status")),
                JobPhase.valueOf(rs.getString("phase")),
                rs.getInt("progress"),
                rs.getString("message"),
                options,
                rs.getInt("pages_total"),
                rs.getInt("convert_done"),
                rs.getInt("pages_done"),
                rs.getInt("retry_total"),
                rs.getInt("retry_done"),
                rs.getInt("rows_total"),
                readJson(rs.getString("failed_pages_json"), INT_LIST),
                readJson(rs.getString("image_paths_json"), STRING_LIST),
                rs.getString("result_location"),
                rs.getInt("cancel_requested") == 1,
                rs.getString("last_error"),
                SqlTime.parse(rs.getString("created_at")),
                SqlTime.parse(rs.getString("updated_at")),
                SqlTime.parse(rs.getString("started_at")),
                SqlTime.parse(rs.getString("ended_at")),
                rs.getLong("version")
        );
    }

    private String writeJson(List<?> values) {
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize job column", e);
        }
    }

    private <T> List<T> readJson(String json, TypeReference<List<T>> type) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse job column", e);
        }
    }
}
