package com.kmg.lineocr.config;

import com.kmg.lineocr.repo.JobRepository;
import com.kmg.lineocr.service.BrowserLauncher;
import com.kmg.lineocr.service.JobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Component
public class StartupInitializer implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StartupInitializer.class);

    private final LineOcrProperties properties;
    private final JdbcTemplate jdbcTemplate;
    private final JobRepository jobRepository;
    private final JobService jobService;
    private final BrowserLauncher browserLauncher;
    private final int serverPort;

    public StartupInitializer(
            LineOcrProperties properties,
            JdbcTemplate jdbcTemplate,
            JobRepository jobRepository,
            JobService jobService,
            BrowserLauncher browserLauncher,
            @Value("${server.port:8787}") int serverPort
    ) {
        this.properties = properties;
        this.jdbcTemplate = jdbcTemplate;
        this.jobRepository = jobRepository;
        this.jobService = jobService;
        this.browserLauncher = browserLauncher;
        this.serverPort = serverPort;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        createDirectories();
        configureSqlitePragmas();
        jobRepository.initializeSchema();
        jobService.recoverAfterRestart();
        log.info("Line OCR ready on port {} using the {} recognizer", serverPort, properties.getRecognizer().getProvider());
        browserLauncher.openIfEnabled(serverPort);
    }

    /**
     * The SQLite file's parent must exist before the first pooled connection is opened.
     */
    private void createDirectories() throws IOException {
        List<Path> dirs = new ArrayList<>(List.of(
                Path.of(properties.getBaseDir()),
                Path.of(properties.getOutput().getRunsDir()),
                Path.of(properties.getOutput().getReportDir()),
                Path.of(properties.getLogs().getDir())
        ));
        Path dbParent = Path.of(properties.getState().getDbPath()).toAbsolutePath().getParent();
        if (dbParent != null) {
            dirs.add(dbParent);
        }
        for (Path dir : dirs) {
            Files.createDirectories(dir);
            log.debug("Ensured directory {}", dir.toAbsolutePath());
        }
    }

    private void configureSqlitePragmas() {
        try {
            jdbcTemplate.queryForObject("PRAGMA journal_mode=WAL", String.class);
            jdbcTemplate.execute("PRAGMA synchronous=NORMAL");
            jdbcTemplate.execute("PRAGMA busy_timeout=30000");
        } catch (DataAccessException e) {
            log.warn("Failed to configure SQLite pragmas: {}", e.getMessage());
        }
    }
}
