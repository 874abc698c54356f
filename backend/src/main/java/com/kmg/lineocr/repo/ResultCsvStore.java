package com.kmg.lineocr.repo;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.kmg.lineocr.model.ResultRow;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * The persisted result set of a job: a UTF-8 (with BOM) CSV table. Every write replaces the whole file
 * through a temporary sibling so readers never observe a half-written table.
 */
@Repository
public class ResultCsvStore {
    private static final char BOM = '\uFEFF';

    private final ObjectWriter writer;
    private final ObjectReader reader;

    public ResultCsvStore() {
        CsvMapper mapper = new CsvMapper();
        CsvSchema schema = mapper.schemaFor(ResultRow.class)
                .withHeader()
                .withLineSeparator("\r\n");
        this.writer = mapper.writerFor(ResultRow.class).with(schema);
        this.reader = mapper.readerFor(ResultRow.class).with(schema);
    }

    public void write(Path target, List<ResultRow> rows) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
            try {
                try (Writer out = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                    out.write(BOM);
                    writer.writeValues(out).writeAll(rows).close();
                }
                moveIntoPlace(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write result set: " + target, e);
        }
    }

    public List<ResultRow> read(Path target) {
        if (!Files.exists(target)) {
            return List.of();
        }
        try {
            String content = Files.readString(target, StandardCharsets.UTF_8);
            if (!content.isEmpty() && content.charAt(0) == BOM) {
                content = content.substring(1);
            }
            if (content.isBlank()) {
                return List.of();
            }
            try (MappingIterator<ResultRow> rows = reader.readValues(content)) {
                return rows.readAll();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read result set: " + target, e);
        }
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
