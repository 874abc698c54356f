package com.kmg.lineocr.repo;

import com.kmg.lineocr.model.LayoutMode;
import com.kmg.lineocr.model.ResultRow;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ResultCsvStoreTest {
    @TempDir
    Path tempDir;

    private final ResultCsvStore store = new ResultCsvStore();

    @Test
    void writesHeaderAfterByteOrderMark() throws Exception {
        Path file = tempDir.resolve("out").resolve("doc_ocr.csv");

        store.write(file, List.of(new ResultRow("doc_page_0001.png", 1, 1, LayoutMode.VERTICAL_RTL, 5, 6, 7, 8, "0.9876", "縦書き")));

        byte[] bytes = Files.readAllBytes(file);
        assertEquals((byte) 0xEF, bytes[0]);
        assertEquals((byte) 0xBB, bytes[1]);
        assertEquals((byte) 0xBF, bytes[2]);
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals("\uFEFFimage_file,page_no,line_no,layout,left,top,width,height,confidence,text", lines.get(0));
        assertEquals("doc_page_0001.png,1,1,vertical-rtl,5,6,7,8,0.9876,縦書き", lines.get(1));
    }

    @Test
    void readsBackWhatWasWritten() {
        Path file = tempDir.resolve("doc_ocr.csv");
        List<ResultRow> rows = List.of(
                new ResultRow("p1.png", 1, 1, LayoutMode.HORIZONTAL, 0, 0, 100, 20, "", "plain"),
                new ResultRow("p1.png", 1, 2, LayoutMode.HORIZONTAL, 0, 30, 100, 20, "0.5000", "with, comma and \"quotes\"")
        );

        store.write(file, rows);

        assertEquals(rows, store.read(file));
    }

    @Test
    void rewriteReplacesTheWholeFile() throws Exception {
        Path file = tempDir.resolve("doc_ocr.csv");
        store.write(file, List.of(
                new ResultRow("p1.png", 1, 1, LayoutMode.HORIZONTAL, 0, 0, 1, 1, "", "a"),
                new ResultRow("p2.png", 2, 1, LayoutMode.HORIZONTAL, 0, 0, 1, 1, "", "b")
        ));

        store.write(file, List.of(new ResultRow("p1.png", 1, 1, LayoutMode.HORIZONTAL, 0, 0, 1, 1, "", "only")));

        List<ResultRow> rows = store.read(file);
        assertEquals(1, rows.size());
        assertEquals("only", rows.get(0).text());
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of(file), files.toList());
        }
    }

    @Test
    void missingFileReadsAsEmpty() {
        assertTrue(store.read(tempDir.resolve("absent.csv")).isEmpty());
    }
}
