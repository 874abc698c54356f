package com.kmg.lineocr.service;

import com.kmg.lineocr.model.InputMode;
import com.kmg.lineocr.model.JobOptions;
import com.kmg.lineocr.model.LayoutMode;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PageRenderServiceTest {
    @TempDir
    Path tempDir;

    private final PageRenderService renderService = new PageRenderService();

    @Test
    void imagesAreListedInNaturalOrder() throws Exception {
        Path folder = Files.createDirectories(tempDir.resolve("scans"));
        for (String name : List.of("page_10.png", "page_2.PNG", "page_1.jpg", "page_002b.tif", "notes.txt", "cover.gif")) {
            Files.write(folder.resolve(name), new byte[0]);
        }

        List<String> names = PageRenderService.listSupportedImages(folder).stream()
                .map(path -> path.getFileName().toString())
                .toList();

        assertEquals(List.of("page_1.jpg", "page_2.PNG", "page_002b.tif", "page_10.png"), names);
    }

    @Test
    void supportedImagesAreRecognizedByExtension() {
        assertTrue(PageRenderService.isSupportedImage(Path.of("a.WEBP")));
        assertTrue(PageRenderService.isSupportedImage(Path.of("scan.tiff")));
        assertFalse(PageRenderService.isSupportedImage(Path.of("a.gif")));
        assertFalse(PageRenderService.isSupportedImage(Path.of("noextension")));
    }

    @Test
    void imageFolderPagesAreStagedInOrder() throws Exception {
        Path folder = Files.createDirectories(tempDir.resolve("in"));
        Files.write(folder.resolve("b_10.png"), new byte[]{10});
        Files.write(folder.resolve("b_9.png"), new byte[]{9});
        Path imagesDir = tempDir.resolve("images");

        try (PageRenderer.PageSource source = renderService.open(options(InputMode.IMAGES, folder), imagesDir)) {
            assertEquals(2, source.pageCount());
            Path first = source.render(0);
            assertEquals(imagesDir.resolve("b_9.png"), first);
            assertArrayEquals(new byte[]{9}, Files.readAllBytes(first));
        }
    }

    @Test
    void pdfPagesAreRenderedToPng() throws Exception {
        Path pdf = tempDir.resolve("report.pdf");
        try (PDDocument document = new PDDocument()) {
            document.addPage(new PDPage(PDRectangle.A6));
            document.addPage(new PDPage(PDRectangle.A6));
            document.save(pdf.toFile());
        }
        Path imagesDir = tempDir.resolve("images");

        try (PageRenderer.PageSource source = renderService.open(options(InputMode.PDF, pdf), imagesDir)) {
            assertEquals(2, source.pageCount());
            Path second = source.render(1);
            assertEquals("report_page_0002.png", second.getFileName().toString());
            assertNotNull(ImageIO.read(second.toFile()));
        }
    }

    @Test
    void unreadableDocumentIsAConversionFailure() throws Exception {
        Path notPdf = Files.writeString(tempDir.resolve("broken.pdf"), "not a pdf");

        assertThrows(PageRenderer.ConversionFailedException.class,
                () -> renderService.open(options(InputMode.PDF, notPdf), tempDir.resolve("images")));
        assertThrows(PageRenderer.ConversionFailedException.class,
                () -> renderService.open(options(InputMode.PDF, tempDir.resolve("absent.pdf")), tempDir.resolve("images")));
    }

    private static JobOptions options(InputMode mode, Path source) {
        return new JobOptions(mode, source.toString(), LayoutMode.AUTO, "CHN_ENG", 72, "out.csv");
    }
}
