package com.kmg.lineocr.service;

import com.kmg.lineocr.model.InputMode;
import com.kmg.lineocr.model.JobOptions;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

@Service
public class PageRenderService implements PageRenderer {
    private static final Logger log = LoggerFactory.getLogger(PageRenderService.class);

    public static final Set<String> SUPPORTED_IMAGES = Set.of("png", "jpg", "jpeg", "bmp", "tif", "tiff", "webp");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    @Override
    public PageSource open(JobOptions options, Path imagesDir) {
        Path source = Path.of(options.sourcePath());
        try {
            Files.createDirectories(imagesDir);
        } catch (IOException e) {
            throw new ConversionFailedException("Failed to create image directory: " + imagesDir, e);
        }
        if (options.inputMode() == InputMode.IMAGES) {
            return new ImageFolderSource(listSupportedImages(source), imagesDir);
        }
        return PdfSource.open(source, options.dpi(), imagesDir);
    }

    public static boolean isSupportedImage(Path path) {
        String name = path.getFileName().toString();
        int idx = name.lastIndexOf('.');
        if (idx < 0) {
            return false;
        }
        return SUPPORTED_IMAGES.contains(name.substring(idx + 1).toLowerCase());
    }

    static List<Path> listSupportedImages(Path folder) {
        if (!Files.isDirectory(folder)) {
            throw new ConversionFailedException("Image folder not found: " + folder);
        }
        try (Stream<Path> stream = Files.list(folder)) {
            return stream.filter(Files::isRegularFile)
                    .filter(PageRenderService::isSupportedImage)
                    .sorted(Comparator.comparing(PageRenderService::naturalKey))
                    .toList();
        } catch (IOException e) {
            throw new ConversionFailedException("Failed to list images: " + e.getMessage(), e);
        }
    }

    /**
     * Sort key that compares digit runs by numeric value, so {@code page_2} precedes {@code page_10}.
     */
    static String naturalKey(Path path) {
        String name = path.getFileName().toString().toLowerCase();
        Matcher matcher = DIGITS.matcher(name);
        StringBuilder key = new StringBuilder();
        int last = 0;
        while (matcher.find()) {
            key.append(name, last, matcher.start());
            String digits = matcher.group().replaceFirst("^0+(?=\\d)", "");
            key.append(String.format("%20s", digits));
            last = matcher.end();
        }
        key.append(name.substring(last));
        return key.toString();
    }

    private static final class PdfSource implements PageSource {
        private final PDDocument document;
        private final PDFRenderer renderer;
        private final String stem;
        private final int dpi;
        private final Path imagesDir;

        private PdfSource(PDDocument document, String stem, int dpi, Path imagesDir) {
            this.document = document;
            this.renderer = new PDFRenderer(document);
            this.stem = stem;
            this.dpi = dpi;
            this.imagesDir = imagesDir;
        }

        static PdfSource open(Path pdf, int dpi, Path imagesDir) {
            if (!Files.isRegularFile(pdf)) {
                throw new ConversionFailedException("PDF not found: " + pdf);
            }
            try {
                PDDocument document = Loader.loadPDF(pdf.toFile());
                String name = pdf.getFileName().toString();
                int dot = name.lastIndexOf('.');
                String stem = dot > 0 ? name.substring(0, dot) : name;
                return new PdfSource(document, stem, dpi, imagesDir);
            } catch (IOException e) {
                throw new ConversionFailedException("Failed to open PDF " + pdf.getFileName() + ": " + e.getMessage(), e);
            }
        }

        @Override
        public int pageCount() {
            return document.getNumberOfPages();
        }

        @Override
        public Path render(int pageIndex) {
            Path target = imagesDir.resolve(String.format("%s_page_%04d.png", stem, pageIndex + 1));
            try {
                BufferedImage image = renderer.renderImageWithDPI(pageIndex, dpi, ImageType.RGB);
                if (!ImageIO.write(image, "png", target.toFile())) {
                    throw new ConversionFailedException("No PNG writer available for page " + (pageIndex + 1));
                }
                return target;
            } catch (IOException e) {
                throw new ConversionFailedException("Failed to render page " + (pageIndex + 1) + ": " + e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            try {
                document.close();
            } catch (IOException e) {
                log.warn("Failed to close PDF document: {}", e.getMessage());
            }
        }
    }

    private static final class ImageFolderSource implements PageSource {
        private final List<Path> images;
        private final Path imagesDir;

        private ImageFolderSource(List<Path> images, Path imagesDir) {
            this.images = images;
            this.imagesDir = imagesDir;
        }

        @Override
        public int pageCount() {
            return images.size();
        }

        @Override
        public Path render(int pageIndex) {
            Path image = images.get(pageIndex);
            Path target = imagesDir.resolve(image.getFileName().toString());
            if (image.toAbsolutePath().normalize().equals(target.toAbsolutePath().normalize())) {
                return target;
            }
            try {
                return Files.copy(image, target, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw new ConversionFailedException("Failed to stage image " + image.getFileName() + ": " + e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            // Staged copies stay on disk for retries.
        }
    }
}
