package com.kmg.lineocr.service;

import com.kmg.lineocr.layout.LayoutClassifier;
import com.kmg.lineocr.layout.LineSorter;
import com.kmg.lineocr.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Recognizes one rendered page and turns its fragments into numbered result rows.
 * A failing page is reported as a {@link PageOutcome} failure, never as an exception.
 */
@Component
public class PageRecognizer {
    private static final Logger log = LoggerFactory.getLogger(PageRecognizer.class);

    private final TextRecognizer recognizer;
    private final LayoutClassifier classifier;
    private final LineSorter sorter;

    public PageRecognizer(TextRecognizer recognizer, LayoutClassifier classifier, LineSorter sorter) {
        this.recognizer = recognizer;
        this.classifier = classifier;
        this.sorter = sorter;
    }

    public RecognizerSession authenticate(RecognizerCredentials credentials) {
        return recognizer.authenticate(credentials);
    }

    public PageOutcome recognize(int pageNo, Path image, RecognizerSession session, String languageHint,
                                 LayoutMode requested) {
        List<Fragment> fragments;
        try {
            fragments = recognizer.recognize(image, session, languageHint);
        } catch (TextRecognizer.RecognitionFailedException e) {
            log.warn("Page {} failed recognition: {}", pageNo, e.getMessage());
            return PageOutcome.failure(pageNo, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Page {} failed with unexpected error: {}", pageNo, e.toString());
            return PageOutcome.failure(pageNo, e.toString());
        }

        LayoutMode layout = classifier.classify(fragments, requested);
        List<Fragment> ordered = sorter.sort(fragments, layout);
        String sourceImage = image.getFileName().toString();
        List<ResultRow> rows = new ArrayList<>(ordered.size());
        int lineNo = 1;
        for (Fragment fragment : ordered) {
            if (!fragment.hasText()) {
                continue;
            }
            rows.add(ResultRow.from(sourceImage, pageNo, lineNo++, layout, fragment));
        }
        log.debug("Page {} recognized: {} fragment(s), {} row(s), layout {}", pageNo, fragments.size(), rows.size(), layout.code());
        return PageOutcome.success(pageNo, rows);
    }
}
