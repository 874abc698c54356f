package com.kmg.lineocr.service;

import com.kmg.lineocr.model.Fragment;
import com.kmg.lineocr.model.RecognizerCredentials;
import com.kmg.lineocr.model.RecognizerSession;

import java.nio.file.Path;
import java.util.*;
import java.util.function.IntConsumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizer double driven by page number, taken from the {@code page_<n>} part of the image name. Every page
 * yields two horizontal lines, {@code p<n>-a} and {@code p<n>-b}, unless it is scripted to fail.
 */
class ScriptedTextRecognizer implements TextRecognizer {
    private static final Pattern PAGE = Pattern.compile("page_(\\d+)");

    private final Set<Integer> failingPages = new HashSet<>();
    private final List<Integer> recognizedPages = new ArrayList<>();
    private boolean failAuthentication;
    private IntConsumer afterPage = page -> {
    };

    ScriptedTextRecognizer failOn(Integer... pages) {
        failingPages.clear();
        failingPages.addAll(Arrays.asList(pages));
        return this;
    }

    ScriptedTextRecognizer failAuthentication() {
        failAuthentication = true;
        return this;
    }

    ScriptedTextRecognizer afterPage(IntConsumer hook) {
        afterPage = hook;
        return this;
    }

    List<Integer> recognizedPages() {
        return recognizedPages;
    }

    @Override
    public String provider() {
        return "scripted";
    }

    @Override
    public boolean accepts(RecognizerCredentials credentials) {
        return true;
    }

    @Override
    public RecognizerSession authenticate(RecognizerCredentials credentials) {
        if (failAuthentication) {
            throw new AuthenticationFailedException("invalid client credentials");
        }
        return new RecognizerSession(provider(), "token");
    }

    @Override
    public List<Fragment> recognize(Path image, RecognizerSession session, String languageHint) {
        int page = pageOf(image);
        recognizedPages.add(page);
        try {
            if (failingPages.contains(page)) {
                throw new RecognitionFailedException("timeout on page " + page);
            }
            return List.of(
                    new Fragment(10, 40, 200, 20, "p" + page + "-b", 0.91f),
                    new Fragment(10, 0, 200, 20, "p" + page + "-a", 0.99f)
            );
        } finally {
            afterPage.accept(page);
        }
    }

    static int pageOf(Path image) {
        Matcher matcher = PAGE.matcher(image.getFileName().toString());
        if (!matcher.find()) {
            throw new IllegalArgumentException("No page number in " + image);
        }
        return Integer.parseInt(matcher.group(1));
    }
}
