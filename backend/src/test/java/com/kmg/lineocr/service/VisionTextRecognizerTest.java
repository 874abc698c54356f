package com.kmg.lineocr.service;

import com.kmg.lineocr.model.RecognizerCredentials;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VisionTextRecognizerTest {
    @TempDir
    Path tempDir;

    private final VisionTextRecognizer recognizer = new VisionTextRecognizer();

    @Test
    void languageCodesMapToVisionHints() {
        assertEquals(List.of("zh", "en"), VisionTextRecognizer.visionLanguageHints("chn_eng"));
        assertEquals(List.of("ja"), VisionTextRecognizer.visionLanguageHints("JAP"));
        assertEquals(List.of("fr"), VisionTextRecognizer.visionLanguageHints(" FR "));
        assertTrue(VisionTextRecognizer.visionLanguageHints(null).isEmpty());
    }

    @Test
    void missingKeyFileIsRejectedBeforeAnyCall() {
        RecognizerCredentials keysOnly = new RecognizerCredentials("ak", "sk", null);
        RecognizerCredentials absentFile = new RecognizerCredentials(null, null, tempDir.resolve("absent.json"));

        assertFalse(recognizer.accepts(keysOnly));
        assertFalse(recognizer.accepts(absentFile));
        assertThrows(TextRecognizer.AuthenticationFailedException.class, () -> recognizer.authenticate(absentFile));
    }
}
