package com.kmg.lineocr.service;

import com.kmg.lineocr.model.Fragment;
import com.kmg.lineocr.model.RecognizerCredentials;
import com.kmg.lineocr.model.RecognizerSession;

import java.nio.file.Path;
import java.util.List;

/**
 * Remote text recognition. Calls are slow and fallible and are never retried here; a page that fails is
 * retried later as part of a job retry.
 */
public interface TextRecognizer {

    String provider();

    /**
     * Whether the given credentials are enough for {@link #authenticate}; checked before a job is created.
     */
    boolean accepts(RecognizerCredentials credentials);

    RecognizerSession authenticate(RecognizerCredentials credentials);

    List<Fragment> recognize(Path image, RecognizerSession session, String languageHint);

    class AuthenticationFailedException extends RuntimeException {
        public AuthenticationFailedException(String message) {
            super(message);
        }

        public AuthenticationFailedException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    class RecognitionFailedException extends RuntimeException {
        public RecognitionFailedException(String message) {
            super(message);
        }

        public RecognitionFailedException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
