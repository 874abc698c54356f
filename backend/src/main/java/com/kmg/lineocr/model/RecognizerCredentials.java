package com.kmg.lineocr.model;

import java.nio.file.Path;

/**
 * Keys for the Baidu recognizer or a service-account key file for Vision. Never logged.
 */
public record RecognizerCredentials(String apiKey, String secretKey, Path keyFile) {

    public boolean hasKeyPair() {
        return apiKey != null && !apiKey.isBlank() && secretKey != null && !secretKey.isBlank();
    }

    @Override
    public String toString() {
        return "RecognizerCredentials[apiKey=***, secretKey=***, keyFile=" + keyFile + "]";
    }
}
