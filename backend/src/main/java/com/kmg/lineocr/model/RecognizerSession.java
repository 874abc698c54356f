package com.kmg.lineocr.model;

public record RecognizerSession(String provider, String token) {

    @Override
    public String toString() {
        return "RecognizerSession[provider=" + provider + "]";
    }
}
