package com.kmg.lineocr.service;

public class InvalidJobStateException extends IllegalStateException {
    public InvalidJobStateException(String message) {
        super(message);
    }
}
