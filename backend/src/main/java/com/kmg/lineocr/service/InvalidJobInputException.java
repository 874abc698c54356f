package com.kmg.lineocr.service;

public class InvalidJobInputException extends IllegalArgumentException {
    public InvalidJobInputException(String message) {
        super(message);
    }

    public InvalidJobInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
