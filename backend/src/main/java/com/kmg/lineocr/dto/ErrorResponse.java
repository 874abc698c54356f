package com.kmg.lineocr.dto;

public record ErrorResponse(String error, String message) {
}
