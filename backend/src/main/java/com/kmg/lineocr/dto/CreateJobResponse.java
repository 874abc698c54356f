package com.kmg.lineocr.dto;

public record CreateJobResponse(String jobId) {
}
