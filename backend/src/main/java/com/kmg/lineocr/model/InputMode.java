package com.kmg.lineocr.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum InputMode {
    PDF("pdf"),
    IMAGES("images");

    private final String code;

    InputMode(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static InputMode fromCode(String value) {
        if (value == null || value.isBlank()) {
            return PDF;
        }
        for (InputMode mode : values()) {
            if (mode.code.equalsIgnoreCase(value.strip())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("input_mode must be pdf or images: " + value);
    }
}
