package com.kmg.lineocr.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum LayoutMode {
    AUTO("auto"),
    HORIZONTAL("horizontal"),
    VERTICAL_RTL("vertical-rtl");

    private final String code;

    LayoutMode(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static LayoutMode fromCode(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        String normalized = value.strip().toLowerCase();
        return Arrays.stream(values())
                .filter(mode -> mode.code.equals(normalized) || mode.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported layout: " + value));
    }
}
