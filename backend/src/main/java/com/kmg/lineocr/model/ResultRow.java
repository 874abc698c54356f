package com.kmg.lineocr.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Comparator;
import java.util.Locale;

@JsonPropertyOrder({"image_file", "page_no", "line_no", "layout", "left", "top", "width", "height", "confidence", "text"})
public record ResultRow(
        @JsonProperty("image_file") String sourceImage,
        @JsonProperty("page_no") int pageNo,
        @JsonProperty("line_no") int lineNo,
        @JsonProperty("layout") LayoutMode layout,
        @JsonProperty("left") int left,
        @JsonProperty("top") int top,
        @JsonProperty("width") int width,
        @JsonProperty("height") int height,
        @JsonProperty("confidence") String confidence,
        @JsonProperty("text") String text
) {
    public static final Comparator<ResultRow> PAGE_LINE_ORDER = Comparator
            .comparingInt(ResultRow::pageNo)
            .thenComparingInt(ResultRow::lineNo);

    public ResultRow {
        confidence = confidence == null ? "" : confidence;
        text = text == null ? "" : text;
    }

    public static ResultRow from(String sourceImage, int pageNo, int lineNo, LayoutMode layout, Fragment fragment) {
        return new ResultRow(
                sourceImage,
                pageNo,
                lineNo,
                layout,
                fragment.left(),
                fragment.top(),
                fragment.width(),
                fragment.height(),
                formatConfidence(fragment.confidence()),
                fragment.text().strip()
        );
    }

    static String formatConfidence(Float confidence) {
        if (confidence == null || confidence.isNaN()) {
            return "";
        }
        return String.format(Locale.ROOT, "%.4f", confidence);
    }
}
