package com.kmg.lineocr.model;

/**
 * One recognized text span on a page image, in pixel coordinates of that image.
 */
public record Fragment(
        int left,
        int top,
        int width,
        int height,
        String text,
        Float confidence
) {
    public Fragment {
        left = Math.max(0, left);
        top = Math.max(0, top);
        width = Math.max(0, width);
        height = Math.max(0, height);
        text = text == null ? "" : text;
    }

    public static Fragment of(int left, int top, int width, int height, String text) {
        return new Fragment(left, top, width, height, text, null);
    }

    public boolean hasText() {
        return !text.isBlank();
    }
}
