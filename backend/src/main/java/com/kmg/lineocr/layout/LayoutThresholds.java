package com.kmg.lineocr.layout;

/**
 * Heuristic constants for line ordering and layout detection. They are empirical and should be
 * calibrated against real documents rather than re-derived.
 *
 * @param rowBucketFactor     horizontal row bucket = median height * factor
 * @param rowBucketMin        lower bound for the row bucket
 * @param columnBucketFactor  vertical column bucket = median width * factor
 * @param columnBucketMin     lower bound for the column bucket
 * @param fallbackSize        median used when no fragment has a positive extent
 * @param verticalAspect      a fragment is vertical-like when height exceeds width * aspect
 * @param verticalRatio       minimum share of vertical-like fragments for vertical-rtl
 * @param bandFactor          classifier band = median width * factor
 * @param bandMin             lower bound for the classifier band
 * @param bandFallback        classifier band when no fragment has a positive width
 * @param minBands            distinct bands required for vertical-rtl
 * @param minFragments        fewer fragments than this always classify as horizontal
 */
public record LayoutThresholds(
        double rowBucketFactor,
        double rowBucketMin,
        double columnBucketFactor,
        double columnBucketMin,
        double fallbackSize,
        double verticalAspect,
        double verticalRatio,
        double bandFactor,
        double bandMin,
        double bandFallback,
        int minBands,
        int minFragments
) {
    public static LayoutThresholds defaults() {
        return new LayoutThresholds(0.8, 8, 1.2, 12, 20, 1.15, 0.6, 1.8, 20, 40, 2, 2);
    }
}
