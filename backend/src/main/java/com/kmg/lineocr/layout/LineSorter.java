package com.kmg.lineocr.layout;

import com.kmg.lineocr.model.Fragment;
import com.kmg.lineocr.model.LayoutMode;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Orders the fragments of one page into reading order.
 * <p>
 * Horizontal pages are cut into bands of {@code max(rowBucketMin, medianHeight * rowBucketFactor)} pixels
 * and read left to right inside a band. Vertical right-to-left pages are cut into columns of
 * {@code max(columnBucketMin, medianWidth * columnBucketFactor)} pixels, visited right to left and read top
 * to bottom. Blank fragments are dropped.
 */
@Component
public class LineSorter {
    private final LayoutThresholds thresholds;

    public LineSorter(LayoutThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public List<Fragment> sort(List<Fragment> fragments, LayoutMode layout) {
        if (fragments == null || fragments.isEmpty()) {
            return List.of();
        }
        List<Fragment> valid = fragments.stream()
                .filter(fragment -> fragment != null && fragment.hasText())
                .toList();
        if (valid.size() <= 1) {
            return valid;
        }

        if (layout == LayoutMode.VERTICAL_RTL) {
            double columnStep = columnBucket(valid);
            return valid.stream()
                    .sorted(Comparator
                            .comparingLong((Fragment f) -> -bucket(f.left(), columnStep))
                            .thenComparingInt(Fragment::top)
                            .thenComparingInt(f -> -f.left()))
                    .toList();
        }

        double rowStep = rowBucket(valid);
        return valid.stream()
                .sorted(Comparator
                        .comparingLong((Fragment f) -> bucket(f.top(), rowStep))
                        .thenComparingInt(Fragment::left)
                        .thenComparingInt(Fragment::top))
                .toList();
    }

    double rowBucket(List<Fragment> fragments) {
        double median = Medians.ofPositive(fragments.stream().map(Fragment::height).toList())
                .orElse(thresholds.fallbackSize());
        return Math.max(thresholds.rowBucketMin(), median * thresholds.rowBucketFactor());
    }

    double columnBucket(List<Fragment> fragments) {
        double median = Medians.ofPositive(fragments.stream().map(Fragment::width).toList())
                .orElse(thresholds.fallbackSize());
        return Math.max(thresholds.columnBucketMin(), median * thresholds.columnBucketFactor());
    }

    private static long bucket(int coordinate, double step) {
        return (long) Math.floor(coordinate / step);
    }
}
