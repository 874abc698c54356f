package com.kmg.lineocr.layout;

import java.util.Collection;
import java.util.OptionalDouble;

final class Medians {
    private Medians() {
    }

    /**
     * Median of the strictly positive values; the mean of the two middle values for an even count.
     */
    static OptionalDouble ofPositive(Collection<Integer> values) {
        double[] sorted = values.stream()
                .filter(v -> v != null && v > 0)
                .mapToDouble(Integer::doubleValue)
                .sorted()
                .toArray();
        if (sorted.length == 0) {
            return OptionalDouble.empty();
        }
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return OptionalDouble.of(sorted[mid]);
        }
        return OptionalDouble.of((sorted[mid - 1] + sorted[mid]) / 2.0);
    }
}
