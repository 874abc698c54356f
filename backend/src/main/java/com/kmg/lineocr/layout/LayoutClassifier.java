package com.kmg.lineocr.layout;

import com.kmg.lineocr.model.Fragment;
import com.kmg.lineocr.model.LayoutMode;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Decides per page whether fragments read horizontally or in vertical right-to-left columns.
 * An explicit layout request always wins over detection.
 */
@Component
public class LayoutClassifier {
    private final LayoutThresholds thresholds;

    public LayoutClassifier(LayoutThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public LayoutMode classify(List<Fragment> fragments, LayoutMode requested) {
        if (requested != null && requested != LayoutMode.AUTO) {
            return requested;
        }
        if (fragments == null || fragments.size() < thresholds.minFragments()) {
            return LayoutMode.HORIZONTAL;
        }

        OptionalDouble medianWidth = Medians.ofPositive(fragments.stream().map(Fragment::width).toList());
        double band = medianWidth.isPresent()
                ? Math.max(thresholds.bandMin(), medianWidth.getAsDouble() * thresholds.bandFactor())
                : thresholds.bandFallback();

        int verticalLike = 0;
        Set<Long> bands = new HashSet<>();
        for (Fragment fragment : fragments) {
            if (fragment.width() > 0 && fragment.height() > fragment.width() * thresholds.verticalAspect()) {
                verticalLike++;
            }
            bands.add((long) Math.floor(fragment.left() / band));
        }

        double ratio = (double) verticalLike / fragments.size();
        if (ratio >= thresholds.verticalRatio() && bands.size() >= thresholds.minBands()) {
            return LayoutMode.VERTICAL_RTL;
        }
        return LayoutMode.HORIZONTAL;
    }
}
