package com.kmg.lineocr.layout;

import com.kmg.lineocr.model.Fragment;
import com.kmg.lineocr.model.LayoutMode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class LineSorterTest {
    private final LineSorter sorter = new LineSorter(LayoutThresholds.defaults());

    @Test
    void horizontalReadsRowsTopToBottom() {
        List<Fragment> fragments = List.of(
                Fragment.of(0, 30, 100, 20, "b"),
                Fragment.of(0, 0, 100, 20, "a")
        );

        assertEquals(List.of("a", "b"), texts(sorter.sort(fragments, LayoutMode.HORIZONTAL)));
    }

    @Test
    void horizontalReadsLeftToRightInsideOneBand() {
        List<Fragment> fragments = List.of(
                Fragment.of(200, 0, 50, 20, "right"),
                Fragment.of(0, 5, 50, 20, "left"),
                Fragment.of(100, 3, 50, 20, "middle")
        );

        assertEquals(List.of("left", "middle", "right"), texts(sorter.sort(fragments, LayoutMode.HORIZONTAL)));
    }

    @Test
    void verticalVisitsColumnsRightToLeftAndReadsTopToBottom() {
        List<Fragment> fragments = List.of(
                Fragment.of(10, 0, 20, 80, "third"),
                Fragment.of(100, 50, 20, 80, "second"),
                Fragment.of(100, 0, 20, 80, "first"),
                Fragment.of(10, 90, 20, 80, "fourth")
        );

        assertEquals(List.of("first", "second", "third", "fourth"), texts(sorter.sort(fragments, LayoutMode.VERTICAL_RTL)));
    }

    @Test
    void blankFragmentsAreDropped() {
        List<Fragment> fragments = List.of(
                Fragment.of(0, 0, 50, 20, "   "),
                Fragment.of(0, 30, 50, 20, "kept"),
                Fragment.of(0, 60, 50, 20, "")
        );

        assertEquals(List.of("kept"), texts(sorter.sort(fragments, LayoutMode.HORIZONTAL)));
    }

    @Test
    void singleOrNoFragmentIsReturnedAsIs() {
        Fragment only = Fragment.of(5, 5, 10, 10, "x");

        assertEquals(List.of(only), sorter.sort(List.of(only), LayoutMode.VERTICAL_RTL));
        assertTrue(sorter.sort(List.of(), LayoutMode.HORIZONTAL).isEmpty());
    }

    @Test
    void orderDoesNotDependOnInputOrder() {
        List<Fragment> fragments = new ArrayList<>();
        for (int row = 0; row < 6; row++) {
            for (int col = 0; col < 4; col++) {
                fragments.add(Fragment.of(col * 120 + row, row * 25 + col, 100, 18, "r" + row + "c" + col));
            }
        }
        List<String> expected = texts(sorter.sort(fragments, LayoutMode.HORIZONTAL));

        Random random = new Random(42);
        for (int i = 0; i < 5; i++) {
            List<Fragment> shuffled = new ArrayList<>(fragments);
            Collections.shuffle(shuffled, random);
            assertEquals(expected, texts(sorter.sort(shuffled, LayoutMode.HORIZONTAL)));
        }
        assertEquals("r0c0", expected.get(0));
        assertEquals("r5c3", expected.get(expected.size() - 1));
    }

    @Test
    void bucketSizesFollowMedianWithLowerBounds() {
        List<Fragment> small = List.of(Fragment.of(0, 0, 4, 4, "a"), Fragment.of(0, 0, 4, 4, "b"));
        List<Fragment> large = List.of(Fragment.of(0, 0, 50, 40, "a"), Fragment.of(0, 0, 70, 60, "b"));
        List<Fragment> empty = List.of(Fragment.of(0, 0, 0, 0, "a"), Fragment.of(0, 0, 0, 0, "b"));

        assertEquals(8.0, sorter.rowBucket(small));
        assertEquals(12.0, sorter.columnBucket(small));
        assertEquals(40.0, sorter.rowBucket(large), 1e-9);
        assertEquals(72.0, sorter.columnBucket(large), 1e-9);
        assertEquals(16.0, sorter.rowBucket(empty), 1e-9);
        assertEquals(24.0, sorter.columnBucket(empty), 1e-9);
    }

    private static List<String> texts(List<Fragment> fragments) {
        return fragments.stream().map(Fragment::text).toList();
    }
}
