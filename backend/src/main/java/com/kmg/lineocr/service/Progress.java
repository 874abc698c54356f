package com.kmg.lineocr.service;

/**
 * Progress bands of a run. Authentication ends at 3, conversion fills 5..45, recognition fills 45..98.
 * A retry run restarts at 0 and fills 5..98. Only a completed terminal status reaches 100.
 */
final class Progress {
    static final int AUTHENTICATED = 3;
    static final int RECOGNITION_START = 45;
    static final int CAP = 98;

    private Progress() {
    }

    static int conversion(int converted, int total) {
        if (total <= 0) {
            return 5;
        }
        return 5 + (40 * converted) / total;
    }

    static int recognition(int attempted, int total) {
        if (total <= 0) {
            return RECOGNITION_START;
        }
        return Math.min(CAP, RECOGNITION_START + (53 * attempted) / total);
    }

    static int retry(int attempted, int total) {
        if (total <= 0) {
            return 5;
        }
        return Math.min(CAP, 5 + (93 * attempted) / total);
    }
}
