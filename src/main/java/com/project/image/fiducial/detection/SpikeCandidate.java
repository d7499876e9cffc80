package com.project.image.fiducial.detection;

/**
 * A maximum flanked by two minima: {@code leftMin < peak < rightMin}.
 *
 * @param prominence {@code (p[peak] - p[leftMin]) + (p[peak] - p[rightMin])}
 */
public record SpikeCandidate(int leftMin, int peak, int rightMin, double peakValue, double prominence) {

    /** Unfilled selection slot. */
    public static final SpikeCandidate EMPTY = new SpikeCandidate(0, 0, 0, 0, 0);

    public static SpikeCandidate of(double[] profile, int leftMin, int peak, int rightMin) {
        double top = profile[peak];
        double prominence = (top - profile[leftMin]) + (top - profile[rightMin]);
        return new SpikeCandidate(leftMin, peak, rightMin, top, prominence);
    }

    public int width() {
        return rightMin - leftMin;
    }

    public boolean isEmpty() {
        return prominence <= 0;
    }
}
