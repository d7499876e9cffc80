package com.project.image.fiducial.detection;

/**
 * The two selected spikes of one pass. {@code spike1} is the more prominent one; an unfilled slot holds
 * {@link SpikeCandidate#EMPTY}, which reports position 0 and prominence 0.
 *
 * @param eligibleCount number of candidates that passed the width and position filters
 */
public record SpikePair(SpikeCandidate spike1, SpikeCandidate spike2, int eligibleCount) {

    static SpikePair ordered(SpikeCandidate a, SpikeCandidate b, int eligibleCount) {
        boolean swap = b.prominence() > a.prominence()
                || (b.prominence() == a.prominence() && !b.isEmpty() && b.peak() < a.peak());
        return swap ? new SpikePair(b, a, eligibleCount) : new SpikePair(a, b, eligibleCount);
    }

    public boolean isComplete() {
        return !spike1.isEmpty() && !spike2.isEmpty();
    }

    public int peak1() {
        return spike1.peak();
    }

    public int peak2() {
        return spike2.peak();
    }

    public int separation() {
        return Math.abs(spike2.peak() - spike1.peak());
    }
}
