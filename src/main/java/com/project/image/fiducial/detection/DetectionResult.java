package com.project.image.fiducial.detection;

/**
 * Outcome of one pass.
 *
 * @param offset   position of the cropped region's first sample in the original raster
 * @param distance separation of the two peaks in real-world units
 */
public record DetectionResult(Axis axis, int offset, SpikePair spikes, double distance, ProfileTrace trace) {

    public int localPeak1() {
        return spikes.peak1();
    }

    public int localPeak2() {
        return spikes.peak2();
    }

    public int absolutePeak1() {
        return offset + spikes.peak1();
    }

    public int absolutePeak2() {
        return offset + spikes.peak2();
    }

    public int lowerPeak() {
        return Math.min(localPeak1(), localPeak2());
    }

    public int upperPeak() {
        return Math.max(localPeak1(), localPeak2());
    }

    public int pixelSeparation() {
        return spikes.separation();
    }
}
