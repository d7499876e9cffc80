package com.project.image.fiducial.detection;

import java.util.List;

/**
 * Intermediate data of a pass, kept for the diagnostic plot.
 */
public record ProfileTrace(double[] raw, double[] smoothed, List<Extremum> extrema) {

    public ProfileTrace {
        extrema = List.copyOf(extrema);
    }

    public int length() {
        return raw.length;
    }
}
