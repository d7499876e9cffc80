package com.project.image.fiducial.exceptions;

import com.project.image.fiducial.detection.Axis;

/** Fewer than two eligible spikes were found in a pass. */
public class NoMarksFoundException extends MeasurementException {
    private final Axis axis;
    private final int eligibleCandidates;

    public NoMarksFoundException(Axis axis, int eligibleCandidates, int peakWidthMax, int peakDistMax) {
        super(String.format("No %s mark pair found: %d eligible spike(s), need 2 (peakWidthMax=%d, peakDistMax=%d)",
                axis.describe(), eligibleCandidates, peakWidthMax, peakDistMax));
        this.axis = axis;
        this.eligibleCandidates = eligibleCandidates;
    }

    public Axis getAxis() { return axis; }
    public int getEligibleCandidates() { return eligibleCandidates; }
}
