package com.project.image.fiducial.exceptions;

/** The horizontal marks are too close to leave a strip for the vertical pass. */
public class DegenerateRefinedCropException extends MeasurementException {
    public DegenerateRefinedCropException(int peak1, int peak2, int verticalCropExtra) {
        super(String.format("No sample edges detected: horizontal marks at %d and %d leave no rows between them"
                + " after removing %d pixels on each side", peak1, peak2, verticalCropExtra));
    }
}
