package com.project.image.fiducial.exceptions;

/** Real-world image width that is not a positive finite number. */
public class InvalidCalibrationException extends MeasurementException {
    public InvalidCalibrationException(double realWidth) {
        super("Real image width must be a positive number, got " + realWidth);
    }
}
