package com.project.image.fiducial.exceptions;

/** Domain-specific exception for measurement errors. */
public class MeasurementException extends RuntimeException {
    public MeasurementException(String message) { super(message); }
    public MeasurementException(String message, Throwable cause) { super(message, cause); }
}
