package com.project.image.fiducial.exceptions;

/**
 * Smoothing window that is even, too small for the polynomial degree, or not shorter than the profile.
 * A negative profile length means the window was rejected before any profile was seen.
 */
public class InvalidSmoothingWindowException extends MeasurementException {
    private final int window;
    private final int degree;
    private final int profileLength;

    public InvalidSmoothingWindowException(String reason, int window, int degree, int profileLength) {
        super(profileLength < 0
                ? String.format("Invalid smoothing window: %s (window=%d, degree=%d)", reason, window, degree)
                : String.format("Invalid smoothing window: %s (window=%d, degree=%d, profile length=%d)",
                        reason, window, degree, profileLength));
        this.window = window;
        this.degree = degree;
        this.profileLength = profileLength;
    }

    public int getWindow() { return window; }
    public int getDegree() { return degree; }
    public int getProfileLength() { return profileLength; }
}
