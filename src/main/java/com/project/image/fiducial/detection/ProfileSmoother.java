package com.project.image.fiducial.detection;

import com.project.image.fiducial.exceptions.InvalidSmoothingWindowException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Savitzky-Golay smoothing: every sample is replaced by the value of a least-squares polynomial fitted
 * over a window centred on it.
 * <p>
 * The first and last {@code window / 2} samples take their values from the polynomial fitted to the first
 * (last) full window, so the output has the same length as the input. Repeating the filter merges the small
 * secondary wiggles around a genuine edge into one extremum without moving it; the price is some distortion
 * near both ends of the profile.
 */
public class ProfileSmoother {

    private final int window;
    private final int degree;
    /** Row t holds the weights giving the fitted value at window position t. */
    private final double[][] weights;

    public ProfileSmoother(int window, int degree) {
        if (degree < 0) {
            throw new InvalidSmoothingWindowException("polynomial degree must be non-negative", window, degree, -1);
        }
        if (window % 2 == 0) {
            throw new InvalidSmoothingWindowException("window must be odd", window, degree, -1);
        }
        if (window <= degree) {
            throw new InvalidSmoothingWindowException("window must be larger than the degree", window, degree, -1);
        }
        this.window = window;
        this.degree = degree;
        this.weights = projectionMatrix(window, degree).getData();
    }

    public int getWindow() {
        return window;
    }

    public int getDegree() {
        return degree;
    }

    /**
     * Apply the filter {@code iterations} times. Zero iterations returns a copy of the input.
     */
    public double[] smooth(double[] profile, int iterations) {
        if (iterations < 0) {
            throw new IllegalArgumentException("Iterations must be non-negative, got " + iterations);
        }
        requireFits(profile.length);
        double[] current = profile.clone();
        for (int i = 0; i < iterations; i++) {
            current = filter(current);
        }
        return current;
    }

    /** A single application of the filter. */
    public double[] apply(double[] profile) {
        requireFits(profile.length);
        return filter(profile);
    }

    private void requireFits(int length) {
        if (window >= length) {
            throw new InvalidSmoothingWindowException("window must be shorter than the profile", window, degree, length);
        }
    }

    private double[] filter(double[] y) {
        int n = y.length;
        int half = window / 2;
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            int row;
            int base;
            if (i < half) {
                row = i;
                base = 0;
            } else if (i >= n - half) {
                row = i - (n - window);
                base = n - window;
            } else {
                row = half;
                base = i - half;
            }
            double[] w = weights[row];
            double sum = 0;
            for (int k = 0; k < window; k++) {
                sum += w[k] * y[base + k];
            }
            out[i] = sum;
        }
        return out;
    }

    /**
     * Hat matrix {@code A (A^T A)^-1 A^T} of the Vandermonde matrix {@code A} over positions
     * {@code -window/2 .. window/2}.
     */
    private static RealMatrix projectionMatrix(int window, int degree) {
        int half = window / 2;
        RealMatrix vandermonde = new Array2DRowRealMatrix(window, degree + 1);
        for (int r = 0; r < window; r++) {
            double x = r - half;
            double power = 1;
            for (int c = 0; c <= degree; c++) {
                vandermonde.setEntry(r, c, power);
                power *= x;
            }
        }
        RealMatrix pseudoInverse = new QRDecomposition(vandermonde).getSolver().getInverse();
        return vandermonde.multiply(pseudoInverse);
    }
}
