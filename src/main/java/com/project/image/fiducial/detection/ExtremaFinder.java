package com.project.image.fiducial.detection;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the local minima and maxima of a profile from sign changes of its first difference.
 * <p>
 * Steps smaller than {@link #FLAT_TOLERANCE} relative to the sample magnitude count as flat, so rounding
 * residue left by the smoother does not create extrema. A flat top or bottom is reported once, at its first
 * sample. A flat run at either end of the profile acts as the base of the adjacent slope. A shelf between two
 * slopes of the same sign is not an extremum. The result is in increasing index order and its kinds
 * alternate.
 */
public class ExtremaFinder {

    static final double FLAT_TOLERANCE = 1e-9;

    public List<Extremum> find(double[] profile) {
        List<Extremum> extrema = new ArrayList<>();
        int n = profile.length;
        int lastSign = 0;
        int lastSlope = -1;
        for (int i = 0; i < n - 1; i++) {
            int sign = slopeSign(profile[i], profile[i + 1]);
            if (sign == 0) {
                continue;
            }
            if (lastSign == 0) {
                // flat lead-in ending here
                if (i > 0) {
                    extrema.add(new Extremum(i, sign > 0 ? Extremum.Kind.MIN : Extremum.Kind.MAX));
                }
            } else if (sign != lastSign) {
                extrema.add(new Extremum(lastSlope + 1, lastSign > 0 ? Extremum.Kind.MAX : Extremum.Kind.MIN));
            }
            lastSign = sign;
            lastSlope = i;
        }
        // flat lead-out
        if (lastSign != 0 && lastSlope < n - 2) {
            extrema.add(new Extremum(lastSlope + 1, lastSign > 0 ? Extremum.Kind.MAX : Extremum.Kind.MIN));
        }
        return extrema;
    }

    static int slopeSign(double a, double b) {
        double diff = b - a;
        double scale = Math.max(1.0, Math.max(Math.abs(a), Math.abs(b)));
        if (Math.abs(diff) <= FLAT_TOLERANCE * scale) {
            return 0;
        }
        return diff > 0 ? 1 : -1;
    }
}
