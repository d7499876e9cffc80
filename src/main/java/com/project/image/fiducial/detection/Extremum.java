package com.project.image.fiducial.detection;

/**
 * Local extremum of a smoothed profile.
 */
public record Extremum(int index, Kind kind) {

    public enum Kind { MIN, MAX }

    public static Extremum min(int index) {
        return new Extremum(index, Kind.MIN);
    }

    public static Extremum max(int index) {
        return new Extremum(index, Kind.MAX);
    }

    public boolean isMax() {
        return kind == Kind.MAX;
    }
}
