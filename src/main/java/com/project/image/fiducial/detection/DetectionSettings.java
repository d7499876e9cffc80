package com.project.image.fiducial.detection;

/**
 * Tuning of both passes.
 *
 * @param verticalCropExtra rows removed inside each horizontal mark before the vertical pass
 * @param peakWidthMax      spikes whose flanking minima are this far apart or more are ignored
 * @param peakDistMax       spikes further than this from both ends of the profile are ignored
 */
public record DetectionSettings(int verticalCropExtra,
                                int peakWidthMax,
                                int peakDistMax,
                                int smoothingIterations,
                                int horizontalWindow,
                                int horizontalDegree,
                                int verticalWindow,
                                int verticalDegree) {

    public static final int DEFAULT_VERTICAL_CROP_EXTRA = 50;
    public static final int DEFAULT_PEAK_WIDTH_MAX = 80;
    public static final int DEFAULT_PEAK_DIST_MAX = 1000;
    public static final int DEFAULT_SMOOTHING_ITERATIONS = 10;

    public DetectionSettings {
        if (verticalCropExtra < 0) {
            throw new IllegalArgumentException("verticalCropExtra must be non-negative, got " + verticalCropExtra);
        }
    }

    public static DetectionSettings defaults() {
        return new DetectionSettings(DEFAULT_VERTICAL_CROP_EXTRA, DEFAULT_PEAK_WIDTH_MAX, DEFAULT_PEAK_DIST_MAX,
                DEFAULT_SMOOTHING_ITERATIONS, 9, 2, 21, 2);
    }

    /** Copy with the non-null values replaced. */
    public DetectionSettings withOverrides(Integer verticalCropExtra, Integer peakWidthMax, Integer peakDistMax) {
        return new DetectionSettings(
                verticalCropExtra == null ? this.verticalCropExtra : verticalCropExtra,
                peakWidthMax == null ? this.peakWidthMax : peakWidthMax,
                peakDistMax == null ? this.peakDistMax : peakDistMax,
                smoothingIterations, horizontalWindow, horizontalDegree, verticalWindow, verticalDegree);
    }

    public PassSettings horizontalPass(int bandWidth) {
        return new PassSettings(Axis.ROWS, bandWidth, horizontalWindow, horizontalDegree, smoothingIterations,
                peakWidthMax, peakDistMax);
    }

    public PassSettings verticalPass(int bandWidth) {
        return new PassSettings(Axis.COLUMNS, bandWidth, verticalWindow, verticalDegree, smoothingIterations,
                peakWidthMax, peakDistMax);
    }
}
