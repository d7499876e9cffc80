package com.project.image.fiducial.detection;

/**
 * Parameters of one detection pass.
 *
 * @param bandWidth number of samples averaged across the scan axis
 */
public record PassSettings(Axis axis,
                           int bandWidth,
                           int smoothingWindow,
                           int smoothingDegree,
                           int smoothingIterations,
                           int peakWidthMax,
                           int peakDistMax) {
}
