package com.project.image.fiducial.detection;

import com.project.image.fiducial.exceptions.InvalidCalibrationException;

/**
 * Uniform pixel pitch derived from the real-world width of the whole image.
 */
public record Calibration(double realWidth, double pixelsPerUnit) {

    public static Calibration forRaster(GrayscaleRaster raster, double realWidth) {
        if (!Double.isFinite(realWidth) || realWidth <= 0) {
            throw new InvalidCalibrationException(realWidth);
        }
        return new Calibration(realWidth, raster.width() / realWidth);
    }

    public double toUnits(int pixels) {
        return pixels / pixelsPerUnit;
    }
}
