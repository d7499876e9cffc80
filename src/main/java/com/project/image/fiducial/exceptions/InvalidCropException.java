package com.project.image.fiducial.exceptions;

import com.project.image.fiducial.detection.CropWindow;

/** Crop margins that are negative or leave no interior. */
public class InvalidCropException extends MeasurementException {
    public InvalidCropException(String message) { super(message); }

    public InvalidCropException(CropWindow window, int rasterWidth, int rasterHeight) {
        super(String.format("Crop top=%d, bottom=%d, left=%d, right=%d leaves no interior in a %dx%d image"
                        + " (interior %dx%d)",
                window.top(), window.bottom(), window.left(), window.right(), rasterWidth, rasterHeight,
                window.interiorWidth(rasterWidth), window.interiorHeight(rasterHeight)));
    }
}
