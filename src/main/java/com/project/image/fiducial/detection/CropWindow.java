package com.project.image.fiducial.detection;

import com.project.image.fiducial.exceptions.InvalidCropException;

/**
 * Pixel margins removed from each edge of a raster.
 */
public record CropWindow(int top, int bottom, int left, int right) {

    public static final CropWindow NONE = new CropWindow(0, 0, 0, 0);

    public CropWindow {
        if (top < 0 || bottom < 0 || left < 0 || right < 0) {
            throw new InvalidCropException("Crop margins must be non-negative: top=" + top + ", bottom=" + bottom
                    + ", left=" + left + ", right=" + right);
        }
    }

    public int interiorWidth(int rasterWidth) {
        return rasterWidth - left - right;
    }

    public int interiorHeight(int rasterHeight) {
        return rasterHeight - top - bottom;
    }

    public void validateFor(GrayscaleRaster raster) {
        if (interiorWidth(raster.width()) <= 0 || interiorHeight(raster.height()) <= 0) {
            throw new InvalidCropException(this, raster.width(), raster.height());
        }
    }

    /** Offset of the cropped region's first sample along the given scan axis. */
    public int offsetAlong(Axis axis) {
        return axis == Axis.ROWS ? top : left;
    }
}
