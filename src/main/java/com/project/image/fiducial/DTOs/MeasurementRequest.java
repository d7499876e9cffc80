package com.project.image.fiducial.DTOs;

import com.project.image.fiducial.detection.CropWindow;
import com.project.image.fiducial.detection.DetectionSettings;

/**
 * Parameters of one image analysis.
 *
 * @param realWidth real-world width of the whole image
 * @param bandWidth columns, centred in the crop, averaged to find the horizontal marks
 * @param verbose   report positions and distances at INFO instead of DEBUG
 */
public record MeasurementRequest(
        double realWidth,
        CropWindow crop,
        int bandWidth,
        DetectionSettings settings,
        boolean verbose
) {}
