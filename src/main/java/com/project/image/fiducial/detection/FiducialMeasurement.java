package com.project.image.fiducial.detection;

/**
 * Both passes over one image together with the geometry needed to annotate it.
 *
 * @param bandStart first column (absolute) averaged by the horizontal pass
 * @param bandEnd   column (absolute) after the last one averaged by the horizontal pass
 */
public record FiducialMeasurement(Calibration calibration,
                                  CropWindow crop,
                                  int bandStart,
                                  int bandEnd,
                                  DetectionResult horizontal,
                                  CropWindow refinedCrop,
                                  DetectionResult vertical) {
}
