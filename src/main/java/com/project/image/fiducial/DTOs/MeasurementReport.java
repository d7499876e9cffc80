package com.project.image.fiducial.DTOs;

import com.project.image.fiducial.detection.FiducialMeasurement;

public record MeasurementReport(
        int width,
        int height,
        FiducialMeasurement measurement,
        byte[] annotatedPng,        // original with crop lines, marks, arrows and labels
        byte[] horizontalPlotPng,   // row profile used to find the sample edges
        byte[] verticalPlotPng      // column profile used to find the vertical marks
) {
    public double horizontalDistance() {
        return measurement.horizontal().distance();
    }

    public double verticalDistance() {
        return measurement.vertical().distance();
    }
}
