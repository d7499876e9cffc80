package com.project.image.fiducial.service;

import com.project.image.fiducial.DTOs.MeasurementReport;
import com.project.image.fiducial.DTOs.MeasurementRequest;
import com.project.image.fiducial.detection.DetectionResult;
import com.project.image.fiducial.detection.FiducialDetector;
import com.project.image.fiducial.detection.FiducialMeasurement;
import com.project.image.fiducial.detection.GrayscaleRaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Runs both detection passes on an image and renders the annotated copy and the profile plots.
 * Nothing is rendered unless both passes succeed.
 */
@Service
public class MeasurementService {
    private static final Logger log = LoggerFactory.getLogger(MeasurementService.class);

    private final RasterCodec rasterCodec;
    private final AnnotationRenderer annotationRenderer;
    private final ProfilePlotRenderer plotRenderer;

    public MeasurementService(RasterCodec rasterCodec, AnnotationRenderer annotationRenderer,
                              ProfilePlotRenderer plotRenderer) {
        this.rasterCodec = rasterCodec;
        this.annotationRenderer = annotationRenderer;
        this.plotRenderer = plotRenderer;
    }

    public MeasurementReport measureFile(Path path, MeasurementRequest request) {
        report(request, "Input filename: {}", path);
        GrayscaleRaster raster = rasterCodec.read(path);
        return measure(raster, request);
    }

    public MeasurementReport measure(GrayscaleRaster raster, MeasurementRequest request) {
        report(request, "Real image width: {}", request.realWidth());
        report(request, "Input image size: {}x{} pixels", raster.width(), raster.height());

        FiducialDetector detector = new FiducialDetector(request.settings());
        FiducialMeasurement measurement = detector.detect(raster, request.crop(), request.bandWidth(),
                request.realWidth());

        report(request, "There are {} pixels per unit", measurement.calibration().pixelsPerUnit());
        reportPass(request, measurement.horizontal());
        reportPass(request, measurement.vertical());

        byte[] annotated = annotationRenderer.render(raster, measurement);
        byte[] horizontalPlot = plotRenderer.render(measurement.horizontal());
        byte[] verticalPlot = plotRenderer.render(measurement.vertical());

        log.info("Measured {}x{} image: horizontal distance {}, vertical distance {}", raster.width(), raster.height(),
                measurement.horizontal().distance(), measurement.vertical().distance());
        return new MeasurementReport(raster.width(), raster.height(), measurement, annotated, horizontalPlot,
                verticalPlot);
    }

    private void reportPass(MeasurementRequest request, DetectionResult result) {
        String name = result.axis().describe();
        report(request, "{} spike1 peak at {} (absolute {})", name, result.localPeak1(), result.absolutePeak1());
        report(request, "{} spike2 peak at {} (absolute {})", name, result.localPeak2(), result.absolutePeak2());
        report(request, "Distance between {} marks: {}", name, result.distance());
    }

    private static void report(MeasurementRequest request, String format, Object... args) {
        if (request.verbose()) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }
}
