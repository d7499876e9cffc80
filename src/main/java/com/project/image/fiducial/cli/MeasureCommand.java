package com.project.image.fiducial.cli;

import com.project.image.fiducial.DTOs.MeasurementReport;
import com.project.image.fiducial.DTOs.MeasurementRequest;
import com.project.image.fiducial.detection.CropWindow;
import com.project.image.fiducial.detection.DetectionSettings;
import com.project.image.fiducial.exceptions.MeasurementException;
import com.project.image.fiducial.exceptions.StorageException;
import com.project.image.fiducial.service.MeasurementService;
import com.project.image.fiducial.service.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Measures the fiducial mark distances of one image and writes the annotated image and both profile plots
 * next to it.
 */
@Command(name = "measure", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Detects two pairs of fiducial marks in a microscope image and measures their distances.")
public class MeasureCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MeasureCommand.class);

    static final String ANNOTATED = "annotated";
    static final String HORIZONTAL_PLOT = "sample_vert_edge_detect";
    static final String VERTICAL_PLOT = "sample_mark_detect";

    @Parameters(index = "0", paramLabel = "filename", description = "Image to analyse.")
    private Path filename;

    @Parameters(index = "1", paramLabel = "realWidth", description = "Real-world width of the whole image.")
    private double realWidth;

    @Parameters(index = "2", arity = "0..1", paramLabel = "cropTop", defaultValue = "100",
            description = "Rows ignored at the top (default: ${DEFAULT-VALUE}).")
    private int cropTop;

    @Parameters(index = "3", arity = "0..1", paramLabel = "cropBottom", defaultValue = "300",
            description = "Rows ignored at the bottom (default: ${DEFAULT-VALUE}).")
    private int cropBottom;

    @Parameters(index = "4", arity = "0..1", paramLabel = "cropLeft", defaultValue = "100",
            description = "Columns ignored on the left (default: ${DEFAULT-VALUE}).")
    private int cropLeft;

    @Parameters(index = "5", arity = "0..1", paramLabel = "cropRight", defaultValue = "100",
            description = "Columns ignored on the right (default: ${DEFAULT-VALUE}).")
    private int cropRight;

    @Option(names = "--band-width", defaultValue = "2000",
            description = "Columns averaged for the horizontal marks (default: ${DEFAULT-VALUE}).")
    private int bandWidth;

    @Option(names = "--vertical-crop-extra", description = "Rows kept clear of the horizontal marks in the vertical pass.")
    private Integer verticalCropExtra;

    @Option(names = "--peak-width-max", description = "Widest spike accepted as a mark, in pixels.")
    private Integer peakWidthMax;

    @Option(names = "--peak-dist-max", description = "How far from either end of the profile a mark may lie, in pixels.")
    private Integer peakDistMax;

    @Option(names = {"-q", "--quiet"}, description = "Only log the final distances.")
    private boolean quiet;

    @Spec
    private CommandSpec spec;

    private final MeasurementService measurementService;
    private final StorageService storageService;
    private final DetectionSettings defaults;
    private final String unit;

    public MeasureCommand(MeasurementService measurementService, StorageService storageService,
                          DetectionSettings defaults, String unit) {
        this.measurementService = measurementService;
        this.storageService = storageService;
        this.defaults = defaults;
        this.unit = unit;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            MeasurementRequest request = new MeasurementRequest(
                    realWidth,
                    new CropWindow(cropTop, cropBottom, cropLeft, cropRight),
                    bandWidth,
                    defaults.withOverrides(verticalCropExtra, peakWidthMax, peakDistMax),
                    !quiet);
            MeasurementReport report = measurementService.measureFile(filename, request);

            String prefix = StorageService.reportPrefix(filename, LocalDateTime.now());
            Path annotated = storageService.writeBeside(filename, prefix, ANNOTATED, report.annotatedPng());
            storageService.writeBeside(filename, prefix, HORIZONTAL_PLOT, report.horizontalPlotPng());
            storageService.writeBeside(filename, prefix, VERTICAL_PLOT, report.verticalPlotPng());

            out.printf(Locale.ROOT, "Distance between horizontal marks: %.3f %s%n", report.horizontalDistance(), unit);
            out.printf(Locale.ROOT, "Distance between vertical marks: %.3f %s%n", report.verticalDistance(), unit);
            out.flush();
            log.info("Results written next to {} with prefix {}", annotated.getParent(), prefix);
            return 0;
        } catch (MeasurementException | StorageException e) {
            log.debug("Measurement of {} failed", filename, e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
