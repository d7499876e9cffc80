package com.project.image.fiducial.cli;

import com.project.image.fiducial.detection.DetectionSettings;
import com.project.image.fiducial.service.MeasurementService;
import com.project.image.fiducial.service.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

import java.util.Arrays;

/**
 * Runs {@link MeasureCommand} once on startup when {@code app.cli.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "app.cli", name = "enabled", havingValue = "true")
public class MeasurementCommandLineRunner implements CommandLineRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(MeasurementCommandLineRunner.class);

    private final MeasurementService measurementService;
    private final StorageService storageService;
    private final DetectionSettings detectionSettings;
    private final String unit;
    private int exitCode;

    public MeasurementCommandLineRunner(MeasurementService measurementService, StorageService storageService,
                                        DetectionSettings detectionSettings,
                                        @Value("${app.measurement.unit:microns}") String unit) {
        this.measurementService = measurementService;
        this.storageService = storageService;
        this.detectionSettings = detectionSettings;
        this.unit = unit;
    }

    @Override
    public void run(String... args) {
        String[] commandArgs = commandArguments(args);
        log.debug("Running measure command with {}", Arrays.toString(commandArgs));
        MeasureCommand command = new MeasureCommand(measurementService, storageService, detectionSettings, unit);
        exitCode = new CommandLine(command).execute(commandArgs);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Drops Spring property arguments such as {@code --app.cli.enabled=true}; the command's own options carry
     * no dot in their names.
     */
    static String[] commandArguments(String[] args) {
        return Arrays.stream(args)
                .filter(arg -> !isPropertyArgument(arg))
                .toArray(String[]::new);
    }

    private static boolean isPropertyArgument(String arg) {
        if (!arg.startsWith("--")) {
            return false;
        }
        int eq = arg.indexOf('=');
        String name = eq < 0 ? arg.substring(2) : arg.substring(2, eq);
        return name.contains(".");
    }
}
