package com.project.image.fiducial.exceptions;

import java.nio.file.Path;

/** The input image path does not resolve to a regular file. */
public class MissingFileException extends MeasurementException {
    private final Path path;

    public MissingFileException(Path path) {
        super("The file " + path + " does not exist.");
        this.path = path;
    }

    public Path getPath() { return path; }
}
