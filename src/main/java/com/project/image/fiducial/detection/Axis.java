package com.project.image.fiducial.detection;

/**
 * Scan axis of a detection pass.
 */
public enum Axis {
    /** One profile value per row; a band of columns is averaged. Finds horizontal marks. */
    ROWS,
    /** One profile value per column; a band of rows is averaged. Finds vertical marks. */
    COLUMNS;

    public String describe() {
        return this == ROWS ? "horizontal" : "vertical";
    }
}
