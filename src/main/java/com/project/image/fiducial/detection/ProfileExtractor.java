package com.project.image.fiducial.detection;

/**
 * Reduces a raster region to the mean intensity of each row or column.
 * <p>
 * Only a band of {@code bandWidth} samples centred in the orthogonal direction contributes to each mean;
 * the band is clamped to the region.
 */
public class ProfileExtractor {

    public double[] extract(GrayscaleRaster region, Axis axis, int bandWidth) {
        if (bandWidth <= 0) {
            throw new IllegalArgumentException("Band width must be positive, got " + bandWidth);
        }
        int length = axis == Axis.ROWS ? region.height() : region.width();
        int across = axis == Axis.ROWS ? region.width() : region.height();
        Band band = Band.centred(across, bandWidth);

        double[] profile = new double[length];
        for (int i = 0; i < length; i++) {
            long sum = 0;
            for (int j = band.start(); j < band.end(); j++) {
                sum += axis == Axis.ROWS ? region.get(j, i) : region.get(i, j);
            }
            profile[i] = sum / (double) band.size();
        }
        return profile;
    }

    /**
     * Half-open range {@code [start, end)} of samples averaged across the scan axis.
     */
    public record Band(int start, int end) {

        public static Band centred(int extent, int bandWidth) {
            int start = (int) Math.floor(extent / 2.0 - bandWidth / 2.0);
            int end = start + bandWidth;
            return new Band(Math.max(0, start), Math.min(extent, end));
        }

        public int size() {
            return end - start;
        }
    }
}
