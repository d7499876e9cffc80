package com.project.image.fiducial.detection;

import java.util.Arrays;

/**
 * Immutable 8-bit grayscale image, stored row-major.
 */
public final class GrayscaleRaster {
    private final int width;
    private final int height;
    private final byte[] pixels;

    public GrayscaleRaster(int width, int height, byte[] pixels) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Raster must have positive size, got " + width + "x" + height);
        }
        if (pixels.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " samples, got " + pixels.length);
        }
        this.width = width;
        this.height = height;
        this.pixels = pixels.clone();
    }

    public static GrayscaleRaster filled(int width, int height, int value) {
        byte[] data = new byte[width * height];
        Arrays.fill(data, (byte) value);
        return new GrayscaleRaster(width, height, data);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /** Sample at (x, y) in the range 0..255. */
    public int get(int x, int y) {
        return pixels[y * width + x] & 0xFF;
    }

    /** Copy of the row-major samples. */
    public byte[] toByteArray() {
        return pixels.clone();
    }

    public GrayscaleRaster crop(CropWindow window) {
        window.validateFor(this);
        int cropWidth = width - window.left() - window.right();
        int cropHeight = height - window.top() - window.bottom();
        byte[] out = new byte[cropWidth * cropHeight];
        for (int y = 0; y < cropHeight; y++) {
            System.arraycopy(pixels, (y + window.top()) * width + window.left(), out, y * cropWidth, cropWidth);
        }
        return new GrayscaleRaster(cropWidth, cropHeight, out);
    }

    /** Raster with rows {@code [from, to)} set to {@code value}; used to build synthetic images. */
    public GrayscaleRaster withRows(int from, int to, int value) {
        byte[] out = pixels.clone();
        for (int y = Math.max(0, from); y < Math.min(height, to); y++) {
            Arrays.fill(out, y * width, (y + 1) * width, (byte) value);
        }
        return new GrayscaleRaster(width, height, out);
    }

    /** Raster with columns {@code [from, to)} set to {@code value}; used to build synthetic images. */
    public GrayscaleRaster withColumns(int from, int to, int value) {
        byte[] out = pixels.clone();
        for (int y = 0; y < height; y++) {
            for (int x = Math.max(0, from); x < Math.min(width, to); x++) {
                out[y * width + x] = (byte) value;
            }
        }
        return new GrayscaleRaster(width, height, out);
    }

    @Override
    public String toString() {
        return "GrayscaleRaster[" + width + "x" + height + "]";
    }
}
