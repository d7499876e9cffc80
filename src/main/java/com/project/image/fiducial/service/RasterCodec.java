package com.project.image.fiducial.service;

import com.project.image.fiducial.detection.GrayscaleRaster;
import com.project.image.fiducial.exceptions.MeasurementException;
import com.project.image.fiducial.exceptions.MissingFileException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Decodes images into 8-bit grayscale rasters and back into OpenCV matrices.
 */
@Service
public class RasterCodec {
    private static final Logger log = LoggerFactory.getLogger(RasterCodec.class);

    private static boolean openCvLoaded;

    static {
        try {
            nu.pattern.OpenCV.loadLocally();
            openCvLoaded = true;
            log.info("OpenCV loaded successfully");
        } catch (Exception | UnsatisfiedLinkError e) {
            log.error("Failed to load OpenCV", e);
        }
    }

    static void requireOpenCv() {
        if (!openCvLoaded) {
            throw new MeasurementException("OpenCV native library is not available");
        }
    }

    public GrayscaleRaster read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new MissingFileException(path);
        }
        requireOpenCv();
        Mat mat = Imgcodecs.imread(path.toString(), Imgcodecs.IMREAD_GRAYSCALE);
        if (mat.empty()) {
            throw new MeasurementException("Cannot decode image " + path);
        }
        try {
            GrayscaleRaster raster = toRaster(mat);
            log.debug("Read {} from {}", raster, path);
            return raster;
        } finally {
            mat.release();
        }
    }

    public GrayscaleRaster decode(byte[] encoded) {
        requireOpenCv();
        MatOfByte buffer = new MatOfByte(encoded);
        Mat mat = Imgcodecs.imdecode(buffer, Imgcodecs.IMREAD_GRAYSCALE);
        buffer.release();
        if (mat.empty()) {
            throw new MeasurementException("The file is not a valid image or is corrupted.");
        }
        try {
            return toRaster(mat);
        } finally {
            mat.release();
        }
    }

    static GrayscaleRaster toRaster(Mat gray) {
        Mat source = gray.isContinuous() ? gray : gray.clone();
        byte[] data = new byte[source.rows() * source.cols()];
        source.get(0, 0, data);
        return new GrayscaleRaster(source.cols(), source.rows(), data);
    }

    static Mat toMat(GrayscaleRaster raster) {
        requireOpenCv();
        Mat mat = new Mat(raster.height(), raster.width(), CvType.CV_8UC1);
        mat.put(0, 0, raster.toByteArray());
        return mat;
    }
}
