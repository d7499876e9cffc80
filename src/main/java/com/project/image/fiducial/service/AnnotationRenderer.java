package com.project.image.fiducial.service;

import com.project.image.fiducial.detection.CropWindow;
import com.project.image.fiducial.detection.DetectionResult;
import com.project.image.fiducial.detection.FiducialMeasurement;
import com.project.image.fiducial.detection.GrayscaleRaster;
import com.project.image.fiducial.exceptions.MeasurementException;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Draws the crop region, the detected marks and the measured distances on a colour copy of the image.
 */
@Service
public class AnnotationRenderer {
    private static final Logger log = LoggerFactory.getLogger(AnnotationRenderer.class);

    // BGR
    private static final Scalar CROP_COLOR = new Scalar(0, 0, 255);
    private static final Scalar REGION_COLOR = new Scalar(0, 255, 0);
    private static final Scalar SCALE_COLOR = new Scalar(255, 0, 255);
    private static final Scalar HORIZONTAL_COLOR = new Scalar(0, 255, 255);
    private static final Scalar VERTICAL_COLOR = new Scalar(255, 100, 0);
    private static final double TIP_LENGTH = 0.04;
    private static final int REFERENCE_WIDTH = 4096;

    private final String unit;

    public AnnotationRenderer(@Value("${app.measurement.unit:microns}") String unit) {
        this.unit = unit;
    }

    public byte[] render(GrayscaleRaster raster, FiducialMeasurement measurement) {
        Mat gray = RasterCodec.toMat(raster);
        Mat canvas = new Mat();
        Imgproc.cvtColor(gray, canvas, Imgproc.COLOR_GRAY2BGR);
        gray.release();
        try {
            Style style = new Style(raster.width());
            drawCrop(canvas, raster, measurement, style);
            drawHorizontalMarks(canvas, raster, measurement, style);
            drawVerticalMarks(canvas, raster, measurement, style);
            return encodePng(canvas);
        } finally {
            canvas.release();
        }
    }

    private void drawCrop(Mat canvas, GrayscaleRaster raster, FiducialMeasurement m, Style style) {
        int w = raster.width();
        int h = raster.height();
        CropWindow crop = m.crop();

        hLine(canvas, crop.top(), w, CROP_COLOR, style.thickness(5));
        hLine(canvas, h - crop.bottom(), w, CROP_COLOR, style.thickness(5));
        vLine(canvas, crop.left(), h, CROP_COLOR, style.thickness(5));
        vLine(canvas, w - crop.right(), h, CROP_COLOR, style.thickness(5));

        Point centre = new Point(crop.left() + crop.interiorWidth(w) / 2.0, crop.top() + crop.interiorHeight(h) / 2.0);
        Imgproc.circle(canvas, centre, style.thickness(10), REGION_COLOR, style.thickness(3));

        // supplied image width
        int y = clamp(h - crop.bottom() / 2, 0, h - 1);
        doubleArrow(canvas, new Point(0, y), new Point(w, y), SCALE_COLOR, style.thickness(6));
        label(canvas, format(m.calibration().realWidth()), new Point(centre.x - style.offset(100), y - style.offset(15)),
                SCALE_COLOR, style);

        vLine(canvas, m.bandStart(), h, REGION_COLOR, style.thickness(2));
        vLine(canvas, m.bandEnd(), h, REGION_COLOR, style.thickness(2));
    }

    private void drawHorizontalMarks(Mat canvas, GrayscaleRaster raster, FiducialMeasurement m, Style style) {
        int w = raster.width();
        int h = raster.height();
        DetectionResult horizontal = m.horizontal();
        int y1 = horizontal.absolutePeak1();
        int y2 = horizontal.absolutePeak2();

        hLine(canvas, y1, w, HORIZONTAL_COLOR, style.thickness(3));
        hLine(canvas, y2, w, HORIZONTAL_COLOR, style.thickness(3));
        double x = w * 0.75;
        doubleArrow(canvas, new Point(x, y1), new Point(x, y2), HORIZONTAL_COLOR, style.thickness(6));
        label(canvas, format(horizontal.distance()), new Point(x + style.offset(10), (y1 + y2) / 2.0),
                HORIZONTAL_COLOR, style);

        CropWindow refined = m.refinedCrop();
        hLine(canvas, refined.top(), w, REGION_COLOR, style.thickness(2));
        hLine(canvas, h - refined.bottom(), w, REGION_COLOR, style.thickness(2));
    }

    private void drawVerticalMarks(Mat canvas, GrayscaleRaster raster, FiducialMeasurement m, Style style) {
        int h = raster.height();
        DetectionResult vertical = m.vertical();
        int x1 = vertical.offset() + vertical.lowerPeak();
        int x2 = vertical.offset() + vertical.upperPeak();

        vLine(canvas, x1, h, VERTICAL_COLOR, style.thickness(3));
        vLine(canvas, x2, h, VERTICAL_COLOR, style.thickness(3));
        int y = clamp(h - m.crop().bottom() - style.offset(50), 0, h - 1);
        doubleArrow(canvas, new Point(x1, y), new Point(x2, y), VERTICAL_COLOR, style.thickness(6));
        double centreX = m.crop().left() + m.crop().interiorWidth(raster.width()) / 2.0;
        label(canvas, format(vertical.distance()), new Point(centreX - style.offset(100), y - style.offset(20)),
                VERTICAL_COLOR, style);
    }

    private String format(double value) {
        return String.format(Locale.ROOT, "%.3f %s", value, unit);
    }

    private static void hLine(Mat canvas, int y, int width, Scalar color, int thickness) {
        Imgproc.line(canvas, new Point(0, y), new Point(width, y), color, thickness);
    }

    private static void vLine(Mat canvas, int x, int height, Scalar color, int thickness) {
        Imgproc.line(canvas, new Point(x, 0), new Point(x, height), color, thickness);
    }

    private static void doubleArrow(Mat canvas, Point a, Point b, Scalar color, int thickness) {
        Imgproc.arrowedLine(canvas, a, b, color, thickness, Imgproc.LINE_8, 0, TIP_LENGTH);
        Imgproc.arrowedLine(canvas, b, a, color, thickness, Imgproc.LINE_8, 0, TIP_LENGTH);
    }

    private static void label(Mat canvas, String text, Point origin, Scalar color, Style style) {
        Imgproc.putText(canvas, text, origin, Imgproc.FONT_HERSHEY_SIMPLEX, style.fontScale(), color,
                style.thickness(10));
    }

    private static int clamp(int v, int lo, int hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    private static byte[] encodePng(Mat canvas) {
        MatOfByte buffer = new MatOfByte();
        try {
            if (!Imgcodecs.imencode(".png", canvas, buffer)) {
                throw new MeasurementException("Failed to encode annotated image");
            }
            byte[] png = buffer.toArray();
            log.debug("Encoded annotated image ({} bytes)", png.length);
            return png;
        } finally {
            buffer.release();
        }
    }

    /** Line widths and text size tuned for 4096-pixel-wide micrographs, scaled to the actual width. */
    private record Style(double scale) {
        Style(int imageWidth) {
            this(Math.max(0.25, imageWidth / (double) REFERENCE_WIDTH));
        }

        int thickness(int base) {
            return Math.max(1, (int) Math.round(base * scale));
        }

        int offset(int base) {
            return (int) Math.round(base * scale);
        }

        double fontScale() {
            return 3 * scale;
        }
    }
}
