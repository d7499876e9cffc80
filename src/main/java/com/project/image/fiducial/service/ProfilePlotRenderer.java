package com.project.image.fiducial.service;

import com.project.image.fiducial.detection.Axis;
import com.project.image.fiducial.detection.DetectionResult;
import com.project.image.fiducial.detection.Extremum;
import com.project.image.fiducial.detection.ProfileTrace;
import com.project.image.fiducial.detection.SpikeCandidate;
import com.project.image.fiducial.exceptions.MeasurementException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.MatOfPoint;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Diagnostic plot of one pass: raw and smoothed profile, detected extrema and the selected spikes.
 */
@Service
public class ProfilePlotRenderer {

    private static final int WIDTH = 1200;
    private static final int HEIGHT = 800;
    private static final int MARGIN_LEFT = 90;
    private static final int MARGIN_RIGHT = 40;
    private static final int MARGIN_TOP = 70;
    private static final int MARGIN_BOTTOM = 80;
    private static final int FONT = Imgproc.FONT_HERSHEY_SIMPLEX;

    // BGR
    private static final Scalar WHITE = new Scalar(255, 255, 255);
    private static final Scalar BLACK = new Scalar(0, 0, 0);
    private static final Scalar GRAY = new Scalar(128, 128, 128);
    private static final Scalar RAW_COLOR = new Scalar(255, 0, 0);
    private static final Scalar SMOOTHED_COLOR = new Scalar(0, 0, 255);
    private static final Scalar MIN_COLOR = new Scalar(0, 128, 0);
    private static final Scalar MAX_COLOR = new Scalar(0, 165, 255);

    public byte[] render(DetectionResult result) {
        RasterCodec.requireOpenCv();
        ProfileTrace trace = result.trace();
        boolean rows = result.axis() == Axis.ROWS;
        String title = rows
                ? "Average gray level of each row vs pixel distance from the top"
                : "Average gray level of each column vs pixel distance from the left";
        String xLabel = rows
                ? "Distance from top of image, [pixels]"
                : "Distance from the left of image, [pixels]";
        int tickStep = rows ? 200 : 500;

        Mat canvas = new Mat(HEIGHT, WIDTH, CvType.CV_8UC3, WHITE);
        try {
            Frame frame = Frame.of(trace);
            drawAxes(canvas, frame, tickStep, title, xLabel);
            drawCurve(canvas, frame, trace.raw(), RAW_COLOR);
            drawCurve(canvas, frame, trace.smoothed(), SMOOTHED_COLOR);
            drawExtrema(canvas, frame, trace);
            drawSpikeLabel(canvas, frame, result.spikes().spike1(), "Spike 1");
            drawSpikeLabel(canvas, frame, result.spikes().spike2(), "Spike 2");
            drawLegend(canvas);
            return toPng(canvas);
        } finally {
            canvas.release();
        }
    }

    private void drawAxes(Mat canvas, Frame frame, int tickStep, String title, String xLabel) {
        Imgproc.rectangle(canvas, new Point(MARGIN_LEFT, MARGIN_TOP),
                new Point(MARGIN_LEFT + plotWidth(), MARGIN_TOP + plotHeight()), BLACK, 1);

        int length = frame.length();
        for (int tick = 0; tick <= length; tick += tickStep) {
            drawXTick(canvas, frame, tick);
        }
        if (length % tickStep != 0) {
            drawXTick(canvas, frame, length);
        }

        for (int i = 0; i <= 5; i++) {
            double value = frame.yMin() + i * (frame.yMax() - frame.yMin()) / 5.0;
            int y = frame.y(value);
            Imgproc.line(canvas, new Point(MARGIN_LEFT - 5, y), new Point(MARGIN_LEFT, y), BLACK, 1);
            String text = String.format(Locale.ROOT, "%.1f", value);
            text(canvas, text, MARGIN_LEFT - 8 - textWidth(text, 0.45), y + 5, 0.45, BLACK, 1);
        }

        text(canvas, title, (WIDTH - textWidth(title, 0.7)) / 2, 30, 0.7, BLACK, 2);
        text(canvas, xLabel, (WIDTH - textWidth(xLabel, 0.55)) / 2, HEIGHT - 25, 0.55, BLACK, 1);
        text(canvas, "Average gray level", 10, MARGIN_TOP - 12, 0.55, BLACK, 1);
    }

    private void drawXTick(Mat canvas, Frame frame, int tick) {
        int x = frame.x(tick);
        int bottom = MARGIN_TOP + plotHeight();
        Imgproc.line(canvas, new Point(x, bottom), new Point(x, bottom + 5), BLACK, 1);
        String label = Integer.toString(tick);
        text(canvas, label, x - textWidth(label, 0.45) / 2, bottom + 22, 0.45, BLACK, 1);
    }

    private void drawCurve(Mat canvas, Frame frame, double[] values, Scalar color) {
        Point[] points = new Point[values.length];
        for (int i = 0; i < values.length; i++) {
            points[i] = new Point(frame.x(i), frame.y(values[i]));
        }
        MatOfPoint curve = new MatOfPoint(points);
        try {
            Imgproc.polylines(canvas, List.of(curve), false, color, 2, Imgproc.LINE_AA);
        } finally {
            curve.release();
        }
    }

    private void drawExtrema(Mat canvas, Frame frame, ProfileTrace trace) {
        for (Extremum e : trace.extrema()) {
            Point p = new Point(frame.x(e.index()), frame.y(trace.smoothed()[e.index()]));
            Imgproc.circle(canvas, p, 4, e.isMax() ? MAX_COLOR : MIN_COLOR, -1, Imgproc.LINE_AA);
        }
    }

    private void drawSpikeLabel(Mat canvas, Frame frame, SpikeCandidate spike, String label) {
        if (spike.isEmpty()) {
            return;
        }
        text(canvas, label, frame.x(spike.peak()), frame.y(spike.peakValue()) - 10, 0.5, BLACK, 1);
    }

    private void drawLegend(Mat canvas) {
        String[] labels = {"raw average", "savitzky-golay filter", "min", "max"};
        Scalar[] colors = {RAW_COLOR, SMOOTHED_COLOR, MIN_COLOR, MAX_COLOR};
        int x = WIDTH / 2 - 100;
        int y = MARGIN_TOP + 10;
        Imgproc.rectangle(canvas, new Point(x, y), new Point(x + 210, y + 20 * labels.length + 8), GRAY, 1);
        for (int i = 0; i < labels.length; i++) {
            int rowY = y + 18 + 20 * i;
            if (i < 2) {
                Imgproc.line(canvas, new Point(x + 8, rowY - 4), new Point(x + 32, rowY - 4), colors[i], 2);
            } else {
                Imgproc.circle(canvas, new Point(x + 20, rowY - 4), 4, colors[i], -1, Imgproc.LINE_AA);
            }
            text(canvas, labels[i], x + 40, rowY, 0.45, BLACK, 1);
        }
    }

    private static void text(Mat canvas, String text, int x, int y, double scale, Scalar color, int thickness) {
        Imgproc.putText(canvas, text, new Point(x, y), FONT, scale, color, thickness, Imgproc.LINE_AA);
    }

    private static int textWidth(String text, double scale) {
        Size size = Imgproc.getTextSize(text, FONT, scale, 1, new int[1]);
        return (int) size.width;
    }

    private static int plotWidth() {
        return WIDTH - MARGIN_LEFT - MARGIN_RIGHT;
    }

    private static int plotHeight() {
        return HEIGHT - MARGIN_TOP - MARGIN_BOTTOM;
    }

    /** Maps profile index and gray level to canvas coordinates. */
    private record Frame(int length, double yMin, double yMax) {

        static Frame of(ProfileTrace trace) {
            double lo = Double.POSITIVE_INFINITY;
            double hi = Double.NEGATIVE_INFINITY;
            for (double[] series : new double[][]{trace.raw(), trace.smoothed()}) {
                for (double v : series) {
                    lo = Math.min(lo, v);
                    hi = Math.max(hi, v);
                }
            }
            double pad = Math.max(1.0, (hi - lo) * 0.05);
            return new Frame(Math.max(1, trace.length()), lo - pad, hi + pad);
        }

        int x(double index) {
            return MARGIN_LEFT + (int) Math.round(index / length * plotWidth());
        }

        int y(double value) {
            double t = (value - yMin) / (yMax - yMin);
            return MARGIN_TOP + plotHeight() - (int) Math.round(t * plotHeight());
        }
    }

    private static byte[] toPng(Mat canvas) {
        MatOfByte buffer = new MatOfByte();
        try {
            if (!Imgcodecs.imencode(".png", canvas, buffer)) {
                throw new MeasurementException("Failed to encode profile plot");
            }
            return buffer.toArray();
        } finally {
            buffer.release();
        }
    }
}
