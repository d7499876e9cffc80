package com.project.image.fiducial.detection;

import com.project.image.fiducial.exceptions.DegenerateRefinedCropException;
import com.project.image.fiducial.exceptions.InvalidCalibrationException;
import com.project.image.fiducial.exceptions.InvalidCropException;
import com.project.image.fiducial.exceptions.NoMarksFoundException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

class FiducialDetectorTest {

    private final FiducialDetector detector = new FiducialDetector(DetectionSettings.defaults());

    /** 1000x1000 mid-gray image with dark five-pixel bands at rows 100 and 900. */
    private static GrayscaleRaster darkBands() {
        return GrayscaleRaster.filled(1000, 1000, 128)
                .withRows(100, 105, 40)
                .withRows(900, 905, 40);
    }

    private static List<Integer> sorted(int a, int b) {
        return IntStream.of(a, b).sorted().boxed().toList();
    }

    @Test
    void horizontal_pass_findsDarkBands() {
        GrayscaleRaster raster = darkBands();
        LineDetectionPass horizontal = new LineDetectionPass(DetectionSettings.defaults().horizontalPass(500));

        DetectionResult result = horizontal.run(raster, CropWindow.NONE, Calibration.forRaster(raster, 10.0));

        // each band leaves an overshoot shoulder on either side (rows 93 and 111 around the first band);
        // both marks land on the same side of their band
        List<Integer> rows = sorted(result.absolutePeak1(), result.absolutePeak2());
        assertThat(rows.get(0)).isIn(93, 111);
        assertThat(rows.get(1)).isEqualTo(rows.get(0) + 800);
        assertThat(result.distance()).isCloseTo(8.0, within(1e-9));
    }

    @Test
    void detect_measuresBothDirections() {
        GrayscaleRaster raster = darkBands()
                .withColumns(200, 205, 220)
                .withColumns(800, 805, 220);

        FiducialMeasurement m = detector.detect(raster, new CropWindow(20, 20, 0, 0), 500, 10.0);

        assertThat(m.calibration().pixelsPerUnit()).isEqualTo(100.0);
        List<Integer> local = sorted(m.horizontal().localPeak1(), m.horizontal().localPeak2());
        assertThat(local).containsExactly(91, 891);
        assertThat(sorted(m.horizontal().absolutePeak1(), m.horizontal().absolutePeak2())).containsExactly(111, 911);
        assertThat(m.horizontal().distance()).isCloseTo(8.0, within(1e-9));
        // 20 + 91 + 50 rows above, 1000 - (20 + 891 - 50) rows below
        assertThat(m.refinedCrop()).isEqualTo(new CropWindow(161, 139, 0, 0));
        assertThat(m.bandStart()).isEqualTo(250);
        assertThat(m.bandEnd()).isEqualTo(750);

        List<Integer> columns = sorted(m.vertical().absolutePeak1(), m.vertical().absolutePeak2());
        assertThat(columns.get(0)).isCloseTo(202, within(5));
        assertThat(columns.get(1)).isCloseTo(802, within(5));
        assertThat(m.vertical().distance()).isCloseTo(6.0, within(1e-9));
    }

    @Test
    void distances_scaleWithRealWidth() {
        GrayscaleRaster raster = darkBands()
                .withColumns(200, 205, 220)
                .withColumns(800, 805, 220);

        FiducialMeasurement narrow = detector.detect(raster, new CropWindow(20, 20, 0, 0), 500, 10.0);
        FiducialMeasurement wide = detector.detect(raster, new CropWindow(20, 20, 0, 0), 500, 20.0);

        // distance = pixel separation * realWidth / rasterWidth
        assertThat(wide.horizontal().pixelSeparation()).isEqualTo(narrow.horizontal().pixelSeparation());
        assertThat(wide.horizontal().distance()).isCloseTo(16.0, within(1e-9));
        assertThat(wide.horizontal().distance()).isCloseTo(2 * narrow.horizontal().distance(), within(1e-9));
        assertThat(wide.vertical().distance()).isCloseTo(2 * narrow.vertical().distance(), within(1e-9));
        assertThat(wide.calibration().pixelsPerUnit()).isEqualTo(50.0);
    }

    @Test
    void constant_image_hasNoMarks() {
        GrayscaleRaster raster = GrayscaleRaster.filled(1000, 1000, 128);

        assertThatThrownBy(() -> detector.detect(raster, CropWindow.NONE, 500, 10.0))
                .isInstanceOf(NoMarksFoundException.class)
                .hasMessageContaining("horizontal");
    }

    @Test
    void marks_closerThanTwiceTheExtra_leaveNoStrip() {
        DetectionResult horizontal = horizontalAt(100, 180);

        assertThatThrownBy(() -> FiducialDetector.refinedWindow(1000, CropWindow.NONE, horizontal, 40))
                .isInstanceOf(DegenerateRefinedCropException.class)
                .hasMessageStartingWith("No sample edges detected");
    }

    @Test
    void refined_window_keepsCropColumns() {
        DetectionResult horizontal = horizontalAt(873, 73);

        CropWindow refined = FiducialDetector.refinedWindow(1000, new CropWindow(20, 20, 30, 40), horizontal, 50);

        assertThat(refined).isEqualTo(new CropWindow(143, 157, 30, 40));
        assertThat(refined.interiorHeight(1000)).isEqualTo(700);
    }

    @Test
    void invalid_inputs_areRejected() {
        GrayscaleRaster raster = darkBands();

        assertThatThrownBy(() -> detector.detect(raster, new CropWindow(600, 500, 0, 0), 500, 10.0))
                .isInstanceOf(InvalidCropException.class);
        assertThatThrownBy(() -> detector.detect(raster, CropWindow.NONE, 500, 0.0))
                .isInstanceOf(InvalidCalibrationException.class);
        assertThatThrownBy(() -> detector.detect(raster, CropWindow.NONE, 500, Double.NaN))
                .isInstanceOf(InvalidCalibrationException.class);
    }

    private static DetectionResult horizontalAt(int peak1, int peak2) {
        SpikePair spikes = new SpikePair(
                new SpikeCandidate(peak1 - 5, peak1, peak1 + 5, 10, 10),
                new SpikeCandidate(peak2 - 5, peak2, peak2 + 5, 8, 8), 2);
        return new DetectionResult(Axis.ROWS, 0, spikes, 0, new ProfileTrace(new double[0], new double[0], List.of()));
    }
}
