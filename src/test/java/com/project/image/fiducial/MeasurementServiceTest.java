package com.project.image.fiducial;

import com.project.image.fiducial.DTOs.MeasurementReport;
import com.project.image.fiducial.DTOs.MeasurementRequest;
import com.project.image.fiducial.detection.CropWindow;
import com.project.image.fiducial.detection.DetectionSettings;
import com.project.image.fiducial.detection.GrayscaleRaster;
import com.project.image.fiducial.exceptions.MissingFileException;
import com.project.image.fiducial.exceptions.NoMarksFoundException;
import com.project.image.fiducial.service.AnnotationRenderer;
import com.project.image.fiducial.service.MeasurementService;
import com.project.image.fiducial.service.ProfilePlotRenderer;
import com.project.image.fiducial.service.RasterCodec;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class MeasurementServiceTest {
    private static final byte[] PNG_SIGNATURE = {(byte) 0x89, 'P', 'N', 'G'};

    private final RasterCodec codec = new RasterCodec();
    private final MeasurementService service =
            new MeasurementService(codec, new AnnotationRenderer("microns"), new ProfilePlotRenderer());

    private static MeasurementRequest request(double realWidth) {
        return new MeasurementRequest(realWidth, new CropWindow(20, 20, 0, 0), 500, DetectionSettings.defaults(), true);
    }

    @Test
    void measure_syntheticFiducials_rendersReport() {
        MeasurementReport report = service.measure(TestImages.fiducials(), request(10.0));

        assertThat(report.width()).isEqualTo(1000);
        assertThat(report.height()).isEqualTo(1000);
        assertThat(report.horizontalDistance()).isCloseTo(8.0, within(1e-9));
        assertThat(report.verticalDistance()).isCloseTo(6.0, within(1e-9));

        assertThat(report.annotatedPng()).startsWith(PNG_SIGNATURE);
        assertThat(report.horizontalPlotPng()).startsWith(PNG_SIGNATURE);
        assertThat(report.verticalPlotPng()).startsWith(PNG_SIGNATURE);

        GrayscaleRaster annotated = codec.decode(report.annotatedPng());
        assertThat(annotated.width()).isEqualTo(1000);
        assertThat(annotated.height()).isEqualTo(1000);
        GrayscaleRaster plot = codec.decode(report.verticalPlotPng());
        assertThat(plot.width()).isEqualTo(1200);
        assertThat(plot.height()).isEqualTo(800);
    }

    @Test
    void measureFile_readsImageFromDisk() throws Exception {
        Path input = Files.createTempDirectory("measure-test").resolve("grid.png");
        Files.write(input, TestImages.png(TestImages.fiducials()));

        MeasurementReport report = service.measureFile(input, request(10.0));

        assertThat(report.horizontalDistance()).isCloseTo(8.0, within(1e-9));
    }

    @Test
    void measureFile_missingFile_fails() {
        Path missing = Path.of(System.getProperty("java.io.tmpdir"), "does-not-exist.tif");

        assertThatThrownBy(() -> service.measureFile(missing, request(10.0)))
                .isInstanceOf(MissingFileException.class);
    }

    @Test
    void failed_pass_rendersNothing() {
        AnnotationRenderer annotations = mock(AnnotationRenderer.class);
        ProfilePlotRenderer plots = mock(ProfilePlotRenderer.class);
        MeasurementService isolated = new MeasurementService(codec, annotations, plots);

        assertThatThrownBy(() -> isolated.measure(GrayscaleRaster.filled(1000, 1000, 128), request(10.0)))
                .isInstanceOf(NoMarksFoundException.class);
        verifyNoInteractions(annotations, plots);
    }
}
