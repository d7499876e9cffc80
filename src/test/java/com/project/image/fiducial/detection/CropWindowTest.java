package com.project.image.fiducial.detection;

import com.project.image.fiducial.exceptions.InvalidCropException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CropWindowTest {

    @Test
    void negative_margin_isRejected() {
        assertThatThrownBy(() -> new CropWindow(0, -1, 0, 0)).isInstanceOf(InvalidCropException.class);
    }

    @Test
    void crop_consumingWholeImage_isRejected() {
        GrayscaleRaster raster = GrayscaleRaster.filled(100, 80, 0);

        assertThatThrownBy(() -> raster.crop(new CropWindow(40, 40, 0, 0)))
                .isInstanceOf(InvalidCropException.class)
                .hasMessageContaining("100x80");
        assertThatThrownBy(() -> raster.crop(new CropWindow(0, 0, 60, 50)))
                .isInstanceOf(InvalidCropException.class);
    }

    @Test
    void crop_copiesInteriorRegion() {
        GrayscaleRaster raster = GrayscaleRaster.filled(10, 8, 0).withRows(2, 3, 200).withColumns(5, 6, 100);

        GrayscaleRaster region = raster.crop(new CropWindow(2, 1, 3, 2));

        assertThat(region.width()).isEqualTo(5);
        assertThat(region.height()).isEqualTo(5);
        assertThat(region.get(0, 0)).isEqualTo(200);
        assertThat(region.get(2, 3)).isEqualTo(100);
        assertThat(region.get(0, 1)).isZero();
    }

    @Test
    void offset_followsScanAxis() {
        CropWindow window = new CropWindow(7, 1, 3, 2);

        assertThat(window.offsetAlong(Axis.ROWS)).isEqualTo(7);
        assertThat(window.offsetAlong(Axis.COLUMNS)).isEqualTo(3);
        assertThat(window.interiorWidth(20)).isEqualTo(15);
        assertThat(window.interiorHeight(20)).isEqualTo(12);
    }
}
