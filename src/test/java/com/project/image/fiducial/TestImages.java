package com.project.image.fiducial;

import com.project.image.fiducial.detection.GrayscaleRaster;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/** Synthetic microscope images shared by the tests. */
public final class TestImages {
    private TestImages() {}

    /**
     * 1000x1000 mid-gray image with dark bands at rows 100 and 900 and bright columns at 200 and 800.
     * With realWidth 10 the marks are 8.0 and 6.0 units apart.
     */
    public static GrayscaleRaster fiducials() {
        return GrayscaleRaster.filled(1000, 1000, 128)
                .withColumns(200, 205, 220)
                .withColumns(800, 805, 220)
                .withRows(100, 105, 40)
                .withRows(900, 905, 40);
    }

    public static byte[] png(GrayscaleRaster raster) throws IOException {
        BufferedImage img = new BufferedImage(raster.width(), raster.height(), BufferedImage.TYPE_BYTE_GRAY);
        img.getRaster().setDataElements(0, 0, raster.width(), raster.height(), raster.toByteArray());
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(img, "png", out);
        return out.toByteArray();
    }
}
