package com.project.image.fiducial.detection;

import com.project.image.fiducial.exceptions.DegenerateRefinedCropException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the sample's horizontal edge marks, then the vertical marks in the strip between them.
 */
public class FiducialDetector {
    private static final Logger log = LoggerFactory.getLogger(FiducialDetector.class);

    private final DetectionSettings settings;

    public FiducialDetector(DetectionSettings settings) {
        this.settings = settings;
    }

    public DetectionSettings getSettings() {
        return settings;
    }

    /**
     * @param crop      margins excluded from the horizontal pass
     * @param bandWidth columns, centred in the crop, averaged by the horizontal pass
     * @param realWidth real-world width of the whole raster
     */
    public FiducialMeasurement detect(GrayscaleRaster raster, CropWindow crop, int bandWidth, double realWidth) {
        Calibration calibration = Calibration.forRaster(raster, realWidth);
        crop.validateFor(raster);

        DetectionResult horizontal = new LineDetectionPass(settings.horizontalPass(bandWidth))
                .run(raster, crop, calibration);
        log.debug("Horizontal marks at rows {} and {}", horizontal.absolutePeak1(), horizontal.absolutePeak2());

        CropWindow refined = refinedWindow(raster.height(), crop, horizontal, settings.verticalCropExtra());
        int rows = refined.interiorHeight(raster.height());
        DetectionResult vertical = new LineDetectionPass(settings.verticalPass(rows))
                .run(raster, refined, calibration);
        log.debug("Vertical marks at columns {} and {}", vertical.absolutePeak1(), vertical.absolutePeak2());

        ProfileExtractor.Band band = ProfileExtractor.Band.centred(crop.interiorWidth(raster.width()), bandWidth);
        return new FiducialMeasurement(calibration, crop, crop.left() + band.start(), crop.left() + band.end(),
                horizontal, refined, vertical);
    }

    /**
     * Strip strictly between the two horizontal marks, {@code extra} rows further in on each side, over the
     * same columns as the original crop.
     */
    static CropWindow refinedWindow(int rasterHeight, CropWindow crop, DetectionResult horizontal, int extra) {
        int lower = horizontal.lowerPeak();
        int upper = horizontal.upperPeak();
        if (upper - lower - 2 * extra <= 0) {
            throw new DegenerateRefinedCropException(horizontal.localPeak1(), horizontal.localPeak2(), extra);
        }
        int top = crop.top() + lower + extra;
        int bottom = rasterHeight - (crop.top() + upper - extra);
        return new CropWindow(top, bottom, crop.left(), crop.right());
    }
}
