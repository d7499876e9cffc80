package com.project.image.fiducial.detection;

import com.project.image.fiducial.exceptions.NoMarksFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * One extract, smooth, find, select cycle along a single axis.
 */
public class LineDetectionPass {
    private static final Logger log = LoggerFactory.getLogger(LineDetectionPass.class);

    private final PassSettings settings;
    private final ProfileExtractor extractor = new ProfileExtractor();
    private final ProfileSmoother smoother;
    private final ExtremaFinder extremaFinder = new ExtremaFinder();
    private final SpikePairSelector selector;

    public LineDetectionPass(PassSettings settings) {
        this.settings = settings;
        this.smoother = new ProfileSmoother(settings.smoothingWindow(), settings.smoothingDegree());
        this.selector = new SpikePairSelector(settings.peakWidthMax(), settings.peakDistMax());
    }

    public PassSettings getSettings() {
        return settings;
    }

    public DetectionResult run(GrayscaleRaster raster, CropWindow window, Calibration calibration) {
        GrayscaleRaster region = raster.crop(window);
        log.debug("{} pass over {} (band {})", settings.axis().describe(), region, settings.bandWidth());
        double[] profile = extractor.extract(region, settings.axis(), settings.bandWidth());
        return runOnProfile(profile, window.offsetAlong(settings.axis()), calibration);
    }

    /**
     * Detect on an already extracted profile.
     *
     * @param offset position of {@code profile[0]} in the original raster
     */
    public DetectionResult runOnProfile(double[] profile, int offset, Calibration calibration) {
        double[] smoothed = smoother.smooth(profile, settings.smoothingIterations());
        List<Extremum> extrema = extremaFinder.find(smoothed);
        SpikePair spikes = selector.select(extrema, smoothed);
        log.debug("{} pass: {} extrema, {} eligible spikes", settings.axis().describe(), extrema.size(),
                spikes.eligibleCount());

        if (!spikes.isComplete()) {
            throw new NoMarksFoundException(settings.axis(), spikes.eligibleCount(),
                    settings.peakWidthMax(), settings.peakDistMax());
        }
        double distance = calibration.toUnits(spikes.separation());
        return new DetectionResult(settings.axis(), offset, spikes, distance,
                new ProfileTrace(profile, smoothed, extrema));
    }
}
