package com.project.image.fiducial.config;

import com.project.image.fiducial.detection.DetectionSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Default tuning of the detection passes; the web form and the command line may override the crop extra,
 * peak width and peak distance per request.
 */
@Configuration
public class DetectionConfig {
    private static final Logger log = LoggerFactory.getLogger(DetectionConfig.class);

    @Bean
    public DetectionSettings detectionSettings(
            @Value("${app.detection.vertical-crop-extra:50}") int verticalCropExtra,
            @Value("${app.detection.peak-width-max:80}") int peakWidthMax,
            @Value("${app.detection.peak-dist-max:1000}") int peakDistMax,
            @Value("${app.detection.smoothing-iterations:10}") int smoothingIterations,
            @Value("${app.detection.horizontal.window:9}") int horizontalWindow,
            @Value("${app.detection.horizontal.degree:2}") int horizontalDegree,
            @Value("${app.detection.vertical.window:21}") int verticalWindow,
            @Value("${app.detection.vertical.degree:2}") int verticalDegree) {
        DetectionSettings settings = new DetectionSettings(verticalCropExtra, peakWidthMax, peakDistMax,
                smoothingIterations, horizontalWindow, horizontalDegree, verticalWindow, verticalDegree);
        log.info("Detection settings: {}", settings);
        return settings;
    }
}
