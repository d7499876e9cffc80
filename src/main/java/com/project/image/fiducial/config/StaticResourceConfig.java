package com.project.image.fiducial.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.CacheControl;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.TimeUnit;

/**
 * Резултатите от измерването (анотирано изображение и двата профила) се записват в app.upload.dir
 * и се показват през /uploads/**.
 */
@Configuration
public class StaticResourceConfig implements WebMvcConfigurer {
    private static final Logger log = LoggerFactory.getLogger(StaticResourceConfig.class);

    // Същата настройка както в StorageService
    @Value("${app.upload.dir:uploads}")
    private String uploadDir;

    // Имената на резултатите съдържат времеви печат и никога не се презаписват
    @Value("${app.upload.cache-days:7}")
    private int cacheDays;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        Path resultsDir = Paths.get(uploadDir).toAbsolutePath().normalize();
        log.debug("Serving measurement results from {}", resultsDir);
        registry.addResourceHandler("/uploads/**")
                .addResourceLocations("file:" + resultsDir + "/")
                .setCacheControl(CacheControl.maxAge(cacheDays, TimeUnit.DAYS).cachePrivate());
    }
}
