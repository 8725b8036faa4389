package com.example.framepickr_backend.config;

import com.example.framepickr_backend.detection.CascadeParams;
import com.example.framepickr_backend.detection.CascadeRegionDetector;
import com.example.framepickr_backend.detection.DetectorModels;
import com.example.framepickr_backend.exception.ModelLoadException;
import org.bytedeco.javacpp.Loader;
import org.bytedeco.opencv.global.opencv_objdetect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Function;

/**
 * Loads the face, eye and smile cascades once. A cascade is looked up in the configured model
 * directory first, then in the copy bundled with the OpenCV jar. When neither exists, or the file
 * is corrupt, context startup fails, so the service never answers scoring requests with silently
 * degraded face metrics.
 */
@Configuration
@EnableConfigurationProperties(DetectorProperties.class)
public class DetectorConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(DetectorConfig.class);
    private static final String BUNDLED_DIR = "/share/opencv4/haarcascades/";

    @Bean
    public DetectorModels detectorModels(DetectorProperties properties) {
        Path dir = Path.of(properties.getModelDir()).toAbsolutePath().normalize();
        Function<String, Optional<Path>> bundled = properties.isBundledFallback()
                ? DetectorConfig::bundledCascade
                : file -> Optional.empty();
        LOGGER.info("Detector models loading from dir={} bundledFallback={}", dir, properties.isBundledFallback());
        DetectorModels models = new DetectorModels(
                load("face", dir, properties.getFace(), bundled),
                load("eye", dir, properties.getEye(), bundled),
                load("smile", dir, properties.getSmile(), bundled));
        LOGGER.info("Detector models ready dir={}", dir);
        return models;
    }

    static CascadeRegionDetector load(String name, Path dir, DetectorProperties.Model model,
                                      Function<String, Optional<Path>> bundled) {
        if (model == null || model.getFile() == null || model.getFile().isBlank()) {
            throw new ModelLoadException("No model file configured for detector '" + name + "'");
        }
        CascadeParams params;
        try {
            params = new CascadeParams(model.getScaleFactor(), model.getMinNeighbors(), model.getMinSize());
        } catch (IllegalArgumentException e) {
            throw new ModelLoadException("Invalid parameters for detector '" + name + "': " + e.getMessage(), e);
        }
        return CascadeRegionDetector.load(name, resolveModel(name, dir, model.getFile(), bundled), params);
    }

    /**
     * @return the file in {@code dir} when present, otherwise the bundled copy.
     * @throws ModelLoadException when neither exists.
     */
    static Path resolveModel(String name, Path dir, String file, Function<String, Optional<Path>> bundled) {
        Path local = dir.resolve(file);
        if (Files.isRegularFile(local)) {
            return local;
        }
        Optional<Path> fallback = bundled.apply(file);
        if (fallback.isPresent()) {
            LOGGER.warn("Detector model missing locally name={} path={}; using bundled copy={}", name, local, fallback.get());
            return fallback.get();
        }
        throw new ModelLoadException("Cascade model '" + name + "' not found: " + local + " (no bundled copy)");
    }

    /**
     * Extracts a Haar cascade shipped in the OpenCV platform jar to the JavaCPP cache.
     */
    public static Optional<Path> bundledCascade(String file) {
        String resource = "/org/bytedeco/opencv/" + Loader.getPlatform() + BUNDLED_DIR + file;
        try {
            File cached = Loader.cacheResource(opencv_objdetect.class, resource);
            return cached != null && cached.isFile() ? Optional.of(cached.toPath()) : Optional.empty();
        } catch (IOException e) {
            LOGGER.warn("Bundled cascade unavailable resource={} cause={}", resource, e.toString());
            return Optional.empty();
        }
    }
}
