package com.example.framepickr_backend.detection;

import com.example.framepickr_backend.exception.ModelLoadException;
import com.example.framepickr_backend.metrics.LumaImage;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.RectVector;
import org.bytedeco.opencv.opencv_core.Size;
import org.bytedeco.opencv.opencv_objdetect.CascadeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Haar cascade detector backed by OpenCV. The model file is validated once in {@link #load};
 * each calling thread then gets its own classifier instance, because OpenCV's
 * {@code CascadeClassifier} keeps scratch state while scanning.
 */
public final class CascadeRegionDetector implements RegionDetector {
    private static final Logger LOGGER = LoggerFactory.getLogger(CascadeRegionDetector.class);

    private final String name;
    private final String modelPath;
    private final CascadeParams params;
    private final ThreadLocal<CascadeClassifier> classifiers;

    private CascadeRegionDetector(String name, String modelPath, CascadeParams params) {
        this.name = name;
        this.modelPath = modelPath;
        this.params = params;
        this.classifiers = ThreadLocal.withInitial(() -> new CascadeClassifier(modelPath));
    }

    /**
     * Loads and validates a cascade file.
     *
     * @throws ModelLoadException when the file is missing, unreadable or not a cascade.
     */
    public static CascadeRegionDetector load(String name, Path modelFile, CascadeParams params) {
        if (modelFile == null || !Files.isRegularFile(modelFile) || !Files.isReadable(modelFile)) {
            throw new ModelLoadException("Cascade model '" + name + "' not found: " + modelFile);
        }
        String path = modelFile.toAbsolutePath().toString();
        CascadeClassifier check;
        try {
            check = new CascadeClassifier(path);
        } catch (RuntimeException | LinkageError e) {
            throw new ModelLoadException("Cascade model '" + name + "' could not be loaded: " + path, e);
        }
        try {
            if (check.empty()) {
                throw new ModelLoadException("Cascade model '" + name + "' is empty or corrupt: " + path);
            }
        } finally {
            check.close();
        }
        LOGGER.info("Cascade loaded name={} path={} scaleFactor={} minNeighbors={} minSize={}",
                name, path, params.scaleFactor(), params.minNeighbors(), params.minSize());
        return new CascadeRegionDetector(name, path, params);
    }

    @Override
    public List<Region> detect(LumaImage image) {
        try (Mat gray = new Mat(image.height(), image.width(), opencv_core.CV_8UC1);
             RectVector found = new RectVector();
             Size minSize = new Size(params.minSize(), params.minSize());
             Size maxSize = new Size()) {
            gray.data().put(image.pixels());
            classifiers.get().detectMultiScale(gray, found, params.scaleFactor(), params.minNeighbors(), 0, minSize, maxSize);
            List<Region> regions = new ArrayList<>((int) found.size());
            for (long i = 0; i < found.size(); i++) {
                Rect r = found.get(i);
                regions.add(new Region(r.x(), r.y(), r.width(), r.height()));
            }
            return regions;
        }
    }

    public String name() {
        return name;
    }

    public String modelPath() {
        return modelPath;
    }

    @Override
    public String toString() {
        return "CascadeRegionDetector[" + name + "]";
    }
}
