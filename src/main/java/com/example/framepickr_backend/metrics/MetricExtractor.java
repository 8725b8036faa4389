package com.example.framepickr_backend.metrics;

import com.example.framepickr_backend.detection.DetectorModels;
import com.example.framepickr_backend.detection.Region;
import com.example.framepickr_backend.detection.RegionDetector;
import com.example.framepickr_backend.model.MetricSet;
import com.example.framepickr_backend.model.NormalizedImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Computes sharpness, brightness and face/eye/smile counts for one normalized image.
 * Output depends only on the pixels, so the same bytes always give the same metrics.
 */
@Component
public class MetricExtractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(MetricExtractor.class);

    private static final Comparator<Region> LARGEST_FIRST = Comparator
            .comparingLong(Region::area).reversed()
            .thenComparingInt(Region::y)
            .thenComparingInt(Region::x);

    private final DetectorModels models;

    public MetricExtractor(DetectorModels models) {
        this.models = models;
    }

    public MetricSet extract(NormalizedImage image) {
        LumaImage luma = LumaImage.fromRgb(image.pixels());
        double sharpness = luma.laplacianVariance();
        double brightness = luma.mean();

        List<Region> faces = distinct(detectSafely(models.face(), "face", luma));
        int eyes = 0;
        int smiles = 0;
        for (Region face : faces) {
            LumaImage roi = luma.crop(face);
            if (roi == null) {
                continue;
            }
            eyes += detectSafely(models.eye(), "eye", roi).size();
            smiles += detectSafely(models.smile(), "smile", roi).size();
        }

        LOGGER.trace("Metrics size={}x{} sharpness={} brightness={} faces={} eyes={} smiles={}",
                luma.width(), luma.height(), sharpness, brightness, faces.size(), eyes, smiles);
        return new MetricSet(sharpness, brightness, faces.size(), eyes, smiles);
    }

    /**
     * Keeps the largest box of every group of overlapping boxes.
     */
    static List<Region> distinct(List<Region> regions) {
        if (regions.size() < 2) {
            return regions;
        }
        List<Region> sorted = new ArrayList<>(regions);
        sorted.sort(LARGEST_FIRST);
        List<Region> kept = new ArrayList<>();
        for (Region candidate : sorted) {
            boolean overlapsKept = false;
            for (Region k : kept) {
                if (k.overlaps(candidate)) {
                    overlapsKept = true;
                    break;
                }
            }
            if (!overlapsKept) {
                kept.add(candidate);
            }
        }
        return kept;
    }

    private static List<Region> detectSafely(RegionDetector detector, String kind, LumaImage image) {
        try {
            List<Region> found = detector.detect(image);
            return found == null ? List.of() : found;
        } catch (RuntimeException e) {
            // degrade to zero detections, the candidate stays OK
            LOGGER.warn("Detector {} failed on {}x{} region; counting zero detections", kind, image.width(), image.height(), e);
            return List.of();
        }
    }
}
