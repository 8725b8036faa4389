package com.example.framepickr_backend.scoring;

import com.example.framepickr_backend.model.MetricSet;
import org.springframework.stereotype.Component;

/**
 * Folds a {@link MetricSet} into one finite score, higher is better.
 */
@Component
public class ScoreCombiner {

    /** Weighted contribution of each term plus their sum. */
    public record Breakdown(double sharpness, double brightness, double faces, double eyes, double smile, double overall) {
    }

    private final ScoringWeights weights;

    public ScoreCombiner(ScoringWeights weights) {
        this.weights = weights;
    }

    public double score(MetricSet metrics) {
        return explain(metrics).overall();
    }

    public Breakdown explain(MetricSet metrics) {
        double sharpness = finiteOr(metrics.sharpness(), 0.0);
        double brightness = clamp(finiteOr(metrics.brightness(), weights.getBrightnessTarget()), 0.0, 255.0);
        int faces = metrics.faceCount();

        // 1) Sharpness against the reference ceiling
        double sharpNorm = clamp01(Math.max(0.0, sharpness) / weights.getSharpnessReference());

        // 2) Exposure: distance from the target, both directions penalized
        double brightNorm = clamp01(1.0 - Math.abs(brightness - weights.getBrightnessTarget()) / weights.getBrightnessTolerance());

        // 3) Faces saturate: the first one counts fully, extra ones only a little
        int extraFaces = Math.min(Math.max(faces - 1, 0), weights.getFaceMarginalCap());
        double faceTerm = Math.min(faces, 1) + weights.getFaceMarginal() * extraFaces;

        // 4) Eyes and smiles only matter when there is a face
        double eyeTerm = faces > 0 ? clamp01(metrics.eyeCount() / (2.0 * faces)) : 0.0;
        double smileTerm = faces > 0 ? clamp01(metrics.smileCount() / (double) faces) : 0.0;

        double sharpPart = weights.getSharpnessWeight() * sharpNorm;
        double brightPart = weights.getBrightnessWeight() * brightNorm;
        double facePart = weights.getFaceWeight() * faceTerm;
        double eyePart = weights.getEyesWeight() * eyeTerm;
        double smilePart = weights.getSmileWeight() * smileTerm;

        double overall = finiteOr(sharpPart + brightPart + facePart + eyePart + smilePart, 0.0);
        return new Breakdown(sharpPart, brightPart, facePart, eyePart, smilePart, overall);
    }

    private static double finiteOr(double value, double fallback) {
        if (Double.isNaN(value)) {
            return fallback;
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? Double.MAX_VALUE : fallback;
        }
        return value;
    }

    private static double clamp01(double value) {
        return clamp(value, 0.0, 1.0);
    }

    private static double clamp(double value, double lo, double hi) {
        if (Double.isNaN(value) || value < lo) {
            return lo;
        }
        return Math.min(value, hi);
    }
}
