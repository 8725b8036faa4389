package com.example.framepickr_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Limits used by the image preprocessor when shrinking large uploads.
 */
@ConfigurationProperties(prefix = "preprocess")
public class PreprocessProperties {

    private long sizeThresholdBytes = 800L * 1024;
    private long targetBytes = 700L * 1024;
    private int maxDimension = 1600;
    private float startQuality = 0.92f;
    private float qualityStep = 0.10f;
    private float minQuality = 0.30f;
    private double fallbackScale = 0.8;

    public long getSizeThresholdBytes() {
        return sizeThresholdBytes;
    }

    public void setSizeThresholdBytes(long sizeThresholdBytes) {
        this.sizeThresholdBytes = sizeThresholdBytes;
    }

    public long getTargetBytes() {
        return targetBytes;
    }

    public void setTargetBytes(long targetBytes) {
        this.targetBytes = targetBytes;
    }

    public int getMaxDimension() {
        return maxDimension;
    }

    public void setMaxDimension(int maxDimension) {
        this.maxDimension = maxDimension;
    }

    public float getStartQuality() {
        return startQuality;
    }

    public void setStartQuality(float startQuality) {
        this.startQuality = startQuality;
    }

    public float getQualityStep() {
        return qualityStep;
    }

    public void setQualityStep(float qualityStep) {
        this.qualityStep = qualityStep;
    }

    public float getMinQuality() {
        return minQuality;
    }

    public void setMinQuality(float minQuality) {
        this.minQuality = minQuality;
    }

    public double getFallbackScale() {
        return fallbackScale;
    }

    public void setFallbackScale(double fallbackScale) {
        this.fallbackScale = fallbackScale;
    }
}
