package com.example.framepickr_backend.scoring;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Calibration constants for {@link ScoreCombiner}. Kept out of the extraction code so they can be
 * tuned against real photo sets through {@code scoring.*} properties.
 */
@Validated
@ConfigurationProperties(prefix = "scoring")
public class ScoringWeights {

    /** Laplacian variance treated as fully sharp. */
    @Positive
    private double sharpnessReference = 500.0;
    /** Mean luma considered ideal exposure. */
    @PositiveOrZero
    private double brightnessTarget = 128.0;
    /** Distance from the target at which the brightness term reaches zero. */
    @Positive
    private double brightnessTolerance = 128.0;
    /** Extra face term per face beyond the first. */
    @PositiveOrZero
    private double faceMarginal = 0.25;
    /** Number of additional faces that still earn the marginal term. */
    @PositiveOrZero
    private int faceMarginalCap = 4;

    private double sharpnessWeight = 1.0;
    private double brightnessWeight = 0.5;
    private double faceWeight = 1.0;
    private double eyesWeight = 0.35;
    private double smileWeight = 0.5;

    public static ScoringWeights defaults() {
        return new ScoringWeights();
    }

    public double getSharpnessReference() {
        return sharpnessReference;
    }

    public void setSharpnessReference(double sharpnessReference) {
        this.sharpnessReference = sharpnessReference;
    }

    public double getBrightnessTarget() {
        return brightnessTarget;
    }

    public void setBrightnessTarget(double brightnessTarget) {
        this.brightnessTarget = brightnessTarget;
    }

    public double getBrightnessTolerance() {
        return brightnessTolerance;
    }

    public void setBrightnessTolerance(double brightnessTolerance) {
        this.brightnessTolerance = brightnessTolerance;
    }

    public double getFaceMarginal() {
        return faceMarginal;
    }

    public void setFaceMarginal(double faceMarginal) {
        this.faceMarginal = faceMarginal;
    }

    public int getFaceMarginalCap() {
        return faceMarginalCap;
    }

    public void setFaceMarginalCap(int faceMarginalCap) {
        this.faceMarginalCap = faceMarginalCap;
    }

    public double getSharpnessWeight() {
        return sharpnessWeight;
    }

    public void setSharpnessWeight(double sharpnessWeight) {
        this.sharpnessWeight = sharpnessWeight;
    }

    public double getBrightnessWeight() {
        return brightnessWeight;
    }

    public void setBrightnessWeight(double brightnessWeight) {
        this.brightnessWeight = brightnessWeight;
    }

    public double getFaceWeight() {
        return faceWeight;
    }

    public void setFaceWeight(double faceWeight) {
        this.faceWeight = faceWeight;
    }

    public double getEyesWeight() {
        return eyesWeight;
    }

    public void setEyesWeight(double eyesWeight) {
        this.eyesWeight = eyesWeight;
    }

    public double getSmileWeight() {
        return smileWeight;
    }

    public void setSmileWeight(double smileWeight) {
        this.smileWeight = smileWeight;
    }
}
