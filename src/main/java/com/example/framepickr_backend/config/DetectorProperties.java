package com.example.framepickr_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Location of the Haar cascade files and the tuning for each detector.
 */
@ConfigurationProperties(prefix = "detector")
public class DetectorProperties {

    private String modelDir = "./models";
    private boolean bundledFallback = true;
    private Model face = new Model("haarcascade_frontalface_default.xml", 1.1, 5, 30);
    private Model eye = new Model("haarcascade_eye.xml", 1.1, 3, 10);
    private Model smile = new Model("haarcascade_smile.xml", 1.7, 22, 15);

    public String getModelDir() {
        return modelDir;
    }

    public void setModelDir(String modelDir) {
        this.modelDir = modelDir;
    }

    /**
     * Whether a cascade missing from {@link #getModelDir()} may be taken from the copy shipped in the OpenCV jar.
     */
    public boolean isBundledFallback() {
        return bundledFallback;
    }

    public void setBundledFallback(boolean bundledFallback) {
        this.bundledFallback = bundledFallback;
    }

    public Model getFace() {
        return face;
    }

    public void setFace(Model face) {
        this.face = face;
    }

    public Model getEye() {
        return eye;
    }

    public void setEye(Model eye) {
        this.eye = eye;
    }

    public Model getSmile() {
        return smile;
    }

    public void setSmile(Model smile) {
        this.smile = smile;
    }

    public static class Model {
        private String file;
        private double scaleFactor = 1.1;
        private int minNeighbors = 3;
        private int minSize = 10;

        public Model() {
        }

        public Model(String file, double scaleFactor, int minNeighbors, int minSize) {
            this.file = file;
            this.scaleFactor = scaleFactor;
            this.minNeighbors = minNeighbors;
            this.minSize = minSize;
        }

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }

        public double getScaleFactor() {
            return scaleFactor;
        }

        public void setScaleFactor(double scaleFactor) {
            this.scaleFactor = scaleFactor;
        }

        public int getMinNeighbors() {
            return minNeighbors;
        }

        public void setMinNeighbors(int minNeighbors) {
            this.minNeighbors = minNeighbors;
        }

        public int getMinSize() {
            return minSize;
        }

        public void setMinSize(int minSize) {
            this.minSize = minSize;
        }
    }
}
