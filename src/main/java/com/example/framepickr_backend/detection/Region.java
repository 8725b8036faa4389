package com.example.framepickr_backend.detection;

/**
 * Axis-aligned detection box in pixel coordinates of the image it was found in.
 */
public record Region(int x, int y, int width, int height) {

    public Region {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("negative region size");
        }
    }

    public long area() {
        return (long) width * height;
    }

    public boolean overlaps(Region other) {
        return x < other.x + other.width && other.x < x + width
                && y < other.y + other.height && other.y < y + height;
    }
}
