package com.example.framepickr_backend.model;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Decoded pixels plus the encoded bytes that were scored and that get persisted.
 * Belongs to a single candidate's processing path.
 */
public final class NormalizedImage {
    private final BufferedImage pixels;
    private final byte[] encoded;
    private final String contentType;
    private final String fileExtension;
    private final boolean transformed;

    public NormalizedImage(BufferedImage pixels, byte[] encoded, String contentType, String fileExtension, boolean transformed) {
        if (pixels == null) {
            throw new IllegalArgumentException("pixels are required");
        }
        this.pixels = pixels;
        this.encoded = encoded == null ? new byte[0] : Arrays.copyOf(encoded, encoded.length);
        this.contentType = contentType;
        this.fileExtension = fileExtension;
        this.transformed = transformed;
    }

    public BufferedImage pixels() {
        return pixels;
    }

    public byte[] encoded() {
        return Arrays.copyOf(encoded, encoded.length);
    }

    public int encodedSize() {
        return encoded.length;
    }

    public int width() {
        return pixels.getWidth();
    }

    public int height() {
        return pixels.getHeight();
    }

    public int channels() {
        return pixels.getColorModel().getNumComponents();
    }

    public String contentType() {
        return contentType;
    }

    /** Extension including the dot, e.g. {@code .jpg}. */
    public String fileExtension() {
        return fileExtension;
    }

    public boolean transformed() {
        return transformed;
    }
}
