package com.example.framepickr_backend.preprocess;

import java.awt.image.BufferedImage;

/**
 * Reads the EXIF Orientation tag (0x0112) from a JPEG and applies it to decoded pixels.
 * Anything that is not a well-formed JPEG with an Exif APP1 segment counts as {@link #NORMAL}.
 */
final class ExifOrientation {
    static final int NORMAL = 1;

    private static final int TAG_ORIENTATION = 0x0112;
    private static final int TYPE_SHORT = 3;
    private static final byte[] EXIF_HEADER = {'E', 'x', 'i', 'f', 0, 0};

    private ExifOrientation() {
    }

    /**
     * @return orientation in {@code [1,8]}; {@link #NORMAL} when absent or unreadable.
     */
    static int read(byte[] jpeg) {
        if (jpeg == null || jpeg.length < 4 || (jpeg[0] & 0xFF) != 0xFF || (jpeg[1] & 0xFF) != 0xD8) {
            return NORMAL;
        }
        int pos = 2;
        while (pos + 4 <= jpeg.length) {
            if ((jpeg[pos] & 0xFF) != 0xFF) {
                return NORMAL;
            }
            int marker = jpeg[pos + 1] & 0xFF;
            if (marker == 0xFF) {
                pos++;
                continue;
            }
            if (marker == 0x01 || (marker >= 0xD0 && marker <= 0xD8)) {
                pos += 2;
                continue;
            }
            if (marker == 0xDA || marker == 0xD9) {
                // metadata segments all come before the first scan
                return NORMAL;
            }
            int length = u16(jpeg, pos + 2, false);
            if (length < 2 || pos + 2 + length > jpeg.length) {
                return NORMAL;
            }
            if (marker == 0xE1) {
                int found = fromApp1(jpeg, pos + 4, pos + 2 + length);
                if (found != 0) {
                    return found;
                }
            }
            pos += 2 + length;
        }
        return NORMAL;
    }

    private static int fromApp1(byte[] b, int start, int end) {
        if (end - start < EXIF_HEADER.length + 8) {
            return 0;
        }
        for (int i = 0; i < EXIF_HEADER.length; i++) {
            if (b[start + i] != EXIF_HEADER[i]) {
                return 0;
            }
        }
        int tiff = start + EXIF_HEADER.length;
        boolean little;
        if (b[tiff] == 'I' && b[tiff + 1] == 'I') {
            little = true;
        } else if (b[tiff] == 'M' && b[tiff + 1] == 'M') {
            little = false;
        } else {
            return 0;
        }
        if (u16(b, tiff + 2, little) != 42) {
            return 0;
        }
        long offset = u32(b, tiff + 4, little);
        if (offset < 8 || offset > end - tiff - 2) {
            return 0;
        }
        int ifd = tiff + (int) offset;
        int count = u16(b, ifd, little);
        for (int i = 0; i < count; i++) {
            int entry = ifd + 2 + 12 * i;
            if (entry + 12 > end) {
                return 0;
            }
            if (u16(b, entry, little) == TAG_ORIENTATION) {
                if (u16(b, entry + 2, little) != TYPE_SHORT) {
                    return 0;
                }
                int value = u16(b, entry + 8, little);
                return value >= 1 && value <= 8 ? value : 0;
            }
        }
        return 0;
    }

    /**
     * Returns the upright image for {@code orientation}; the input itself for {@link #NORMAL}.
     * Orientations 5 to 8 swap width and height.
     */
    static BufferedImage apply(BufferedImage src, int orientation) {
        if (orientation <= NORMAL || orientation > 8) {
            return src;
        }
        int w = src.getWidth(), h = src.getHeight();
        boolean swap = orientation >= 5;
        int dw = swap ? h : w, dh = swap ? w : h;
        int[] in = src.getRGB(0, 0, w, h, null, 0, w);
        int[] out = new int[in.length];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int dx, dy;
                switch (orientation) {
                    case 2 -> { dx = w - 1 - x; dy = y; }
                    case 3 -> { dx = w - 1 - x; dy = h - 1 - y; }
                    case 4 -> { dx = x; dy = h - 1 - y; }
                    case 5 -> { dx = y; dy = x; }
                    case 6 -> { dx = h - 1 - y; dy = x; }
                    case 7 -> { dx = h - 1 - y; dy = w - 1 - x; }
                    default -> { dx = y; dy = w - 1 - x; }
                }
                out[dy * dw + dx] = in[y * w + x];
            }
        }
        BufferedImage rotated = new BufferedImage(dw, dh, BufferedImage.TYPE_INT_RGB);
        rotated.setRGB(0, 0, dw, dh, out, 0, dw);
        return rotated;
    }

    private static int u16(byte[] b, int at, boolean little) {
        int b0 = b[at] & 0xFF, b1 = b[at + 1] & 0xFF;
        return little ? (b1 << 8) | b0 : (b0 << 8) | b1;
    }

    private static long u32(byte[] b, int at, boolean little) {
        long hi = u16(b, little ? at + 2 : at, little);
        long lo = u16(b, little ? at : at + 2, little);
        return (hi << 16) | lo;
    }
}
