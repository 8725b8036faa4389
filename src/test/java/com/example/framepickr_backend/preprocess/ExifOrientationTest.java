package com.example.framepickr_backend.preprocess;

import com.example.framepickr_backend.support.TestImages;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ExifOrientationTest {

    private static BufferedImage numbered(int w, int h) {
        BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                img.setRGB(x, y, y * w + x);
            }
        }
        return img;
    }

    private static int at(BufferedImage img, int x, int y) {
        return img.getRGB(x, y) & 0xFFFFFF;
    }

    @Test
    void readsOrientationFromExifSegment() {
        byte[] jpeg = TestImages.jpeg(TestImages.uniform(16, 8, 100));

        assertThat(ExifOrientation.read(TestImages.withExifOrientation(jpeg, 6))).isEqualTo(6);
        assertThat(ExifOrientation.read(TestImages.withExifOrientation(jpeg, 3))).isEqualTo(3);
    }

    @Test
    void missingOrBrokenMetadataIsNormal() {
        assertThat(ExifOrientation.read(TestImages.jpeg(TestImages.uniform(16, 8, 100)))).isEqualTo(ExifOrientation.NORMAL);
        assertThat(ExifOrientation.read(TestImages.png(TestImages.uniform(16, 8, 100)))).isEqualTo(ExifOrientation.NORMAL);
        assertThat(ExifOrientation.read("junk".getBytes(StandardCharsets.UTF_8))).isEqualTo(ExifOrientation.NORMAL);
        assertThat(ExifOrientation.read(new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE1, 0x7F, 0x7F}))
                .isEqualTo(ExifOrientation.NORMAL);
    }

    @Test
    void rotatesClockwiseForSix() {
        // 3x2 source: row 0 = 0 1 2, row 1 = 3 4 5
        BufferedImage out = ExifOrientation.apply(numbered(3, 2), 6);

        assertThat(out.getWidth()).isEqualTo(2);
        assertThat(out.getHeight()).isEqualTo(3);
        assertThat(at(out, 0, 0)).isEqualTo(3);
        assertThat(at(out, 1, 0)).isEqualTo(0);
        assertThat(at(out, 0, 2)).isEqualTo(5);
        assertThat(at(out, 1, 2)).isEqualTo(2);
    }

    @Test
    void rotatesCounterClockwiseForEight() {
        BufferedImage out = ExifOrientation.apply(numbered(3, 2), 8);

        assertThat(out.getWidth()).isEqualTo(2);
        assertThat(at(out, 0, 0)).isEqualTo(2);
        assertThat(at(out, 1, 0)).isEqualTo(5);
        assertThat(at(out, 0, 2)).isEqualTo(0);
    }

    @Test
    void halfTurnAndMirrorsKeepDimensions() {
        BufferedImage half = ExifOrientation.apply(numbered(3, 2), 3);
        BufferedImage mirrored = ExifOrientation.apply(numbered(3, 2), 2);

        assertThat(half.getWidth()).isEqualTo(3);
        assertThat(at(half, 0, 0)).isEqualTo(5);
        assertThat(at(mirrored, 0, 0)).isEqualTo(2);
        assertThat(at(mirrored, 0, 1)).isEqualTo(5);
    }

    @Test
    void normalReturnsTheSameImage() {
        BufferedImage src = numbered(3, 2);

        assertThat(ExifOrientation.apply(src, ExifOrientation.NORMAL)).isSameAs(src);
    }
}
