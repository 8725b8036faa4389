package com.example.framepickr_backend.metrics;

import com.example.framepickr_backend.detection.Region;
import com.example.framepickr_backend.support.TestImages;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LumaImageTest {

    @Test
    void uniformImageHasNoDetail() {
        LumaImage luma = LumaImage.fromRgb(TestImages.uniform(100, 100, 128));

        assertThat(luma.laplacianVariance()).isEqualTo(0.0);
        assertThat(luma.mean()).isEqualTo(128.0);
    }

    @Test
    void checkerboardIsMaximallySharp() {
        LumaImage luma = LumaImage.fromRgb(TestImages.checkerboard(8, 6));

        // every response is +-1020, half of each
        assertThat(luma.laplacianVariance()).isCloseTo(1_040_400.0, within(1e-6));
        assertThat(luma.mean()).isCloseTo(127.5, within(1e-9));
    }

    @Test
    void noiseIsSharperThanFlat() {
        double flat = LumaImage.fromRgb(TestImages.noise(50, 50, 2, 1L)).laplacianVariance();
        double busy = LumaImage.fromRgb(TestImages.noise(50, 50, 60, 1L)).laplacianVariance();

        assertThat(busy).isGreaterThan(flat);
    }

    @Test
    void luminanceUsesBt601Weights() {
        assertThat(LumaImage.luminance(0xFF0000)).isEqualTo(76);
        assertThat(LumaImage.luminance(0x00FF00)).isEqualTo(150);
        assertThat(LumaImage.luminance(0x0000FF)).isEqualTo(29);
        assertThat(LumaImage.luminance(0xFFFFFF)).isEqualTo(255);
    }

    @Test
    void singlePixelImageIsHandled() {
        LumaImage luma = LumaImage.of(1, 1, new byte[]{(byte) 200});

        assertThat(luma.laplacianVariance()).isEqualTo(0.0);
        assertThat(luma.mean()).isEqualTo(200.0);
    }

    @Test
    void cropIsClippedToTheImage() {
        byte[] plane = new byte[16];
        for (int i = 0; i < plane.length; i++) {
            plane[i] = (byte) i;
        }
        LumaImage luma = LumaImage.of(4, 4, plane);

        LumaImage roi = luma.crop(new Region(2, 2, 10, 10));

        assertThat(roi.width()).isEqualTo(2);
        assertThat(roi.height()).isEqualTo(2);
        assertThat(roi.pixels()).containsExactly(10, 11, 14, 15);
        assertThat(luma.crop(new Region(8, 8, 2, 2))).isNull();
    }

    @Test
    void rejectsMismatchedBuffer() {
        assertThatThrownBy(() -> LumaImage.of(3, 3, new byte[8]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
