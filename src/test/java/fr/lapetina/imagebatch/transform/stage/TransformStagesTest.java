package fr.lapetina.imagebatch.transform.stage;

import fr.lapetina.imagebatch.ImageFixtures;
import fr.lapetina.imagebatch.domain.model.Dimensions;
import fr.lapetina.imagebatch.transform.TransformException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransformStagesTest {

    private static BufferedImage gray(int... levels) {
        BufferedImage image = new BufferedImage(levels.length, 1, BufferedImage.TYPE_INT_RGB);
        for (int x = 0; x < levels.length; x++) {
            int v = levels[x];
            image.setRGB(x, 0, (v << 16) | (v << 8) | v);
        }
        return image;
    }

    private static int redAt(BufferedImage image, int x, int y) {
        return (image.getRGB(x, y) >> 16) & 0xFF;
    }

    @Nested
    @DisplayName("ResizeStage")
    class Resize {

        @Test
        @DisplayName("absent target should return the input")
        void absentTargetShouldReturnInput() throws Exception {
            BufferedImage image = ImageFixtures.gradient(10, 10);

            assertThat(new ResizeStage(null).apply(image)).isSameAs(image);
        }

        @Test
        @DisplayName("should keep the working buffer type")
        void shouldKeepBufferType() throws Exception {
            BufferedImage image = ImageFixtures.translucent(20, 20);

            BufferedImage result = new ResizeStage(Dimensions.of(7, 5)).apply(image);

            assertThat(result.getType()).isEqualTo(BufferedImage.TYPE_INT_ARGB);
            assertThat(result.getWidth()).isEqualTo(7);
            assertThat(result.getHeight()).isEqualTo(5);
        }

        @Test
        @DisplayName("should reject negative height")
        void shouldRejectNegativeHeight() {
            assertThatThrownBy(() -> new ResizeStage(Dimensions.of(10, -1)).apply(ImageFixtures.gradient(4, 4)))
                    .isInstanceOf(TransformException.class)
                    .hasMessageContaining("height");
        }
    }

    @Nested
    @DisplayName("GaussianBlurStage")
    class Blur {

        @Test
        @DisplayName("kernel should cover three deviations each side")
        void kernelShouldCoverThreeDeviations() {
            assertThat(GaussianBlurStage.kernelSize(1.5)).isEqualTo(11);
            assertThat(GaussianBlurStage.kernelSize(2.0)).isEqualTo(13);
            assertThat(GaussianBlurStage.kernelSize(0.1)).isEqualTo(3);
        }

        @Test
        @DisplayName("should blur the alpha channel with the colours")
        void shouldBlurAlpha() throws Exception {
            BufferedImage image = ImageFixtures.translucent(8, 4);

            BufferedImage result = new GaussianBlurStage(1.0).apply(image);

            int alphaAtEdge = result.getRGB(3, 1) >>> 24;
            assertThat(alphaAtEdge).isGreaterThan(0x80).isLessThan(0xFF);
            assertThat(result.getType()).isEqualTo(BufferedImage.TYPE_INT_ARGB);
        }

        @Test
        @DisplayName("zero radius should return the input")
        void zeroRadiusShouldReturnInput() throws Exception {
            BufferedImage image = ImageFixtures.gradient(5, 5);

            assertThat(new GaussianBlurStage(0).apply(image)).isSameAs(image);
        }

        @Test
        @DisplayName("should leave a uniform image unchanged")
        void shouldLeaveUniformImageUnchanged() throws Exception {
            BufferedImage image = ImageFixtures.solid(9, 7, 0x4080C0);

            BufferedImage result = new GaussianBlurStage(2.0).apply(image);

            assertThat(ImageFixtures.pixels(result)).containsOnly(0xFF4080C0);
        }

        @Test
        @DisplayName("should spread a bright point to its neighbours")
        void shouldSpreadBrightPoint() throws Exception {
            BufferedImage image = gray(0, 0, 0, 255, 0, 0, 0);

            BufferedImage result = new GaussianBlurStage(1.0).apply(image);

            assertThat(redAt(result, 3, 0)).isLessThan(255);
            assertThat(redAt(result, 2, 0)).isGreaterThan(0);
            assertThat(redAt(result, 2, 0)).isEqualTo(redAt(result, 4, 0));
        }

        @Test
        @DisplayName("should reject non-finite radius")
        void shouldRejectNonFiniteRadius() {
            assertThatThrownBy(() -> new GaussianBlurStage(Double.NaN).apply(ImageFixtures.gradient(3, 3)))
                    .isInstanceOf(TransformException.class);
        }
    }

    @Nested
    @DisplayName("SharpenStage")
    class Sharpen {

        @Test
        @DisplayName("factor 1.0 should return the input")
        void unitFactorShouldReturnInput() throws Exception {
            BufferedImage image = ImageFixtures.gradient(5, 5);

            assertThat(new SharpenStage(1.0).apply(image)).isSameAs(image);
        }

        @Test
        @DisplayName("should leave a uniform image unchanged")
        void shouldLeaveUniformImageUnchanged() throws Exception {
            BufferedImage image = ImageFixtures.solid(6, 6, 0x808080);

            BufferedImage result = new SharpenStage(2.5).apply(image);

            assertThat(ImageFixtures.pixels(result)).containsOnly(0xFF808080);
        }

        @Test
        @DisplayName("should increase local contrast")
        void shouldIncreaseLocalContrast() throws Exception {
            BufferedImage image = gray(100, 100, 150, 150);

            BufferedImage result = new SharpenStage(2.0).apply(image);

            assertThat(redAt(result, 1, 0)).isLessThan(100);
            assertThat(redAt(result, 2, 0)).isGreaterThan(150);
        }

        @Test
        @DisplayName("should keep alpha as it was")
        void shouldKeepAlpha() throws Exception {
            BufferedImage image = ImageFixtures.translucent(8, 4);

            BufferedImage result = new SharpenStage(3.0).apply(image);

            for (int x = 0; x < 8; x++) {
                assertThat(result.getRGB(x, 1) >>> 24).isEqualTo(image.getRGB(x, 1) >>> 24);
            }
        }

        @Test
        @DisplayName("should reject non-positive factor")
        void shouldRejectNonPositiveFactor() {
            assertThatThrownBy(() -> new SharpenStage(0).apply(ImageFixtures.gradient(3, 3)))
                    .isInstanceOf(TransformException.class)
                    .hasMessageContaining("sharpen");
        }
    }

    @Nested
    @DisplayName("ContrastStage")
    class Contrast {

        @Test
        @DisplayName("mean luminance should use rounded ITU-R 601 weights")
        void meanLuminanceShouldUseLumaWeights() {
            assertThat(ContrastStage.meanLuminance(new int[]{0xFF0000})).isEqualTo(76);
            assertThat(ContrastStage.meanLuminance(new int[]{0x00FF00})).isEqualTo(150);
            assertThat(ContrastStage.meanLuminance(new int[]{0x646464, 0x8C8C8C})).isEqualTo(120);
        }

        @Test
        @DisplayName("should stretch values around the mean")
        void shouldStretchAroundMean() throws Exception {
            BufferedImage result = new ContrastStage(2.0).apply(gray(100, 140));

            assertThat(redAt(result, 0, 0)).isEqualTo(80);
            assertThat(redAt(result, 1, 0)).isEqualTo(160);
        }

        @Test
        @DisplayName("should clamp to the channel range")
        void shouldClamp() throws Exception {
            BufferedImage result = new ContrastStage(10.0).apply(gray(0, 255));

            assertThat(redAt(result, 0, 0)).isZero();
            assertThat(redAt(result, 1, 0)).isEqualTo(255);
        }
    }

    @Nested
    @DisplayName("BrightnessStage")
    class Brightness {

        @Test
        @DisplayName("should scale and clamp every colour channel")
        void shouldScaleAndClamp() throws Exception {
            BufferedImage image = new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB);
            image.setRGB(0, 0, (100 << 16) | (50 << 8) | 200);

            BufferedImage result = new BrightnessStage(1.5).apply(image);

            assertThat(result.getRGB(0, 0)).isEqualTo(0xFF000000 | (150 << 16) | (75 << 8) | 255);
        }

        @Test
        @DisplayName("should preserve alpha")
        void shouldPreserveAlpha() throws Exception {
            BufferedImage image = ImageFixtures.translucent(4, 1);

            BufferedImage result = new BrightnessStage(0.5).apply(image);

            assertThat(result.getRGB(0, 0) >>> 24).isEqualTo(0x80);
            assertThat(result.getRGB(3, 0) >>> 24).isEqualTo(0xFF);
        }

        @Test
        @DisplayName("should keep alpha as it was")
        void shouldKeepAlpha() throws Exception {
            BufferedImage image = ImageFixtures.translucent(8, 4);

            BufferedImage result = new SharpenStage(3.0).apply(image);

            for (int x = 0; x < 8; x++) {
                assertThat(result.getRGB(x, 1) >>> 24).isEqualTo(image.getRGB(x, 1) >>> 24);
            }
        }

        @Test
        @DisplayName("should reject non-positive factor")
        void shouldRejectNonPositiveFactor() {
            assertThatThrownBy(() -> new BrightnessStage(-1).apply(ImageFixtures.gradient(3, 3)))
                    .isInstanceOf(TransformException.class);
        }
    }
}
