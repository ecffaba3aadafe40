package fr.lapetina.imagebatch.transform;

import fr.lapetina.imagebatch.ImageFixtures;
import fr.lapetina.imagebatch.domain.model.TransformParameters;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransformPipelineTest {

    private final TransformPipeline pipeline = new TransformPipeline();

    @Nested
    @DisplayName("Identity parameters")
    class Identity {

        @Test
        @DisplayName("should return a pixel-identical copy")
        void shouldReturnPixelIdenticalCopy() throws Exception {
            BufferedImage source = ImageFixtures.gradient(37, 23);

            BufferedImage result = pipeline.apply(source, TransformParameters.identity());

            assertThat(result).isNotSameAs(source);
            assertThat(result.getWidth()).isEqualTo(37);
            assertThat(result.getHeight()).isEqualTo(23);
            assertThat(ImageFixtures.pixels(result)).containsExactly(ImageFixtures.pixels(source));
        }

        @Test
        @DisplayName("should keep alpha of translucent images")
        void shouldKeepAlpha() throws Exception {
            BufferedImage source = ImageFixtures.translucent(16, 8);

            BufferedImage result = pipeline.apply(source, TransformParameters.identity());

            assertThat(result.getColorModel().hasAlpha()).isTrue();
            assertThat(ImageFixtures.pixels(result)).containsExactly(ImageFixtures.pixels(source));
        }

        @Test
        @DisplayName("resize to the source size should be identity")
        void resizeToSourceSizeShouldBeIdentity() throws Exception {
            BufferedImage source = ImageFixtures.gradient(20, 10);
            TransformParameters params = TransformParameters.builder().resize(20, 10).build();

            BufferedImage result = pipeline.apply(source, params);

            assertThat(ImageFixtures.pixels(result)).containsExactly(ImageFixtures.pixels(source));
        }
    }

    @Test
    @DisplayName("should run stages in fixed order")
    void shouldRunStagesInFixedOrder() throws Exception {
        List<String> observed = new ArrayList<>();
        TransformPipeline observedPipeline = new TransformPipeline((stage, elapsed) -> observed.add(stage));

        observedPipeline.apply(ImageFixtures.gradient(10, 10), TransformParameters.defaults().toBuilder().resize(8, 6).build());

        assertThat(observed).containsExactly("resize", "blur", "sharpen", "contrast", "brightness");
        assertThat(observed).isEqualTo(TransformPipeline.STAGE_ORDER);
    }

    @Test
    @DisplayName("should resize to the exact target without keeping aspect ratio")
    void shouldResizeToExactTarget() throws Exception {
        BufferedImage source = ImageFixtures.gradient(100, 100);
        TransformParameters params = TransformParameters.defaults().toBuilder().resize(64, 48).build();

        BufferedImage result = pipeline.apply(source, params);

        assertThat(result.getWidth()).isEqualTo(64);
        assertThat(result.getHeight()).isEqualTo(48);
    }

    @Test
    @DisplayName("should not modify the source image")
    void shouldNotModifySource() throws Exception {
        BufferedImage source = ImageFixtures.gradient(30, 20);
        int[] before = ImageFixtures.pixels(source);

        pipeline.apply(source, TransformParameters.defaults().toBuilder().resize(15, 10).build());

        assertThat(ImageFixtures.pixels(source)).containsExactly(before);
    }

    @Test
    @DisplayName("should be deterministic")
    void shouldBeDeterministic() throws Exception {
        BufferedImage source = ImageFixtures.gradient(40, 30);
        TransformParameters params = TransformParameters.defaults().toBuilder().resize(20, 16).build();

        BufferedImage first = pipeline.apply(source, params);
        BufferedImage second = pipeline.apply(source, params);

        assertThat(ImageFixtures.pixels(first)).containsExactly(ImageFixtures.pixels(second));
    }

    @Test
    @DisplayName("should name the stage that rejected its parameter")
    void shouldNameRejectingStage() {
        TransformParameters params = TransformParameters.builder().sharpenFactor(0).build();

        assertThatThrownBy(() -> pipeline.apply(ImageFixtures.gradient(4, 4), params))
                .isInstanceOf(TransformException.class)
                .hasMessageContaining("sharpen")
                .satisfies(e -> {
                    TransformException te = (TransformException) e;
                    assertThat(te.getStage()).isEqualTo("sharpen");
                    assertThat(te.getParameter()).isEqualTo("factor");
                });
    }

    @Test
    @DisplayName("should reject non-positive resize dimensions")
    void shouldRejectNonPositiveResize() {
        TransformParameters params = TransformParameters.builder().resize(0, 10).build();

        assertThatThrownBy(() -> pipeline.apply(ImageFixtures.gradient(4, 4), params))
                .isInstanceOf(TransformException.class)
                .satisfies(e -> assertThat(((TransformException) e).getStage()).isEqualTo("resize"));
    }
}
