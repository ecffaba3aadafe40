package fr.lapetina.imagebatch.infrastructure.config;

import fr.lapetina.imagebatch.domain.model.Dimensions;
import fr.lapetina.imagebatch.domain.model.ImageCodec;
import fr.lapetina.imagebatch.domain.model.TransformParameters;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("should load configuration from the classpath")
    void shouldLoadFromClasspath() {
        ImageBatchConfig config = new ConfigLoader("test-config.yaml").load();

        assertThat(config.getInput().getDirectory()).isEqualTo("target/test-data/input");
        assertThat(config.getInput().getExtensions()).containsExactly(".jpg", ".png");
        assertThat(config.getOutput().getPrefix()).isEqualTo("out_");
        assertThat(config.getExecution().getWorkers()).isEqualTo(4);
        assertThat(config.getExecution().getRingBufferSize()).isEqualTo(16);
        assertThat(config.getExecution().getWaitStrategy()).isEqualTo("yielding");
        assertThat(config.getEncoding().getJpegQuality()).isEqualTo(0.75);
        assertThat(config.getEncoding().getTiffCompression()).isEqualTo("Deflate");
        assertThat(config.getMetrics().isEnabled()).isFalse();
        assertThat(config.getReport().isEnabled()).isFalse();

        TransformParameters parameters = config.getTransform().toParameters();
        assertThat(parameters.resize()).isEqualTo(Dimensions.of(64, 48));
        assertThat(parameters.blurRadius()).isEqualTo(0.5);
        assertThat(parameters.sharpenFactor()).isEqualTo(2.0);
        assertThat(parameters.contrastFactor()).isEqualTo(1.3);
        assertThat(parameters.brightnessFactor()).isEqualTo(0.9);
    }

    @Test
    @DisplayName("should prefer a file on disk and keep defaults for missing sections")
    void shouldLoadFromFile() throws Exception {
        Path file = tempDir.resolve("batch.yaml");
        Files.writeString(file, String.join("\n",
                "execution:",
                "  workers: 8",
                "output:",
                "  format: png",
                ""));

        ImageBatchConfig config = new ConfigLoader(file.toString()).load();

        assertThat(config.getExecution().getWorkers()).isEqualTo(8);
        assertThat(config.getExecution().getRingBufferSize()).isEqualTo(256);
        assertThat(config.getOutput().resolveFormatOverride()).isEqualTo(ImageCodec.PNG);
        assertThat(config.getTransform().toParameters().resize()).isEqualTo(Dimensions.of(800, 600));
        assertThat(config.getOutput().getPrefix()).isEqualTo("processed_");
    }

    @Test
    @DisplayName("empty document should yield the defaults")
    void emptyDocumentShouldYieldDefaults() {
        ImageBatchConfig config = new ConfigLoader("unused.yaml")
                .loadFromStream(new ByteArrayInputStream(new byte[0]));

        assertThat(config.getExecution().getWorkers()).isEqualTo(1);
        assertThat(config.getOutput().resolveFormatOverride()).isNull();
        assertThat(config.getMetrics().getPrefix()).isEqualTo("image_batch");
    }

    @Test
    @DisplayName("missing file should fail")
    void missingFileShouldFail() {
        ConfigLoader loader = new ConfigLoader(tempDir.resolve("absent.yaml").toString());

        assertThatThrownBy(loader::load)
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("unknown keys should be reported")
    void unknownKeysShouldFail() {
        String yaml = "execution:\n  threads: 4\n";
        ConfigLoader loader = new ConfigLoader("unused.yaml");

        assertThatThrownBy(() -> loader.loadFromStream(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("Invalid configuration");
    }

    @Nested
    @DisplayName("Transform section")
    class TransformSection {

        @Test
        @DisplayName("clearing both dimensions should disable resize")
        void clearingDimensionsShouldDisableResize() {
            ImageBatchConfig.TransformConfig transform = new ImageBatchConfig.TransformConfig();
            transform.setWidth(null);
            transform.setHeight(null);

            assertThat(transform.toParameters().resize()).isNull();
        }

        @Test
        @DisplayName("a single dimension should be rejected")
        void singleDimensionShouldBeRejected() {
            ImageBatchConfig.TransformConfig transform = new ImageBatchConfig.TransformConfig();
            transform.setHeight(null);

            assertThatThrownBy(transform::toParameters)
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("together");
        }
    }

    @Test
    @DisplayName("unknown output format should be rejected")
    void unknownFormatShouldBeRejected() {
        ImageBatchConfig.OutputConfig output = new ImageBatchConfig.OutputConfig();
        output.setFormat("gif");

        assertThatThrownBy(output::resolveFormatOverride)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("gif");
    }
}
