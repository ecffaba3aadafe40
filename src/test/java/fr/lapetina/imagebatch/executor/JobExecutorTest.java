package fr.lapetina.imagebatch.executor;

import fr.lapetina.imagebatch.ImageFixtures;
import fr.lapetina.imagebatch.domain.format.FormatCache;
import fr.lapetina.imagebatch.domain.model.ErrorKind;
import fr.lapetina.imagebatch.domain.model.ImageCodec;
import fr.lapetina.imagebatch.domain.model.ImageJob;
import fr.lapetina.imagebatch.domain.model.JobOutcome;
import fr.lapetina.imagebatch.domain.model.TransformParameters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class JobExecutorTest {

    private static final TransformParameters SMALL = TransformParameters.defaults().toBuilder()
            .resize(80, 60)
            .build();

    @TempDir
    Path tempDir;

    private JobExecutor executor;
    private Path inputDir;
    private Path outputDir;

    @BeforeEach
    void setUp() {
        executor = JobExecutor.withDefaults();
        inputDir = tempDir.resolve("in");
        outputDir = tempDir.resolve("out");
    }

    private long outputFileCount() throws Exception {
        if (!Files.exists(outputDir)) {
            return 0;
        }
        try (Stream<Path> files = Files.list(outputDir)) {
            return files.count();
        }
    }

    @Nested
    @DisplayName("Successful jobs")
    class Success {

        @Test
        @DisplayName("should write each output in the codec of its extension")
        void shouldWriteCodecOfExtension() throws Exception {
            Path a = ImageFixtures.write(inputDir.resolve("a.jpg"), ImageFixtures.gradient(120, 90), "jpg");
            Path b = ImageFixtures.write(inputDir.resolve("b.png"), ImageFixtures.gradient(50, 50), "png");
            Path c = ImageFixtures.write(inputDir.resolve("c.bmp"), ImageFixtures.gradient(33, 17), "bmp");
            TransformParameters params = TransformParameters.defaults();

            JobOutcome outA = executor.execute(ImageJob.of(a, outputDir.resolve("a.jpg"), params));
            JobOutcome outB = executor.execute(ImageJob.of(b, outputDir.resolve("b.png"), params));
            JobOutcome outC = executor.execute(ImageJob.of(c, outputDir.resolve("c.bmp"), params));

            assertThat(outA.isSuccess()).isTrue();
            assertThat(outA.codec()).isEqualTo(ImageCodec.JPEG);
            assertThat(outB.codec()).isEqualTo(ImageCodec.PNG);
            assertThat(outC.codec()).isEqualTo(ImageCodec.BMP);

            for (JobOutcome outcome : new JobOutcome[]{outA, outB, outC}) {
                BufferedImage written = ImageFixtures.read(outcome.output());
                assertThat(written.getWidth()).isEqualTo(800);
                assertThat(written.getHeight()).isEqualTo(600);
                assertThat(outcome.elapsed()).isPositive();
            }
            assertThat(outputFileCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("explicit format should override the output extension")
        void explicitFormatShouldOverrideExtension() throws Exception {
            Path input = ImageFixtures.write(inputDir.resolve("photo.png"), ImageFixtures.gradient(20, 20), "png");
            Path output = outputDir.resolve("photo.jpg");

            JobOutcome outcome = executor.execute(new ImageJob(input, output, SMALL, ImageCodec.PNG));

            assertThat(outcome.codec()).isEqualTo(ImageCodec.PNG);
            byte[] bytes = Files.readAllBytes(output);
            assertThat(bytes[0] & 0xFF).isEqualTo(0x89);
            assertThat((char) bytes[1]).isEqualTo('P');
        }

        @Test
        @DisplayName("should flatten alpha when writing JPEG")
        void shouldFlattenAlphaForJpeg() throws Exception {
            Path input = ImageFixtures.write(inputDir.resolve("alpha.png"), ImageFixtures.translucent(40, 40), "png");
            Path output = outputDir.resolve("alpha.jpg");

            JobOutcome outcome = executor.execute(ImageJob.of(input, output, SMALL));

            assertThat(outcome.isSuccess()).isTrue();
            assertThat(ImageFixtures.read(output).getColorModel().hasAlpha()).isFalse();
        }

        @Test
        @DisplayName("should write TIFF outputs")
        void shouldWriteTiff() throws Exception {
            Path input = ImageFixtures.write(inputDir.resolve("scan.png"), ImageFixtures.gradient(30, 30), "png");
            Path output = outputDir.resolve("scan.tiff");

            JobOutcome outcome = executor.execute(ImageJob.of(input, output, SMALL));

            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcome.codec()).isEqualTo(ImageCodec.TIFF);
            assertThat(ImageFixtures.read(output).getWidth()).isEqualTo(80);
        }

        @Test
        @DisplayName("should create missing output directories")
        void shouldCreateOutputDirectories() throws Exception {
            Path input = ImageFixtures.write(inputDir.resolve("a.png"), ImageFixtures.gradient(10, 10), "png");
            Path output = outputDir.resolve("nested/deeper/a.png");

            JobOutcome outcome = executor.execute(ImageJob.of(input, output, SMALL));

            assertThat(outcome.isSuccess()).isTrue();
            assertThat(output).exists();
        }

        @Test
        @DisplayName("should memoize the output filename in the shared cache")
        void shouldUseSharedCache() throws Exception {
            Path input = ImageFixtures.write(inputDir.resolve("a.png"), ImageFixtures.gradient(10, 10), "png");
            FormatCache cache = new FormatCache();

            executor.execute(ImageJob.of(input, outputDir.resolve("a.bmp"), SMALL), cache);

            assertThat(cache.contains("a.bmp")).isTrue();
        }
    }

    @Nested
    @DisplayName("Failed jobs")
    class Failure {

        @Test
        @DisplayName("corrupt input should fail with DECODE_ERROR and write nothing")
        void corruptInputShouldFailWithDecodeError() throws Exception {
            Path input = ImageFixtures.writeGarbage(inputDir.resolve("broken.jpg"));

            JobOutcome outcome = executor.execute(ImageJob.of(input, outputDir.resolve("broken.jpg"), SMALL));

            assertThat(outcome.isFailure()).isTrue();
            assertThat(outcome.errorKind()).isEqualTo(ErrorKind.DECODE_ERROR);
            assertThat(outcome.input()).isEqualTo(input);
            assertThat(outputFileCount()).isZero();
        }

        @Test
        @DisplayName("truncated JPEG should fail with DECODE_ERROR and write nothing")
        void truncatedJpegShouldFailWithDecodeError() throws Exception {
            Path input = ImageFixtures.writeTruncated(inputDir.resolve("cut.jpg"), ImageFixtures.gradient(120, 90), "jpg");

            JobOutcome outcome = executor.execute(ImageJob.of(input, outputDir.resolve("cut.jpg"), SMALL));

            assertThat(outcome.isFailure()).isTrue();
            assertThat(outcome.errorKind()).isEqualTo(ErrorKind.DECODE_ERROR);
            assertThat(outputFileCount()).isZero();
        }

        @Test
        @DisplayName("empty input should fail with DECODE_ERROR")
        void emptyInputShouldFailWithDecodeError() throws Exception {
            Files.createDirectories(inputDir);
            Path input = Files.createFile(inputDir.resolve("empty.png"));

            JobOutcome outcome = executor.execute(ImageJob.of(input, outputDir.resolve("empty.png"), SMALL));

            assertThat(outcome.errorKind()).isEqualTo(ErrorKind.DECODE_ERROR);
        }

        @Test
        @DisplayName("missing input should fail with IO_ERROR")
        void missingInputShouldFailWithIoError() throws Exception {
            Path input = inputDir.resolve("ghost.png");

            JobOutcome outcome = executor.execute(ImageJob.of(input, outputDir.resolve("ghost.png"), SMALL));

            assertThat(outcome.errorKind()).isEqualTo(ErrorKind.IO_ERROR);
            assertThat(outcome.errorMessage()).contains("NoSuchFileException");
            assertThat(outputFileCount()).isZero();
        }

        @Test
        @DisplayName("out-of-range parameter should fail with TRANSFORM_ERROR")
        void invalidParameterShouldFailWithTransformError() throws Exception {
            Path input = ImageFixtures.write(inputDir.resolve("a.png"), ImageFixtures.gradient(10, 10), "png");
            TransformParameters invalid = SMALL.toBuilder().brightnessFactor(-2).build();

            JobOutcome outcome = executor.execute(ImageJob.of(input, outputDir.resolve("a.png"), invalid));

            assertThat(outcome.errorKind()).isEqualTo(ErrorKind.TRANSFORM_ERROR);
            assertThat(outcome.errorMessage()).contains("brightness");
            assertThat(outputFileCount()).isZero();
        }

        @Test
        @DisplayName("codec without writer should fail with ENCODE_ERROR and leave no file")
        void missingWriterShouldFailWithEncodeError() throws Exception {
            Path input = ImageFixtures.write(inputDir.resolve("a.png"), ImageFixtures.gradient(10, 10), "png");
            Path output = outputDir.resolve("a.webp");

            JobOutcome outcome = executor.execute(ImageJob.of(input, output, SMALL));

            assertThat(outcome.errorKind()).isEqualTo(ErrorKind.ENCODE_ERROR);
            assertThat(outcome.errorMessage()).contains("WEBP");
            assertThat(output).doesNotExist();
            assertThat(outputFileCount()).isZero();
        }

        @Test
        @DisplayName("unwritable output should fail with IO_ERROR")
        void unwritableOutputShouldFailWithIoError() throws Exception {
            Path input = ImageFixtures.write(inputDir.resolve("a.png"), ImageFixtures.gradient(10, 10), "png");
            Path output = outputDir.resolve("taken.png");
            Files.createDirectories(output);
            Files.writeString(output.resolve("occupant.txt"), "keeps the directory non-empty");

            JobOutcome outcome = executor.execute(ImageJob.of(input, output, SMALL));

            assertThat(outcome.errorKind()).isEqualTo(ErrorKind.IO_ERROR);
            assertThat(output).isDirectory();
            try (Stream<Path> files = Files.list(outputDir)) {
                assertThat(files).containsExactly(output);
            }
        }
    }
}
