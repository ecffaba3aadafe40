package fr.lapetina.imagebatch.executor;

import fr.lapetina.imagebatch.domain.format.FormatCache;
import fr.lapetina.imagebatch.domain.format.FormatResolver;
import fr.lapetina.imagebatch.domain.model.ErrorKind;
import fr.lapetina.imagebatch.domain.model.ImageCodec;
import fr.lapetina.imagebatch.domain.model.ImageJob;
import fr.lapetina.imagebatch.domain.model.JobOutcome;
import fr.lapetina.imagebatch.infrastructure.io.DecodeException;
import fr.lapetina.imagebatch.infrastructure.io.EncodeException;
import fr.lapetina.imagebatch.infrastructure.io.ImageDecoder;
import fr.lapetina.imagebatch.infrastructure.io.ImageEncoder;
import fr.lapetina.imagebatch.infrastructure.io.OutputWriter;
import fr.lapetina.imagebatch.transform.TransformException;
import fr.lapetina.imagebatch.transform.TransformPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Runs one job end to end: read, decode, transform, encode, write.
 *
 * PHASES AND ERROR KINDS:
 *
 * 1. read bytes   -> IO_ERROR
 * 2. decode       -> DECODE_ERROR
 * 3. transform    -> TRANSFORM_ERROR
 * 4. encode       -> ENCODE_ERROR
 * 5. write        -> IO_ERROR
 *
 * The codec is resolved from the output filename (or the job's explicit format) between
 * transform and encode. Encoding happens in memory so nothing reaches the output path unless
 * every phase succeeded.
 *
 * {@link #execute(ImageJob)} never throws for failures of the image itself: every exception,
 * running out of memory on an oversized image and a missing native library are returned as a
 * failed {@link JobOutcome} carrying the kind of the phase that was running.
 *
 * Instances hold no per-job state and are shared by all workers.
 */
public final class JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final TransformPipeline pipeline;
    private final ImageDecoder decoder;
    private final ImageEncoder encoder;
    private final OutputWriter writer;

    public JobExecutor(TransformPipeline pipeline, ImageDecoder decoder, ImageEncoder encoder, OutputWriter writer) {
        this.pipeline = Objects.requireNonNull(pipeline, "TransformPipeline is required");
        this.decoder = Objects.requireNonNull(decoder, "ImageDecoder is required");
        this.encoder = Objects.requireNonNull(encoder, "ImageEncoder is required");
        this.writer = Objects.requireNonNull(writer, "OutputWriter is required");
    }

    /**
     * Executor with a plain pipeline and default encoder settings.
     */
    public static JobExecutor withDefaults() {
        return new JobExecutor(new TransformPipeline(), new ImageDecoder(), ImageEncoder.withDefaults(), new OutputWriter());
    }

    /**
     * Executes a single job with a private format cache.
     */
    public JobOutcome execute(ImageJob job) {
        return execute(job, new FormatCache());
    }

    /**
     * Executes a single job, resolving its codec through the batch's shared cache.
     */
    public JobOutcome execute(ImageJob job, FormatCache formatCache) {
        return execute(job, formatCache, phase -> { });
    }

    /**
     * Executes a single job and reports each phase as it is entered.
     *
     * @param phaseListener told about every phase before it runs; lets a caller attribute
     *                      a failure that escapes this method to the right phase
     */
    public JobOutcome execute(ImageJob job, FormatCache formatCache, Consumer<Phase> phaseListener) {
        long start = System.nanoTime();
        Path input = job.input();
        Phase phase = Phase.READ;

        log.info("Processing image: input={}, output={}", input, job.output());

        try {
            phaseListener.accept(phase);
            byte[] data = Files.readAllBytes(input);

            phase = Phase.DECODE;
            phaseListener.accept(phase);
            BufferedImage decoded = decoder.decode(data, input.toString());
            // Release the raw bytes before the pixel-heavy stages
            data = null;

            phase = Phase.TRANSFORM;
            phaseListener.accept(phase);
            BufferedImage transformed = pipeline.apply(decoded, job.parameters());

            phase = Phase.ENCODE;
            phaseListener.accept(phase);
            ImageCodec codec = FormatResolver.resolve(job.output(), job.outputFormat(), formatCache);
            byte[] encoded = encoder.encode(transformed, codec);

            phase = Phase.WRITE;
            phaseListener.accept(phase);
            writer.write(job.output(), encoded);

            Duration elapsed = elapsedSince(start);
            log.info("Image processed: input={}, output={}, codec={}, size={}x{}, elapsedMs={}",
                    input, job.output(), codec, transformed.getWidth(), transformed.getHeight(), elapsed.toMillis());

            return JobOutcome.completed(input, job.output(), codec, elapsed);
        } catch (DecodeException | TransformException | EncodeException e) {
            return failed(job, phase.getErrorKind(), e.getMessage(), start);
        } catch (IOException | RuntimeException e) {
            return failed(job, phase.getErrorKind(), phase.getFailurePrefix() + describe(e), start);
        } catch (OutOfMemoryError e) {
            return failed(job, phase.getErrorKind(), "Out of memory during " + phase.getLabel(), start);
        } catch (LinkageError e) {
            // Missing native codec or filter library
            return failed(job, phase.getErrorKind(), phase.getFailurePrefix() + describe(e), start);
        }
    }

    private JobOutcome failed(ImageJob job, ErrorKind kind, String message, long start) {
        Duration elapsed = elapsedSince(start);
        log.error("Image failed: input={}, errorKind={}, error={}, elapsedMs={}",
                job.input(), kind, message, elapsed.toMillis());
        return JobOutcome.failed(job.input(), kind, message, elapsed);
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static String describe(Throwable e) {
        // NoSuchFileException and friends carry only the path as message
        String message = e.getMessage();
        return message == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + message;
    }

    /**
     * Steps of one job, each with the error kind its failures are reported as.
     */
    public enum Phase {
        READ("read", ErrorKind.IO_ERROR, "Cannot read input: "),
        DECODE("decode", ErrorKind.DECODE_ERROR, "Decode failed: "),
        TRANSFORM("transform", ErrorKind.TRANSFORM_ERROR, "Transform failed: "),
        ENCODE("encode", ErrorKind.ENCODE_ERROR, "Encode failed: "),
        WRITE("write", ErrorKind.IO_ERROR, "Cannot write output: ");

        private final String label;
        private final ErrorKind errorKind;
        private final String failurePrefix;

        Phase(String label, ErrorKind errorKind, String failurePrefix) {
            this.label = label;
            this.errorKind = errorKind;
            this.failurePrefix = failurePrefix;
        }

        public String getLabel() {
            return label;
        }

        public ErrorKind getErrorKind() {
            return errorKind;
        }

        String getFailurePrefix() {
            return failurePrefix;
        }
    }
}
