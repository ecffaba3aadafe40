package fr.lapetina.imagebatch.domain.model;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * One unit of batch work: an input image, where to write the result and what to apply.
 * Immutable and thread-safe.
 *
 * @param input        image to decode
 * @param output       file to write; parent directories are created on demand
 * @param parameters   transform parameters, usually shared by the whole batch
 * @param outputFormat explicit codec, or {@code null} to infer it from the output filename
 */
public record ImageJob(
        Path input,
        Path output,
        TransformParameters parameters,
        ImageCodec outputFormat
) {
    public ImageJob {
        Objects.requireNonNull(input, "Input path is required");
        Objects.requireNonNull(output, "Output path is required");
        Objects.requireNonNull(parameters, "Transform parameters are required");
    }

    /**
     * Creates a job whose output format follows the output file extension.
     */
    public static ImageJob of(Path input, Path output, TransformParameters parameters) {
        return new ImageJob(input, output, parameters, null);
    }

    public Optional<ImageCodec> formatOverride() {
        return Optional.ofNullable(outputFormat);
    }
}
