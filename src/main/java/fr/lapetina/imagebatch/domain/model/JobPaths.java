package fr.lapetina.imagebatch.domain.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Resolved (input, output) pair produced by job planning, before parameters are attached.
 */
public record JobPaths(Path input, Path output) {
    public JobPaths {
        Objects.requireNonNull(input, "Input path is required");
        Objects.requireNonNull(output, "Output path is required");
    }

    public ImageJob toJob(TransformParameters parameters, ImageCodec outputFormat) {
        return new ImageJob(input, output, parameters, outputFormat);
    }
}
