package fr.lapetina.imagebatch.domain.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Result of executing exactly one {@link ImageJob}.
 * Immutable and thread-safe.
 *
 * <p>A completed outcome carries the output path, the codec written and the elapsed time.
 * A failed outcome carries the error kind and a human-readable message; its output and codec
 * are {@code null}.
 */
public record JobOutcome(
        Path input,
        Path output,
        ImageCodec codec,
        Duration elapsed,
        ErrorKind errorKind,
        String errorMessage
) {
    public JobOutcome {
        Objects.requireNonNull(input, "Input path is required");
        if (elapsed == null) {
            elapsed = Duration.ZERO;
        }
        if (errorKind == null) {
            Objects.requireNonNull(output, "Output path is required for a completed outcome");
        }
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public boolean isFailure() {
        return errorKind != null;
    }

    /**
     * Creates a successful outcome.
     */
    public static JobOutcome completed(Path input, Path output, ImageCodec codec, Duration elapsed) {
        return new JobOutcome(input, output, codec, elapsed, null, null);
    }

    /**
     * Creates a failed outcome.
     */
    public static JobOutcome failed(Path input, ErrorKind errorKind, String errorMessage, Duration elapsed) {
        Objects.requireNonNull(errorKind, "Error kind is required for a failed outcome");
        return new JobOutcome(input, null, null, elapsed, errorKind, errorMessage);
    }

    public static JobOutcome failed(Path input, ErrorKind errorKind, String errorMessage) {
        return failed(input, errorKind, errorMessage, Duration.ZERO);
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "Completed{input=" + input + ", output=" + output + ", codec=" + codec
                    + ", elapsedMs=" + elapsed.toMillis() + '}';
        }
        return "Failed{input=" + input + ", kind=" + errorKind + ", message=" + errorMessage + '}';
    }
}
