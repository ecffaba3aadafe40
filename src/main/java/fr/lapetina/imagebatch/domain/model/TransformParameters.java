package fr.lapetina.imagebatch.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Numeric parameters of the transform chain, shared read-only by every job of a batch.
 * Immutable and thread-safe.
 *
 * <p>Construction does not range-check; call {@link #validate()} before dispatch. This keeps
 * out-of-range values representable so that the transform stages can still reject them when
 * a caller bypasses validation.
 *
 * @param resize           target size, or {@code null} to keep the source size
 * @param blurRadius       Gaussian blur standard deviation, {@code <= 0} disables the stage
 * @param sharpenFactor    sharpness enhancement, 1.0 is identity
 * @param contrastFactor   contrast enhancement, 1.0 is identity
 * @param brightnessFactor brightness enhancement, 1.0 is identity
 */
public record TransformParameters(
        Dimensions resize,
        double blurRadius,
        double sharpenFactor,
        double contrastFactor,
        double brightnessFactor
) {

    /**
     * Parameters under which the pipeline leaves the image untouched.
     */
    public static TransformParameters identity() {
        return new TransformParameters(null, 0.0, 1.0, 1.0, 1.0);
    }

    /**
     * Default command line parameters of the processor.
     */
    public static TransformParameters defaults() {
        return new TransformParameters(Dimensions.of(800, 600), 1.0, 1.5, 1.2, 1.1);
    }

    public boolean hasResize() {
        return resize != null;
    }

    /**
     * Checks every field against its valid range.
     *
     * @return this instance, for chaining
     * @throws IllegalArgumentException listing every violated constraint
     */
    public TransformParameters validate() {
        List<String> violations = new ArrayList<>();

        if (resize != null && !resize.isPositive()) {
            violations.add("resize dimensions must be positive, got " + resize);
        }
        if (!Double.isFinite(blurRadius) || blurRadius < 0) {
            violations.add("blurRadius must be finite and >= 0, got " + blurRadius);
        }
        checkFactor("sharpenFactor", sharpenFactor, violations);
        checkFactor("contrastFactor", contrastFactor, violations);
        checkFactor("brightnessFactor", brightnessFactor, violations);

        if (!violations.isEmpty()) {
            throw new IllegalArgumentException("Invalid transform parameters: " + String.join("; ", violations));
        }
        return this;
    }

    private static void checkFactor(String name, double value, List<String> violations) {
        if (!Double.isFinite(value) || value <= 0) {
            violations.add(name + " must be finite and > 0, got " + value);
        }
    }

    public Builder toBuilder() {
        return new Builder()
                .resize(resize)
                .blurRadius(blurRadius)
                .sharpenFactor(sharpenFactor)
                .contrastFactor(contrastFactor)
                .brightnessFactor(brightnessFactor);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder starting from identity values.
     */
    public static final class Builder {
        private Dimensions resize;
        private double blurRadius = 0.0;
        private double sharpenFactor = 1.0;
        private double contrastFactor = 1.0;
        private double brightnessFactor = 1.0;

        public Builder resize(Dimensions resize) {
            this.resize = resize;
            return this;
        }

        public Builder resize(int width, int height) {
            this.resize = Dimensions.of(width, height);
            return this;
        }

        public Builder blurRadius(double blurRadius) {
            this.blurRadius = blurRadius;
            return this;
        }

        public Builder sharpenFactor(double sharpenFactor) {
            this.sharpenFactor = sharpenFactor;
            return this;
        }

        public Builder contrastFactor(double contrastFactor) {
            this.contrastFactor = contrastFactor;
            return this;
        }

        public Builder brightnessFactor(double brightnessFactor) {
            this.brightnessFactor = brightnessFactor;
            return this;
        }

        public TransformParameters build() {
            return new TransformParameters(resize, blurRadius, sharpenFactor, contrastFactor, brightnessFactor);
        }
    }
}
