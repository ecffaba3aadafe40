package fr.lapetina.imagebatch.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Output codecs understood by the encoder.
 */
public enum ImageCodec {
    JPEG("jpeg", false, true),
    PNG("png", true, false),
    BMP("bmp", false, false),
    TIFF("tiff", true, false),
    WEBP("webp", true, true);

    private final String formatName;
    private final boolean supportsAlpha;
    private final boolean lossy;

    ImageCodec(String formatName, boolean supportsAlpha, boolean lossy) {
        this.formatName = formatName;
        this.supportsAlpha = supportsAlpha;
        this.lossy = lossy;
    }

    /**
     * Returns the ImageIO format name used to look up writers.
     */
    public String getFormatName() {
        return formatName;
    }

    public boolean supportsAlpha() {
        return supportsAlpha;
    }

    public boolean isLossy() {
        return lossy;
    }

    /**
     * Parses a codec name as found in configuration ("png", "JPEG", "jpg").
     *
     * @return the codec, or empty for a blank or unknown name
     */
    public static Optional<ImageCodec> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("JPG")) {
            return Optional.of(JPEG);
        }
        for (ImageCodec codec : values()) {
            if (codec.name().equals(normalized)) {
                return Optional.of(codec);
            }
        }
        return Optional.empty();
    }
}
