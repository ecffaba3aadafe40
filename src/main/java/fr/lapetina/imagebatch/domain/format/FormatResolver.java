package fr.lapetina.imagebatch.domain.format;

import fr.lapetina.imagebatch.domain.model.ImageCodec;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps a filename to the codec used when writing it.
 *
 * Extension rules (case-insensitive): .jpg/.jpeg to JPEG, .png to PNG, .bmp to BMP,
 * .tiff to TIFF, .webp to WEBP. Anything else falls back to JPEG.
 * An explicit override always wins and skips extension inspection.
 */
public final class FormatResolver {

    public static final ImageCodec DEFAULT_CODEC = ImageCodec.JPEG;

    private static final Map<String, ImageCodec> EXTENSIONS = new LinkedHashMap<>();

    static {
        EXTENSIONS.put(".jpg", ImageCodec.JPEG);
        EXTENSIONS.put(".jpeg", ImageCodec.JPEG);
        EXTENSIONS.put(".png", ImageCodec.PNG);
        EXTENSIONS.put(".bmp", ImageCodec.BMP);
        EXTENSIONS.put(".tiff", ImageCodec.TIFF);
        EXTENSIONS.put(".webp", ImageCodec.WEBP);
    }

    private FormatResolver() {
        // Utility class
    }

    /**
     * Resolves the codec for a filename, memoizing the extension lookup in the given cache.
     *
     * @param filename file name or path string
     * @param override explicit codec, may be null
     * @param cache    batch-scoped memo, or null for an uncached lookup
     * @return the codec, never null
     */
    public static ImageCodec resolve(String filename, ImageCodec override, FormatCache cache) {
        if (override != null) {
            return override;
        }
        if (filename == null || cache == null) {
            return inferFromFilename(filename);
        }
        return cache.computeIfAbsent(filename, FormatResolver::inferFromFilename);
    }

    public static ImageCodec resolve(Path path, ImageCodec override, FormatCache cache) {
        if (path == null) {
            return resolve((String) null, override, cache);
        }
        Path fileName = path.getFileName();
        return resolve(fileName != null ? fileName.toString() : path.toString(), override, cache);
    }

    /**
     * Uncached extension lookup.
     */
    public static ImageCodec inferFromFilename(String filename) {
        if (filename == null) {
            return DEFAULT_CODEC;
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, ImageCodec> entry : EXTENSIONS.entrySet()) {
            if (lower.endsWith(entry.getKey())) {
                return entry.getValue();
            }
        }
        return DEFAULT_CODEC;
    }
}
