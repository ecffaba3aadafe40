package fr.lapetina.imagebatch.infrastructure.io;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.event.IIOReadWarningListener;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.MemoryCacheImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Decodes image bytes with the ImageIO readers available at runtime.
 *
 * Works on bytes already read from disk so that file system failures and format failures
 * are reported separately by the caller.
 *
 * Reader warnings are treated as failures: the JPEG reader reports a truncated stream as a
 * warning and fills the missing rows, which would otherwise pass as a valid image.
 */
public final class ImageDecoder {

    /**
     * Decodes a complete image file held in memory.
     *
     * @param data   raw file content
     * @param source name used in error messages
     * @return the decoded image
     * @throws DecodeException if no reader recognizes the data, the reader fails or warns
     */
    public BufferedImage decode(byte[] data, String source) throws DecodeException {
        if (data.length == 0) {
            throw new DecodeException("Empty file: " + source);
        }

        try (ImageInputStream stream = new MemoryCacheImageInputStream(new ByteArrayInputStream(data))) {
            Iterator<ImageReader> readers = ImageIO.getImageReaders(stream);
            if (!readers.hasNext()) {
                throw new DecodeException("Unsupported or corrupt image: " + source);
            }
            return read(readers.next(), stream, source);
        } catch (IOException e) {
            throw new DecodeException("Failed to decode " + source + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // Some readers surface malformed data as unchecked exceptions
            throw new DecodeException("Malformed image data in " + source + ": " + e, e);
        }
    }

    private BufferedImage read(ImageReader reader, ImageInputStream stream, String source)
            throws IOException, DecodeException {
        List<String> warnings = new ArrayList<>();
        IIOReadWarningListener listener = (r, warning) -> warnings.add(warning);

        BufferedImage image;
        try {
            reader.addIIOReadWarningListener(listener);
            reader.setInput(stream, true, true);
            image = reader.read(0);
        } finally {
            reader.dispose();
        }

        if (!warnings.isEmpty()) {
            throw new DecodeException("Truncated or damaged image data in " + source + ": " + warnings.get(0));
        }
        if (image == null) {
            throw new DecodeException("Unsupported or corrupt image: " + source);
        }
        return image;
    }
}
