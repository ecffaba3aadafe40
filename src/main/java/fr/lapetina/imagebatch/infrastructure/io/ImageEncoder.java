package fr.lapetina.imagebatch.infrastructure.io;

import fr.lapetina.imagebatch.domain.model.ImageCodec;
import fr.lapetina.imagebatch.transform.ImageBuffers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import javax.imageio.stream.MemoryCacheImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.Iterator;

/**
 * Encodes images in memory with codec-specific write parameters.
 *
 * - JPEG: explicit compression quality
 * - TIFF: explicit compression type (LZW by default)
 * - PNG, BMP: lossless writer defaults
 *
 * Images carrying alpha are flattened onto white before encoding in a codec without alpha.
 */
public final class ImageEncoder {

    private static final Logger log = LoggerFactory.getLogger(ImageEncoder.class);

    private final float jpegQuality;
    private final String tiffCompression;

    public ImageEncoder(float jpegQuality, String tiffCompression) {
        if (jpegQuality <= 0f || jpegQuality > 1f) {
            throw new IllegalArgumentException("JPEG quality must be in (0, 1], got " + jpegQuality);
        }
        this.jpegQuality = jpegQuality;
        this.tiffCompression = tiffCompression;
    }

    /**
     * Creates an encoder with JPEG quality 0.9 and LZW TIFF compression.
     */
    public static ImageEncoder withDefaults() {
        return new ImageEncoder(0.9f, "LZW");
    }

    /**
     * Encodes the image.
     *
     * @return the complete file content
     * @throws EncodeException if no writer supports the codec or the writer fails
     */
    public byte[] encode(BufferedImage image, ImageCodec codec) throws EncodeException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(codec.getFormatName());
        if (!writers.hasNext()) {
            throw new EncodeException("No image writer available for codec " + codec);
        }
        ImageWriter writer = writers.next();

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        try (ImageOutputStream output = new MemoryCacheImageOutputStream(buffer)) {
            BufferedImage prepared = prepare(image, codec);
            writer.setOutput(output);
            writer.write(null, new IIOImage(prepared, null, null), writeParam(writer, codec));
            output.flush();
        } catch (IOException | RuntimeException e) {
            throw new EncodeException("Failed to encode as " + codec + ": " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }

        byte[] bytes = buffer.toByteArray();
        if (bytes.length == 0) {
            throw new EncodeException("Writer produced no data for codec " + codec);
        }
        return bytes;
    }

    private BufferedImage prepare(BufferedImage image, ImageCodec codec) {
        if (codec.supportsAlpha() || !ImageBuffers.hasAlpha(image)) {
            return image;
        }
        BufferedImage flattened = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = flattened.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        log.debug("Flattened alpha channel for codec {}", codec);
        return flattened;
    }

    private ImageWriteParam writeParam(ImageWriter writer, ImageCodec codec) {
        ImageWriteParam param = writer.getDefaultWriteParam();
        if (!param.canWriteCompressed()) {
            return param;
        }

        switch (codec) {
            case JPEG -> {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                param.setCompressionQuality(jpegQuality);
            }
            case TIFF -> {
                if (tiffCompression != null && !tiffCompression.isBlank()) {
                    String[] types = param.getCompressionTypes();
                    if (types != null && Arrays.asList(types).contains(tiffCompression)) {
                        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                        param.setCompressionType(tiffCompression);
                    } else {
                        log.warn("Unsupported TIFF compression '{}', using writer default", tiffCompression);
                    }
                }
            }
            default -> {
                // Writer defaults
            }
        }
        return param;
    }

    public float getJpegQuality() {
        return jpegQuality;
    }

    public String getTiffCompression() {
        return tiffCompression;
    }
}
