package fr.lapetina.imagebatch.transform;

import java.awt.image.BufferedImage;

/**
 * Helpers for the packed-int working buffers used by the transform stages.
 */
public final class ImageBuffers {

    private ImageBuffers() {
        // Utility class
    }

    /**
     * Copies any decoded image into a fresh {@code TYPE_INT_ARGB} buffer when it has an
     * alpha channel, {@code TYPE_INT_RGB} otherwise.
     */
    public static BufferedImage toWorking(BufferedImage source) {
        int type = source.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        return convert(source, type);
    }

    /**
     * Copies an image into a new buffer of the given packed-int type.
     */
    public static BufferedImage convert(BufferedImage source, int type) {
        int width = source.getWidth();
        int height = source.getHeight();
        BufferedImage target = new BufferedImage(width, height, type);
        target.setRGB(0, 0, width, height, pixels(source), 0, width);
        return target;
    }

    /**
     * Returns the image as packed ARGB ints, row-major.
     */
    public static int[] pixels(BufferedImage image) {
        int width = image.getWidth();
        return image.getRGB(0, 0, width, image.getHeight(), null, 0, width);
    }

    /**
     * Creates a new buffer shaped like {@code template} holding the given pixels.
     */
    public static BufferedImage withPixels(BufferedImage template, int[] argb) {
        int width = template.getWidth();
        BufferedImage target = new BufferedImage(width, template.getHeight(), template.getType());
        target.setRGB(0, 0, width, template.getHeight(), argb, 0, width);
        return target;
    }

    public static boolean hasAlpha(BufferedImage image) {
        return image.getColorModel().hasAlpha();
    }

    public static int alpha(int argb) {
        return (argb >>> 24) & 0xFF;
    }

    public static int red(int argb) {
        return (argb >> 16) & 0xFF;
    }

    public static int green(int argb) {
        return (argb >> 8) & 0xFF;
    }

    public static int blue(int argb) {
        return argb & 0xFF;
    }

    public static int argb(int a, int r, int g, int b) {
        return (a << 24) | (r << 16) | (g << 8) | b;
    }

    /**
     * Rounds to the nearest integer and clamps to the 8-bit channel range.
     */
    public static int clamp(double value) {
        long rounded = Math.round(value);
        if (rounded < 0) {
            return 0;
        }
        return rounded > 255 ? 255 : (int) rounded;
    }
}
