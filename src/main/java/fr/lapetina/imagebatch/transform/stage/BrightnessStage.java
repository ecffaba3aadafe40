package fr.lapetina.imagebatch.transform.stage;

import fr.lapetina.imagebatch.transform.ImageBuffers;
import fr.lapetina.imagebatch.transform.TransformException;
import fr.lapetina.imagebatch.transform.TransformStage;

import java.awt.image.BufferedImage;

/**
 * Final stage: scales every colour channel by the factor. Alpha is left untouched.
 */
public final class BrightnessStage implements TransformStage {

    public static final String NAME = "brightness";

    private final double factor;

    public BrightnessStage(double factor) {
        this.factor = factor;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public BufferedImage apply(BufferedImage image) throws TransformException {
        if (!Double.isFinite(factor) || factor <= 0) {
            throw TransformException.invalidParameter(NAME, "factor", factor);
        }
        if (factor == 1.0) {
            return image;
        }

        int[] pixels = ImageBuffers.pixels(image);
        for (int i = 0; i < pixels.length; i++) {
            int p = pixels[i];
            pixels[i] = ImageBuffers.argb(
                    ImageBuffers.alpha(p),
                    ImageBuffers.clamp(ImageBuffers.red(p) * factor),
                    ImageBuffers.clamp(ImageBuffers.green(p) * factor),
                    ImageBuffers.clamp(ImageBuffers.blue(p) * factor));
        }
        return ImageBuffers.withPixels(image, pixels);
    }

    public double getFactor() {
        return factor;
    }
}
