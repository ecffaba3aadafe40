package fr.lapetina.imagebatch.transform.stage;

import fr.lapetina.imagebatch.transform.ImageBuffers;
import fr.lapetina.imagebatch.transform.TransformException;
import fr.lapetina.imagebatch.transform.TransformStage;

import java.awt.image.BufferedImage;

/**
 * Fourth stage: linear contrast enhancement around the mean luminance.
 *
 * {@code out = mean + factor * (v - mean)} per colour channel, where mean is the rounded
 * average of ITU-R 601 luma over the whole image. Alpha is left untouched.
 */
public final class ContrastStage implements TransformStage {

    public static final String NAME = "contrast";

    private final double factor;

    public ContrastStage(double factor) {
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
        int mean = meanLuminance(pixels);

        for (int i = 0; i < pixels.length; i++) {
            int p = pixels[i];
            pixels[i] = ImageBuffers.argb(
                    ImageBuffers.alpha(p),
                    ImageBuffers.clamp(mean + factor * (ImageBuffers.red(p) - mean)),
                    ImageBuffers.clamp(mean + factor * (ImageBuffers.green(p) - mean)),
                    ImageBuffers.clamp(mean + factor * (ImageBuffers.blue(p) - mean)));
        }
        return ImageBuffers.withPixels(image, pixels);
    }

    static int meanLuminance(int[] pixels) {
        if (pixels.length == 0) {
            return 0;
        }
        double sum = 0;
        for (int p : pixels) {
            sum += (ImageBuffers.red(p) * 299 + ImageBuffers.green(p) * 587 + ImageBuffers.blue(p) * 114) / 1000.0;
        }
        return (int) (sum / pixels.length + 0.5);
    }

    public double getFactor() {
        return factor;
    }
}
