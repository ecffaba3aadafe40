package fr.lapetina.imagebatch.transform.stage;

import fr.lapetina.imagebatch.transform.TransformException;
import fr.lapetina.imagebatch.transform.TransformStage;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.imgproc.Imgproc;

import java.awt.image.BufferedImage;

/**
 * Third stage: unsharp-style sharpness enhancement.
 *
 * Blends between a smoothed copy and the source: {@code out = smooth + factor * (src - smooth)}.
 * Factor 1.0 returns the source, factors above 1.0 sharpen, below 1.0 soften.
 * Alpha is left untouched.
 */
public final class SharpenStage implements TransformStage {

    public static final String NAME = "sharpen";

    // 3x3 smoothing kernel, centre weight 5, total 13
    private static final float[] SMOOTH = {
            1 / 13f, 1 / 13f, 1 / 13f,
            1 / 13f, 5 / 13f, 1 / 13f,
            1 / 13f, 1 / 13f, 1 / 13f
    };

    private static final int ALPHA_CHANNEL = 3;

    private final double factor;

    public SharpenStage(double factor) {
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

        Mat input = null;
        Mat kernel = null;
        Mat smooth = new Mat();
        Mat output = new Mat();
        Mat alpha = new Mat();
        try {
            input = OpenCvMats.toBgra(image);
            kernel = new Mat(3, 3, CvType.CV_32F);
            kernel.put(0, 0, SMOOTH);
            Imgproc.filter2D(input, smooth, -1, kernel, new Point(-1, -1), 0, Core.BORDER_REPLICATE);

            // factor * src + (1 - factor) * smooth, saturated to 0..255
            Core.addWeighted(input, factor, smooth, 1.0 - factor, 0, output);

            Core.extractChannel(input, alpha, ALPHA_CHANNEL);
            Core.insertChannel(alpha, output, ALPHA_CHANNEL);
            return OpenCvMats.toImage(image, output);
        } finally {
            OpenCvMats.release(input, kernel, smooth, output, alpha);
        }
    }

    public double getFactor() {
        return factor;
    }
}
