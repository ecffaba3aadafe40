package fr.lapetina.imagebatch.transform.stage;

import fr.lapetina.imagebatch.transform.TransformException;
import fr.lapetina.imagebatch.transform.TransformStage;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.awt.image.BufferedImage;

/**
 * Second stage: Gaussian blur over all four channels.
 *
 * The radius is the standard deviation of the kernel; the kernel extends three deviations
 * each side. Edges replicate the border pixel. A radius of zero or less is an identity.
 */
public final class GaussianBlurStage implements TransformStage {

    public static final String NAME = "blur";

    private final double radius;

    public GaussianBlurStage(double radius) {
        this.radius = radius;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public BufferedImage apply(BufferedImage image) throws TransformException {
        if (!Double.isFinite(radius)) {
            throw TransformException.invalidParameter(NAME, "radius", radius);
        }
        if (radius <= 0) {
            return image;
        }

        int size = kernelSize(radius);
        Mat input = null;
        Mat output = new Mat();
        try {
            input = OpenCvMats.toBgra(image);
            Imgproc.GaussianBlur(input, output, new Size(size, size), radius, radius, Core.BORDER_REPLICATE);
            return OpenCvMats.toImage(image, output);
        } finally {
            OpenCvMats.release(input, output);
        }
    }

    /**
     * Odd kernel width covering three deviations each side of the centre.
     */
    static int kernelSize(double sigma) {
        return Math.max(1, (int) Math.ceil(sigma * 3.0)) * 2 + 1;
    }

    public double getRadius() {
        return radius;
    }
}
