package fr.lapetina.imagebatch.transform.stage;

import fr.lapetina.imagebatch.transform.ImageBuffers;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.awt.image.BufferedImage;

/**
 * Moves pixels between {@link BufferedImage} and 8-bit BGRA OpenCV matrices.
 *
 * The native library is loaded when this class is first used.
 */
final class OpenCvMats {

    static {
        nu.pattern.OpenCV.loadLocally();
    }

    private OpenCvMats() {
    }

    /**
     * Copies the image into a new {@code CV_8UC4} matrix in B, G, R, A channel order.
     * The caller releases it.
     */
    static Mat toBgra(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] argb = ImageBuffers.pixels(image);

        byte[] bytes = new byte[argb.length * 4];
        for (int i = 0, j = 0; i < argb.length; i++, j += 4) {
            int pixel = argb[i];
            bytes[j] = (byte) ImageBuffers.blue(pixel);
            bytes[j + 1] = (byte) ImageBuffers.green(pixel);
            bytes[j + 2] = (byte) ImageBuffers.red(pixel);
            bytes[j + 3] = (byte) ImageBuffers.alpha(pixel);
        }

        Mat mat = new Mat(height, width, CvType.CV_8UC4);
        mat.put(0, 0, bytes);
        return mat;
    }

    /**
     * Builds an image of the template's type from a {@code CV_8UC4} BGRA matrix.
     */
    static BufferedImage toImage(BufferedImage template, Mat bgra) {
        byte[] bytes = new byte[(int) bgra.total() * 4];
        bgra.get(0, 0, bytes);

        int[] argb = new int[bytes.length / 4];
        for (int i = 0, j = 0; i < argb.length; i++, j += 4) {
            argb[i] = ImageBuffers.argb(bytes[j + 3] & 0xFF, bytes[j + 2] & 0xFF, bytes[j + 1] & 0xFF, bytes[j] & 0xFF);
        }
        return ImageBuffers.withPixels(template, argb);
    }

    static void release(Mat... mats) {
        for (Mat mat : mats) {
            if (mat != null) {
                mat.release();
            }
        }
    }
}
