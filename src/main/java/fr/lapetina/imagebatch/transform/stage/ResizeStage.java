package fr.lapetina.imagebatch.transform.stage;

import fr.lapetina.imagebatch.domain.model.Dimensions;
import fr.lapetina.imagebatch.transform.ImageBuffers;
import fr.lapetina.imagebatch.transform.TransformException;
import fr.lapetina.imagebatch.transform.TransformStage;
import net.coobird.thumbnailator.Thumbnails;
import net.coobird.thumbnailator.resizers.configurations.Antialiasing;
import net.coobird.thumbnailator.resizers.configurations.Rendering;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * First stage: scales the image to exact target dimensions.
 *
 * Aspect ratio is not preserved. Uses Thumbnailator's progressive resampling with quality
 * rendering hints. A null target, or one equal to the source size, leaves the image as is.
 */
public final class ResizeStage implements TransformStage {

    public static final String NAME = "resize";

    private final Dimensions target;

    public ResizeStage(Dimensions target) {
        this.target = target;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public BufferedImage apply(BufferedImage image) throws TransformException {
        if (target == null) {
            return image;
        }
        if (target.width() <= 0) {
            throw TransformException.invalidParameter(NAME, "width", target.width());
        }
        if (target.height() <= 0) {
            throw TransformException.invalidParameter(NAME, "height", target.height());
        }
        if (target.matches(image.getWidth(), image.getHeight())) {
            return image;
        }

        try {
            BufferedImage resized = Thumbnails.of(image)
                    .forceSize(target.width(), target.height())
                    .antialiasing(Antialiasing.ON)
                    .rendering(Rendering.QUALITY)
                    .asBufferedImage();
            return resized.getType() == image.getType()
                    ? resized
                    : ImageBuffers.convert(resized, image.getType());
        } catch (IOException e) {
            throw new TransformException(NAME, null, "Resize to " + target + " failed: " + e.getMessage(), e);
        }
    }

    public Dimensions getTarget() {
        return target;
    }
}
