package fr.lapetina.imagebatch.transform;

import java.awt.image.BufferedImage;

/**
 * One pixel operation of the transform chain.
 *
 * Implementations are immutable, carry their own parameter and perform no I/O.
 * They receive and return images of type {@code TYPE_INT_RGB} or {@code TYPE_INT_ARGB}
 * and never modify their input.
 */
public interface TransformStage {

    /**
     * Returns the stage name used in errors, logs and metrics.
     */
    String getName();

    /**
     * Applies the operation.
     *
     * @param image working buffer, not modified
     * @return a new buffer, or the input itself when the stage is an identity
     * @throws TransformException if the stage parameter is out of range or processing fails
     */
    BufferedImage apply(BufferedImage image) throws TransformException;
}
