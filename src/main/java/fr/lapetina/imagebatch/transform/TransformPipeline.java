package fr.lapetina.imagebatch.transform;

import fr.lapetina.imagebatch.domain.model.TransformParameters;
import fr.lapetina.imagebatch.transform.stage.BrightnessStage;
import fr.lapetina.imagebatch.transform.stage.ContrastStage;
import fr.lapetina.imagebatch.transform.stage.GaussianBlurStage;
import fr.lapetina.imagebatch.transform.stage.ResizeStage;
import fr.lapetina.imagebatch.transform.stage.SharpenStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.List;

/**
 * Applies the transform chain to one decoded image, entirely in memory.
 *
 * STAGE ORDER: resize -> blur -> sharpen -> contrast -> brightness
 *
 * Resizing first means the convolution stages run over the target pixel count rather than
 * the source one. Contrast and brightness run last so the blur does not wash them out.
 *
 * The pipeline never touches the file system: the caller decodes once before and encodes
 * once after. Instances are stateless and safe to share between workers.
 */
public final class TransformPipeline {

    private static final Logger log = LoggerFactory.getLogger(TransformPipeline.class);

    public static final List<String> STAGE_ORDER = List.of(
            ResizeStage.NAME,
            GaussianBlurStage.NAME,
            SharpenStage.NAME,
            ContrastStage.NAME,
            BrightnessStage.NAME
    );

    private final StageObserver observer;

    public TransformPipeline() {
        this(StageObserver.NOOP);
    }

    public TransformPipeline(StageObserver observer) {
        this.observer = observer != null ? observer : StageObserver.NOOP;
    }

    /**
     * Runs every stage over a private copy of {@code source}.
     *
     * @param source     decoded image, not modified
     * @param parameters transform parameters
     * @return a new working buffer ({@code TYPE_INT_RGB} or {@code TYPE_INT_ARGB})
     * @throws TransformException naming the first stage that failed
     */
    public BufferedImage apply(BufferedImage source, TransformParameters parameters) throws TransformException {
        BufferedImage current = ImageBuffers.toWorking(source);

        for (TransformStage stage : stagesFor(parameters)) {
            long start = System.nanoTime();
            try {
                current = stage.apply(current);
            } catch (RuntimeException e) {
                throw new TransformException(stage.getName(), null,
                        "Stage '" + stage.getName() + "' failed: " + e.getMessage(), e);
            }
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            observer.onStageCompleted(stage.getName(), elapsed);

            log.debug("Stage completed: stage={}, size={}x{}, elapsedMs={}",
                    stage.getName(), current.getWidth(), current.getHeight(), elapsed.toMillis());
        }

        return current;
    }

    /**
     * Builds the stage chain for the given parameters, in pipeline order.
     */
    public static List<TransformStage> stagesFor(TransformParameters parameters) {
        return List.of(
                new ResizeStage(parameters.resize()),
                new GaussianBlurStage(parameters.blurRadius()),
                new SharpenStage(parameters.sharpenFactor()),
                new ContrastStage(parameters.contrastFactor()),
                new BrightnessStage(parameters.brightnessFactor())
        );
    }

    /**
     * Receives the duration of every stage run.
     */
    @FunctionalInterface
    public interface StageObserver {

        StageObserver NOOP = (stage, elapsed) -> { };

        void onStageCompleted(String stage, Duration elapsed);
    }
}
