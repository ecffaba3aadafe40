/**
 * In-memory transform chain applied to one decoded image.
 *
 * <h2>Pipeline Stages</h2>
 * <pre>
 * Resize → Gaussian Blur → Sharpen → Contrast → Brightness
 * </pre>
 *
 * <p>Each stage is a {@link fr.lapetina.imagebatch.transform.TransformStage} holding its own
 * parameter. Identity parameters (no resize, blur 0, factors 1.0) leave the pixels untouched.
 *
 * @see fr.lapetina.imagebatch.transform.TransformPipeline
 */
package fr.lapetina.imagebatch.transform;
