/**
 * Domain model classes of the batch engine.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.imagebatch.domain.model.ImageJob} - Immutable unit of work (input, output, parameters)</li>
 *   <li>{@link fr.lapetina.imagebatch.domain.model.TransformParameters} - Shared, validated transform settings</li>
 *   <li>{@link fr.lapetina.imagebatch.domain.model.JobOutcome} - Completed or failed result of one job</li>
 *   <li>{@link fr.lapetina.imagebatch.domain.model.BatchReport} - Aggregate of all outcomes of a batch</li>
 *   <li>{@link fr.lapetina.imagebatch.domain.model.ErrorKind} - Per-image error taxonomy</li>
 *   <li>{@link fr.lapetina.imagebatch.domain.model.ImageCodec} - Output codecs</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Every type in this package is an immutable record or enum and may be shared freely
 * between worker threads.
 */
package fr.lapetina.imagebatch.domain.model;
