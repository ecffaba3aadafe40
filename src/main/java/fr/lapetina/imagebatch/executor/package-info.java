/**
 * Single-image execution.
 *
 * <p>{@link fr.lapetina.imagebatch.executor.JobExecutor} is both the unit of work of the batch
 * worker pool and the standalone single-image entry point. It converts every failure into a
 * typed {@link fr.lapetina.imagebatch.domain.model.JobOutcome} instead of throwing.
 *
 * @see fr.lapetina.imagebatch.domain.model.ErrorKind
 */
package fr.lapetina.imagebatch.executor;
