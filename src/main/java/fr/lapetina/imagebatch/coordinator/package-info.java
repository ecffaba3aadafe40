/**
 * LMAX Disruptor-based batch coordinator.
 *
 * <p>Jobs are published to a pre-allocated ring buffer and consumed by a worker pool, one
 * worker per event. Outcomes flow back into a per-batch tracker which produces the
 * {@link fr.lapetina.imagebatch.domain.model.BatchReport}.
 *
 * <h2>Flow</h2>
 * <pre>
 * process(jobs) → validate parameters → publish (blocks when full) → workers → tracker → report
 * </pre>
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.imagebatch.coordinator.BatchCoordinator} - Worker pool owner and batch entry point</li>
 *   <li>{@link fr.lapetina.imagebatch.coordinator.handlers.JobWorkHandler} - Executes one job per event</li>
 *   <li>{@link fr.lapetina.imagebatch.coordinator.exception.BatchRejectedException} - Thrown when a batch is refused</li>
 * </ul>
 *
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.imagebatch.coordinator;
