/**
 * Ring buffer events.
 *
 * <p>{@link fr.lapetina.imagebatch.domain.event.ImageJobEvent} instances are pre-allocated
 * by {@link fr.lapetina.imagebatch.domain.event.ImageJobEventFactory} and reused for every job.
 */
package fr.lapetina.imagebatch.domain.event;
