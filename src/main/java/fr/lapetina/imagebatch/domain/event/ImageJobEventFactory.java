package fr.lapetina.imagebatch.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for creating ImageJobEvent instances in the Disruptor ring buffer.
 *
 * The Disruptor pre-allocates events at startup; they are then reused by clearing and
 * re-initializing them for each job.
 */
public final class ImageJobEventFactory implements EventFactory<ImageJobEvent> {

    @Override
    public ImageJobEvent newInstance() {
        return new ImageJobEvent();
    }
}
