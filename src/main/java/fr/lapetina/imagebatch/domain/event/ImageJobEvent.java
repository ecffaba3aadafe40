package fr.lapetina.imagebatch.domain.event;

import fr.lapetina.imagebatch.domain.format.FormatCache;
import fr.lapetina.imagebatch.domain.model.ImageJob;
import fr.lapetina.imagebatch.domain.model.JobOutcome;

import java.time.Instant;
import java.util.function.Consumer;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * This is a mutable holder that gets reused across the ring buffer. It carries one job,
 * the batch it belongs to (through its outcome sink and format cache) and, once executed,
 * the outcome.
 *
 * IMPORTANT: This class is intentionally mutable for Disruptor performance.
 * It should never be accessed outside the worker handlers.
 */
public final class ImageJobEvent {

    private ImageJob job;
    private FormatCache formatCache;
    private Consumer<JobOutcome> outcomeSink;
    private JobOutcome outcome;
    private Instant acceptedAt;

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.job = null;
        this.formatCache = null;
        this.outcomeSink = null;
        this.outcome = null;
        this.acceptedAt = null;
    }

    /**
     * Initializes the event with a new job of a batch.
     */
    public void initialize(ImageJob job, FormatCache formatCache, Consumer<JobOutcome> outcomeSink) {
        clear();
        this.job = job;
        this.formatCache = formatCache;
        this.outcomeSink = outcomeSink;
        this.acceptedAt = Instant.now();
    }

    /**
     * Stores the outcome and hands it to the batch. Only the first call has an effect.
     */
    public void complete(JobOutcome outcome) {
        if (this.outcome != null) {
            return;
        }
        this.outcome = outcome;
        if (outcomeSink != null) {
            outcomeSink.accept(outcome);
        }
    }

    public ImageJob getJob() {
        return job;
    }

    public FormatCache getFormatCache() {
        return formatCache;
    }

    public JobOutcome getOutcome() {
        return outcome;
    }

    public Instant getAcceptedAt() {
        return acceptedAt;
    }

    public boolean isCompleted() {
        return outcome != null;
    }

    @Override
    public String toString() {
        return "ImageJobEvent{" +
                "input=" + (job != null ? job.input() : "null") +
                ", output=" + (job != null ? job.output() : "null") +
                ", completed=" + isCompleted() +
                '}';
    }
}
