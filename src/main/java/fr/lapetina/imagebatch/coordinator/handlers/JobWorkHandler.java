package fr.lapetina.imagebatch.coordinator.handlers;

import com.lmax.disruptor.WorkHandler;
import fr.lapetina.imagebatch.domain.event.ImageJobEvent;
import fr.lapetina.imagebatch.domain.model.ImageJob;
import fr.lapetina.imagebatch.domain.model.JobOutcome;
import fr.lapetina.imagebatch.executor.JobExecutor;
import fr.lapetina.imagebatch.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Worker of the batch pool: each event is consumed by exactly one instance.
 *
 * Executes the job, records metrics and hands the outcome to the event's batch. The outcome
 * is delivered in a finally block so that even an unexpected error produces one outcome per
 * job and the waiting batch never hangs.
 *
 * Sets the {@code image} MDC key for the duration of the job.
 */
public final class JobWorkHandler implements WorkHandler<ImageJobEvent> {

    private static final Logger log = LoggerFactory.getLogger(JobWorkHandler.class);

    static final String MDC_IMAGE = "image";

    private final JobExecutor executor;
    private final MetricsRegistry metricsRegistry;
    private final AtomicInteger inFlight;

    public JobWorkHandler(JobExecutor executor, MetricsRegistry metricsRegistry, AtomicInteger inFlight) {
        this.executor = executor;
        this.metricsRegistry = metricsRegistry;
        this.inFlight = inFlight;
    }

    @Override
    public void onEvent(ImageJobEvent event) {
        ImageJob job = event.getJob();
        if (job == null) {
            log.warn("Received event without job: {}", event);
            return;
        }

        MDC.put(MDC_IMAGE, String.valueOf(job.input().getFileName()));
        metricsRegistry.setInFlightJobs(inFlight.incrementAndGet());

        AtomicReference<JobExecutor.Phase> phase = new AtomicReference<>(JobExecutor.Phase.READ);
        JobOutcome outcome = null;
        try {
            outcome = executor.execute(job, event.getFormatCache(), phase::set);
        } finally {
            if (outcome == null) {
                outcome = abortedOutcome(job, phase.get());
            }
            try {
                metricsRegistry.setInFlightJobs(inFlight.decrementAndGet());
                metricsRegistry.recordOutcome(outcome);
            } catch (RuntimeException e) {
                log.warn("Failed to record metrics: input={}", job.input(), e);
            }
            // Releases the batch; metrics are visible to the caller by then
            event.complete(outcome);
            event.clear();
            MDC.remove(MDC_IMAGE);
        }
    }

    /**
     * Outcome for a job whose executor threw, attributed to the phase that was running.
     */
    static JobOutcome abortedOutcome(ImageJob job, JobExecutor.Phase phase) {
        log.error("Job aborted: input={}, phase={}", job.input(), phase.getLabel());
        return JobOutcome.failed(job.input(), phase.getErrorKind(),
                "Job aborted by unexpected error during " + phase.getLabel());
    }

    public JobExecutor getExecutor() {
        return executor;
    }
}
