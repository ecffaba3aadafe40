package fr.lapetina.imagebatch.coordinator;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.imagebatch.coordinator.exception.BatchRejectedException;
import fr.lapetina.imagebatch.coordinator.handlers.JobWorkHandler;
import fr.lapetina.imagebatch.domain.event.ImageJobEvent;
import fr.lapetina.imagebatch.domain.event.ImageJobEventFactory;
import fr.lapetina.imagebatch.domain.model.BatchReport;
import fr.lapetina.imagebatch.domain.model.ImageCodec;
import fr.lapetina.imagebatch.domain.model.ImageJob;
import fr.lapetina.imagebatch.domain.model.JobPaths;
import fr.lapetina.imagebatch.domain.model.TransformParameters;
import fr.lapetina.imagebatch.executor.JobExecutor;
import fr.lapetina.imagebatch.infrastructure.config.ImageBatchConfig;
import fr.lapetina.imagebatch.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs batches of image jobs on a fixed pool of workers and aggregates their outcomes.
 *
 * WORKER POOL:
 *
 * Jobs are published to a Disruptor ring buffer consumed by a worker pool of exactly
 * {@code workers} {@link JobWorkHandler}s. Each event is taken by one worker only, so at
 * most {@code workers} jobs are in flight. A single worker is the same code path.
 *
 * BACKPRESSURE:
 *
 * Publishing claims slots with {@code next()}, which waits while the ring buffer is full.
 * A batch larger than the ring buffer is therefore fed at the pace of the workers.
 *
 * AGGREGATION:
 *
 * Each batch owns a {@link BatchTracker} and a format cache. Workers fold outcomes into the
 * tracker in completion order; {@link #process(List)} returns once every job has reported.
 * Failures of individual jobs never abort the batch.
 *
 * The coordinator is reusable across batches and may be called from several threads.
 *
 * WAIT STRATEGY CHOICE: Configurable (default BlockingWaitStrategy)
 *
 * Workers are CPU bound on pixel work, so idle workers should not burn a core in a spin loop.
 */
public final class BatchCoordinator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchCoordinator.class);

    private final Disruptor<ImageJobEvent> disruptor;
    private final RingBuffer<ImageJobEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicInteger inFlight = new AtomicInteger(0);

    private final int workers;
    private final MetricsRegistry metricsRegistry;

    private BatchCoordinator(Builder builder) {
        this.workers = builder.workers;
        this.metricsRegistry = builder.metricsRegistry;

        ThreadFactory threadFactory = new DisruptorThreadFactory("image-worker");
        WaitStrategy waitStrategy = createWaitStrategy(builder.waitStrategy);

        this.disruptor = new Disruptor<>(
                new ImageJobEventFactory(),
                builder.ringBufferSize,
                threadFactory,
                ProducerType.MULTI, // Batches may be submitted from several threads
                waitStrategy
        );

        JobWorkHandler[] handlers = new JobWorkHandler[workers];
        for (int i = 0; i < workers; i++) {
            handlers[i] = new JobWorkHandler(builder.jobExecutor, metricsRegistry, inFlight);
        }
        disruptor.handleEventsWithWorkerPool(handlers);

        disruptor.setDefaultExceptionHandler(new DisruptorExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("BatchCoordinator created: workers={}, ringBufferSize={}, waitStrategy={}",
                workers, builder.ringBufferSize, builder.waitStrategy);
    }

    /**
     * Starts the worker threads. Called implicitly by the first non-empty batch.
     */
    public BatchCoordinator start() {
        if (closed.get()) {
            throw new BatchRejectedException(BatchRejectedException.Reason.COORDINATOR_CLOSED);
        }
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("BatchCoordinator started with {} workers", workers);
        }
        return this;
    }

    /**
     * Executes every job and returns the aggregated report.
     *
     * @param jobs jobs to run, each with its own (usually shared) parameters
     * @return the report, with exactly one outcome per job
     * @throws BatchRejectedException if a job's parameters are out of range or the coordinator is closed
     * @throws InterruptedException   if the calling thread is interrupted while waiting; jobs already
     *                                published still run to completion
     */
    public BatchReport process(List<ImageJob> jobs) throws InterruptedException {
        Objects.requireNonNull(jobs, "Job list is required");
        if (closed.get()) {
            throw new BatchRejectedException(BatchRejectedException.Reason.COORDINATOR_CLOSED);
        }
        validateParameters(jobs);

        if (jobs.isEmpty()) {
            log.info("Empty batch, nothing to process");
            return BatchReport.empty(workers);
        }

        start();

        BatchTracker tracker = new BatchTracker(jobs.size(), workers);
        log.info("Batch started: jobs={}, workers={}", jobs.size(), workers);

        for (ImageJob job : jobs) {
            publish(job, tracker);
        }

        tracker.await();
        BatchReport report = tracker.toReport();
        metricsRegistry.recordBatch(report);

        log.info("Batch completed: total={}, processed={}, errors={}, totalMs={}, avgMs={}",
                report.totalJobs(),
                report.processedCount(),
                report.errorCount(),
                report.totalTime().toMillis(),
                report.averageTimePerImage().toMillis());

        return report;
    }

    /**
     * Builds one job per path pair with shared parameters, then runs them.
     *
     * @param outputFormat explicit codec for every output, or {@code null} to follow extensions
     */
    public BatchReport process(List<JobPaths> paths, TransformParameters parameters, ImageCodec outputFormat)
            throws InterruptedException {
        Objects.requireNonNull(paths, "Path list is required");
        Objects.requireNonNull(parameters, "Transform parameters are required");

        List<ImageJob> jobs = new ArrayList<>(paths.size());
        for (JobPaths pair : paths) {
            jobs.add(pair.toJob(parameters, outputFormat));
        }
        return process(jobs);
    }

    private void publish(ImageJob job, BatchTracker tracker) {
        // Waits while the ring buffer is full
        long sequence = ringBuffer.next();
        try {
            ImageJobEvent event = ringBuffer.get(sequence);
            event.initialize(job, tracker.formatCache(), tracker::record);
        } finally {
            ringBuffer.publish(sequence);
        }

        metricsRegistry.setRingBufferRemaining((int) ringBuffer.remainingCapacity());
        log.debug("Job submitted: input={}, sequence={}", job.input(), sequence);
    }

    private void validateParameters(List<ImageJob> jobs) {
        Set<TransformParameters> distinct = new LinkedHashSet<>();
        for (ImageJob job : jobs) {
            distinct.add(job.parameters());
        }
        for (TransformParameters parameters : distinct) {
            try {
                parameters.validate();
            } catch (IllegalArgumentException e) {
                log.error("Batch rejected: jobs={}, error={}", jobs.size(), e.getMessage());
                throw new BatchRejectedException(BatchRejectedException.Reason.INVALID_PARAMETERS, e.getMessage(), e);
            }
        }
    }

    public int getWorkers() {
        return workers;
    }

    /**
     * Returns current ring buffer remaining capacity.
     */
    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    /**
     * Returns the number of jobs currently executing.
     */
    public int getInFlight() {
        return inFlight.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Waits for published jobs to drain, then stops the workers.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down BatchCoordinator...");
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
                log.info("BatchCoordinator shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("BatchCoordinator shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new com.lmax.disruptor.BusySpinWaitStrategy();
            case "sleeping" -> new com.lmax.disruptor.SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory for worker threads.
     */
    private static class DisruptorThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        DisruptorThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(false);
            return t;
        }
    }

    /**
     * Exception handler for Disruptor.
     */
    private static class DisruptorExceptionHandler
            implements com.lmax.disruptor.ExceptionHandler<ImageJobEvent> {

        private static final Logger log = LoggerFactory.getLogger(DisruptorExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, ImageJobEvent event) {
            // The worker has already delivered an outcome for the job
            log.error("Exception in worker: sequence={}, event={}", sequence, event, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    /**
     * Builder for BatchCoordinator.
     */
    public static final class Builder {
        private int workers = 1;
        private int ringBufferSize = 256;
        private String waitStrategy = "blocking";
        private JobExecutor jobExecutor;
        private MetricsRegistry metricsRegistry;

        /**
         * Number of workers; values below 1 are raised to 1.
         */
        public Builder workers(int workers) {
            if (workers < 1) {
                log.warn("Worker count {} raised to 1", workers);
            }
            this.workers = Math.max(1, workers);
            return this;
        }

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder jobExecutor(JobExecutor executor) {
            this.jobExecutor = executor;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder fromConfig(ImageBatchConfig config) {
            workers(config.getExecution().getWorkers());
            ringBufferSize(config.getExecution().getRingBufferSize());
            this.waitStrategy = config.getExecution().getWaitStrategy();
            return this;
        }

        public BatchCoordinator build() {
            if (jobExecutor == null) {
                throw new IllegalStateException("JobExecutor is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            if (waitStrategy == null) {
                waitStrategy = "blocking";
            }
            return new BatchCoordinator(this);
        }
    }
}
