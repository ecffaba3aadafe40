package fr.lapetina.imagebatch.infrastructure.metrics;

import fr.lapetina.imagebatch.domain.model.BatchReport;
import fr.lapetina.imagebatch.domain.model.ErrorKind;
import fr.lapetina.imagebatch.domain.model.JobOutcome;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Job counters by codec and status
 * - Error counters by kind
 * - Per-image and per-stage latency timers
 * - In-flight job and ring buffer gauges
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    public static final String DEFAULT_PREFIX = "image_batch";

    private final PrometheusMeterRegistry registry;
    private final JvmGcMetrics gcMetrics;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> jobCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ErrorKind, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> imageTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> stageTimers = new ConcurrentHashMap<>();

    private final Counter batchCounter;
    private final Timer batchTimer;

    // Global gauges
    private final AtomicInteger inFlightJobs = new AtomicInteger(0);
    private final AtomicInteger ringBufferRemaining = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        this.gcMetrics = new JvmGcMetrics();
        gcMetrics.bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_inflight_jobs", inFlightJobs, AtomicInteger::get)
                .description("Jobs currently being executed by workers")
                .register(registry);

        Gauge.builder(prefix + "_ringbuffer_remaining", ringBufferRemaining, AtomicInteger::get)
                .description("Remaining capacity in the ring buffer")
                .register(registry);

        this.batchCounter = Counter.builder(prefix + "_batches_total")
                .description("Total number of completed batches")
                .register(registry);

        this.batchTimer = Timer.builder(prefix + "_batch_duration")
                .description("Wall-clock duration of a batch")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this(DEFAULT_PREFIX);
    }

    /**
     * Records one job outcome: status counter, error counter and, on success, image latency.
     */
    public void recordOutcome(JobOutcome outcome) {
        String codec = outcome.codec() != null ? outcome.codec().name() : "none";
        String status = outcome.isSuccess() ? "completed" : "failed";

        jobCounters.computeIfAbsent(codec + ":" + status, k ->
                Counter.builder(prefix + "_jobs_total")
                        .description("Total number of executed jobs")
                        .tag("codec", codec)
                        .tag("status", status)
                        .register(registry)
        ).increment();

        if (outcome.isFailure()) {
            incrementErrorCount(outcome.errorKind());
        } else {
            recordImageLatency(codec, outcome.elapsed());
        }
    }

    /**
     * Records the processing time of one completed image.
     */
    public void recordImageLatency(String codec, Duration latency) {
        imageTimers.computeIfAbsent(codec, k ->
                Timer.builder(prefix + "_image_latency")
                        .description("Per-image processing latency")
                        .tag("codec", codec)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Records transform stage latency (resize, blur, etc.).
     */
    public void recordStageLatency(String stage, Duration latency) {
        stageTimers.computeIfAbsent(stage, k ->
                Timer.builder(prefix + "_stage_latency")
                        .description("Transform stage latency")
                        .tag("stage", stage)
                        .publishPercentileHistogram()
                        .register(registry)
        ).record(latency);
    }

    /**
     * Increments error counter.
     */
    public void incrementErrorCount(ErrorKind kind) {
        errorCounters.computeIfAbsent(kind, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of failed jobs")
                        .tag("kind", kind.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Records a finished batch.
     */
    public void recordBatch(BatchReport report) {
        batchCounter.increment();
        batchTimer.record(report.totalTime());
    }

    public void setInFlightJobs(int value) {
        inFlightJobs.set(value);
    }

    public void setRingBufferRemaining(int value) {
        ringBufferRemaining.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public void close() {
        gcMetrics.close();
        registry.close();
    }
}
