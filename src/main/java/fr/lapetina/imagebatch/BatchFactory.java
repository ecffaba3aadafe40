package fr.lapetina.imagebatch;

import fr.lapetina.imagebatch.coordinator.BatchCoordinator;
import fr.lapetina.imagebatch.domain.model.ImageCodec;
import fr.lapetina.imagebatch.domain.model.TransformParameters;
import fr.lapetina.imagebatch.executor.JobExecutor;
import fr.lapetina.imagebatch.infrastructure.config.ConfigLoader;
import fr.lapetina.imagebatch.infrastructure.config.ImageBatchConfig;
import fr.lapetina.imagebatch.infrastructure.io.ImageDecoder;
import fr.lapetina.imagebatch.infrastructure.io.ImageEncoder;
import fr.lapetina.imagebatch.infrastructure.io.JobPlanner;
import fr.lapetina.imagebatch.infrastructure.io.OutputWriter;
import fr.lapetina.imagebatch.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.imagebatch.report.ReportWriter;
import fr.lapetina.imagebatch.transform.TransformPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashSet;

/**
 * Factory for creating a fully-wired batch processor from configuration.
 * This is the primary entry point for obtaining a configured BatchCoordinator.
 *
 * <p>Usage:
 * <pre>{@code
 * try (BatchFactory factory = BatchFactory.create("config.yaml").start()) {
 *     BatchReport report = factory.getCoordinator().process(jobs);
 * }
 * }</pre>
 */
public class BatchFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchFactory.class);

    private final ImageBatchConfig config;
    private final TransformParameters transformParameters;
    private final ImageCodec outputFormat;
    private final MetricsRegistry metricsRegistry;
    private final JobExecutor jobExecutor;
    private final JobPlanner jobPlanner;
    private final ReportWriter reportWriter;
    private final BatchCoordinator coordinator;

    protected BatchFactory(ImageBatchConfig config) {
        this.config = config;

        // Fail fast on malformed parameters; range checks happen per batch
        this.transformParameters = config.getTransform().toParameters();
        this.outputFormat = config.getOutput().resolveFormatOverride();

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        TransformPipeline pipeline = config.getMetrics().isEnabled()
                ? new TransformPipeline(metricsRegistry::recordStageLatency)
                : new TransformPipeline();

        ImageEncoder encoder = new ImageEncoder(
                (float) config.getEncoding().getJpegQuality(),
                config.getEncoding().getTiffCompression()
        );

        this.jobExecutor = new JobExecutor(pipeline, new ImageDecoder(), encoder, new OutputWriter());

        this.jobPlanner = new JobPlanner(
                new LinkedHashSet<>(config.getInput().getExtensions()),
                config.getOutput().getPrefix()
        );

        this.reportWriter = config.getReport().isEnabled()
                ? new ReportWriter(Paths.get(config.getReport().getDirectory()))
                : null;

        // Build coordinator
        this.coordinator = BatchCoordinator.builder()
                .fromConfig(config)
                .jobExecutor(jobExecutor)
                .metricsRegistry(metricsRegistry)
                .build();

        log.info("BatchFactory initialized: workers={}, parameters={}, outputFormat={}",
                coordinator.getWorkers(), transformParameters, outputFormat != null ? outputFormat : "by extension");
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static BatchFactory create(String configPath) {
        log.info("Initializing BatchFactory from config: {}", configPath);
        return new BatchFactory(new ConfigLoader(configPath).load());
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static BatchFactory create() {
        return create("config.yaml");
    }

    /**
     * Creates a factory from an already loaded configuration.
     */
    public static BatchFactory create(ImageBatchConfig config) {
        return new BatchFactory(config);
    }

    /**
     * Starts the worker pool.
     */
    public BatchFactory start() {
        coordinator.start();
        return this;
    }

    public ImageBatchConfig getConfig() {
        return config;
    }

    public TransformParameters getTransformParameters() {
        return transformParameters;
    }

    /**
     * Explicit output codec from configuration, or null when outputs follow their extension.
     */
    public ImageCodec getOutputFormat() {
        return outputFormat;
    }

    public Path getInputDirectory() {
        return Paths.get(config.getInput().getDirectory());
    }

    public Path getOutputDirectory() {
        return Paths.get(config.getOutput().getDirectory());
    }

    public BatchCoordinator getCoordinator() {
        return coordinator;
    }

    public JobExecutor getJobExecutor() {
        return jobExecutor;
    }

    public JobPlanner getJobPlanner() {
        return jobPlanner;
    }

    /**
     * Report writer, or null when reports are disabled.
     */
    public ReportWriter getReportWriter() {
        return reportWriter;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    @Override
    public void close() {
        log.info("Shutting down BatchFactory...");

        try {
            coordinator.close();
        } catch (Exception e) {
            log.warn("Error closing coordinator", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("BatchFactory shut down");
    }
}
