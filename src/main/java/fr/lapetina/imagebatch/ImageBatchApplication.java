package fr.lapetina.imagebatch;

import fr.lapetina.imagebatch.domain.model.BatchReport;
import fr.lapetina.imagebatch.domain.model.JobOutcome;
import fr.lapetina.imagebatch.domain.model.JobPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Main entry point for the batch image processor.
 *
 * <p>Plans jobs from the configured input directory, runs them, writes the JSON report and
 * logs a summary. Exit status is 1 when nothing could be planned or the run failed as a
 * whole, 0 otherwise, even if some images failed.
 */
public class ImageBatchApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ImageBatchApplication.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;

    private final BatchFactory factory;
    private BatchReport lastReport;

    public ImageBatchApplication(String configPath) {
        this(BatchFactory.create(configPath));
    }

    public ImageBatchApplication(BatchFactory factory) {
        this.factory = factory;
    }

    /**
     * Runs one batch over the configured input directory.
     *
     * @return the process exit status
     */
    public int run() throws IOException, InterruptedException {
        Path inputDir = factory.getInputDirectory();
        Path outputDir = factory.getOutputDirectory();

        List<JobPaths> plan = factory.getJobPlanner().plan(inputDir, outputDir);
        if (plan.isEmpty()) {
            log.warn("No supported images found: inputDir={}, extensions={}",
                    inputDir, factory.getJobPlanner().getExtensions());
            return EXIT_FAILURE;
        }

        log.info("Processing {} images with {} workers: inputDir={}, outputDir={}",
                plan.size(), factory.getCoordinator().getWorkers(), inputDir, outputDir);

        BatchReport report = factory.getCoordinator()
                .process(plan, factory.getTransformParameters(), factory.getOutputFormat());
        this.lastReport = report;

        if (factory.getReportWriter() != null) {
            factory.getReportWriter().write(report);
        }
        exportMetrics();
        logSummary(report);

        return EXIT_OK;
    }

    private void exportMetrics() throws IOException {
        if (!factory.getConfig().getMetrics().isEnabled()) {
            return;
        }
        String exportFile = factory.getConfig().getMetrics().getExportFile();
        if (exportFile == null || exportFile.isBlank()) {
            return;
        }
        Path target = Paths.get(exportFile).toAbsolutePath();
        Files.createDirectories(target.getParent());
        Files.writeString(target, factory.getMetricsRegistry().scrape());
        log.info("Metrics exported: path={}", target);
    }

    private void logSummary(BatchReport report) {
        log.info("Batch summary: total={}, processed={}, errors={}, workers={}, totalTimeMs={}, avgTimePerImageMs={}",
                report.totalJobs(),
                report.processedCount(),
                report.errorCount(),
                report.workers(),
                report.totalTime().toMillis(),
                report.averageTimePerImage().toMillis());

        for (JobOutcome failure : report.failures()) {
            log.warn("Failed image: input={}, errorKind={}, error={}",
                    failure.input(), failure.errorKind(), failure.errorMessage());
        }
    }

    /**
     * Report of the last successful {@link #run()}, or null.
     */
    public BatchReport getLastReport() {
        return lastReport;
    }

    public BatchFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }
    }

    public static void main(String[] args) {
        System.setProperty("java.awt.headless", "true");
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        int status;
        try (ImageBatchApplication app = new ImageBatchApplication(configPath)) {
            status = app.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Batch interrupted");
            status = EXIT_FAILURE;
        } catch (Exception e) {
            log.error("Batch processing failed", e);
            status = EXIT_FAILURE;
        }
        System.exit(status);
    }
}
