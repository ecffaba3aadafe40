/**
 * Image Batch - concurrent batch image transformation engine.
 *
 * <p>This library applies a fixed chain of pixel transforms (resize, blur, sharpen, contrast,
 * brightness) to many images in parallel, using an LMAX Disruptor worker pool, and reports a
 * typed outcome for every image.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.imagebatch.BatchFactory} - Main entry point for creating
 *       a fully-configured processor from YAML configuration</li>
 *   <li>{@link fr.lapetina.imagebatch.ImageBatchApplication} - Command line batch run over a directory</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (BatchFactory factory = BatchFactory.create("config.yaml").start()) {
 *     List<JobPaths> plan = factory.getJobPlanner().plan(inputDir, outputDir);
 *     BatchReport report = factory.getCoordinator()
 *             .process(plan, factory.getTransformParameters(), null);
 *     System.out.println(report.processedCount() + " images processed");
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Configurable worker count with bounded ring buffer backpressure</li>
 *   <li>Per-image error isolation (decode, transform, encode, I/O)</li>
 *   <li>Extension-driven output codec selection (JPEG, PNG, BMP, TIFF)</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 *   <li>JSON batch reports</li>
 * </ul>
 *
 * @see fr.lapetina.imagebatch.BatchFactory
 * @see fr.lapetina.imagebatch.coordinator.BatchCoordinator
 */
package fr.lapetina.imagebatch;
