/**
 * Configuration loading.
 *
 * <p>This package handles YAML configuration parsing into a plain bean tree.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.imagebatch.infrastructure.config.ImageBatchConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.imagebatch.infrastructure.config.ConfigLoader} - YAML loading from file or classpath</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code input} - Input directory and accepted extensions</li>
 *   <li>{@code output} - Output directory, filename prefix and optional format override</li>
 *   <li>{@code transform} - Resize target and enhancement factors</li>
 *   <li>{@code execution} - Worker count, ring buffer size and wait strategy</li>
 *   <li>{@code encoding} - JPEG quality and TIFF compression</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 *   <li>{@code report} - JSON batch report output</li>
 * </ul>
 *
 * @see fr.lapetina.imagebatch.infrastructure.config.ConfigLoader
 */
package fr.lapetina.imagebatch.infrastructure.config;
