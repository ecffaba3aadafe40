/**
 * Micrometer metrics with Prometheus exposition.
 *
 * <h2>Key Metrics</h2>
 * <ul>
 *   <li>{@code <prefix>_jobs_total} - Executed jobs by codec and status</li>
 *   <li>{@code <prefix>_errors_total} - Failed jobs by error kind</li>
 *   <li>{@code <prefix>_image_latency} - Per-image processing time</li>
 *   <li>{@code <prefix>_stage_latency} - Per-stage transform time</li>
 *   <li>{@code <prefix>_inflight_jobs} - Jobs currently executing</li>
 * </ul>
 *
 * @see fr.lapetina.imagebatch.infrastructure.metrics.MetricsRegistry
 */
package fr.lapetina.imagebatch.infrastructure.metrics;
