/**
 * File system and codec plumbing around the transform pipeline.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.imagebatch.infrastructure.io.JobPlanner} - Turns an input directory into job paths</li>
 *   <li>{@link fr.lapetina.imagebatch.infrastructure.io.ImageDecoder} - ImageIO decoding from memory</li>
 *   <li>{@link fr.lapetina.imagebatch.infrastructure.io.ImageEncoder} - Codec-specific in-memory encoding</li>
 *   <li>{@link fr.lapetina.imagebatch.infrastructure.io.OutputWriter} - Temp file and atomic move</li>
 * </ul>
 */
package fr.lapetina.imagebatch.infrastructure.io;
