package fr.lapetina.imagebatch.domain.model;

/**
 * Error taxonomy for image jobs.
 * Every per-image failure is classified into exactly one of these kinds.
 */
public enum ErrorKind {
    /** Input bytes are not a readable image (corrupt, truncated, unknown format) */
    DECODE_ERROR,

    /** A transform stage rejected its parameter or failed while processing pixels */
    TRANSFORM_ERROR,

    /** No writer for the target codec, or the writer failed */
    ENCODE_ERROR,

    /** File system access failure (missing input, unwritable output) */
    IO_ERROR
}
