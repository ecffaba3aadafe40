package fr.lapetina.imagebatch.infrastructure.io;

/**
 * Input bytes could not be turned into an image.
 */
public final class DecodeException extends Exception {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
