package fr.lapetina.imagebatch.infrastructure.io;

/**
 * An image could not be encoded in the requested codec.
 */
public final class EncodeException extends Exception {

    public EncodeException(String message) {
        super(message);
    }

    public EncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
