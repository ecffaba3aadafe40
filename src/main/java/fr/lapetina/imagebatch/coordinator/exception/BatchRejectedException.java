package fr.lapetina.imagebatch.coordinator.exception;

/**
 * Exception thrown when a whole batch is refused before any job runs.
 *
 * This occurs when:
 * - A job carries transform parameters outside their valid range
 * - The coordinator has already been closed
 */
public final class BatchRejectedException extends RuntimeException {

    private final Reason reason;

    public BatchRejectedException(Reason reason) {
        super("Batch rejected: " + reason.getMessage());
        this.reason = reason;
    }

    public BatchRejectedException(Reason reason, String details) {
        super("Batch rejected: " + reason.getMessage() + " - " + details);
        this.reason = reason;
    }

    public BatchRejectedException(Reason reason, String details, Throwable cause) {
        super("Batch rejected: " + reason.getMessage() + " - " + details, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        INVALID_PARAMETERS("Invalid transform parameters"),
        COORDINATOR_CLOSED("Coordinator is closed");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
