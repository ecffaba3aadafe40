package fr.lapetina.imagebatch.transform;

/**
 * Thrown by a transform stage that cannot process its input.
 *
 * Carries the stage name and, when the cause is a bad value, the offending parameter.
 * Reaching this with a parameter problem means upstream validation was bypassed.
 */
public final class TransformException extends Exception {

    private final String stage;
    private final String parameter;

    public TransformException(String stage, String parameter, String message) {
        super(message);
        this.stage = stage;
        this.parameter = parameter;
    }

    public TransformException(String stage, String parameter, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.parameter = parameter;
    }

    /**
     * Creates the exception for a parameter outside its valid range.
     */
    public static TransformException invalidParameter(String stage, String parameter, Object value) {
        return new TransformException(stage, parameter,
                "Stage '" + stage + "' rejected " + parameter + "=" + value);
    }

    public String getStage() {
        return stage;
    }

    /**
     * Returns the offending parameter name, or null when the failure is not parameter related.
     */
    public String getParameter() {
        return parameter;
    }
}
