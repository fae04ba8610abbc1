package tw.gc.auto.control.exceptions;

/**
 * Requested pool, allocation, pipeline, candidate or trace does not exist.
 */
public class EntityNotFoundException extends ControlPlaneException {
    private static final String DEFAULT_ERROR_CODE = "GEN-404";

    public EntityNotFoundException(String message) {
        super(message);
    }

    public EntityNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
