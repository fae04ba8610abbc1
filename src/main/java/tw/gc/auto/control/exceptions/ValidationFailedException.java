package tw.gc.auto.control.exceptions;

/**
 * Candidate failed validation. A business outcome, not a system fault.
 */
public class ValidationFailedException extends ControlPlaneException {
    private static final String DEFAULT_ERROR_CODE = "PRM-001";

    public ValidationFailedException(String message) {
        super(message);
    }

    public ValidationFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
