package tw.gc.auto.control.exceptions;

/**
 * Allocation breaks a per-experiment or concurrency limit of the pool.
 */
public class CapitalLimitExceededException extends ControlPlaneException {
    private static final String DEFAULT_ERROR_CODE = "CAP-002";

    public CapitalLimitExceededException(String message) {
        super(message);
    }

    public CapitalLimitExceededException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
