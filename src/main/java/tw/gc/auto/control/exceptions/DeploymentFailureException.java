package tw.gc.auto.control.exceptions;

/**
 * Post-validation deployment (capital allocation or registration) failed; the candidate stays pending.
 */
public class DeploymentFailureException extends ControlPlaneException {
    private static final String DEFAULT_ERROR_CODE = "PRM-002";

    public DeploymentFailureException(String message) {
        super(message);
    }

    public DeploymentFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
