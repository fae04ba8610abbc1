package tw.gc.auto.control.exceptions;

/**
 * Internal fault in the confidence nudge engine. Never propagated past the engine.
 */
public class NudgeEngineDegradedException extends ControlPlaneException {
    private static final String DEFAULT_ERROR_CODE = "NDG-001";

    public NudgeEngineDegradedException(String message) {
        super(message);
    }

    public NudgeEngineDegradedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
