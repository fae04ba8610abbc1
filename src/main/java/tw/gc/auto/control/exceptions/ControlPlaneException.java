package tw.gc.auto.control.exceptions;

import lombok.Getter;

/**
 * Base exception for control-plane failures. Every subclass carries a stable error code so
 * callers and the REST layer can tell a business rejection from a system fault.
 */
@Getter
public abstract class ControlPlaneException extends RuntimeException {

    private final String errorCode;

    protected ControlPlaneException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected ControlPlaneException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected abstract String getDefaultErrorCode();
}
