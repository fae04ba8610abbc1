package tw.gc.auto.control.exceptions;

import lombok.Getter;

/**
 * Order submission blocked by the safety supervisor. The reason is the human-readable block
 * reason (emergency stop, circuit breaker or cooldown).
 */
@Getter
public class CircuitBreakerTrippedException extends ControlPlaneException {
    private static final String DEFAULT_ERROR_CODE = "SAF-001";

    private final String reason;

    public CircuitBreakerTrippedException(String reason) {
        super("Order submission blocked: " + reason);
        this.reason = reason;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
