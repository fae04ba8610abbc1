package tw.gc.auto.control.events;

import tw.gc.auto.control.entities.ControlEvent.EventSeverity;

import java.time.LocalDateTime;

/**
 * Safety supervisor circuit breaker tripped or reset.
 */
public record CircuitBreakerNotification(boolean tripped, String reason, LocalDateTime occurredAt)
        implements ControlPlaneNotification {

    @Override
    public String type() {
        return tripped ? "CIRCUIT_BREAKER_TRIPPED" : "CIRCUIT_BREAKER_RESET";
    }

    @Override
    public String category() {
        return "SAFETY";
    }

    @Override
    public EventSeverity severity() {
        return tripped ? EventSeverity.CRITICAL : EventSeverity.MEDIUM;
    }

    @Override
    public String message() {
        return tripped ? "Circuit breaker tripped: " + reason : "Circuit breaker reset: " + reason;
    }
}
