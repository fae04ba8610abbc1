package tw.gc.auto.control.events;

import tw.gc.auto.control.entities.ControlEvent.EventSeverity;

import java.time.LocalDateTime;

/**
 * Confidence nudge engine breaker state change. Never affects order flow.
 */
public record NudgeBreakerNotification(boolean tripped, String reason, LocalDateTime occurredAt)
        implements ControlPlaneNotification {

    @Override
    public String type() {
        return tripped ? "NUDGE_BREAKER_TRIPPED" : "NUDGE_BREAKER_RESET";
    }

    @Override
    public String category() {
        return "NUDGE";
    }

    @Override
    public EventSeverity severity() {
        return tripped ? EventSeverity.HIGH : EventSeverity.LOW;
    }

    @Override
    public String message() {
        return tripped ? "Nudge circuit breaker tripped: " + reason : "Nudge circuit breaker reset: " + reason;
    }
}
