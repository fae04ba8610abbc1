package tw.gc.auto.control.events;

import tw.gc.auto.control.entities.ControlEvent.EventSeverity;

import java.time.LocalDateTime;

public record EmergencyStopNotification(boolean active, String reason, LocalDateTime occurredAt)
        implements ControlPlaneNotification {

    @Override
    public String type() {
        return active ? "EMERGENCY_STOP_ACTIVATED" : "EMERGENCY_STOP_CLEARED";
    }

    @Override
    public String category() {
        return "SAFETY";
    }

    @Override
    public EventSeverity severity() {
        return active ? EventSeverity.CRITICAL : EventSeverity.HIGH;
    }

    @Override
    public String message() {
        return active ? "Emergency stop activated: " + reason : "Emergency stop cleared";
    }
}
