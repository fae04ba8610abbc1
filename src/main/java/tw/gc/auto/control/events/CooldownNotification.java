package tw.gc.auto.control.events;

import tw.gc.auto.control.entities.ControlEvent.EventSeverity;

import java.time.LocalDateTime;

public record CooldownNotification(boolean started, LocalDateTime endsAt, String reason, LocalDateTime occurredAt)
        implements ControlPlaneNotification {

    @Override
    public String type() {
        return started ? "COOLDOWN_STARTED" : "COOLDOWN_ENDED";
    }

    @Override
    public String category() {
        return "SAFETY";
    }

    @Override
    public EventSeverity severity() {
        return started ? EventSeverity.MEDIUM : EventSeverity.LOW;
    }

    @Override
    public String message() {
        return started ? "Cooldown until " + endsAt + ": " + reason : "Cooldown ended";
    }
}
