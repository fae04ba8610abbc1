package tw.gc.auto.control.events;

import tw.gc.auto.control.entities.ControlEvent.EventSeverity;

import java.time.LocalDateTime;

/**
 * Typed message published by the control-plane components. Subscribers (audit, alerting, UI
 * push) listen for the concrete types they care about.
 */
public interface ControlPlaneNotification {

    String type();

    String category();

    EventSeverity severity();

    String message();

    LocalDateTime occurredAt();
}
