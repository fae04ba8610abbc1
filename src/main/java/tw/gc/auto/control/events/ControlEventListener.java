package tw.gc.auto.control.events;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import tw.gc.auto.control.entities.ControlEvent;
import tw.gc.auto.control.repositories.ControlEventRepository;

/**
 * Audit subscriber: writes every notification to the control_events table.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ControlEventListener {

    private static final int MAX_MESSAGE_LENGTH = 500;

    private final ControlEventRepository controlEventRepository;

    @EventListener
    public void onNotification(ControlPlaneNotification notification) {
        switch (notification.severity()) {
            case CRITICAL, HIGH -> log.warn("🔔 [{}] {}", notification.type(), notification.message());
            default -> log.info("🔔 [{}] {}", notification.type(), notification.message());
        }

        String message = notification.message();
        if (message != null && message.length() > MAX_MESSAGE_LENGTH) {
            message = message.substring(0, MAX_MESSAGE_LENGTH);
        }

        controlEventRepository.save(ControlEvent.builder()
                .occurredAt(notification.occurredAt())
                .type(notification.type())
                .severity(notification.severity())
                .category(notification.category())
                .message(message)
                .component(notification.getClass().getSimpleName())
                .build());
    }
}
