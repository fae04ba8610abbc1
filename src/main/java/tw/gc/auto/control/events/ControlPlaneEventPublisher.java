package tw.gc.auto.control.events;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Publish side of the notification channel. A failing subscriber is logged and never
 * propagates back into the component that published.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ControlPlaneEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    public void publish(ControlPlaneNotification notification) {
        try {
            applicationEventPublisher.publishEvent(notification);
        } catch (Exception e) {
            log.error("❌ Failed to deliver {} notification", notification.type(), e);
        }
    }
}
