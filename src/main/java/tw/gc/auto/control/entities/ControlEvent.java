package tw.gc.auto.control.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Persisted history of control-plane notifications: breaker trips and resets, promotions,
 * rejections, capital movements, emergency stop and mode changes.
 */
@Entity
@Table(name = "control_events", indexes = {
    @Index(name = "idx_control_events_time", columnList = "occurred_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ControlEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "occurred_at", nullable = false)
    private LocalDateTime occurredAt;

    @Column(name = "event_type", nullable = false, length = 50)
    private String type;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 10)
    private EventSeverity severity;

    @Column(name = "category", length = 50, nullable = false)
    private String category; // SAFETY, PROMOTION, CAPITAL, NUDGE

    @Column(name = "message", length = 500, nullable = false)
    private String message;

    @Column(name = "component", length = 50)
    private String component;

    public enum EventSeverity {
        LOW, MEDIUM, HIGH, CRITICAL
    }
}
