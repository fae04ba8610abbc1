package tw.gc.auto.control.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A promotion ladder rung: candidates that meet {@link #criteria} wait here for validation.
 * Several pipelines may be active at once and a candidate may sit in more than one.
 */
@Entity
@Table(name = "promotion_pipelines")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromotionPipeline {

    @Id
    @Column(name = "id", length = 100)
    private String id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Embedded
    private PromotionCriteria criteria;

    @Column(name = "active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();

    @Version
    private Long version;
}
