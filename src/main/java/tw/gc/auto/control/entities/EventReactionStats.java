package tw.gc.auto.control.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Historical 5-minute price reaction statistics for an (event type, sector) pair.
 * Written by the news ingestion side; read by the confidence nudge engine.
 */
@Entity
@Table(name = "event_reaction_stats",
    uniqueConstraints = @UniqueConstraint(name = "uk_reaction_type_sector",
        columnNames = {"event_type", "sector"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventReactionStats {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "sector", nullable = false, length = 100)
    private String sector;

    @Column(name = "sample_size_5m", nullable = false)
    private int sampleSize5m;

    /** Effect size (z-score) of the 5-minute reaction */
    @Column(name = "effect_size_5m", nullable = false)
    private double effectSize5m;

    @Column(name = "avg_return_5m")
    private Double avgReturn5m;

    @Column(name = "hit_rate_5m")
    private Double hitRate5m;

    /** Correlation with already-priced factors; null when not measured */
    @Column(name = "orthogonality_score")
    private Double orthogonalityScore;

    @Column(name = "passes_validation", nullable = false)
    private boolean passesValidation;

    /** Effect still significant over the trailing 12 months */
    @Column(name = "last_12m_threshold", nullable = false)
    private boolean last12mThreshold;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
