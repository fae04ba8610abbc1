package tw.gc.auto.control.entities;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one validation run. Re-validation appends a new row; rows are never updated.
 */
@Entity
@Immutable
@Table(name = "validation_results", indexes = {
    @Index(name = "idx_validation_candidate", columnList = "candidate_id, validated_at")
})
@Getter
@ToString
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class ValidationResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "candidate_id", nullable = false, length = 100)
    private String candidateId;

    @Column(name = "pipeline_id", nullable = false, length = 100)
    private String pipelineId;

    @Column(name = "passed", nullable = false)
    private boolean passed;

    @Column(name = "score", nullable = false)
    private double score;

    @Column(name = "validation_period_days", nullable = false)
    private int validationPeriod;

    @Column(name = "pnl", nullable = false)
    private double pnl;

    @Column(name = "win_rate", nullable = false)
    private double winRate;

    @Column(name = "drawdown", nullable = false)
    private double drawdown;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "validation_feedback", joinColumns = @JoinColumn(name = "validation_id"))
    @OrderColumn(name = "feedback_order")
    @Column(name = "message", length = 200)
    @Builder.Default
    private List<String> feedback = new ArrayList<>();

    @Column(name = "validated_at", nullable = false)
    private LocalDateTime validatedAt;
}
