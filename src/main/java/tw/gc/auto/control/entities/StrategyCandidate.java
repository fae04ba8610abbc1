package tw.gc.auto.control.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.auto.control.enums.RiskLevel;

import java.time.LocalDateTime;

/**
 * StrategyCandidate Entity - a strategy emitted by the evolution engine.
 *
 * <p>Candidates are written once on submission. Pipeline progress is tracked separately in
 * {@link PipelineMembership}, so the candidate row itself never changes after it is stored.</p>
 */
@Entity
@Table(name = "strategy_candidates", indexes = {
    @Index(name = "idx_candidate_experiment", columnList = "experiment_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyCandidate {

    @Id
    @Column(name = "id", length = 100)
    private String id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "fitness", nullable = false)
    private double fitness;

    @Column(name = "generation", nullable = false)
    private int generation;

    @Column(name = "experiment_id", length = 100)
    private String experimentId;

    @Embedded
    private PerformanceSnapshot performance;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_level", nullable = false, length = 10)
    @Builder.Default
    private RiskLevel riskLevel = RiskLevel.LOW;

    @Column(name = "strategy_type", length = 100)
    private String strategyType;

    /** Comma separated market conditions the strategy was evolved for */
    @Column(name = "market_conditions", length = 500)
    private String marketConditions;

    /** Strategy parameters as JSON */
    @Column(name = "parameters_json", columnDefinition = "TEXT")
    private String parametersJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();
}
