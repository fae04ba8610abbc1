package tw.gc.auto.control.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.auto.control.enums.PipelineStage;

import java.time.LocalDateTime;

/**
 * PipelineMembership Entity - position of one candidate inside one pipeline.
 *
 * <p>The pending, promoted and rejected sets of a pipeline are the three values of
 * {@link #stage}. The unique key on (pipeline, candidate) means a candidate can only ever be in
 * one of them, and moving between sets is a single-row update.</p>
 */
@Entity
@Table(name = "pipeline_memberships",
    uniqueConstraints = @UniqueConstraint(name = "uk_membership_pipeline_candidate",
        columnNames = {"pipeline_id", "candidate_id"}),
    indexes = @Index(name = "idx_membership_stage", columnList = "pipeline_id, stage"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineMembership {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "pipeline_id", nullable = false, length = 100)
    private String pipelineId;

    @Column(name = "candidate_id", nullable = false, length = 100)
    private String candidateId;

    @Enumerated(EnumType.STRING)
    @Column(name = "stage", nullable = false, length = 20)
    @Builder.Default
    private PipelineStage stage = PipelineStage.PENDING;

    /** When the candidate qualified for the pipeline; the validation period counts from here */
    @Column(name = "entered_at", nullable = false)
    private LocalDateTime enteredAt;

    @Column(name = "decided_at")
    private LocalDateTime decidedAt;

    @Column(name = "deployment_attempts", nullable = false)
    @Builder.Default
    private int deploymentAttempts = 0;

    @Column(name = "last_deployment_error", length = 500)
    private String lastDeploymentError;

    @Column(name = "allocation_id")
    private Long allocationId;

    @Version
    private Long version;
}
