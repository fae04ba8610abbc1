package tw.gc.auto.control.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.auto.control.enums.AllocationStatus;
import tw.gc.auto.control.enums.RiskLevel;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "capital_allocations", indexes = {
    @Index(name = "idx_allocation_pool_status", columnList = "pool_id, status"),
    @Index(name = "idx_allocation_experiment", columnList = "experiment_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CapitalAllocation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "pool_id", nullable = false, length = 100)
    private String poolId;

    @Column(name = "experiment_id", nullable = false, length = 100)
    private String experimentId;

    @Column(name = "amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_level", nullable = false, length = 10)
    private RiskLevel riskLevel;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    @Builder.Default
    private AllocationStatus status = AllocationStatus.ACTIVE;

    /** Mark-to-market P&L while active, realized P&L once released */
    @Column(name = "running_pnl", nullable = false, precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal runningPnl = BigDecimal.ZERO;

    @Column(name = "allocated_at", nullable = false)
    private LocalDateTime allocatedAt;

    @Column(name = "released_at")
    private LocalDateTime releasedAt;

    @Version
    private Long version;
}
