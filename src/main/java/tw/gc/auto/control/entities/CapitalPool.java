package tw.gc.auto.control.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.auto.control.enums.PoolPurpose;
import tw.gc.auto.control.enums.RiskLevel;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * CapitalPool Entity - a segregated bucket of trading capital.
 *
 * <p>Invariant: {@code 0 <= allocatedCapital <= totalCapital}. Only
 * {@link tw.gc.auto.control.services.capital.CapitalLedgerService} writes these rows.</p>
 */
@Entity
@Table(name = "capital_pools")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CapitalPool {

    @Id
    @Column(name = "id", length = 100)
    private String id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "purpose", nullable = false, length = 20)
    private PoolPurpose purpose;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_level", nullable = false, length = 10)
    private RiskLevel riskLevel;

    @Column(name = "total_capital", nullable = false, precision = 19, scale = 4)
    private BigDecimal totalCapital;

    @Column(name = "allocated_capital", nullable = false, precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal allocatedCapital = BigDecimal.ZERO;

    /** Sum of P&L realized by released allocations */
    @Column(name = "realized_pnl", nullable = false, precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    @Column(name = "max_drawdown", nullable = false)
    private double maxDrawdown;

    @Column(name = "current_drawdown", nullable = false)
    @Builder.Default
    private double currentDrawdown = 0.0;

    @Column(name = "last_updated")
    @Builder.Default
    private LocalDateTime lastUpdated = LocalDateTime.now();

    @Version
    private Long version;

    public BigDecimal getAvailableCapital() {
        return totalCapital.subtract(allocatedCapital);
    }
}
