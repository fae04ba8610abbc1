package tw.gc.auto.control.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Back-test performance reported by the evolution engine when it emits a candidate.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceSnapshot {

    @Column(name = "total_trades", nullable = false)
    private int totalTrades;

    /** Fraction in [0, 1] */
    @Column(name = "win_rate", nullable = false)
    private double winRate;

    @Column(name = "profit_factor", nullable = false)
    private double profitFactor;

    /** Peak-to-trough decline as a fraction in [0, 1] */
    @Column(name = "max_drawdown", nullable = false)
    private double maxDrawdown;

    @Column(name = "sharpe_ratio", nullable = false)
    private double sharpeRatio;
}
