package tw.gc.auto.control.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Results of the pre-trade risk gates. Explanatory notes live on the trace.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskGateOutcome {

    @Column(name = "gate_position_limits_ok", nullable = false)
    private boolean positionLimitsOk;

    @Column(name = "gate_portfolio_heat_ok", nullable = false)
    private boolean portfolioHeatOk;

    @Column(name = "gate_drawdown_ok", nullable = false)
    private boolean drawdownOk;

    public boolean allPassed() {
        return positionLimitsOk && portfolioHeatOk && drawdownOk;
    }

    public int passedCount() {
        return (positionLimitsOk ? 1 : 0) + (portfolioHeatOk ? 1 : 0) + (drawdownOk ? 1 : 0);
    }
}
