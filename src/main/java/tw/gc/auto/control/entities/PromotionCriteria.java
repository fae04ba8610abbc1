package tw.gc.auto.control.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromotionCriteria {

    @Column(name = "min_generations", nullable = false)
    private int minGenerations;

    @Column(name = "min_fitness", nullable = false)
    private double minFitness;

    @Column(name = "min_win_rate", nullable = false)
    private double minWinRate;

    @Column(name = "max_drawdown", nullable = false)
    private double maxDrawdown;

    @Column(name = "min_trades", nullable = false)
    private int minTrades;

    @Column(name = "consistency_score", nullable = false)
    private double consistencyScore;

    /** Validation window in days */
    @Column(name = "validation_period_days", nullable = false)
    private int validationPeriod;
}
