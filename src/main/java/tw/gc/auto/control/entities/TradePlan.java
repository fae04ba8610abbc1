package tw.gc.auto.control.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.auto.control.enums.OrderType;
import tw.gc.auto.control.enums.TradeAction;

@Embeddable
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TradePlan {

    @Enumerated(EnumType.STRING)
    @Column(name = "plan_action", nullable = false, length = 10)
    private TradeAction action;

    @Enumerated(EnumType.STRING)
    @Column(name = "plan_order_type", length = 10)
    private OrderType orderType;

    @Column(name = "plan_qty")
    private int qty;

    @Column(name = "plan_limit_price")
    private Double limitPrice;

    @Column(name = "plan_sizing_method", length = 50)
    private String sizingMethod;

    @Column(name = "plan_risk_percent")
    private Double riskPercent;

    @Column(name = "plan_stop_loss")
    private Double stopLoss;

    @Column(name = "plan_take_profit")
    private Double takeProfit;

    /** Strategy confidence before any news nudge */
    @Column(name = "plan_base_confidence")
    private Double baseConfidence;

    @Column(name = "plan_adjusted_confidence")
    private Double adjustedConfidence;

    /** Opens or adds to a position, as opposed to reducing one */
    @Column(name = "plan_entry", nullable = false)
    @Builder.Default
    private boolean entry = true;
}
