package tw.gc.auto.control.services.decision;

import lombok.Builder;
import tw.gc.auto.control.entities.RiskGateOutcome;
import tw.gc.auto.control.entities.TradePlan;
import tw.gc.auto.control.services.nudge.EventSignal;
import tw.gc.auto.control.services.nudge.MarketContext;

import java.util.List;

/**
 * Input to one decision cycle: the strategy's plan, the risk gates it already evaluated, and the
 * news and market context around it.
 */
@Builder
public record DecisionRequest(
        String strategyId,
        String symbol,
        String sector,
        TradePlan plan,
        RiskGateOutcome riskGate,
        List<String> riskNotes,
        List<EventSignal> events,
        MarketContext marketContext
) {
}
