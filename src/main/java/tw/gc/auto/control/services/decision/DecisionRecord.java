package tw.gc.auto.control.services.decision;

import lombok.Builder;
import tw.gc.auto.control.entities.MarketSnapshot;
import tw.gc.auto.control.entities.NewsEvidence;
import tw.gc.auto.control.entities.RiskGateOutcome;
import tw.gc.auto.control.entities.TradePlan;
import tw.gc.auto.control.enums.ExecutionStatus;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Everything known about a decision at the time it is recorded. {@code traceId} and
 * {@code asOf} are assigned by the recorder when absent.
 */
@Builder
public record DecisionRecord(
        String traceId,
        String symbol,
        LocalDateTime asOf,
        TradePlan plan,
        RiskGateOutcome riskGate,
        List<String> riskNotes,
        boolean safetyPermitted,
        String safetyBlockReason,
        MarketSnapshot marketContext,
        List<NewsEvidence> newsEvidence,
        Double nudgeValue,
        Double nudgeRegimeShrink,
        String nudgeReason,
        ExecutionStatus executionStatus,
        List<String> brokerOrderIds
) {
}
