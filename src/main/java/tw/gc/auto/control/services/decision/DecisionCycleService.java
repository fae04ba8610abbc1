package tw.gc.auto.control.services.decision;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.auto.control.entities.DecisionTrace;
import tw.gc.auto.control.entities.MarketSnapshot;
import tw.gc.auto.control.entities.NewsEvidence;
import tw.gc.auto.control.entities.RiskGateOutcome;
import tw.gc.auto.control.entities.TradePlan;
import tw.gc.auto.control.enums.ExecutionStatus;
import tw.gc.auto.control.enums.TradeAction;
import tw.gc.auto.control.services.execution.OrderRequest;
import tw.gc.auto.control.services.execution.OrderSubmissionGateway;
import tw.gc.auto.control.services.execution.OrderSubmissionResult;
import tw.gc.auto.control.services.nudge.ConfidenceNudgeService;
import tw.gc.auto.control.services.nudge.EventSignal;
import tw.gc.auto.control.services.nudge.MarketContext;
import tw.gc.auto.control.services.nudge.NudgeExplanation;
import tw.gc.auto.control.services.safety.OrderGateDecision;
import tw.gc.auto.control.services.safety.OrderIntent;
import tw.gc.auto.control.services.safety.SafetySupervisorService;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one decision cycle for a strategy's trade plan and leaves a trace behind.
 * <p>
 * An order is sent only when every risk gate and the safety gate pass and the plan is not a
 * HOLD. The trace is stored as PENDING before submission and then moved to the execution
 * result, so a crash mid-submission still leaves evidence.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DecisionCycleService {

    private final ConfidenceNudgeService nudgeService;
    private final SafetySupervisorService safetySupervisor;
    private final OrderSubmissionGateway orderGateway;
    private final DecisionEvidenceRecorder recorder;

    public DecisionTrace runCycle(DecisionRequest request) {
        List<EventSignal> events = request.events() != null ? request.events() : List.of();
        MarketContext market = request.marketContext();
        TradePlan plan = request.plan();

        double nudge = nudgeService.calculateNudge(events, market, request.sector(), request.symbol());
        NudgeExplanation explanation = nudgeService.explainNudge(nudge, events, market);
        double base = plan.getBaseConfidence() != null ? plan.getBaseConfidence() : 0.0;
        TradePlan adjusted = plan.toBuilder()
                .adjustedConfidence(Math.max(0.0, Math.min(1.0, base + nudge)))
                .build();

        OrderIntent intent = plan.isEntry() ? OrderIntent.entry(request.symbol()) : OrderIntent.exit(request.symbol());
        OrderGateDecision safetyGate = safetySupervisor.checkOrder(intent);
        RiskGateOutcome riskGate = request.riskGate() != null ? request.riskGate() : new RiskGateOutcome();

        DecisionTrace trace = recorder.record(DecisionRecord.builder()
                .symbol(request.symbol())
                .plan(adjusted)
                .riskGate(riskGate)
                .riskNotes(request.riskNotes())
                .safetyPermitted(safetyGate.permitted())
                .safetyBlockReason(safetyGate.blockReason())
                .marketContext(toSnapshot(market))
                .newsEvidence(toEvidence(events))
                .nudgeValue(nudge)
                .nudgeRegimeShrink(explanation.regimeShrink())
                .nudgeReason(explanation.reason())
                .executionStatus(ExecutionStatus.PENDING)
                .build());

        if (adjusted.getAction() == TradeAction.HOLD) {
            return recorder.updateExecution(trace.getTraceId(), ExecutionStatus.CANCELLED, List.of());
        }
        if (!riskGate.allPassed() || !safetyGate.permitted()) {
            log.warn("🚫 Decision {} for {} not executed (risk gates {}/3, safety {})",
                    trace.getTraceId(), request.symbol(), riskGate.passedCount(),
                    safetyGate.permitted() ? "ok" : safetyGate.blockReason());
            return recorder.updateExecution(trace.getTraceId(), ExecutionStatus.REJECTED, List.of());
        }

        OrderSubmissionResult result = orderGateway.submit(new OrderRequest(
                request.strategyId(),
                request.symbol(),
                adjusted.getAction(),
                adjusted.getOrderType(),
                adjusted.getQty(),
                adjusted.getLimitPrice(),
                adjusted.isEntry()));
        return recorder.updateExecution(trace.getTraceId(), result.status(), result.brokerOrderIds());
    }

    private static MarketSnapshot toSnapshot(MarketContext market) {
        if (market == null) {
            return null;
        }
        return MarketSnapshot.builder()
                .regime(market.regime())
                .volatility(market.volatility())
                .vix(market.vix())
                .build();
    }

    private static List<NewsEvidence> toEvidence(List<EventSignal> events) {
        List<NewsEvidence> evidence = new ArrayList<>();
        for (EventSignal event : events) {
            if (!event.isValidated()) {
                continue;
            }
            evidence.add(NewsEvidence.builder()
                    .eventType(event.getType())
                    .direction(event.getDirection() > 0 ? "positive" : "negative")
                    .confidence(event.getConfidence())
                    .effectSize(event.getEffectZ())
                    .expectedReturn(event.getExpectedReturn5m())
                    .hitRate(event.getHitRate())
                    .build());
        }
        return evidence;
    }
}
