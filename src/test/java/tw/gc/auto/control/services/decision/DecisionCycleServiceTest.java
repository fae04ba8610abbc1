package tw.gc.auto.control.services.decision;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import tw.gc.auto.control.entities.DecisionTrace;
import tw.gc.auto.control.entities.RiskGateOutcome;
import tw.gc.auto.control.entities.TradePlan;
import tw.gc.auto.control.enums.ExecutionStatus;
import tw.gc.auto.control.enums.OrderType;
import tw.gc.auto.control.enums.TradeAction;
import tw.gc.auto.control.repositories.DecisionTraceRepository;
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
import tw.gc.auto.control.support.MutableClock;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DecisionCycleServiceTest {

    @Mock
    private ConfidenceNudgeService nudgeService;
    @Mock
    private SafetySupervisorService safetySupervisor;
    @Mock
    private OrderSubmissionGateway orderGateway;
    @Mock
    private DecisionTraceRepository traceRepository;

    private final Map<String, DecisionTrace> store = new HashMap<>();
    private DecisionCycleService cycleService;

    @BeforeEach
    void setUp() {
        when(traceRepository.save(any(DecisionTrace.class))).thenAnswer(inv -> {
            DecisionTrace trace = inv.getArgument(0);
            store.put(trace.getTraceId(), trace);
            return trace;
        });
        when(traceRepository.findById(anyString())).thenAnswer(inv -> Optional.ofNullable(store.get(inv.<String>getArgument(0))));

        DecisionEvidenceRecorder recorder = new DecisionEvidenceRecorder(traceRepository, MutableClock.startingAt("2026-03-02T02:00:00Z"));
        cycleService = new DecisionCycleService(nudgeService, safetySupervisor, orderGateway, recorder);

        when(nudgeService.calculateNudge(any(), any(), any(), any())).thenReturn(0.02);
        when(nudgeService.explainNudge(anyDouble(), any(), any())).thenReturn(new NudgeExplanation(
                2.0, "Positive news reaction expected", 0.4, List.of(), 0.8, 24.0, false));
        when(safetySupervisor.checkOrder(any())).thenReturn(OrderGateDecision.permit());
        when(orderGateway.submit(any())).thenReturn(OrderSubmissionResult.accepted(ExecutionStatus.FILLED, List.of("PAPER-1")));
    }

    private static DecisionRequest request(TradeAction action, RiskGateOutcome gates) {
        EventSignal validated = EventSignal.builder()
                .type("earnings_beat").direction(1).confidence(0.9).effectZ(0.35).validated(true).build();
        EventSignal raw = EventSignal.builder().type("rumor").direction(-1).confidence(0.3).build();
        return DecisionRequest.builder()
                .strategyId("momentum-1")
                .symbol("2330.TW")
                .sector("semiconductors")
                .plan(TradePlan.builder()
                        .action(action)
                        .orderType(OrderType.MARKET)
                        .qty(3)
                        .baseConfidence(0.99)
                        .build())
                .riskGate(gates)
                .riskNotes(List.of("heat ok"))
                .events(List.of(validated, raw))
                .marketContext(new MarketContext(24.0, 0.1, 1.0, "trending", 0.22))
                .build();
    }

    @Test
    void runCycle_allGatesPass_shouldSubmitAndRecordFill() {
        DecisionTrace trace = cycleService.runCycle(request(TradeAction.BUY, new RiskGateOutcome(true, true, true)));

        assertThat(trace.getExecutionStatus()).isEqualTo(ExecutionStatus.FILLED);
        assertThat(trace.getBrokerOrderIds()).containsExactly("PAPER-1");
        assertThat(trace.isSafetyPermitted()).isTrue();
        assertThat(trace.getNudgeValue()).isEqualTo(0.02);
        assertThat(trace.getNudgeRegimeShrink()).isEqualTo(0.8);
        assertThat(trace.getMarketContext().getRegime()).isEqualTo("trending");
        assertThat(trace.getMarketContext().getVix()).isEqualTo(24.0);
        assertThat(trace.getNewsEvidence()).extracting("eventType").containsExactly("earnings_beat");

        ArgumentCaptor<OrderRequest> captor = ArgumentCaptor.forClass(OrderRequest.class);
        verify(orderGateway).submit(captor.capture());
        assertThat(captor.getValue().quantity()).isEqualTo(3);
        assertThat(captor.getValue().strategyId()).isEqualTo("momentum-1");
        verify(safetySupervisor).checkOrder(OrderIntent.entry("2330.TW"));
    }

    @Test
    void runCycle_shouldClampAdjustedConfidence() {
        DecisionTrace trace = cycleService.runCycle(request(TradeAction.BUY, new RiskGateOutcome(true, true, true)));

        assertThat(trace.getPlan().getBaseConfidence()).isEqualTo(0.99);
        assertThat(trace.getPlan().getAdjustedConfidence()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void runCycle_failedRiskGate_shouldRejectWithoutSubmitting() {
        DecisionTrace trace = cycleService.runCycle(request(TradeAction.SELL, new RiskGateOutcome(true, false, true)));

        assertThat(trace.getExecutionStatus()).isEqualTo(ExecutionStatus.REJECTED);
        verify(orderGateway, never()).submit(any());
    }

    @Test
    void runCycle_safetyBlock_shouldRecordReasonAndReject() {
        when(safetySupervisor.checkOrder(any())).thenReturn(OrderGateDecision.block("Emergency stop active: manual"));

        DecisionTrace trace = cycleService.runCycle(request(TradeAction.BUY, new RiskGateOutcome(true, true, true)));

        assertThat(trace.isSafetyPermitted()).isFalse();
        assertThat(trace.getSafetyBlockReason()).isEqualTo("Emergency stop active: manual");
        assertThat(trace.getExecutionStatus()).isEqualTo(ExecutionStatus.REJECTED);
        verify(orderGateway, never()).submit(any());
    }

    @Test
    void runCycle_hold_shouldCancelWithoutSubmitting() {
        DecisionTrace trace = cycleService.runCycle(request(TradeAction.HOLD, new RiskGateOutcome(true, true, true)));

        assertThat(trace.getExecutionStatus()).isEqualTo(ExecutionStatus.CANCELLED);
        verify(orderGateway, never()).submit(any());
    }

    @Test
    void runCycle_brokerFailure_shouldLeaveRejectedTrace() {
        when(orderGateway.submit(any())).thenReturn(OrderSubmissionResult.failed("Broker error: timeout"));

        DecisionTrace trace = cycleService.runCycle(request(TradeAction.BUY, new RiskGateOutcome(true, true, true)));

        assertThat(trace.getExecutionStatus()).isEqualTo(ExecutionStatus.REJECTED);
        assertThat(trace.getBrokerOrderIds()).isEmpty();
    }

    @Test
    void runCycle_exitPlan_shouldAskSafetyGateAsExit() {
        DecisionRequest base = request(TradeAction.SELL, new RiskGateOutcome(true, true, true));
        DecisionRequest exit = DecisionRequest.builder()
                .strategyId(base.strategyId())
                .symbol(base.symbol())
                .plan(base.plan().toBuilder().entry(false).build())
                .riskGate(base.riskGate())
                .build();

        cycleService.runCycle(exit);

        verify(safetySupervisor).checkOrder(OrderIntent.exit("2330.TW"));
    }
}
