package tw.gc.auto.control.services.safety;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import tw.gc.auto.control.config.ControlPlaneProperties;
import tw.gc.auto.control.entities.SafetyStatus;
import tw.gc.auto.control.enums.TradingMode;
import tw.gc.auto.control.events.CircuitBreakerNotification;
import tw.gc.auto.control.events.ControlPlaneEventPublisher;
import tw.gc.auto.control.events.ControlPlaneNotification;
import tw.gc.auto.control.events.CooldownNotification;
import tw.gc.auto.control.exceptions.CircuitBreakerTrippedException;
import tw.gc.auto.control.repositories.SafetyStatusRepository;
import tw.gc.auto.control.support.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SafetySupervisorServiceTest {

    @Mock
    private SafetyStatusRepository repository;

    @Mock
    private ControlPlaneEventPublisher eventPublisher;

    private final ControlPlaneProperties properties = new ControlPlaneProperties();
    private final MutableClock clock = MutableClock.startingAt("2026-03-02T01:00:00Z");

    private SafetySupervisorService supervisor;

    @BeforeEach
    void setUp() {
        when(repository.findById(SafetyStatus.SINGLETON_ID)).thenReturn(Optional.empty());
        when(repository.save(any(SafetyStatus.class))).thenAnswer(inv -> inv.getArgument(0));

        supervisor = new SafetySupervisorService(repository, eventPublisher, properties, clock);
        supervisor.initialize();
    }

    // ==================== Initialization ====================

    @Test
    void initialize_withNoStoredStatus_shouldStartInPaperModeWithConfiguredLimits() {
        SafetyStatus status = supervisor.getStatus();

        assertEquals(TradingMode.PAPER, status.getTradingMode());
        assertEquals(1500.0, status.getMaxDailyLoss());
        assertEquals(50, status.getMaxTradesPerDay());
        assertFalse(status.isCircuitBreakerActive());
    }

    @Test
    void initialize_withStoredStatus_shouldKeepPersistedState() {
        SafetyStatus stored = SafetyStatus.builder()
                .id(SafetyStatus.SINGLETON_ID)
                .tradingMode(TradingMode.PAPER)
                .emergencyStopActive(true)
                .emergencyStopReason("operator")
                .build();
        when(repository.findById(SafetyStatus.SINGLETON_ID)).thenReturn(Optional.of(stored));

        SafetySupervisorService restarted = new SafetySupervisorService(repository, eventPublisher, properties, clock);
        restarted.initialize();

        assertTrue(restarted.getStatus().isEmergencyStopActive());
        assertFalse(restarted.checkOrder(OrderIntent.exit("2330.TW")).permitted());
    }

    // ==================== Order gate ====================

    @Test
    void checkOrder_withNothingActive_shouldPermit() {
        OrderGateDecision decision = supervisor.checkOrder(OrderIntent.entry("2330.TW"));

        assertTrue(decision.permitted());
        assertNull(decision.blockReason());
    }

    @Test
    void checkOrder_duringEmergencyStop_shouldBlockWithReason() {
        supervisor.activateEmergencyStop("Broker outage");

        OrderGateDecision decision = supervisor.checkOrder(OrderIntent.exit("2330.TW"));

        assertFalse(decision.permitted());
        assertEquals("Emergency stop active: Broker outage", decision.blockReason());
    }

    @Test
    void checkOrder_whenBreakerTripped_shouldBlockEntriesAndExits() {
        supervisor.tripCircuitBreaker("test");

        assertFalse(supervisor.checkOrder(OrderIntent.entry("2330.TW")).permitted());
        assertFalse(supervisor.checkOrder(OrderIntent.exit("2330.TW")).permitted());
    }

    @Test
    void checkOrder_duringCooldown_shouldBlockEntriesOnly() {
        supervisor.startCooldown("loss", Duration.ofMinutes(5));

        OrderGateDecision entry = supervisor.checkOrder(OrderIntent.entry("2330.TW"));
        OrderGateDecision exit = supervisor.checkOrder(OrderIntent.exit("2330.TW"));

        assertFalse(entry.permitted());
        assertThat(entry.blockReason()).startsWith("Cooldown active until");
        assertTrue(exit.permitted());
    }

    @Test
    void requireOrderPermitted_whenBlocked_shouldThrowWithReason() {
        supervisor.tripCircuitBreaker("Error rate too high");

        assertThatThrownBy(() -> supervisor.requireOrderPermitted(OrderIntent.entry("2330.TW")))
                .isInstanceOf(CircuitBreakerTrippedException.class)
                .hasMessageContaining("Error rate too high");
    }

    @Test
    void checkOrder_whenPersistenceFails_shouldFailClosed() {
        supervisor.tripCircuitBreaker("x");
        clock.advance(Duration.ofMinutes(6));
        when(repository.save(any(SafetyStatus.class))).thenThrow(new IllegalStateException("db down"));

        OrderGateDecision decision = supervisor.checkOrder(OrderIntent.entry("2330.TW"));

        assertFalse(decision.permitted());
        assertThat(decision.blockReason()).contains("db down");
    }

    @Test
    void tripCircuitBreaker_whenPersistenceFails_shouldStillBlockOrders() {
        when(repository.save(any(SafetyStatus.class))).thenThrow(new IllegalStateException("db down"));

        supervisor.evaluateRiskMetrics("broker", RiskMetrics.operational(0.5, 50.0));

        OrderGateDecision decision = supervisor.checkOrder(OrderIntent.entry("2330.TW"));
        assertFalse(decision.permitted());
        assertThat(decision.blockReason()).contains("Error rate 50.00%");
        verify(eventPublisher).publish(any(CircuitBreakerNotification.class));
    }

    @Test
    void recordTrade_whenPersistenceFails_shouldNotThrowAndKeepCount() {
        when(repository.save(any(SafetyStatus.class))).thenThrow(new IllegalStateException("db down"));

        assertDoesNotThrow(() -> supervisor.recordTrade());

        assertEquals(1, supervisor.getStatus().getCurrentTradeCount());
    }

    @Test
    void resetCircuitBreaker_whenPersistenceFails_shouldStayTripped() {
        supervisor.tripCircuitBreaker("latency");
        when(repository.save(any(SafetyStatus.class))).thenThrow(new IllegalStateException("db down"));

        assertThatThrownBy(() -> supervisor.resetCircuitBreaker()).hasMessage("db down");

        assertTrue(supervisor.isTradingHalted());
    }

    // ==================== Circuit breaker ====================

    @Test
    void tripCircuitBreaker_shouldPublishOnceAndKeepOriginalTriggerTime() {
        assertTrue(supervisor.tripCircuitBreaker("first"));
        LocalDateTime triggeredAt = supervisor.getStatus().getCircuitBreakerTriggeredAt();
        clock.advance(Duration.ofMinutes(1));

        assertFalse(supervisor.tripCircuitBreaker("second"));

        SafetyStatus status = supervisor.getStatus();
        assertEquals("first", status.getCircuitBreakerReason());
        assertEquals(triggeredAt, status.getCircuitBreakerTriggeredAt());
        verify(eventPublisher, times(1)).publish(any(CircuitBreakerNotification.class));
    }

    @Test
    void circuitBreaker_shouldAutoResetAfterFiveMinutes() {
        supervisor.tripCircuitBreaker("latency");

        clock.advance(Duration.ofMinutes(4).plusSeconds(59));
        assertTrue(supervisor.getStatus().isCircuitBreakerActive());

        clock.advance(Duration.ofSeconds(1));
        supervisor.expireTimers();

        assertFalse(supervisor.getStatus().isCircuitBreakerActive());
        ArgumentCaptor<ControlPlaneNotification> events = ArgumentCaptor.forClass(ControlPlaneNotification.class);
        verify(eventPublisher, atLeast(2)).publish(events.capture());
        assertThat(events.getAllValues())
                .anyMatch(n -> n instanceof CircuitBreakerNotification c && !c.tripped()
                        && c.message().contains("Auto-reset after 5 minutes"));
    }

    @Test
    void expireTimers_whenBreakerRetrippedMeanwhile_shouldKeepNewTrip() {
        ReadHookClock hookedClock = new ReadHookClock(clock.instant());
        SafetySupervisorService racing = new SafetySupervisorService(repository, eventPublisher, properties, hookedClock);
        racing.initialize();
        racing.tripCircuitBreaker("latency");
        hookedClock.advance(Duration.ofMinutes(5));

        hookedClock.onNextRead = () -> {
            racing.resetCircuitBreaker();
            racing.tripCircuitBreaker("Error rate spike");
        };
        racing.expireTimers();

        SafetyStatus status = racing.getStatus();
        assertTrue(status.isCircuitBreakerActive());
        assertEquals("Error rate spike", status.getCircuitBreakerReason());
    }

    @Test
    void resetCircuitBreaker_shouldClearImmediately() {
        supervisor.tripCircuitBreaker("manual");

        SafetyStatus status = supervisor.resetCircuitBreaker();

        assertFalse(status.isCircuitBreakerActive());
        assertNull(status.getCircuitBreakerReason());
    }

    @Test
    void evaluateRiskMetrics_highErrorRate_shouldTrip() {
        supervisor.recordHealthMetrics(0.06, 2.0);

        SafetyStatus status = supervisor.getStatus();
        assertTrue(status.isCircuitBreakerActive());
        assertThat(status.getCircuitBreakerReason()).contains("Error rate");
    }

    @Test
    void evaluateRiskMetrics_highLatency_shouldTrip() {
        supervisor.recordHealthMetrics(0.0, 9.5);

        assertThat(supervisor.getStatus().getCircuitBreakerReason()).contains("Latency p95");
    }

    @Test
    void evaluateRiskMetrics_withinThresholds_shouldNotTrip() {
        supervisor.evaluateRiskMetrics("broker", new RiskMetrics(0.05, 8.0, 1500.0, 50));

        assertFalse(supervisor.getStatus().isCircuitBreakerActive());
    }

    @Test
    void evaluateRiskMetrics_unreadableValue_shouldFailClosed() {
        supervisor.evaluateRiskMetrics("broker", new RiskMetrics(Double.NaN, 1.0, null, null));

        assertThat(supervisor.getStatus().getCircuitBreakerReason()).contains("unreadable from broker");
    }

    @Test
    void evaluateRiskMetrics_missingReading_shouldFailClosed() {
        supervisor.evaluateRiskMetrics("broker", null);

        assertTrue(supervisor.getStatus().isCircuitBreakerActive());
    }

    // ==================== Inputs ====================

    @Test
    void recordTrade_beyondDailyLimit_shouldTrip() {
        for (int i = 0; i < 50; i++) {
            supervisor.recordTrade();
        }
        assertFalse(supervisor.getStatus().isCircuitBreakerActive());

        supervisor.recordTrade();

        SafetyStatus status = supervisor.getStatus();
        assertEquals(51, status.getCurrentTradeCount());
        assertTrue(status.isCircuitBreakerActive());
    }

    @Test
    void recordRealizedPnl_loss_shouldStartCooldownAndAccumulateDailyLoss() {
        supervisor.recordRealizedPnl(-200.0);

        SafetyStatus status = supervisor.getStatus();
        assertEquals(200.0, status.getCurrentDailyLoss());
        assertTrue(status.isCooldownActive());
        assertEquals(LocalDateTime.now(clock).plusSeconds(300), status.getCooldownEndsAt());
        verify(eventPublisher).publish(any(CooldownNotification.class));
    }

    @Test
    void recordRealizedPnl_gain_shouldChangeNothing() {
        supervisor.recordRealizedPnl(500.0);

        SafetyStatus status = supervisor.getStatus();
        assertEquals(0.0, status.getCurrentDailyLoss());
        assertFalse(status.isCooldownActive());
    }

    @Test
    void recordRealizedPnl_overDailyLimit_shouldTripBreaker() {
        supervisor.recordRealizedPnl(-1000.0);
        supervisor.recordRealizedPnl(-600.0);

        SafetyStatus status = supervisor.getStatus();
        assertTrue(status.isCircuitBreakerActive());
        assertThat(status.getCircuitBreakerReason()).contains("Daily loss 1600.00");
    }

    @Test
    void cooldown_shouldExpireOnRead() {
        supervisor.recordRealizedPnl(-10.0);
        clock.advance(Duration.ofSeconds(300));

        assertTrue(supervisor.checkOrder(OrderIntent.entry("2330.TW")).permitted());
        assertFalse(supervisor.getStatus().isCooldownActive());
    }

    @Test
    void resetDailyCounters_shouldZeroLossAndTrades() {
        supervisor.recordTrade();
        supervisor.recordRealizedPnl(-100.0);

        supervisor.resetDailyCounters();

        SafetyStatus status = supervisor.getStatus();
        assertEquals(0, status.getCurrentTradeCount());
        assertEquals(0.0, status.getCurrentDailyLoss());
    }

    // ==================== Mode and emergency stop ====================

    @Test
    void setTradingMode_toLiveDuringEmergencyStop_shouldBeRefused() {
        supervisor.activateEmergencyStop(null);

        assertThatThrownBy(() -> supervisor.setTradingMode(TradingMode.LIVE))
                .isInstanceOf(IllegalStateException.class);
        assertEquals(TradingMode.PAPER, supervisor.getStatus().getTradingMode());
        assertEquals("Manual emergency stop", supervisor.getStatus().getEmergencyStopReason());
    }

    @Test
    void setTradingMode_toLive_shouldSwitchAndPersist() {
        SafetyStatus status = supervisor.setTradingMode(TradingMode.LIVE);

        assertEquals(TradingMode.LIVE, status.getTradingMode());
        verify(repository).save(argThat((SafetyStatus s) -> s.getTradingMode() == TradingMode.LIVE));
    }

    @Test
    void emergencyStop_shouldNeverClearByItself() {
        supervisor.activateEmergencyStop("halt");
        clock.advance(Duration.ofHours(2));
        supervisor.expireTimers();

        assertTrue(supervisor.isTradingHalted());

        supervisor.deactivateEmergencyStop();
        assertFalse(supervisor.isTradingHalted());
    }

    @Test
    void getStatus_shouldReturnDetachedCopy() {
        SafetyStatus copy = supervisor.getStatus();
        copy.setEmergencyStopActive(true);

        assertFalse(supervisor.getStatus().isEmergencyStopActive());
    }

    /**
     * Runs a one-shot action on the next clock read, between a timer snapshot and its reset.
     */
    private static class ReadHookClock extends MutableClock {

        private Runnable onNextRead;

        ReadHookClock(Instant start) {
            super(start);
        }

        @Override
        public Instant instant() {
            Runnable hook = onNextRead;
            onNextRead = null;
            if (hook != null) {
                hook.run();
            }
            return super.instant();
        }
    }
}
