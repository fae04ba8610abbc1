package tw.gc.auto.control.services.safety;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import tw.gc.auto.control.config.ControlPlaneProperties;
import tw.gc.auto.control.entities.SafetyStatus;
import tw.gc.auto.control.enums.TradingMode;
import tw.gc.auto.control.events.CircuitBreakerNotification;
import tw.gc.auto.control.events.ControlPlaneEventPublisher;
import tw.gc.auto.control.events.ControlPlaneNotification;
import tw.gc.auto.control.events.CooldownNotification;
import tw.gc.auto.control.events.EmergencyStopNotification;
import tw.gc.auto.control.events.TradingModeNotification;
import tw.gc.auto.control.exceptions.CircuitBreakerTrippedException;
import tw.gc.auto.control.repositories.SafetyStatusRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Safety Supervisor
 *
 * Owns the single {@link SafetyStatus} and vetoes order submission. Three independent
 * mechanisms, all of which must be clear for an order to proceed:
 * <ul>
 *   <li><b>Emergency stop</b>: manual kill switch, never resets by itself</li>
 *   <li><b>Circuit breaker</b>: trips on error rate, latency, daily loss or trade count and
 *       resets automatically after a fixed window or manually</li>
 *   <li><b>Cooldown</b>: short throttle after a realized loss; blocks new entries only</li>
 * </ul>
 *
 * All mutations are serialized on one lock and written through to the database. Readers see an
 * immutable snapshot, so the submission check never waits on a writer. A change that tightens
 * trading takes effect even if the write fails; a change that loosens it needs the write.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SafetySupervisorService {

    private final SafetyStatusRepository repository;
    private final ControlPlaneEventPublisher eventPublisher;
    private final ControlPlaneProperties properties;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile SafetyStatus current;

    @PostConstruct
    public void initialize() {
        ControlPlaneProperties.Safety config = properties.getSafety();
        SafetyStatus status = repository.findById(SafetyStatus.SINGLETON_ID)
                .orElseGet(() -> SafetyStatus.builder()
                        .id(SafetyStatus.SINGLETON_ID)
                        .tradingMode(TradingMode.PAPER)
                        .build());
        status.setMaxDailyLoss(config.getMaxDailyLoss());
        status.setMaxTradesPerDay(config.getMaxTradesPerDay());
        status.setUpdatedAt(now());
        current = repository.save(status);

        log.info("🛡️ SafetySupervisor initialized: mode={}, emergencyStop={}, breaker={}, cooldown={}",
                current.getTradingMode(), current.isEmergencyStopActive(),
                current.isCircuitBreakerActive(), current.isCooldownActive());
    }

    /**
     * Copy of the current status with expired timers already cleared
     */
    public SafetyStatus getStatus() {
        expireTimers();
        return snapshot().toBuilder().build();
    }

    // ===== Order gate =====

    /**
     * Synchronous gate consulted at the moment of submission.
     */
    public OrderGateDecision checkOrder(OrderIntent intent) {
        try {
            expireTimers();
            SafetyStatus status = snapshot();

            if (status.isEmergencyStopActive()) {
                return OrderGateDecision.block("Emergency stop active: " + nullToDash(status.getEmergencyStopReason()));
            }
            if (status.isCircuitBreakerActive()) {
                return OrderGateDecision.block("Circuit breaker active: " + nullToDash(status.getCircuitBreakerReason()));
            }
            if (status.isCooldownActive() && intent.entry()) {
                return OrderGateDecision.block(String.format("Cooldown active until %s: %s",
                        status.getCooldownEndsAt(), nullToDash(status.getCooldownReason())));
            }
            return OrderGateDecision.permit();
        } catch (RuntimeException e) {
            // Fail closed
            log.error("❌ Safety gate evaluation failed for {}", intent.symbol(), e);
            return OrderGateDecision.block("Safety gate evaluation failed: " + e.getMessage());
        }
    }

    /**
     * @throws CircuitBreakerTrippedException when any safety mechanism blocks the order
     */
    public void requireOrderPermitted(OrderIntent intent) {
        OrderGateDecision decision = checkOrder(intent);
        if (!decision.permitted()) {
            throw new CircuitBreakerTrippedException(decision.blockReason());
        }
    }

    public boolean isTradingHalted() {
        SafetyStatus status = snapshot();
        return status.isEmergencyStopActive() || status.isCircuitBreakerActive();
    }

    // ===== Trading mode & emergency stop =====

    public SafetyStatus setTradingMode(TradingMode mode) {
        if (mode == null) {
            throw new IllegalArgumentException("Trading mode must be provided");
        }
        TradingMode previous = snapshot().getTradingMode();
        if (previous == mode) {
            log.info("⚠️ Already in {} mode", mode);
            return getStatus();
        }

        mutate(s -> {
            if (mode == TradingMode.LIVE && s.isEmergencyStopActive()) {
                throw new IllegalStateException("Cannot switch to LIVE while emergency stop is active");
            }
            s.setTradingMode(mode);
        }, false, List.of(new TradingModeNotification(previous, mode, now())));

        log.info("🔄 Trading mode switched: {} → {}", previous, mode);
        return getStatus();
    }

    public SafetyStatus activateEmergencyStop(String reason) {
        String why = reason == null || reason.isBlank() ? "Manual emergency stop" : reason;
        if (snapshot().isEmergencyStopActive()) {
            return getStatus();
        }
        mutate(s -> {
            s.setEmergencyStopActive(true);
            s.setEmergencyStopReason(why);
        }, true, List.of(new EmergencyStopNotification(true, why, now())));
        log.error("🚨 EMERGENCY STOP ACTIVATED: {}", why);
        return getStatus();
    }

    public SafetyStatus deactivateEmergencyStop() {
        if (!snapshot().isEmergencyStopActive()) {
            return getStatus();
        }
        mutate(s -> {
            s.setEmergencyStopActive(false);
            s.setEmergencyStopReason(null);
        }, false, List.of(new EmergencyStopNotification(false, null, now())));
        log.warn("✅ Emergency stop cleared");
        return getStatus();
    }

    // ===== Circuit breaker =====

    /**
     * Trip the breaker. A breaker that is already active keeps its original trigger time.
     *
     * @return true if this call tripped it
     */
    public boolean tripCircuitBreaker(String reason) {
        lock.lock();
        try {
            if (current.isCircuitBreakerActive()) {
                return false;
            }
            LocalDateTime now = now();
            apply(s -> {
                s.setCircuitBreakerActive(true);
                s.setCircuitBreakerReason(reason);
                s.setCircuitBreakerTriggeredAt(now);
            }, true);
        } finally {
            lock.unlock();
        }
        log.error("🚨 CIRCUIT BREAKER TRIPPED: {}", reason);
        eventPublisher.publish(new CircuitBreakerNotification(true, reason, now()));
        return true;
    }

    public SafetyStatus resetCircuitBreaker() {
        resetBreaker("Manual reset", null);
        return getStatus();
    }

    public SafetyStatus clearCooldown() {
        endCooldown();
        return getStatus();
    }

    // ===== Inputs =====

    /**
     * Count an order sent to the broker; trips when the count exceeds the daily maximum.
     */
    public void recordTrade() {
        int[] counts = new int[2];
        mutate(s -> {
            s.setCurrentTradeCount(s.getCurrentTradeCount() + 1);
            counts[0] = s.getCurrentTradeCount();
            counts[1] = s.getMaxTradesPerDay();
        }, true, List.of());
        if (counts[0] > counts[1]) {
            tripCircuitBreaker(String.format("Trade count %d exceeds max trades per day %d", counts[0], counts[1]));
        }
    }

    /**
     * Feed a realized P&amp;L event. A loss adds to the daily loss and starts a cooldown.
     */
    public void recordRealizedPnl(double pnl) {
        if (Double.isNaN(pnl)) {
            tripCircuitBreaker("Realized P&L reading unavailable");
            return;
        }
        if (pnl >= 0) {
            return;
        }

        double[] loss = new double[2];
        mutate(s -> {
            s.setCurrentDailyLoss(s.getCurrentDailyLoss() + Math.abs(pnl));
            loss[0] = s.getCurrentDailyLoss();
            loss[1] = s.getMaxDailyLoss();
        }, true, List.of());

        startCooldown(String.format("Realized loss of %.2f", Math.abs(pnl)),
                Duration.ofSeconds(properties.getSafety().getCooldownSeconds()));

        if (loss[0] > loss[1]) {
            tripCircuitBreaker(String.format("Daily loss %.2f exceeds max daily loss %.2f", loss[0], loss[1]));
        }
    }

    public void recordHealthMetrics(double errorRate, double latencyP95Ms) {
        evaluateRiskMetrics("health", RiskMetrics.operational(errorRate, latencyP95Ms));
    }

    /**
     * Compare a reading against the thresholds. Unreadable values (NaN) count as a breach.
     */
    public void evaluateRiskMetrics(String source, RiskMetrics metrics) {
        if (metrics == null) {
            tripCircuitBreaker("Risk metrics unavailable from " + source);
            return;
        }
        ControlPlaneProperties.Safety config = properties.getSafety();

        String breach = null;
        if (isUnreadable(metrics.errorRate()) || isUnreadable(metrics.latencyP95Ms())
                || isUnreadable(metrics.dailyLoss())) {
            breach = "Risk metric unreadable from " + source;
        } else if (metrics.errorRate() != null && metrics.errorRate() > config.getMaxErrorRate()) {
            breach = String.format("Error rate %.2f%% exceeds %.2f%% (%s)",
                    metrics.errorRate() * 100, config.getMaxErrorRate() * 100, source);
        } else if (metrics.latencyP95Ms() != null && metrics.latencyP95Ms() > config.getMaxLatencyP95Ms()) {
            breach = String.format("Latency p95 %.1fms exceeds %.1fms (%s)",
                    metrics.latencyP95Ms(), config.getMaxLatencyP95Ms(), source);
        } else if (metrics.dailyLoss() != null && metrics.dailyLoss() > snapshot().getMaxDailyLoss()) {
            breach = String.format("Daily loss %.2f exceeds max daily loss %.2f (%s)",
                    metrics.dailyLoss(), snapshot().getMaxDailyLoss(), source);
        } else if (metrics.tradeCount() != null && metrics.tradeCount() > snapshot().getMaxTradesPerDay()) {
            breach = String.format("Trade count %d exceeds max trades per day %d (%s)",
                    metrics.tradeCount(), snapshot().getMaxTradesPerDay(), source);
        }

        if (breach != null) {
            tripCircuitBreaker(breach);
        }
    }

    // ===== Timers =====

    /**
     * Expire the circuit breaker window and the cooldown. Also called on every read, so expiry
     * is exact even if the scheduler is late.
     */
    @Scheduled(fixedDelay = 1000)
    public void expireTimers() {
        SafetyStatus status = snapshot();
        LocalDateTime now = now();

        if (status.isCircuitBreakerActive() && status.getCircuitBreakerTriggeredAt() != null) {
            Duration window = Duration.ofMinutes(properties.getSafety().getCircuitBreakerResetMinutes());
            if (!now.isBefore(status.getCircuitBreakerTriggeredAt().plus(window))) {
                resetBreaker("Auto-reset after " + window.toMinutes() + " minutes",
                        status.getCircuitBreakerTriggeredAt());
            }
        }
        if (status.isCooldownActive() && status.getCooldownEndsAt() != null
                && !now.isBefore(status.getCooldownEndsAt())) {
            endCooldown();
        }
    }

    /**
     * Daily loss and trade count start from zero each trading day
     */
    @Scheduled(cron = "0 0 0 * * *", zone = "Asia/Taipei")
    public void resetDailyCounters() {
        mutate(s -> {
            s.setCurrentDailyLoss(0.0);
            s.setCurrentTradeCount(0);
        }, false, List.of());
        log.info("🔄 Daily safety counters reset");
    }

    public void startCooldown(String reason, Duration duration) {
        LocalDateTime endsAt = now().plus(duration);
        mutate(s -> {
            s.setCooldownActive(true);
            s.setCooldownReason(reason);
            if (s.getCooldownEndsAt() == null || s.getCooldownEndsAt().isBefore(endsAt)) {
                s.setCooldownEndsAt(endsAt);
            }
        }, true, List.of(new CooldownNotification(true, endsAt, reason, now())));
        log.warn("⏸️ Cooldown started until {}: {}", endsAt, reason);
    }

    // ===== Internals =====

    /**
     * @param expectedTriggeredAt when set, only the trip that started at this time is cleared
     */
    private void resetBreaker(String reason, LocalDateTime expectedTriggeredAt) {
        lock.lock();
        try {
            if (!current.isCircuitBreakerActive()) {
                return;
            }
            if (expectedTriggeredAt != null
                    && !expectedTriggeredAt.equals(current.getCircuitBreakerTriggeredAt())) {
                return;
            }
            apply(s -> {
                s.setCircuitBreakerActive(false);
                s.setCircuitBreakerReason(null);
                s.setCircuitBreakerTriggeredAt(null);
            }, false);
        } finally {
            lock.unlock();
        }
        log.info("✅ Circuit breaker reset: {}", reason);
        eventPublisher.publish(new CircuitBreakerNotification(false, reason, now()));
    }

    private void endCooldown() {
        lock.lock();
        try {
            if (!current.isCooldownActive()) {
                return;
            }
            apply(s -> {
                s.setCooldownActive(false);
                s.setCooldownEndsAt(null);
                s.setCooldownReason(null);
            }, false);
        } finally {
            lock.unlock();
        }
        log.info("▶️ Cooldown ended");
        eventPublisher.publish(new CooldownNotification(false, null, null, now()));
    }

    private void mutate(Consumer<SafetyStatus> change, boolean restrictive,
                        List<ControlPlaneNotification> notifications) {
        lock.lock();
        try {
            apply(change, restrictive);
        } finally {
            lock.unlock();
        }
        notifications.forEach(eventPublisher::publish);
    }

    /**
     * Copy, change, persist, then publish the new snapshot. Caller holds the lock.
     * A restrictive snapshot is published before the write and stays published if it fails.
     */
    private void apply(Consumer<SafetyStatus> change, boolean restrictive) {
        SafetyStatus next = current.toBuilder().build();
        change.accept(next);
        next.setUpdatedAt(now());
        if (!restrictive) {
            current = repository.save(next);
            return;
        }
        current = next;
        try {
            current = repository.save(next);
        } catch (RuntimeException e) {
            log.error("❌ Failed to persist safety status, keeping it in memory: breaker={}, emergencyStop={}, cooldown={}",
                    next.isCircuitBreakerActive(), next.isEmergencyStopActive(), next.isCooldownActive(), e);
        }
    }

    private SafetyStatus snapshot() {
        SafetyStatus status = current;
        if (status == null) {
            throw new IllegalStateException("Safety supervisor not initialized");
        }
        return status;
    }

    private static boolean isUnreadable(Double value) {
        return value != null && (value.isNaN() || value.isInfinite());
    }

    private static String nullToDash(String value) {
        return value == null ? "-" : value;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
