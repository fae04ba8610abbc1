package tw.gc.auto.control.services.nudge;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import tw.gc.auto.control.config.ControlPlaneProperties;
import tw.gc.auto.control.events.ControlPlaneEventPublisher;
import tw.gc.auto.control.events.NudgeBreakerNotification;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Breaker local to the nudge engine. Tripping it only zeroes nudges; order flow is governed by
 * the safety supervisor.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NudgeCircuitBreaker {

    private final ControlPlaneProperties properties;
    private final ControlPlaneEventPublisher eventPublisher;
    private final Clock clock;

    private boolean active;
    private LocalDateTime lastTrigger;
    private String reason;
    private double avgLatencyMs;
    private int consecutiveErrors;
    private long triggers;

    public boolean isActive() {
        expire();
        synchronized (this) {
            return active;
        }
    }

    /**
     * Folds a latency sample into the moving average and trips when it exceeds the limit.
     */
    public synchronized void recordLatency(double latencyMs) {
        ControlPlaneProperties.Nudge config = properties.getNudge();
        double alpha = config.getLatencySmoothing();
        avgLatencyMs = (1 - alpha) * avgLatencyMs + alpha * latencyMs;
        consecutiveErrors = 0;
        if (avgLatencyMs > config.getMaxAvgLatencyMs()) {
            trip(String.format("High latency: %.1fms", avgLatencyMs));
        }
    }

    public synchronized void recordError(String message) {
        consecutiveErrors++;
        if (consecutiveErrors >= properties.getNudge().getMaxConsecutiveErrors()) {
            trip("Consecutive errors: " + consecutiveErrors + " (last: " + message + ")");
        }
    }

    public void trip(String tripReason) {
        LocalDateTime now = LocalDateTime.now(clock);
        synchronized (this) {
            if (active) {
                return;
            }
            active = true;
            lastTrigger = now;
            reason = tripReason;
            triggers++;
        }
        log.warn("🔌 Nudge circuit breaker triggered: {}", tripReason);
        eventPublisher.publish(new NudgeBreakerNotification(true, tripReason, now));
    }

    public void reset() {
        resetWith("Manual reset");
    }

    @Scheduled(fixedDelay = 1000)
    public void expire() {
        boolean due;
        synchronized (this) {
            due = active && autoResetDue();
        }
        if (due) {
            resetWith("Auto-reset after " + properties.getNudge().getCircuitBreakerResetMinutes() + " minutes");
        }
    }

    public BreakerStatus status() {
        expire();
        synchronized (this) {
            return snapshot();
        }
    }

    private BreakerStatus snapshot() {
        long remainingMs = 0;
        if (active && lastTrigger != null) {
            Duration elapsed = Duration.between(lastTrigger, LocalDateTime.now(clock));
            remainingMs = Math.max(0, resetAfter().minus(elapsed).toMillis());
        }
        return new BreakerStatus(active, lastTrigger, reason, remainingMs);
    }

    public synchronized double getAvgLatencyMs() {
        return avgLatencyMs;
    }

    public synchronized long getTriggers() {
        return triggers;
    }

    private void resetWith(String resetReason) {
        synchronized (this) {
            if (!active) {
                return;
            }
            active = false;
            lastTrigger = null;
            reason = null;
            consecutiveErrors = 0;
            avgLatencyMs = 0;
        }
        log.info("🔄 Nudge circuit breaker reset: {}", resetReason);
        eventPublisher.publish(new NudgeBreakerNotification(false, resetReason, LocalDateTime.now(clock)));
    }

    private boolean autoResetDue() {
        return lastTrigger != null
                && !LocalDateTime.now(clock).isBefore(lastTrigger.plus(resetAfter()));
    }

    private Duration resetAfter() {
        return Duration.ofMinutes(properties.getNudge().getCircuitBreakerResetMinutes());
    }

    public record BreakerStatus(boolean active, LocalDateTime lastTrigger, String reason, long timeRemainingMs) {
    }
}
