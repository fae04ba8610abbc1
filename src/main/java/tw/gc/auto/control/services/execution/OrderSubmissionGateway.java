package tw.gc.auto.control.services.execution;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import tw.gc.auto.control.config.ControlPlaneProperties;
import tw.gc.auto.control.enums.TradeAction;
import tw.gc.auto.control.enums.TradingMode;
import tw.gc.auto.control.events.CircuitBreakerNotification;
import tw.gc.auto.control.services.safety.OrderGateDecision;
import tw.gc.auto.control.services.safety.OrderIntent;
import tw.gc.auto.control.services.safety.RiskMetrics;
import tw.gc.auto.control.services.safety.RiskMetricsSource;
import tw.gc.auto.control.services.safety.SafetySupervisorService;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Single path from the strategy side to a broker. Every order is checked against the safety
 * supervisor at submission time, so a halt takes effect for the very next order.
 * <p>
 * Also reports its own broker error rate and p95 latency to the safety monitor. Only broker
 * faults count as errors; a broker rejecting an order is a business outcome. Samples age out
 * after the circuit breaker window and are dropped when the breaker resets.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OrderSubmissionGateway implements RiskMetricsSource {

    static final int METRICS_WINDOW = 100;

    private final SafetySupervisorService safetySupervisor;
    private final List<BrokerAdapter> brokerAdapters;
    private final ControlPlaneProperties properties;
    private final Clock clock;

    private final Deque<Sample> samples = new ArrayDeque<>();

    public OrderSubmissionResult submit(OrderRequest request) {
        if (request.action() == TradeAction.HOLD) {
            return OrderSubmissionResult.blocked("HOLD requires no order");
        }

        OrderIntent intent = request.entry()
                ? OrderIntent.entry(request.symbol())
                : OrderIntent.exit(request.symbol());
        OrderGateDecision decision = safetySupervisor.checkOrder(intent);
        if (!decision.permitted()) {
            log.warn("🚫 Order blocked: {} {} x{} | {}",
                    request.action(), request.symbol(), request.quantity(), decision.blockReason());
            return OrderSubmissionResult.blocked(decision.blockReason());
        }

        TradingMode mode = safetySupervisor.getStatus().getTradingMode();
        BrokerAdapter adapter = brokerAdapters.stream()
                .filter(a -> a.supports(mode))
                .findFirst()
                .orElse(null);
        if (adapter == null) {
            log.error("❌ No broker adapter for {} mode", mode);
            record(0, true);
            return OrderSubmissionResult.failed("No broker adapter for " + mode + " mode");
        }

        long start = System.nanoTime();
        OrderSubmissionResult result;
        try {
            result = adapter.submit(request);
        } catch (RuntimeException e) {
            log.error("❌ Broker submission failed for {}", request.symbol(), e);
            record(elapsedMs(start), true);
            return OrderSubmissionResult.failed("Broker error: " + e.getMessage());
        }
        record(elapsedMs(start), false);

        if (result.reason() == null) {
            safetySupervisor.recordTrade();
            log.info("✅ Order submitted: {} {} x{} → {}",
                    request.action(), request.symbol(), request.quantity(), result.brokerOrderIds());
        } else {
            log.warn("⚠️ Broker rejected {} {}: {}", request.action(), request.symbol(), result.reason());
        }
        return result;
    }

    @Override
    public String name() {
        return "order-gateway";
    }

    @Override
    public synchronized RiskMetrics currentMetrics() {
        evictExpired();
        if (samples.isEmpty()) {
            return RiskMetrics.operational(0.0, 0.0);
        }
        long errors = samples.stream().filter(Sample::error).count();
        double[] latencies = samples.stream().mapToDouble(Sample::latencyMs).toArray();
        Arrays.sort(latencies);
        int index = (int) Math.ceil(0.95 * latencies.length) - 1;
        double p95 = latencies[Math.max(index, 0)];
        return RiskMetrics.operational((double) errors / samples.size(), p95);
    }

    @EventListener
    public synchronized void onCircuitBreaker(CircuitBreakerNotification notification) {
        if (!notification.tripped()) {
            samples.clear();
            log.info("🔄 Order gateway metrics window cleared after breaker reset");
        }
    }

    private synchronized void record(double latencyMs, boolean error) {
        samples.addLast(new Sample(LocalDateTime.now(clock), latencyMs, error));
        while (samples.size() > METRICS_WINDOW) {
            samples.removeFirst();
        }
    }

    private void evictExpired() {
        Duration window = Duration.ofMinutes(properties.getSafety().getCircuitBreakerResetMinutes());
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(window);
        while (!samples.isEmpty() && !samples.peekFirst().recordedAt().isAfter(cutoff)) {
            samples.removeFirst();
        }
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private record Sample(LocalDateTime recordedAt, double latencyMs, boolean error) {
    }
}
