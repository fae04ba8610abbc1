package tw.gc.auto.control.services.safety;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Polls every registered {@link RiskMetricsSource} and hands the readings to the supervisor.
 * A source that cannot be read trips the circuit breaker.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SafetyMonitor {

    private final SafetySupervisorService safetySupervisor;
    private final List<RiskMetricsSource> sources;

    @Scheduled(fixedDelayString = "${control.safety.monitor-interval-ms:10000}")
    public void monitorRiskMetrics() {
        for (RiskMetricsSource source : sources) {
            RiskMetrics metrics;
            try {
                metrics = source.currentMetrics();
            } catch (Exception e) {
                log.error("❌ Failed to read risk metrics from {}", source.name(), e);
                safetySupervisor.tripCircuitBreaker(
                        "Risk metric unavailable from " + source.name() + ": " + e.getMessage());
                continue;
            }
            safetySupervisor.evaluateRiskMetrics(source.name(), metrics);
        }
    }
}
