package tw.gc.auto.control.services.safety;

/**
 * Supplies risk readings to the {@link SafetyMonitor}. Throwing is a valid answer and trips the
 * circuit breaker.
 */
public interface RiskMetricsSource {

    String name();

    RiskMetrics currentMetrics();
}
