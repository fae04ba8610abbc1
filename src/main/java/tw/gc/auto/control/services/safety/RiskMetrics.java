package tw.gc.auto.control.services.safety;

/**
 * Operational risk readings. A null field was not reported by the source; NaN means the source
 * could not compute it and is treated as a breach.
 */
public record RiskMetrics(Double errorRate, Double latencyP95Ms, Double dailyLoss, Integer tradeCount) {

    public static RiskMetrics operational(double errorRate, double latencyP95Ms) {
        return new RiskMetrics(errorRate, latencyP95Ms, null, null);
    }
}
