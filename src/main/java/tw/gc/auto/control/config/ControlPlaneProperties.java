package tw.gc.auto.control.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import tw.gc.auto.control.enums.RiskLevel;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Tunable thresholds for the promotion, capital, safety and nudge components.
 * <p>
 * The consistency weights and regime-shrink coefficients are uncalibrated heuristics.
 */
@Data
@Component
@ConfigurationProperties(prefix = "control")
public class ControlPlaneProperties {

    private Promotion promotion = new Promotion();
    private Capital capital = new Capital();
    private Safety safety = new Safety();
    private Nudge nudge = new Nudge();
    private Evolution evolution = new Evolution();

    @Data
    public static class Promotion {
        /** Pool that funds newly promoted strategies */
        private String deploymentPoolId = "competition_pool";
        private Map<RiskLevel, BigDecimal> deploymentAmount = new EnumMap<>(Map.of(
                RiskLevel.LOW, new BigDecimal("1000"),
                RiskLevel.MEDIUM, new BigDecimal("2500"),
                RiskLevel.HIGH, new BigDecimal("5000")));
        private long sweepIntervalMs = 3_600_000L;
        private boolean seedDefaultPipelines = true;
        private Consistency consistency = new Consistency();
        private Scoring scoring = new Scoring();
    }

    @Data
    public static class Consistency {
        private double winRateWeight = 0.4;
        private double profitFactorWeight = 0.3;
        private double sharpeWeight = 0.3;
        /** Profit factor at which its component saturates */
        private double profitFactorNorm = 2.0;
        /** Sharpe ratio at which its component saturates */
        private double sharpeNorm = 3.0;
    }

    @Data
    public static class Scoring {
        private double pnlWeight = 0.4;
        private double pnlNorm = 1000.0;
        private double winRateWeight = 0.4;
        private double drawdownWeight = 0.2;
        private double drawdownNorm = 0.15;
        private double strongProfit = 500.0;
        private double highWinRate = 0.7;
        private double lowDrawdown = 0.05;
    }

    @Data
    public static class Capital {
        private Map<RiskLevel, BigDecimal> maxPerExperiment = new EnumMap<>(Map.of(
                RiskLevel.LOW, new BigDecimal("1000"),
                RiskLevel.MEDIUM, new BigDecimal("2500"),
                RiskLevel.HIGH, new BigDecimal("5000")));
        private int maxConcurrentExperiments = 5;
        /** Fraction of pool capital lost by active allocations that forces a pool-wide release */
        private double emergencyStopLoss = 0.20;
        private boolean seedDefaultPools = true;
    }

    @Data
    public static class Safety {
        private double maxDailyLoss = 1500.0;
        private int maxTradesPerDay = 50;
        private double maxErrorRate = 0.05;
        private double maxLatencyP95Ms = 8.0;
        private long circuitBreakerResetMinutes = 5;
        private long cooldownSeconds = 300;
        private long monitorIntervalMs = 10_000L;
    }

    @Data
    public static class Nudge {
        private double confidenceCap = 0.05;
        private double effectSizeCap = 0.6;
        private double vixShrinkThreshold = 20.0;
        private double vixShrinkPerPoint = 0.04;
        private double minRegimeShrink = 0.5;
        private double wideSpreadPercent = 0.5;
        private double wideSpreadShrink = 0.8;
        private double strongTrendStrength = 2.0;
        private double strongTrendShrink = 0.7;
        private int minSampleSize = 100;
        private double minEffectSize = 0.2;
        private double maxOrthogonality = 0.3;
        private double maxAvgLatencyMs = 8.0;
        private double latencySmoothing = 0.1;
        private int maxConsecutiveErrors = 3;
        private long circuitBreakerResetMinutes = 5;
    }

    @Data
    public static class Evolution {
        private String baseUrl = "http://localhost:8890";
        private int connectTimeoutMs = 3000;
        /** Upper bound on a single validation call; the run itself is bounded by the validation period */
        private int readTimeoutMs = 120_000;
    }
}
