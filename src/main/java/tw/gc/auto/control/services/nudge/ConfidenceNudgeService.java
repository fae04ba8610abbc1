package tw.gc.auto.control.services.nudge;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.auto.control.config.ControlPlaneProperties;
import tw.gc.auto.control.entities.EventReactionStats;
import tw.gc.auto.control.exceptions.NudgeEngineDegradedException;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns validated news events into a small, capped adjustment of a trade plan's confidence.
 * <p>
 * The engine is advisory: every internal fault yields a zero nudge and counts against its own
 * breaker, and nothing here can block an order.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConfidenceNudgeService {

    private final EventReactionStatsService reactionStatsService;
    private final NudgeCircuitBreaker circuitBreaker;
    private final ControlPlaneProperties properties;

    private final AtomicLong nudgesApplied = new AtomicLong();
    private final AtomicLong validationFailures = new AtomicLong();

    /**
     * @return confidence adjustment in [-cap, +cap]; 0 when nothing validated applies
     */
    public double calculateNudge(List<EventSignal> events, MarketContext marketContext, String sector, String symbol) {
        long start = System.nanoTime();
        try {
            if (circuitBreaker.isActive()) {
                log.debug("🔌 Nudge circuit breaker active - returning 0 for {}", symbol);
                return 0.0;
            }
            double nudge = computeNudge(events, marketContext, sector);
            circuitBreaker.recordLatency((System.nanoTime() - start) / 1_000_000.0);
            if (nudge != 0.0) {
                nudgesApplied.incrementAndGet();
            }
            return nudge;
        } catch (RuntimeException e) {
            NudgeEngineDegradedException degraded =
                    new NudgeEngineDegradedException("Nudge calculation failed for " + symbol, e);
            log.error("❌ {} [{}]", degraded.getMessage(), degraded.getErrorCode(), e);
            circuitBreaker.recordError(e.getMessage());
            return 0.0;
        }
    }

    private double computeNudge(List<EventSignal> events, MarketContext marketContext, String sector) {
        if (events == null || events.isEmpty()) {
            return 0.0;
        }
        ControlPlaneProperties.Nudge config = properties.getNudge();
        double effectCap = config.getEffectSizeCap();

        double totalEffect = 0.0;
        double totalConfidence = 0.0;
        for (EventSignal event : events) {
            if (!event.isValidated() || event.getEffectZ() == null
                    || !Double.isFinite(event.getEffectZ()) || !Double.isFinite(event.getConfidence())) {
                continue;
            }
            Optional<EventReactionStats> stats = reactionStatsService.getReactionStats(event.getType(), sector);
            if (stats.isEmpty() || !stats.get().isPassesValidation()) {
                validationFailures.incrementAndGet();
                continue;
            }
            double cappedEffect = Math.max(-effectCap, Math.min(effectCap, event.getEffectZ()));
            double confidence = Math.max(0.0, Math.min(1.0, event.getConfidence()));
            totalEffect += cappedEffect * confidence;
            totalConfidence += confidence;
        }

        if (totalConfidence == 0.0) {
            return 0.0;
        }
        double nudge = (totalEffect / totalConfidence) * calculateRegimeShrink(marketContext);
        if (!Double.isFinite(nudge)) {
            return 0.0;
        }
        double cap = config.getConfidenceCap();
        return Math.max(-cap, Math.min(cap, nudge));
    }

    /**
     * Reduces news influence in volatile, illiquid or strongly trending markets.
     */
    public double calculateRegimeShrink(MarketContext marketContext) {
        ControlPlaneProperties.Nudge config = properties.getNudge();
        double shrink = 1.0;
        if (marketContext == null) {
            return shrink;
        }

        Double vix = marketContext.vix();
        if (vix != null && vix > config.getVixShrinkThreshold()) {
            double excess = vix - config.getVixShrinkThreshold();
            shrink *= Math.max(config.getMinRegimeShrink(), 1 - excess * config.getVixShrinkPerPoint());
        }
        Double spread = marketContext.spreadPercent();
        if (spread != null && spread > config.getWideSpreadPercent()) {
            shrink *= config.getWideSpreadShrink();
        }
        Double trend = marketContext.trendStrength();
        if (trend != null && trend > config.getStrongTrendStrength()) {
            shrink *= config.getStrongTrendShrink();
        }
        return Math.max(config.getMinRegimeShrink(), shrink);
    }

    /**
     * Checks the event's type against its historical reaction statistics and, when it passes,
     * copies the measured effect onto the event.
     */
    public boolean validateEvent(EventSignal event, String sector) {
        try {
            Optional<EventReactionStats> found = reactionStatsService.getReactionStats(event.getType(), sector);
            if (found.isEmpty()) {
                return false;
            }
            EventReactionStats stats = found.get();
            ControlPlaneProperties.Nudge config = properties.getNudge();

            boolean orthogonal = stats.getOrthogonalityScore() == null
                    || Math.abs(stats.getOrthogonalityScore()) <= config.getMaxOrthogonality();
            boolean passes = stats.isPassesValidation()
                    && stats.isLast12mThreshold()
                    && stats.getSampleSize5m() >= config.getMinSampleSize()
                    && Math.abs(stats.getEffectSize5m()) >= config.getMinEffectSize()
                    && orthogonal;

            if (passes) {
                event.setEffectZ(stats.getEffectSize5m());
                event.setExpectedReturn5m(stats.getAvgReturn5m());
                event.setHitRate(stats.getHitRate5m());
                event.setValidated(true);
            }
            return passes;
        } catch (RuntimeException e) {
            log.error("❌ Event validation error for {} / {}", event.getType(), sector, e);
            return false;
        }
    }

    public NudgeExplanation explainNudge(double nudge, List<EventSignal> events, MarketContext marketContext) {
        boolean breakerActive = circuitBreaker.isActive();
        if (Math.abs(nudge) < 0.001) {
            return NudgeExplanation.none(breakerActive);
        }

        List<NudgeExplanation.Factor> factors = events.stream()
                .filter(EventSignal::isValidated)
                .map(e -> new NudgeExplanation.Factor(
                        e.getType(),
                        e.getDirection() > 0 ? "positive" : "negative",
                        e.getConfidence(),
                        e.getEffectZ(),
                        e.getExpectedReturn5m(),
                        e.getHitRate()))
                .toList();

        return new NudgeExplanation(
                Math.round(nudge * 10000) / 100.0,
                nudge > 0 ? "Positive news reaction expected" : "Negative news reaction expected",
                Math.abs(nudge) / properties.getNudge().getConfidenceCap(),
                factors,
                calculateRegimeShrink(marketContext),
                marketContext != null ? marketContext.vix() : null,
                breakerActive);
    }

    public NudgePerformanceStats getPerformanceStats() {
        List<EventReactionStats> validated = reactionStatsService.getValidatedEventTypes();
        return new NudgePerformanceStats(
                nudgesApplied.get(),
                circuitBreaker.getAvgLatencyMs(),
                circuitBreaker.getTriggers(),
                validationFailures.get(),
                validated.size(),
                circuitBreaker.status());
    }

    public NudgeCircuitBreaker.BreakerStatus resetCircuitBreaker() {
        circuitBreaker.reset();
        return circuitBreaker.status();
    }

    public record NudgePerformanceStats(
            long nudgesApplied,
            double avgLatencyMs,
            long circuitBreakerTriggers,
            long validationFailures,
            int validatedEventTypes,
            NudgeCircuitBreaker.BreakerStatus circuitBreaker
    ) {
    }
}
