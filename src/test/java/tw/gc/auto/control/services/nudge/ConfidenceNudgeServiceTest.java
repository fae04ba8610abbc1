package tw.gc.auto.control.services.nudge;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import tw.gc.auto.control.config.ControlPlaneProperties;
import tw.gc.auto.control.entities.EventReactionStats;
import tw.gc.auto.control.events.ControlPlaneEventPublisher;
import tw.gc.auto.control.support.MutableClock;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ConfidenceNudgeServiceTest {

    private static final String SECTOR = "semiconductors";

    @Mock
    private EventReactionStatsService reactionStatsService;

    @Mock
    private ControlPlaneEventPublisher eventPublisher;

    private final ControlPlaneProperties properties = new ControlPlaneProperties();
    private NudgeCircuitBreaker breaker;
    private ConfidenceNudgeService nudgeService;

    @BeforeEach
    void setUp() {
        // Timing is covered by NudgeCircuitBreakerTest; keep slow mock warm-up from tripping here
        properties.getNudge().setMaxAvgLatencyMs(10_000);
        breaker = new NudgeCircuitBreaker(properties, eventPublisher, MutableClock.startingAt("2026-03-02T01:00:00Z"));
        nudgeService = new ConfidenceNudgeService(reactionStatsService, breaker, properties);

        when(reactionStatsService.getReactionStats("earnings_beat", SECTOR)).thenReturn(Optional.of(passingStats("earnings_beat")));
        when(reactionStatsService.getReactionStats("guidance_raise", SECTOR)).thenReturn(Optional.of(passingStats("guidance_raise")));
    }

    private static EventReactionStats passingStats(String type) {
        return EventReactionStats.builder()
                .eventType(type)
                .sector(SECTOR)
                .sampleSize5m(250)
                .effectSize5m(0.35)
                .avgReturn5m(0.004)
                .hitRate5m(0.61)
                .orthogonalityScore(0.1)
                .passesValidation(true)
                .last12mThreshold(true)
                .build();
    }

    private static EventSignal validated(String type, double effectZ, double confidence) {
        return EventSignal.builder()
                .type(type)
                .sector(SECTOR)
                .symbol("2330.TW")
                .direction(effectZ >= 0 ? 1 : -1)
                .confidence(confidence)
                .effectZ(effectZ)
                .validated(true)
                .build();
    }

    // ==================== calculateNudge ====================

    @Test
    void calculateNudge_highVix_shouldShrinkEffect() {
        double nudge = nudgeService.calculateNudge(
                List.of(validated("earnings_beat", 0.04, 1.0)), MarketContext.of(30.0), SECTOR, "2330.TW");

        assertThat(nudge).isCloseTo(0.024, within(1e-9));
    }

    @Test
    void calculateNudge_shouldWeightByConfidence() {
        double nudge = nudgeService.calculateNudge(List.of(
                        validated("earnings_beat", 0.04, 0.5),
                        validated("guidance_raise", 0.02, 1.0)),
                MarketContext.of(15.0), SECTOR, "2330.TW");

        assertThat(nudge).isCloseTo(0.04 / 1.5, within(1e-9));
    }

    @Test
    void calculateNudge_shouldNeverExceedCap() {
        double up = nudgeService.calculateNudge(List.of(validated("earnings_beat", 2.5, 1.0)), MarketContext.of(12.0), SECTOR, "X");
        double down = nudgeService.calculateNudge(List.of(validated("earnings_beat", -0.9, 1.0)), MarketContext.of(12.0), SECTOR, "X");

        assertThat(up).isEqualTo(0.05);
        assertThat(down).isEqualTo(-0.05);
    }

    @Test
    void calculateNudge_unvalidatedEvents_shouldBeIgnored() {
        EventSignal raw = validated("earnings_beat", 0.04, 1.0);
        raw.setValidated(false);
        EventSignal noEffect = validated("earnings_beat", 0.04, 1.0);
        noEffect.setEffectZ(null);

        assertThat(nudgeService.calculateNudge(List.of(raw, noEffect), null, SECTOR, "X")).isZero();
        assertThat(nudgeService.calculateNudge(List.of(), null, SECTOR, "X")).isZero();
    }

    @Test
    void calculateNudge_eventTypeWithoutPassingStats_shouldBeSkippedAndCounted() {
        when(reactionStatsService.getReactionStats("rumor", SECTOR)).thenReturn(Optional.empty());
        EventReactionStats failing = passingStats("buyback");
        failing.setPassesValidation(false);
        when(reactionStatsService.getReactionStats("buyback", SECTOR)).thenReturn(Optional.of(failing));

        double nudge = nudgeService.calculateNudge(List.of(
                validated("rumor", 0.03, 1.0),
                validated("buyback", 0.03, 1.0)), null, SECTOR, "X");

        assertThat(nudge).isZero();
        assertThat(nudgeService.getPerformanceStats().validationFailures()).isEqualTo(2);
    }

    @Test
    void calculateNudge_whileBreakerTripped_shouldReturnZero() {
        breaker.trip("test");

        double nudge = nudgeService.calculateNudge(
                List.of(validated("earnings_beat", 0.04, 1.0)), null, SECTOR, "X");

        assertThat(nudge).isZero();
        verify(reactionStatsService, never()).getReactionStats(anyString(), anyString());
    }

    @Test
    void calculateNudge_repeatedInternalFaults_shouldDegradeToZeroAndTrip() {
        when(reactionStatsService.getReactionStats("earnings_beat", SECTOR)).thenThrow(new IllegalStateException("db"));
        List<EventSignal> events = List.of(validated("earnings_beat", 0.04, 1.0));

        for (int i = 0; i < 3; i++) {
            assertThat(nudgeService.calculateNudge(events, null, SECTOR, "X")).isZero();
        }

        assertThat(breaker.isActive()).isTrue();
        assertThat(nudgeService.getPerformanceStats().circuitBreakerTriggers()).isEqualTo(1);
    }

    @Test
    void calculateNudge_nonFiniteInputs_shouldBeSkipped() {
        EventSignal nanConfidence = validated("earnings_beat", 0.04, Double.NaN);
        EventSignal nanEffect = validated("earnings_beat", Double.NaN, 1.0);
        EventSignal infiniteEffect = validated("earnings_beat", Double.POSITIVE_INFINITY, 1.0);

        double nudge = nudgeService.calculateNudge(
                List.of(nanConfidence, nanEffect, infiniteEffect), MarketContext.of(15.0), SECTOR, "2330.TW");

        assertThat(nudge).isEqualTo(0.0);
    }

    @Test
    void calculateNudge_confidenceOutOfRange_shouldBeClampedAndStayWithinCap() {
        double nudge = nudgeService.calculateNudge(List.of(
                        validated("earnings_beat", 0.04, 7.0),
                        validated("guidance_raise", 0.02, -3.0)),
                MarketContext.of(15.0), SECTOR, "2330.TW");

        assertThat(nudge).isCloseTo(0.04, within(1e-9));
    }

    // ==================== Regime shrink ====================

    @Test
    void calculateRegimeShrink_calmMarket_shouldBeOne() {
        assertThat(nudgeService.calculateRegimeShrink(MarketContext.of(18.0))).isEqualTo(1.0);
        assertThat(nudgeService.calculateRegimeShrink(null)).isEqualTo(1.0);
    }

    @Test
    void calculateRegimeShrink_wideSpreadAndStrongTrend_shouldCompound() {
        MarketContext context = new MarketContext(null, 0.6, 2.5, "trending", null);

        assertThat(nudgeService.calculateRegimeShrink(context)).isCloseTo(0.56, within(1e-9));
    }

    @Test
    void calculateRegimeShrink_shouldBeFlooredAtHalf() {
        MarketContext stressed = new MarketContext(45.0, 0.9, 3.0, "crisis", 0.6);

        assertThat(nudgeService.calculateRegimeShrink(stressed)).isEqualTo(0.5);
    }

    // ==================== validateEvent ====================

    @Test
    void validateEvent_passingStats_shouldPopulateEvent() {
        EventSignal event = EventSignal.builder().type("earnings_beat").confidence(0.8).direction(1).build();

        boolean valid = nudgeService.validateEvent(event, SECTOR);

        assertThat(valid).isTrue();
        assertThat(event.isValidated()).isTrue();
        assertThat(event.getEffectZ()).isEqualTo(0.35);
        assertThat(event.getExpectedReturn5m()).isEqualTo(0.004);
        assertThat(event.getHitRate()).isEqualTo(0.61);
    }

    @Test
    void validateEvent_smallSample_shouldFail() {
        EventReactionStats thin = passingStats("thin");
        thin.setSampleSize5m(99);
        when(reactionStatsService.getReactionStats("thin", SECTOR)).thenReturn(Optional.of(thin));
        EventSignal event = EventSignal.builder().type("thin").build();

        assertThat(nudgeService.validateEvent(event, SECTOR)).isFalse();
        assertThat(event.isValidated()).isFalse();
        assertThat(event.getEffectZ()).isNull();
    }

    @Test
    void validateEvent_correlatedWithPricedFactors_shouldFail() {
        EventReactionStats correlated = passingStats("correlated");
        correlated.setOrthogonalityScore(-0.45);
        when(reactionStatsService.getReactionStats("correlated", SECTOR)).thenReturn(Optional.of(correlated));

        assertThat(nudgeService.validateEvent(EventSignal.builder().type("correlated").build(), SECTOR)).isFalse();
    }

    @Test
    void validateEvent_unmeasuredOrthogonality_shouldNotBlock() {
        EventReactionStats unmeasured = passingStats("unmeasured");
        unmeasured.setOrthogonalityScore(null);
        when(reactionStatsService.getReactionStats("unmeasured", SECTOR)).thenReturn(Optional.of(unmeasured));

        assertThat(nudgeService.validateEvent(EventSignal.builder().type("unmeasured").build(), SECTOR)).isTrue();
    }

    @Test
    void validateEvent_staleEffect_shouldFail() {
        EventReactionStats stale = passingStats("stale");
        stale.setLast12mThreshold(false);
        when(reactionStatsService.getReactionStats("stale", SECTOR)).thenReturn(Optional.of(stale));

        assertThat(nudgeService.validateEvent(EventSignal.builder().type("stale").build(), SECTOR)).isFalse();
    }

    // ==================== Explanation and stats ====================

    @Test
    void explainNudge_negligibleNudge_shouldSayNoValidatedEvents() {
        NudgeExplanation explanation = nudgeService.explainNudge(0.0005, List.of(), MarketContext.of(25.0));

        assertThat(explanation.reason()).isEqualTo("No validated news events");
        assertThat(explanation.nudgeBasisPoints()).isZero();
        assertThat(explanation.factors()).isEmpty();
    }

    @Test
    void explainNudge_shouldDescribeContributingEvents() {
        EventSignal event = validated("earnings_beat", 0.04, 0.9);
        event.setExpectedReturn5m(0.003);

        NudgeExplanation explanation = nudgeService.explainNudge(0.024, List.of(event), MarketContext.of(30.0));

        assertThat(explanation.reason()).isEqualTo("Positive news reaction expected");
        assertThat(explanation.nudgeBasisPoints()).isEqualTo(2.4);
        assertThat(explanation.confidence()).isCloseTo(0.48, within(1e-9));
        assertThat(explanation.regimeShrink()).isCloseTo(0.6, within(1e-9));
        assertThat(explanation.vixLevel()).isEqualTo(30.0);
        assertThat(explanation.factors()).singleElement()
                .satisfies(f -> {
                    assertThat(f.eventType()).isEqualTo("earnings_beat");
                    assertThat(f.direction()).isEqualTo("positive");
                    assertThat(f.expectedReturn()).isEqualTo(0.003);
                });
    }

    @Test
    void getPerformanceStats_shouldCountAppliedNudges() {
        when(reactionStatsService.getValidatedEventTypes()).thenReturn(List.of(passingStats("earnings_beat")));
        nudgeService.calculateNudge(List.of(validated("earnings_beat", 0.04, 1.0)), null, SECTOR, "X");
        nudgeService.calculateNudge(List.of(), null, SECTOR, "X");

        ConfidenceNudgeService.NudgePerformanceStats stats = nudgeService.getPerformanceStats();

        assertThat(stats.nudgesApplied()).isEqualTo(1);
        assertThat(stats.validatedEventTypes()).isEqualTo(1);
        assertThat(stats.circuitBreaker().active()).isFalse();
    }

    @Test
    void resetCircuitBreaker_shouldReactivateNudges() {
        breaker.trip("test");

        NudgeCircuitBreaker.BreakerStatus status = nudgeService.resetCircuitBreaker();

        assertThat(status.active()).isFalse();
        assertThat(nudgeService.calculateNudge(List.of(validated("earnings_beat", 0.04, 1.0)), null, SECTOR, "X"))
                .isEqualTo(0.04);
    }
}
