package tw.gc.auto.control.repositories;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;
import tw.gc.auto.control.entities.CapitalAllocation;
import tw.gc.auto.control.entities.CapitalPool;
import tw.gc.auto.control.entities.CapitalTransaction;
import tw.gc.auto.control.entities.DecisionTrace;
import tw.gc.auto.control.entities.EventReactionStats;
import tw.gc.auto.control.entities.NewsEvidence;
import tw.gc.auto.control.entities.PipelineMembership;
import tw.gc.auto.control.entities.PromotionCriteria;
import tw.gc.auto.control.entities.PromotionPipeline;
import tw.gc.auto.control.entities.RiskGateOutcome;
import tw.gc.auto.control.entities.TradePlan;
import tw.gc.auto.control.entities.ValidationResult;
import tw.gc.auto.control.enums.AllocationStatus;
import tw.gc.auto.control.enums.PipelineStage;
import tw.gc.auto.control.enums.PoolPurpose;
import tw.gc.auto.control.enums.RiskLevel;
import tw.gc.auto.control.enums.TradeAction;
import tw.gc.auto.control.enums.TransactionType;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@ActiveProfiles("test")
class RepositoryTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2026, 3, 2, 9, 0);

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private CapitalPoolRepository poolRepository;

    @Autowired
    private CapitalAllocationRepository allocationRepository;

    @Autowired
    private CapitalTransactionRepository transactionRepository;

    @Autowired
    private PromotionPipelineRepository pipelineRepository;

    @Autowired
    private PipelineMembershipRepository membershipRepository;

    @Autowired
    private ValidationResultRepository validationResultRepository;

    @Autowired
    private DecisionTraceRepository traceRepository;

    @Autowired
    private EventReactionStatsRepository reactionStatsRepository;

    private CapitalPool pool(String id) {
        return CapitalPool.builder()
                .id(id)
                .name(id)
                .purpose(PoolPurpose.RESEARCH)
                .riskLevel(RiskLevel.MEDIUM)
                .totalCapital(new BigDecimal("10000"))
                .maxDrawdown(0.15)
                .build();
    }

    @Test
    void testCapitalPoolFindByIdForUpdate() {
        entityManager.persist(pool("research_pool"));
        entityManager.flush();
        entityManager.clear();

        CapitalPool found = poolRepository.findByIdForUpdate("research_pool").orElseThrow();
        assertEquals(0, new BigDecimal("10000").compareTo(found.getTotalCapital()));
        assertTrue(poolRepository.findByIdForUpdate("missing").isEmpty());
    }

    @Test
    void testAllocationCountByPoolAndStatus() {
        entityManager.persist(pool("research_pool"));
        for (int i = 0; i < 3; i++) {
            entityManager.persist(CapitalAllocation.builder()
                    .poolId("research_pool")
                    .experimentId("exp-" + i)
                    .amount(new BigDecimal("500"))
                    .riskLevel(RiskLevel.LOW)
                    .status(i == 0 ? AllocationStatus.RELEASED : AllocationStatus.ACTIVE)
                    .allocatedAt(T0)
                    .build());
        }
        entityManager.flush();

        assertEquals(2, allocationRepository.countByPoolIdAndStatus("research_pool", AllocationStatus.ACTIVE));
        assertEquals(1, allocationRepository.findByPoolIdAndStatus("research_pool", AllocationStatus.RELEASED).size());
        assertEquals(3, allocationRepository.findByPoolId("research_pool").size());
    }

    @Test
    void testTransactionsNewestFirst() {
        for (TransactionType type : List.of(TransactionType.POOL_INIT, TransactionType.ALLOCATION, TransactionType.RELEASE)) {
            entityManager.persist(CapitalTransaction.builder()
                    .type(type)
                    .poolId("research_pool")
                    .amount(new BigDecimal("100"))
                    .description(type.name())
                    .timestamp(T0)
                    .build());
        }
        entityManager.flush();

        List<CapitalTransaction> latest = transactionRepository.findByPoolIdOrderByIdDesc("research_pool", PageRequest.of(0, 2));
        assertEquals(2, latest.size());
        assertEquals(TransactionType.RELEASE, latest.get(0).getType());
        assertEquals(TransactionType.ALLOCATION, latest.get(1).getType());
    }

    @Test
    void testPipelineMembershipStages() {
        entityManager.persist(PromotionPipeline.builder()
                .id("conservative_promotion")
                .name("Conservative Promotion")
                .criteria(new PromotionCriteria(10, 2.0, 0.55, 0.15, 100, 0.7, 7))
                .createdAt(T0)
                .build());
        entityManager.persist(PipelineMembership.builder()
                .pipelineId("conservative_promotion").candidateId("b").enteredAt(T0.plusHours(1)).build());
        entityManager.persist(PipelineMembership.builder()
                .pipelineId("conservative_promotion").candidateId("a").enteredAt(T0).build());
        entityManager.persist(PipelineMembership.builder()
                .pipelineId("conservative_promotion").candidateId("c").stage(PipelineStage.PROMOTED).enteredAt(T0).build());
        entityManager.flush();

        List<PipelineMembership> pending = membershipRepository
                .findByPipelineIdAndStageOrderByEnteredAtAsc("conservative_promotion", PipelineStage.PENDING);
        assertEquals(List.of("a", "b"), pending.stream().map(PipelineMembership::getCandidateId).toList());
        assertTrue(membershipRepository.existsByPipelineIdAndCandidateId("conservative_promotion", "c"));
        assertEquals(1, membershipRepository.countByStage(PipelineStage.PROMOTED));
        assertEquals(1, pipelineRepository.findByActiveTrue().size());
    }

    @Test
    void testValidationResultFeedbackOrderIsKept() {
        entityManager.persist(ValidationResult.builder()
                .candidateId("evo-1")
                .pipelineId("conservative_promotion")
                .passed(false)
                .score(0.2)
                .validationPeriod(7)
                .feedback(new ArrayList<>(List.of("Failed validation criteria", "Excessive drawdown")))
                .validatedAt(T0)
                .build());
        entityManager.flush();
        entityManager.clear();

        ValidationResult found = validationResultRepository
                .findFirstByCandidateIdAndPipelineIdOrderByValidatedAtDesc("evo-1", "conservative_promotion")
                .orElseThrow();
        assertEquals(List.of("Failed validation criteria", "Excessive drawdown"), found.getFeedback());
    }

    @Test
    void testDecisionTraceBySymbolNewestFirst() {
        for (int i = 0; i < 3; i++) {
            entityManager.persist(DecisionTrace.builder()
                    .traceId("t-" + i)
                    .symbol(i < 2 ? "2330.TW" : "2454.TW")
                    .asOf(T0.plusMinutes(i))
                    .plan(TradePlan.builder().action(TradeAction.BUY).qty(1).build())
                    .riskGate(new RiskGateOutcome(true, true, true))
                    .newsEvidence(new ArrayList<>(List.of(NewsEvidence.builder().eventType("earnings_beat").confidence(0.8).build())))
                    .build());
        }
        entityManager.flush();
        entityManager.clear();

        List<DecisionTrace> traces = traceRepository.findBySymbolOrderByAsOfDesc("2330.TW", PageRequest.of(0, 10));
        assertEquals(List.of("t-1", "t-0"), traces.stream().map(DecisionTrace::getTraceId).toList());
        assertEquals("earnings_beat", traces.get(0).getNewsEvidence().get(0).getEventType());
        assertEquals(1, traceRepository.findAllByOrderByAsOfDesc(PageRequest.of(0, 1)).size());
    }

    @Test
    void testReactionStatsLookup() {
        entityManager.persist(EventReactionStats.builder()
                .eventType("earnings_beat").sector("semiconductors")
                .sampleSize5m(240).effectSize5m(0.4).passesValidation(true).last12mThreshold(true)
                .build());
        entityManager.persist(EventReactionStats.builder()
                .eventType("rumor").sector("semiconductors")
                .sampleSize5m(30).effectSize5m(0.1).passesValidation(false).last12mThreshold(false)
                .build());
        entityManager.flush();

        assertTrue(reactionStatsRepository.findByEventTypeAndSector("earnings_beat", "semiconductors").isPresent());
        assertTrue(reactionStatsRepository.findByEventTypeAndSector("earnings_beat", "banks").isEmpty());
        assertEquals(1, reactionStatsRepository.findByPassesValidationTrue().size());
    }
}
