package tw.gc.auto.control.services.promotion;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import tw.gc.auto.control.config.ControlPlaneProperties;
import tw.gc.auto.control.entities.CapitalAllocation;
import tw.gc.auto.control.entities.PerformanceSnapshot;
import tw.gc.auto.control.entities.PipelineMembership;
import tw.gc.auto.control.entities.PromotionCriteria;
import tw.gc.auto.control.entities.PromotionPipeline;
import tw.gc.auto.control.entities.StrategyCandidate;
import tw.gc.auto.control.entities.ValidationResult;
import tw.gc.auto.control.enums.PipelineStage;
import tw.gc.auto.control.events.ControlPlaneEventPublisher;
import tw.gc.auto.control.events.PromotionNotification;
import tw.gc.auto.control.exceptions.DeploymentFailureException;
import tw.gc.auto.control.exceptions.EntityNotFoundException;
import tw.gc.auto.control.exceptions.ValidationFailedException;
import tw.gc.auto.control.repositories.PipelineMembershipRepository;
import tw.gc.auto.control.repositories.PromotionPipelineRepository;
import tw.gc.auto.control.repositories.StrategyCandidateRepository;
import tw.gc.auto.control.repositories.ValidationResultRepository;
import tw.gc.auto.control.services.capital.CapitalLedgerService;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Moves evolved strategies from the research side into funded competition.
 * <p>
 * A candidate joins every active pipeline whose criteria it meets. Once it has waited the
 * pipeline's validation period it is validated, and on success funded from the deployment pool
 * and registered with the execution system. Decisions on one pipeline are serialised so a manual
 * promotion and the scheduled sweep cannot decide the same membership twice.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PromotionPipelineService {

    static final String CONSERVATIVE = "conservative_promotion";
    static final String AGGRESSIVE = "aggressive_promotion";
    static final String HIGH_FREQUENCY = "high_freq_promotion";

    private final StrategyCandidateRepository candidateRepository;
    private final PromotionPipelineRepository pipelineRepository;
    private final PipelineMembershipRepository membershipRepository;
    private final ValidationResultRepository validationResultRepository;
    private final CapitalLedgerService capitalLedger;
    private final ValidationRunner validationRunner;
    private final StrategyRegistrar strategyRegistrar;
    private final ControlPlaneEventPublisher eventPublisher;
    private final ControlPlaneProperties properties;
    private final Clock clock;

    private final Map<String, ReentrantLock> pipelineLocks = new ConcurrentHashMap<>();

    @PostConstruct
    public void initialize() {
        if (properties.getPromotion().isSeedDefaultPipelines()) {
            ensureDefaultPipelines();
        }
    }

    public void ensureDefaultPipelines() {
        createPipelineIfAbsent(CONSERVATIVE, "Conservative Promotion",
                new PromotionCriteria(10, 2.0, 0.55, 0.15, 100, 0.7, 7), true);
        createPipelineIfAbsent(AGGRESSIVE, "Aggressive Promotion",
                new PromotionCriteria(5, 1.5, 0.60, 0.20, 50, 0.6, 3), true);
        createPipelineIfAbsent(HIGH_FREQUENCY, "High-Frequency Promotion",
                new PromotionCriteria(3, 1.2, 0.65, 0.10, 200, 0.8, 1), false);
    }

    private void createPipelineIfAbsent(String id, String name, PromotionCriteria criteria, boolean active) {
        if (pipelineRepository.existsById(id)) {
            return;
        }
        createPipeline(PromotionPipeline.builder()
                .id(id)
                .name(name)
                .criteria(criteria)
                .active(active)
                .build());
    }

    public PromotionPipeline createPipeline(PromotionPipeline pipeline) {
        if (pipeline.getId() == null || pipeline.getCriteria() == null) {
            throw new IllegalArgumentException("Pipeline id and criteria are required");
        }
        if (pipelineRepository.existsById(pipeline.getId())) {
            throw new IllegalArgumentException("Pipeline already exists: " + pipeline.getId());
        }
        pipeline.setCreatedAt(LocalDateTime.now(clock));
        PromotionPipeline saved = pipelineRepository.save(pipeline);
        log.info("🪜 Pipeline created: {} (active={})", saved.getId(), saved.isActive());
        return saved;
    }

    public PromotionPipeline setPipelineActive(String pipelineId, boolean active) {
        PromotionPipeline pipeline = findPipeline(pipelineId);
        pipeline.setActive(active);
        log.info("🪜 Pipeline {} {}", pipelineId, active ? "activated" : "deactivated");
        return pipelineRepository.save(pipeline);
    }

    /**
     * Stores the candidate and enters it into every active pipeline it qualifies for.
     *
     * @return ids of the pipelines the candidate joined on this call
     */
    public List<String> addCandidate(StrategyCandidate submitted) {
        if (submitted == null || submitted.getId() == null) {
            throw new IllegalArgumentException("Candidate id is required");
        }
        StrategyCandidate candidate = candidateRepository.findById(submitted.getId())
                .orElseGet(() -> {
                    submitted.setCreatedAt(LocalDateTime.now(clock));
                    return candidateRepository.save(submitted);
                });

        List<String> joined = new ArrayList<>();
        for (PromotionPipeline pipeline : pipelineRepository.findByActiveTrue()) {
            if (!evaluateCandidate(candidate, pipeline.getCriteria())) {
                continue;
            }
            boolean added = withPipelineLock(pipeline.getId(), () -> {
                if (membershipRepository.existsByPipelineIdAndCandidateId(pipeline.getId(), candidate.getId())) {
                    return false;
                }
                membershipRepository.save(PipelineMembership.builder()
                        .pipelineId(pipeline.getId())
                        .candidateId(candidate.getId())
                        .stage(PipelineStage.PENDING)
                        .enteredAt(LocalDateTime.now(clock))
                        .build());
                return true;
            });
            if (added) {
                joined.add(pipeline.getId());
                log.info("📥 Candidate {} ({}) entered pipeline {}", candidate.getName(), candidate.getId(), pipeline.getId());
            }
        }

        if (joined.isEmpty()) {
            log.debug("Candidate {} did not qualify for any new pipeline", candidate.getId());
        }
        return joined;
    }

    public boolean evaluateCandidate(StrategyCandidate candidate, PromotionCriteria criteria) {
        PerformanceSnapshot performance = candidate.getPerformance();
        if (performance == null || criteria == null) {
            return false;
        }
        return candidate.getGeneration() >= criteria.getMinGenerations()
                && candidate.getFitness() >= criteria.getMinFitness()
                && performance.getWinRate() >= criteria.getMinWinRate()
                && performance.getMaxDrawdown() <= criteria.getMaxDrawdown()
                && performance.getTotalTrades() >= criteria.getMinTrades()
                && calculateConsistencyScore(performance) >= criteria.getConsistencyScore();
    }

    public double calculateConsistencyScore(PerformanceSnapshot performance) {
        ControlPlaneProperties.Consistency weights = properties.getPromotion().getConsistency();
        double winRateComponent = performance.getWinRate() * weights.getWinRateWeight();
        double profitFactorComponent = Math.min(performance.getProfitFactor() / weights.getProfitFactorNorm(), 1.0)
                * weights.getProfitFactorWeight();
        double sharpeComponent = Math.min(performance.getSharpeRatio() / weights.getSharpeNorm(), 1.0)
                * weights.getSharpeWeight();
        return winRateComponent + profitFactorComponent + sharpeComponent;
    }

    /**
     * Validates a pending candidate and, if it passes, funds and registers it.
     *
     * @throws EntityNotFoundException if the pipeline, candidate or membership does not exist
     * @throws IllegalStateException if the candidate was already decided in this pipeline
     */
    public PromotionDecision promoteCandidate(String candidateId, String pipelineId) {
        return withPipelineLock(pipelineId, () -> decide(candidateId, pipelineId));
    }

    private PromotionDecision decide(String candidateId, String pipelineId) {
        PromotionPipeline pipeline = findPipeline(pipelineId);
        StrategyCandidate candidate = candidateRepository.findById(candidateId)
                .orElseThrow(() -> new EntityNotFoundException("Candidate not found: " + candidateId));
        PipelineMembership membership = membershipRepository.findByPipelineIdAndCandidateId(pipelineId, candidateId)
                .orElseThrow(() -> new EntityNotFoundException(
                        "Candidate " + candidateId + " is not in pipeline " + pipelineId));
        if (membership.getStage() != PipelineStage.PENDING) {
            throw new IllegalStateException(
                    "Candidate " + candidateId + " already " + membership.getStage() + " in " + pipelineId);
        }

        ValidationResult validation;
        try {
            validation = validationResultRepository.save(validateCandidate(candidate, pipeline));
        } catch (RuntimeException e) {
            log.error("❌ Validation run failed for {} in {}; will retry", candidateId, pipelineId, e);
            return new PromotionDecision(candidateId, pipelineId, PromotionDecision.Outcome.DEFERRED, null, null,
                    "Validation run failed: " + e.getMessage());
        }

        if (!validation.isPassed()) {
            membership.setStage(PipelineStage.REJECTED);
            membership.setDecidedAt(LocalDateTime.now(clock));
            membershipRepository.save(membership);
            String summary = String.join("; ", validation.getFeedback());
            log.warn("⛔ Strategy {} rejected during validation in {}: {}", candidate.getName(), pipelineId, summary);
            eventPublisher.publish(new PromotionNotification(candidateId, candidate.getName(), pipelineId,
                    false, null, summary, LocalDateTime.now(clock)));
            return new PromotionDecision(candidateId, pipelineId, PromotionDecision.Outcome.REJECTED, validation, null, summary);
        }

        CapitalAllocation allocation;
        try {
            allocation = deploy(candidate);
        } catch (DeploymentFailureException e) {
            membership.setDeploymentAttempts(membership.getDeploymentAttempts() + 1);
            membership.setLastDeploymentError(truncate(e.getMessage(), 500));
            membershipRepository.save(membership);
            log.warn("⚠️ Deployment of {} deferred (attempt {}): {} [{}]",
                    candidateId, membership.getDeploymentAttempts(), e.getMessage(), e.getErrorCode());
            return new PromotionDecision(candidateId, pipelineId, PromotionDecision.Outcome.DEFERRED, validation, null,
                    e.getMessage());
        }

        membership.setStage(PipelineStage.PROMOTED);
        membership.setDecidedAt(LocalDateTime.now(clock));
        membership.setAllocationId(allocation.getId());
        membership.setLastDeploymentError(null);
        try {
            membershipRepository.save(membership);
        } catch (RuntimeException e) {
            log.error("❌ Could not record promotion of {} in {}; releasing allocation {}",
                    candidateId, pipelineId, allocation.getId(), e);
            membership.setStage(PipelineStage.PENDING);
            membership.setDecidedAt(null);
            membership.setAllocationId(null);
            compensate(allocation, "failed promotion record");
            return new PromotionDecision(candidateId, pipelineId, PromotionDecision.Outcome.DEFERRED, validation, null,
                    "Recording promotion failed: " + e.getMessage());
        }

        String summary = String.format("score %.3f, allocated %s from %s",
                validation.getScore(), allocation.getAmount(), allocation.getPoolId());
        log.info("🚀 Strategy {} promoted to main competition via {} ({})", candidate.getName(), pipelineId, summary);
        eventPublisher.publish(new PromotionNotification(candidateId, candidate.getName(), pipelineId,
                true, allocation.getId(), summary, LocalDateTime.now(clock)));
        return new PromotionDecision(candidateId, pipelineId, PromotionDecision.Outcome.PROMOTED, validation,
                allocation.getId(), summary);
    }

    /**
     * Funds the candidate and registers it. A registration failure releases the allocation again.
     */
    private CapitalAllocation deploy(StrategyCandidate candidate) {
        String poolId = properties.getPromotion().getDeploymentPoolId();
        BigDecimal amount = properties.getPromotion().getDeploymentAmount().get(candidate.getRiskLevel());
        if (amount == null) {
            throw new DeploymentFailureException("No deployment amount configured for " + candidate.getRiskLevel());
        }

        CapitalAllocation allocation;
        try {
            allocation = capitalLedger.allocateCapital(poolId, candidate.getId(), amount, candidate.getRiskLevel());
        } catch (RuntimeException e) {
            throw new DeploymentFailureException("Capital allocation failed: " + e.getMessage(), e);
        }

        try {
            strategyRegistrar.register(candidate, allocation);
            return allocation;
        } catch (RuntimeException e) {
            compensate(allocation, "failed registration");
            if (e instanceof DeploymentFailureException failure) {
                throw failure;
            }
            throw new DeploymentFailureException("Registration failed: " + e.getMessage(), e);
        }
    }

    private void compensate(CapitalAllocation allocation, String cause) {
        try {
            capitalLedger.releaseCapital(allocation.getId(), BigDecimal.ZERO);
            log.info("↩️ Released allocation {} after {}", allocation.getId(), cause);
        } catch (RuntimeException e) {
            log.error("❌ Could not release allocation {} after {}", allocation.getId(), cause, e);
        }
    }

    /**
     * Runs the candidate through the validation environment for the pipeline's validation period
     * and scores the result. The returned result is not yet stored.
     */
    public ValidationResult validateCandidate(StrategyCandidate candidate, PromotionPipeline pipeline) {
        PromotionCriteria criteria = pipeline.getCriteria();
        int days = criteria.getValidationPeriod();

        ValidationRun run;
        try {
            run = validationRunner.run(candidate, days);
        } catch (ValidationFailedException e) {
            log.warn("⛔ Validation environment refused {}: {}", candidate.getId(), e.getMessage());
            return ValidationResult.builder()
                    .candidateId(candidate.getId())
                    .pipelineId(pipeline.getId())
                    .passed(false)
                    .score(0.0)
                    .validationPeriod(days)
                    .feedback(new ArrayList<>(List.of("Failed validation criteria", truncate(e.getMessage(), 200))))
                    .validatedAt(LocalDateTime.now(clock))
                    .build();
        }

        boolean passed = run.pnl() > 0
                && run.winRate() > criteria.getMinWinRate()
                && run.drawdown() < criteria.getMaxDrawdown();

        return ValidationResult.builder()
                .candidateId(candidate.getId())
                .pipelineId(pipeline.getId())
                .passed(passed)
                .score(calculateValidationScore(run))
                .validationPeriod(days)
                .pnl(run.pnl())
                .winRate(run.winRate())
                .drawdown(run.drawdown())
                .feedback(generateFeedback(passed, run, criteria))
                .validatedAt(LocalDateTime.now(clock))
                .build();
    }

    double calculateValidationScore(ValidationRun run) {
        ControlPlaneProperties.Scoring scoring = properties.getPromotion().getScoring();
        return scoring.getPnlWeight() * (run.pnl() / scoring.getPnlNorm())
                + scoring.getWinRateWeight() * run.winRate()
                + scoring.getDrawdownWeight() * (1 - run.drawdown() / scoring.getDrawdownNorm());
    }

    private List<String> generateFeedback(boolean passed, ValidationRun run, PromotionCriteria criteria) {
        ControlPlaneProperties.Scoring scoring = properties.getPromotion().getScoring();
        List<String> feedback = new ArrayList<>();
        if (passed) {
            feedback.add("Passed all validation criteria");
            if (run.pnl() > scoring.getStrongProfit()) feedback.add("Strong profit performance");
            if (run.winRate() > scoring.getHighWinRate()) feedback.add("High win rate maintained");
            if (run.drawdown() < scoring.getLowDrawdown()) feedback.add("Excellent risk management");
        } else {
            feedback.add("Failed validation criteria");
            if (run.pnl() <= 0) feedback.add("Negative P&L during validation");
            if (run.winRate() <= criteria.getMinWinRate()) feedback.add("Win rate below threshold");
            if (run.drawdown() >= criteria.getMaxDrawdown()) feedback.add("Excessive drawdown");
        }
        return feedback;
    }

    /**
     * Decides every pending candidate that has served its validation period.
     */
    @Scheduled(fixedDelayString = "${control.promotion.sweep-interval-ms:3600000}",
            initialDelayString = "${control.promotion.sweep-interval-ms:3600000}")
    public List<PromotionDecision> checkForPromotions() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<PromotionDecision> decisions = new ArrayList<>();

        for (PromotionPipeline pipeline : pipelineRepository.findByActiveTrue()) {
            Duration period = Duration.ofDays(pipeline.getCriteria().getValidationPeriod());
            List<PipelineMembership> pending =
                    membershipRepository.findByPipelineIdAndStageOrderByEnteredAtAsc(pipeline.getId(), PipelineStage.PENDING);

            for (PipelineMembership membership : pending) {
                if (Duration.between(membership.getEnteredAt(), now).compareTo(period) < 0) {
                    continue;
                }
                try {
                    decisions.add(promoteCandidate(membership.getCandidateId(), pipeline.getId()));
                } catch (RuntimeException e) {
                    log.error("❌ Promotion check failed for {} in {}", membership.getCandidateId(), pipeline.getId(), e);
                }
            }
        }

        if (!decisions.isEmpty()) {
            log.info("🪜 Promotion sweep decided {} candidate(s)", decisions.size());
        }
        return decisions;
    }

    public List<PromotionPipeline> getPipelines() {
        return pipelineRepository.findAllByOrderByCreatedAtAsc();
    }

    public PipelineView getPipeline(String pipelineId) {
        PromotionPipeline pipeline = findPipeline(pipelineId);
        return new PipelineView(pipeline,
                candidateIds(pipelineId, PipelineStage.PENDING),
                candidateIds(pipelineId, PipelineStage.PROMOTED),
                candidateIds(pipelineId, PipelineStage.REJECTED));
    }

    public List<StrategyCandidate> getCandidates() {
        return candidateRepository.findAllByOrderByCreatedAtDesc();
    }

    public List<ValidationResult> getValidationResults(String candidateId) {
        return validationResultRepository.findByCandidateIdOrderByValidatedAtDesc(candidateId);
    }

    public PromotionStats getPromotionStats() {
        long promoted = membershipRepository.countByStage(PipelineStage.PROMOTED);
        long rejected = membershipRepository.countByStage(PipelineStage.REJECTED);
        long decided = promoted + rejected;
        return new PromotionStats(
                candidateRepository.count(),
                promoted,
                rejected,
                decided > 0 ? (double) promoted / decided : 0.0,
                pipelineRepository.findByActiveTrue().size());
    }

    private List<String> candidateIds(String pipelineId, PipelineStage stage) {
        return membershipRepository.findByPipelineIdAndStageOrderByEnteredAtAsc(pipelineId, stage).stream()
                .map(PipelineMembership::getCandidateId)
                .toList();
    }

    private PromotionPipeline findPipeline(String pipelineId) {
        return pipelineRepository.findById(pipelineId)
                .orElseThrow(() -> new EntityNotFoundException("Pipeline not found: " + pipelineId));
    }

    private <T> T withPipelineLock(String pipelineId, Supplier<T> action) {
        ReentrantLock lock = pipelineLocks.computeIfAbsent(pipelineId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private static String truncate(String message, int maxLength) {
        if (message == null) {
            return null;
        }
        return message.length() > maxLength ? message.substring(0, maxLength) : message;
    }

    public record PipelineView(
            PromotionPipeline pipeline,
            List<String> pendingCandidates,
            List<String> promotedCandidates,
            List<String> rejectedCandidates
    ) {
    }

    public record PromotionStats(
            long totalCandidates,
            long totalPromoted,
            long totalRejected,
            double successRate,
            int activePipelines
    ) {
    }
}
