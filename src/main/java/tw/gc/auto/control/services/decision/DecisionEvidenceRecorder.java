package tw.gc.auto.control.services.decision;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import tw.gc.auto.control.entities.DecisionTrace;
import tw.gc.auto.control.entities.RiskGateOutcome;
import tw.gc.auto.control.enums.ExecutionStatus;
import tw.gc.auto.control.enums.ProofStrength;
import tw.gc.auto.control.exceptions.EntityNotFoundException;
import tw.gc.auto.control.repositories.DecisionTraceRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Stores one trace per decision cycle and tracks its execution status afterwards.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DecisionEvidenceRecorder {

    private static final int LOCK_STRIPES = 64;

    private final DecisionTraceRepository repository;
    private final Clock clock;

    private final ReentrantLock[] traceLocks = createLocks();

    public DecisionTrace record(DecisionRecord decision) {
        if (decision.symbol() == null || decision.plan() == null) {
            throw new IllegalArgumentException("Decision symbol and plan are required");
        }
        DecisionTrace trace = DecisionTrace.builder()
                .traceId(decision.traceId() != null ? decision.traceId() : UUID.randomUUID().toString())
                .symbol(decision.symbol())
                .asOf(decision.asOf() != null ? decision.asOf() : LocalDateTime.now(clock))
                .plan(decision.plan())
                .riskGate(decision.riskGate() != null ? decision.riskGate() : new RiskGateOutcome())
                .riskNotes(decision.riskNotes() != null ? new ArrayList<>(decision.riskNotes()) : new ArrayList<>())
                .safetyPermitted(decision.safetyPermitted())
                .safetyBlockReason(decision.safetyBlockReason())
                .marketContext(decision.marketContext())
                .newsEvidence(decision.newsEvidence() != null ? new ArrayList<>(decision.newsEvidence()) : new ArrayList<>())
                .nudgeValue(decision.nudgeValue())
                .nudgeRegimeShrink(decision.nudgeRegimeShrink())
                .nudgeReason(decision.nudgeReason())
                .executionStatus(decision.executionStatus() != null ? decision.executionStatus() : ExecutionStatus.PENDING)
                .brokerOrderIds(decision.brokerOrderIds() != null ? new ArrayList<>(decision.brokerOrderIds()) : new ArrayList<>())
                .executionUpdatedAt(LocalDateTime.now(clock))
                .build();

        DecisionTrace saved = repository.save(trace);
        log.debug("🧾 Trace {} recorded for {} ({})", saved.getTraceId(), saved.getSymbol(), saved.getExecutionStatus());
        return saved;
    }

    /**
     * Moves the trace's execution status forward and appends any new broker order ids.
     *
     * @throws IllegalStateException if the trace is terminal or the move would go backwards
     */
    public DecisionTrace updateExecution(String traceId, ExecutionStatus status, List<String> brokerOrderIds) {
        ReentrantLock lock = lockFor(traceId);
        lock.lock();
        try {
            DecisionTrace trace = findByTraceId(traceId);
            ExecutionStatus current = trace.getExecutionStatus();
            if (current.isTerminal()) {
                throw new IllegalStateException("Trace " + traceId + " is already " + current);
            }
            if (!current.canTransitionTo(status)) {
                throw new IllegalStateException("Trace " + traceId + " cannot move from " + current + " to " + status);
            }

            trace.setExecutionStatus(status);
            if (brokerOrderIds != null) {
                brokerOrderIds.stream()
                        .filter(id -> !trace.getBrokerOrderIds().contains(id))
                        .forEach(trace.getBrokerOrderIds()::add);
            }
            trace.setExecutionUpdatedAt(LocalDateTime.now(clock));
            DecisionTrace saved = repository.save(trace);
            log.info("🧾 Trace {} {} → {}", traceId, current, status);
            return saved;
        } finally {
            lock.unlock();
        }
    }

    public DecisionTrace findByTraceId(String traceId) {
        return repository.findById(traceId)
                .orElseThrow(() -> new EntityNotFoundException("Decision trace not found: " + traceId));
    }

    public List<DecisionTrace> findRecentBySymbol(String symbol, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        if (symbol == null || symbol.isBlank()) {
            return repository.findAllByOrderByAsOfDesc(page);
        }
        return repository.findBySymbolOrderByAsOfDesc(symbol, page);
    }

    /**
     * How well the recorded evidence supports the decision.
     */
    public ProofStrength proofStrength(DecisionTrace trace) {
        int gatesPassed = trace.getRiskGate() != null ? trace.getRiskGate().passedCount() : 0;
        int evidence = 0;
        if (trace.getMarketContext() != null) evidence++;
        if (trace.getNewsEvidence() != null && !trace.getNewsEvidence().isEmpty()) evidence++;
        if (trace.getBrokerOrderIds() != null && !trace.getBrokerOrderIds().isEmpty()) evidence++;

        if (gatesPassed == 3 && evidence >= 2) {
            return ProofStrength.STRONG;
        }
        if (gatesPassed >= 2 && evidence >= 1) {
            return ProofStrength.MEDIUM;
        }
        return ProofStrength.WEAK;
    }

    private ReentrantLock lockFor(String traceId) {
        return traceLocks[Math.floorMod(traceId.hashCode(), LOCK_STRIPES)];
    }

    private static ReentrantLock[] createLocks() {
        ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
        return locks;
    }
}
