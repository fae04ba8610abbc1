package tw.gc.auto.control.services.capital;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import tw.gc.auto.control.config.ControlPlaneProperties;
import tw.gc.auto.control.entities.CapitalAllocation;
import tw.gc.auto.control.entities.CapitalPool;
import tw.gc.auto.control.entities.CapitalTransaction;
import tw.gc.auto.control.enums.AllocationStatus;
import tw.gc.auto.control.enums.PoolPurpose;
import tw.gc.auto.control.enums.RiskLevel;
import tw.gc.auto.control.enums.TransactionType;
import tw.gc.auto.control.events.CapitalAllocationNotification;
import tw.gc.auto.control.events.ControlPlaneEventPublisher;
import tw.gc.auto.control.exceptions.CapitalLimitExceededException;
import tw.gc.auto.control.exceptions.EntityNotFoundException;
import tw.gc.auto.control.exceptions.InsufficientCapitalException;
import tw.gc.auto.control.repositories.CapitalAllocationRepository;
import tw.gc.auto.control.repositories.CapitalPoolRepository;
import tw.gc.auto.control.repositories.CapitalTransactionRepository;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Capital Ledger Service
 *
 * The only component that mutates capital balances. Responsible for:
 * - Allocating pool capital to experiments and promoted strategies
 * - Releasing allocations with their realized P&amp;L
 * - Moving unallocated capital between pools
 * - Mark-to-market P&amp;L and the pool stop-loss
 *
 * Every mutation of a pool runs under that pool's lock and inside one database transaction
 * that also holds a row lock on the pool, so {@code 0 <= allocated <= total} is checked and
 * written atomically. A failed operation leaves the pool untouched.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CapitalLedgerService {

    private final CapitalPoolRepository poolRepository;
    private final CapitalAllocationRepository allocationRepository;
    private final CapitalTransactionRepository transactionRepository;
    private final TransactionTemplate transactionTemplate;
    private final ControlPlaneEventPublisher eventPublisher;
    private final ControlPlaneProperties properties;
    private final Clock clock;

    private final Map<String, ReentrantLock> poolLocks = new ConcurrentHashMap<>();

    @PostConstruct
    public void initialize() {
        if (properties.getCapital().isSeedDefaultPools()) {
            ensureDefaultPools();
        }
        log.info("💰 CapitalLedgerService initialized");
    }

    /**
     * Ensure the research, competition and validation pools exist
     */
    public void ensureDefaultPools() {
        createPoolIfAbsent("research_pool", "Research Pool", PoolPurpose.RESEARCH, RiskLevel.LOW,
                new BigDecimal("10000"), 0.10);
        createPoolIfAbsent("competition_pool", "Competition Pool", PoolPurpose.COMPETITION, RiskLevel.MEDIUM,
                new BigDecimal("50000"), 0.20);
        createPoolIfAbsent("validation_pool", "Validation Pool", PoolPurpose.VALIDATION, RiskLevel.MEDIUM,
                new BigDecimal("15000"), 0.15);
    }

    public CapitalPool createPoolIfAbsent(String poolId, String name, PoolPurpose purpose, RiskLevel riskLevel,
                                          BigDecimal totalCapital, double maxDrawdown) {
        requirePositive(totalCapital, "totalCapital");
        return withPoolLocks(List.of(poolId), () -> poolRepository.findById(poolId).orElseGet(() -> {
            LocalDateTime now = now();
            CapitalPool pool = poolRepository.save(CapitalPool.builder()
                    .id(poolId)
                    .name(name)
                    .purpose(purpose)
                    .riskLevel(riskLevel)
                    .totalCapital(totalCapital)
                    .allocatedCapital(BigDecimal.ZERO)
                    .maxDrawdown(maxDrawdown)
                    .lastUpdated(now)
                    .build());
            appendTransaction(TransactionType.POOL_INIT, poolId, null, null, totalCapital,
                    String.format("Initialize %s with %s", name, totalCapital.toPlainString()), now);
            log.info("✅ Created capital pool {} ({})", poolId, totalCapital.toPlainString());
            return pool;
        }));
    }

    /**
     * Reserve {@code amount} of a pool's unallocated capital for an experiment.
     *
     * @throws InsufficientCapitalException if the amount exceeds total minus allocated capital
     * @throws CapitalLimitExceededException if the per-risk-level or concurrency limit is hit
     */
    public CapitalAllocation allocateCapital(String poolId, String experimentId, BigDecimal amount, RiskLevel riskLevel) {
        requirePositive(amount, "amount");
        RiskLevel level = riskLevel != null ? riskLevel : RiskLevel.LOW;

        CapitalAllocation allocation = withPoolLocks(List.of(poolId), () -> {
            CapitalPool pool = lockPool(poolId);

            if (amount.compareTo(pool.getAvailableCapital()) > 0) {
                throw new InsufficientCapitalException(poolId, pool.getAvailableCapital(), amount);
            }

            BigDecimal maxAmount = properties.getCapital().getMaxPerExperiment().get(level);
            if (maxAmount != null && amount.compareTo(maxAmount) > 0) {
                throw new CapitalLimitExceededException(String.format(
                        "Amount %s exceeds maximum %s for risk level %s",
                        amount.toPlainString(), maxAmount.toPlainString(), level));
            }

            int maxConcurrent = properties.getCapital().getMaxConcurrentExperiments();
            if (allocationRepository.countByPoolIdAndStatus(poolId, AllocationStatus.ACTIVE) >= maxConcurrent) {
                throw new CapitalLimitExceededException(String.format(
                        "Maximum concurrent experiments (%d) reached for pool %s", maxConcurrent, poolId));
            }

            LocalDateTime now = now();
            CapitalAllocation saved = allocationRepository.save(CapitalAllocation.builder()
                    .poolId(poolId)
                    .experimentId(experimentId)
                    .amount(amount)
                    .riskLevel(level)
                    .status(AllocationStatus.ACTIVE)
                    .runningPnl(BigDecimal.ZERO)
                    .allocatedAt(now)
                    .build());

            pool.setAllocatedCapital(pool.getAllocatedCapital().add(amount));
            pool.setLastUpdated(now);
            poolRepository.save(pool);

            appendTransaction(TransactionType.ALLOCATION, poolId, experimentId, saved.getId(), amount,
                    String.format("Allocated %s to experiment %s", amount.toPlainString(), experimentId), now);
            return saved;
        });

        log.info("💰 Allocated {} from {} to {} (allocation {})",
                amount.toPlainString(), poolId, experimentId, allocation.getId());
        eventPublisher.publish(new CapitalAllocationNotification(TransactionType.ALLOCATION, poolId,
                allocation.getId(), experimentId, amount, allocation.getAllocatedAt()));
        return allocation;
    }

    /**
     * Return an active allocation to its pool. The pool's allocated capital drops by exactly the
     * allocated amount; {@code finalPnl} is recorded as realized P&amp;L.
     */
    public CapitalAllocation releaseCapital(Long allocationId, BigDecimal finalPnl) {
        BigDecimal pnl = finalPnl != null ? finalPnl : BigDecimal.ZERO;
        String poolId = findAllocation(allocationId).getPoolId();

        CapitalAllocation released = withPoolLocks(List.of(poolId), () -> {
            CapitalPool pool = lockPool(poolId);
            CapitalAllocation allocation = findAllocation(allocationId);
            if (allocation.getStatus() != AllocationStatus.ACTIVE) {
                throw new IllegalStateException("Allocation " + allocationId + " is not active");
            }
            return release(pool, allocation, pnl, now());
        });

        log.info("💸 Released allocation {} ({}) from {} with P&L {}",
                allocationId, released.getAmount().toPlainString(), poolId, pnl.toPlainString());
        eventPublisher.publish(new CapitalAllocationNotification(TransactionType.RELEASE, poolId,
                allocationId, released.getExperimentId(), released.getAmount(), released.getReleasedAt()));
        return released;
    }

    /**
     * Move unallocated capital from one pool to another. Both legs commit together or not at all.
     */
    public void transferCapital(String fromPoolId, String toPoolId, BigDecimal amount, String reason) {
        requirePositive(amount, "amount");
        if (fromPoolId.equals(toPoolId)) {
            throw new IllegalArgumentException("Cannot transfer capital to the same pool");
        }

        LocalDateTime at = withPoolLocks(List.of(fromPoolId, toPoolId), () -> {
            CapitalPool from = lockPool(fromPoolId);
            CapitalPool to = lockPool(toPoolId);

            if (amount.compareTo(from.getAvailableCapital()) > 0) {
                throw new InsufficientCapitalException(fromPoolId, from.getAvailableCapital(), amount);
            }

            LocalDateTime now = now();
            from.setTotalCapital(from.getTotalCapital().subtract(amount));
            from.setLastUpdated(now);
            to.setTotalCapital(to.getTotalCapital().add(amount));
            to.setLastUpdated(now);
            poolRepository.save(from);
            poolRepository.save(to);

            String description = String.format("Transfer %s from %s to %s: %s",
                    amount.toPlainString(), fromPoolId, toPoolId, reason);
            appendTransaction(TransactionType.TRANSFER_OUT, fromPoolId, null, null, amount.negate(), description, now);
            appendTransaction(TransactionType.TRANSFER_IN, toPoolId, null, null, amount, description, now);
            return now;
        });

        log.info("🔁 Transferred {} from {} to {} ({})", amount.toPlainString(), fromPoolId, toPoolId, reason);
        eventPublisher.publish(new CapitalAllocationNotification(TransactionType.TRANSFER_OUT, fromPoolId,
                null, null, amount, at));
        eventPublisher.publish(new CapitalAllocationNotification(TransactionType.TRANSFER_IN, toPoolId,
                null, null, amount, at));
    }

    /**
     * Mark-to-market an active allocation. Pool totals are not touched unless the pool's combined
     * running loss crosses the stop-loss, in which case every active allocation in the pool is
     * released at its running P&amp;L.
     */
    public CapitalAllocation updatePnl(Long allocationId, BigDecimal delta) {
        if (delta == null) {
            throw new IllegalArgumentException("P&L delta must be provided");
        }
        String poolId = findAllocation(allocationId).getPoolId();
        List<CapitalAllocation> stopped = new ArrayList<>();

        CapitalAllocation updated = withPoolLocks(List.of(poolId), () -> {
            CapitalPool pool = lockPool(poolId);
            CapitalAllocation allocation = findAllocation(allocationId);
            if (allocation.getStatus() != AllocationStatus.ACTIVE) {
                throw new IllegalStateException("Allocation " + allocationId + " is not active");
            }

            LocalDateTime now = now();
            allocation.setRunningPnl(allocation.getRunningPnl().add(delta));
            CapitalAllocation saved = allocationRepository.save(allocation);
            appendTransaction(TransactionType.PNL_UPDATE, poolId, allocation.getExperimentId(), allocationId, delta,
                    String.format("P&L update for experiment %s: %s", allocation.getExperimentId(), delta.toPlainString()),
                    now);

            List<CapitalAllocation> active = allocationRepository.findByPoolIdAndStatus(poolId, AllocationStatus.ACTIVE);
            BigDecimal totalPnl = active.stream()
                    .map(CapitalAllocation::getRunningPnl)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            double lossFraction = totalPnl.signum() < 0
                    ? totalPnl.negate().divide(pool.getTotalCapital(), 6, RoundingMode.HALF_UP).doubleValue()
                    : 0.0;

            if (lossFraction > properties.getCapital().getEmergencyStopLoss()) {
                log.warn("🚨 Pool stop-loss triggered for {}: running loss {} ({}%)",
                        poolId, totalPnl.toPlainString(), String.format("%.2f", lossFraction * 100));
                for (CapitalAllocation each : active) {
                    stopped.add(release(pool, each, each.getRunningPnl(), now));
                }
            } else {
                pool.setLastUpdated(now);
                poolRepository.save(pool);
            }
            return saved;
        });

        for (CapitalAllocation each : stopped) {
            eventPublisher.publish(new CapitalAllocationNotification(TransactionType.RELEASE, poolId,
                    each.getId(), each.getExperimentId(), each.getAmount(), each.getReleasedAt()));
        }
        return stopped.stream()
                .filter(a -> a.getId().equals(allocationId))
                .findFirst()
                .orElse(updated);
    }

    // ===== Queries =====

    public List<CapitalPool> getPools() {
        return poolRepository.findAll();
    }

    public CapitalPool getPool(String poolId) {
        return poolRepository.findById(poolId)
                .orElseThrow(() -> new EntityNotFoundException("Pool " + poolId + " not found"));
    }

    public CapitalAllocation getAllocation(Long allocationId) {
        return findAllocation(allocationId);
    }

    public List<CapitalAllocation> getAllocations(String poolId) {
        return poolId != null ? allocationRepository.findByPoolId(poolId) : allocationRepository.findAll();
    }

    public List<CapitalAllocation> getActiveAllocations(String poolId) {
        return poolId != null
                ? allocationRepository.findByPoolIdAndStatus(poolId, AllocationStatus.ACTIVE)
                : allocationRepository.findByStatus(AllocationStatus.ACTIVE);
    }

    /**
     * Most recent transactions first
     */
    public List<CapitalTransaction> getTransactions(String poolId, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        return poolId != null
                ? transactionRepository.findByPoolIdOrderByIdDesc(poolId, page)
                : transactionRepository.findAllByOrderByIdDesc(page);
    }

    public PoolAnalytics getPoolAnalytics(String poolId) {
        CapitalPool pool = getPool(poolId);
        List<CapitalAllocation> allocations = allocationRepository.findByPoolId(poolId);
        List<CapitalAllocation> completed = allocations.stream()
                .filter(a -> a.getStatus() == AllocationStatus.RELEASED)
                .toList();
        long activeCount = allocations.size() - completed.size();

        BigDecimal totalPnl = completed.stream()
                .map(CapitalAllocation::getRunningPnl)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal avgPnl = completed.isEmpty()
                ? BigDecimal.ZERO
                : totalPnl.divide(BigDecimal.valueOf(completed.size()), 4, RoundingMode.HALF_UP);
        double winRate = completed.isEmpty()
                ? 0.0
                : (double) completed.stream().filter(a -> a.getRunningPnl().signum() > 0).count() / completed.size();
        double utilization = pool.getTotalCapital().signum() == 0
                ? 0.0
                : pool.getAllocatedCapital().divide(pool.getTotalCapital(), 6, RoundingMode.HALF_UP).doubleValue();

        return new PoolAnalytics(poolId, totalPnl, avgPnl, winRate, activeCount, completed.size(),
                utilization, pool.getCurrentDrawdown());
    }

    public record PoolAnalytics(
            String poolId,
            BigDecimal totalPnl,
            BigDecimal avgPnl,
            double winRate,
            long activeExperiments,
            long completedExperiments,
            double utilizationRate,
            double drawdownPercent
    ) {
    }

    // ===== Internals =====

    private CapitalAllocation release(CapitalPool pool, CapitalAllocation allocation, BigDecimal pnl, LocalDateTime now) {
        BigDecimal newAllocated = pool.getAllocatedCapital().subtract(allocation.getAmount());
        if (newAllocated.signum() < 0) {
            throw new IllegalStateException("Release of allocation " + allocation.getId()
                    + " would make pool " + pool.getId() + " allocated capital negative");
        }

        allocation.setStatus(AllocationStatus.RELEASED);
        allocation.setReleasedAt(now);
        allocation.setRunningPnl(pnl);
        CapitalAllocation saved = allocationRepository.save(allocation);

        pool.setAllocatedCapital(newAllocated);
        pool.setRealizedPnl(pool.getRealizedPnl().add(pnl));
        if (pool.getRealizedPnl().signum() < 0 && pool.getTotalCapital().signum() > 0) {
            pool.setCurrentDrawdown(pool.getRealizedPnl().negate()
                    .divide(pool.getTotalCapital(), 6, RoundingMode.HALF_UP).doubleValue());
        } else {
            pool.setCurrentDrawdown(0.0);
        }
        pool.setLastUpdated(now);
        poolRepository.save(pool);

        appendTransaction(TransactionType.RELEASE, pool.getId(), allocation.getExperimentId(), allocation.getId(),
                allocation.getAmount(),
                String.format("Released %s from experiment %s with P&L %s",
                        allocation.getAmount().toPlainString(), allocation.getExperimentId(), pnl.toPlainString()),
                now);
        return saved;
    }

    /**
     * Run {@code action} in one transaction while holding the in-process lock of every pool
     * involved. Locks are taken in pool-id order so two transfers in opposite directions cannot
     * deadlock.
     */
    private <T> T withPoolLocks(List<String> poolIds, Supplier<T> action) {
        List<ReentrantLock> locks = poolIds.stream()
                .distinct()
                .sorted()
                .map(id -> poolLocks.computeIfAbsent(id, k -> new ReentrantLock()))
                .toList();
        locks.forEach(ReentrantLock::lock);
        try {
            return transactionTemplate.execute(status -> action.get());
        } finally {
            for (int i = locks.size() - 1; i >= 0; i--) {
                locks.get(i).unlock();
            }
        }
    }

    private CapitalPool lockPool(String poolId) {
        return poolRepository.findByIdForUpdate(poolId)
                .orElseThrow(() -> new EntityNotFoundException("Pool " + poolId + " not found"));
    }

    private CapitalAllocation findAllocation(Long allocationId) {
        return allocationRepository.findById(allocationId)
                .orElseThrow(() -> new EntityNotFoundException("Allocation " + allocationId + " not found"));
    }

    private void appendTransaction(TransactionType type, String poolId, String experimentId, Long allocationId,
                                   BigDecimal amount, String description, LocalDateTime at) {
        transactionRepository.save(CapitalTransaction.builder()
                .type(type)
                .poolId(poolId)
                .experimentId(experimentId)
                .allocationId(allocationId)
                .amount(amount)
                .description(description)
                .timestamp(at)
                .build());
    }

    private static void requirePositive(BigDecimal amount, String name) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
