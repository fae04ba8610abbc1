package tw.gc.auto.control.controllers;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tw.gc.auto.control.entities.CapitalAllocation;
import tw.gc.auto.control.entities.CapitalPool;
import tw.gc.auto.control.entities.CapitalTransaction;
import tw.gc.auto.control.enums.RiskLevel;
import tw.gc.auto.control.services.capital.CapitalLedgerService;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/capital")
@RequiredArgsConstructor
public class CapitalController {

    private final CapitalLedgerService capitalLedger;

    @GetMapping("/pools")
    public ResponseEntity<List<CapitalPool>> getPools() {
        return ResponseEntity.ok(capitalLedger.getPools());
    }

    @GetMapping("/pools/{poolId}")
    public ResponseEntity<CapitalPool> getPool(@PathVariable String poolId) {
        return ResponseEntity.ok(capitalLedger.getPool(poolId));
    }

    @GetMapping("/pools/{poolId}/analytics")
    public ResponseEntity<CapitalLedgerService.PoolAnalytics> getAnalytics(@PathVariable String poolId) {
        return ResponseEntity.ok(capitalLedger.getPoolAnalytics(poolId));
    }

    @PostMapping("/allocations")
    public ResponseEntity<CapitalAllocation> allocate(@RequestBody AllocationRequest request) {
        return ResponseEntity.ok(capitalLedger.allocateCapital(
                request.poolId(), request.experimentId(), request.amount(), request.riskLevel()));
    }

    @PostMapping("/allocations/{allocationId}/release")
    public ResponseEntity<CapitalAllocation> release(@PathVariable Long allocationId,
                                                     @RequestBody(required = false) Map<String, BigDecimal> body) {
        BigDecimal finalPnl = body != null ? body.getOrDefault("finalPnl", BigDecimal.ZERO) : BigDecimal.ZERO;
        return ResponseEntity.ok(capitalLedger.releaseCapital(allocationId, finalPnl));
    }

    @PostMapping("/allocations/{allocationId}/pnl")
    public ResponseEntity<CapitalAllocation> updatePnl(@PathVariable Long allocationId,
                                                       @RequestBody Map<String, BigDecimal> body) {
        BigDecimal delta = body.get("delta");
        if (delta == null) {
            throw new IllegalArgumentException("delta is required");
        }
        return ResponseEntity.ok(capitalLedger.updatePnl(allocationId, delta));
    }

    @PostMapping("/transfers")
    public ResponseEntity<Map<String, String>> transfer(@RequestBody TransferRequest request) {
        capitalLedger.transferCapital(request.fromPoolId(), request.toPoolId(), request.amount(), request.reason());
        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Transferred " + request.amount() + " from " + request.fromPoolId() + " to " + request.toPoolId()));
    }

    @GetMapping("/allocations")
    public ResponseEntity<List<CapitalAllocation>> getAllocations(
            @RequestParam(required = false) String poolId,
            @RequestParam(defaultValue = "false") boolean activeOnly) {
        return ResponseEntity.ok(activeOnly
                ? capitalLedger.getActiveAllocations(poolId)
                : capitalLedger.getAllocations(poolId));
    }

    @GetMapping("/transactions")
    public ResponseEntity<List<CapitalTransaction>> getTransactions(
            @RequestParam(required = false) String poolId,
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(capitalLedger.getTransactions(poolId, limit));
    }

    public record AllocationRequest(String poolId, String experimentId, BigDecimal amount, RiskLevel riskLevel) {
    }

    public record TransferRequest(String fromPoolId, String toPoolId, BigDecimal amount, String reason) {
    }
}
