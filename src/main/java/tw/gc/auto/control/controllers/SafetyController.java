package tw.gc.auto.control.controllers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tw.gc.auto.control.entities.SafetyStatus;
import tw.gc.auto.control.enums.TradingMode;
import tw.gc.auto.control.services.safety.SafetySupervisorService;

/**
 * Operator controls for the safety supervisor.
 */
@RestController
@RequestMapping("/api/safety")
@RequiredArgsConstructor
@Slf4j
public class SafetyController {

    private final SafetySupervisorService safetySupervisor;

    @GetMapping("/status")
    public ResponseEntity<SafetyStatus> getStatus() {
        return ResponseEntity.ok(safetySupervisor.getStatus());
    }

    @PostMapping("/mode")
    public ResponseEntity<SafetyStatus> setTradingMode(@RequestParam TradingMode mode) {
        log.info("🎛️ Trading mode change requested: {}", mode);
        return ResponseEntity.ok(safetySupervisor.setTradingMode(mode));
    }

    @PostMapping("/emergency-stop")
    public ResponseEntity<SafetyStatus> toggleEmergencyStop(
            @RequestParam boolean active,
            @RequestParam(required = false) String reason) {
        SafetyStatus status = active
                ? safetySupervisor.activateEmergencyStop(reason)
                : safetySupervisor.deactivateEmergencyStop();
        return ResponseEntity.ok(status);
    }

    @PostMapping("/circuit-breaker/reset")
    public ResponseEntity<SafetyStatus> resetCircuitBreaker() {
        return ResponseEntity.ok(safetySupervisor.resetCircuitBreaker());
    }

    @PostMapping("/cooldown/clear")
    public ResponseEntity<SafetyStatus> clearCooldown() {
        return ResponseEntity.ok(safetySupervisor.clearCooldown());
    }
}
