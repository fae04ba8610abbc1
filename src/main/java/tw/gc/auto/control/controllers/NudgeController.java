package tw.gc.auto.control.controllers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tw.gc.auto.control.services.nudge.ConfidenceNudgeService;
import tw.gc.auto.control.services.nudge.NudgeCircuitBreaker;

@RestController
@RequestMapping("/api/nudge")
@RequiredArgsConstructor
@Slf4j
public class NudgeController {

    private final ConfidenceNudgeService nudgeService;

    @GetMapping("/status")
    public ResponseEntity<ConfidenceNudgeService.NudgePerformanceStats> getStatus() {
        return ResponseEntity.ok(nudgeService.getPerformanceStats());
    }

    @PostMapping("/circuit-breaker/reset")
    public ResponseEntity<NudgeCircuitBreaker.BreakerStatus> resetCircuitBreaker() {
        log.info("🔄 Manual nudge breaker reset requested");
        return ResponseEntity.ok(nudgeService.resetCircuitBreaker());
    }
}
