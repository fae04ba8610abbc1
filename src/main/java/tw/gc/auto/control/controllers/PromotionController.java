package tw.gc.auto.control.controllers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tw.gc.auto.control.entities.PromotionPipeline;
import tw.gc.auto.control.entities.StrategyCandidate;
import tw.gc.auto.control.entities.ValidationResult;
import tw.gc.auto.control.services.promotion.PromotionDecision;
import tw.gc.auto.control.services.promotion.PromotionPipelineService;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/promotion")
@RequiredArgsConstructor
@Slf4j
public class PromotionController {

    private final PromotionPipelineService promotionService;

    @PostMapping("/candidates")
    public ResponseEntity<Map<String, Object>> addCandidate(@RequestBody StrategyCandidate candidate) {
        List<String> joined = promotionService.addCandidate(candidate);
        return ResponseEntity.ok(Map.of(
                "candidateId", candidate.getId(),
                "joinedPipelines", joined));
    }

    @GetMapping("/candidates")
    public ResponseEntity<List<StrategyCandidate>> getCandidates() {
        return ResponseEntity.ok(promotionService.getCandidates());
    }

    @GetMapping("/candidates/{candidateId}/validations")
    public ResponseEntity<List<ValidationResult>> getValidationResults(@PathVariable String candidateId) {
        return ResponseEntity.ok(promotionService.getValidationResults(candidateId));
    }

    @GetMapping("/pipelines")
    public ResponseEntity<List<PromotionPipeline>> getPipelines() {
        return ResponseEntity.ok(promotionService.getPipelines());
    }

    @GetMapping("/pipelines/{pipelineId}")
    public ResponseEntity<PromotionPipelineService.PipelineView> getPipeline(@PathVariable String pipelineId) {
        return ResponseEntity.ok(promotionService.getPipeline(pipelineId));
    }

    @PostMapping("/pipelines/{pipelineId}/active")
    public ResponseEntity<PromotionPipeline> setPipelineActive(@PathVariable String pipelineId,
                                                               @RequestParam boolean active) {
        return ResponseEntity.ok(promotionService.setPipelineActive(pipelineId, active));
    }

    @PostMapping("/pipelines/{pipelineId}/candidates/{candidateId}/promote")
    public ResponseEntity<PromotionDecision> promote(@PathVariable String pipelineId,
                                                     @PathVariable String candidateId) {
        log.info("🎯 Manual promotion: {} in {}", candidateId, pipelineId);
        return ResponseEntity.ok(promotionService.promoteCandidate(candidateId, pipelineId));
    }

    @GetMapping("/stats")
    public ResponseEntity<PromotionPipelineService.PromotionStats> getStats() {
        return ResponseEntity.ok(promotionService.getPromotionStats());
    }
}
