package tw.gc.auto.control.controllers;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tw.gc.auto.control.entities.DecisionTrace;
import tw.gc.auto.control.enums.ProofStrength;
import tw.gc.auto.control.services.decision.DecisionEvidenceRecorder;

import java.util.List;

/**
 * Read-only access to recorded decision evidence.
 */
@RestController
@RequestMapping("/api/decisions")
@RequiredArgsConstructor
public class DecisionTraceController {

    private final DecisionEvidenceRecorder recorder;

    @GetMapping("/{traceId}")
    public ResponseEntity<TraceView> getTrace(@PathVariable String traceId) {
        return ResponseEntity.ok(view(recorder.findByTraceId(traceId)));
    }

    @GetMapping
    public ResponseEntity<List<TraceView>> getRecent(
            @RequestParam(required = false) String symbol,
            @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(recorder.findRecentBySymbol(symbol, limit).stream()
                .map(this::view)
                .toList());
    }

    private TraceView view(DecisionTrace trace) {
        return new TraceView(trace, recorder.proofStrength(trace));
    }

    public record TraceView(DecisionTrace trace, ProofStrength proofStrength) {
    }
}
