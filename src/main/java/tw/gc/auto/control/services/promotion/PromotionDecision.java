package tw.gc.auto.control.services.promotion;

import tw.gc.auto.control.entities.ValidationResult;

/**
 * Result of one promotion attempt. DEFERRED leaves the candidate pending for a later attempt.
 */
public record PromotionDecision(
        String candidateId,
        String pipelineId,
        Outcome outcome,
        ValidationResult validation,
        Long allocationId,
        String reason
) {

    public enum Outcome {
        PROMOTED,
        REJECTED,
        DEFERRED
    }
}
