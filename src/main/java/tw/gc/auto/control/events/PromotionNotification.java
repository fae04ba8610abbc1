package tw.gc.auto.control.events;

import tw.gc.auto.control.entities.ControlEvent.EventSeverity;

import java.time.LocalDateTime;

/**
 * A candidate was promoted (and funded) or rejected by a pipeline.
 */
public record PromotionNotification(
        String candidateId,
        String candidateName,
        String pipelineId,
        boolean promoted,
        Long allocationId,
        String summary,
        LocalDateTime occurredAt
) implements ControlPlaneNotification {

    @Override
    public String type() {
        return promoted ? "STRATEGY_PROMOTED" : "STRATEGY_REJECTED";
    }

    @Override
    public String category() {
        return "PROMOTION";
    }

    @Override
    public EventSeverity severity() {
        return promoted ? EventSeverity.HIGH : EventSeverity.LOW;
    }

    @Override
    public String message() {
        return String.format("Strategy %s (%s) %s by %s: %s",
                candidateName, candidateId, promoted ? "promoted" : "rejected", pipelineId, summary);
    }
}
