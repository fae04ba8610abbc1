package tw.gc.auto.control.services.execution;

import tw.gc.auto.control.enums.ExecutionStatus;

import java.util.List;

/**
 * Outcome of an order submission. A blocked submission never reached a broker and carries the
 * reason it was stopped.
 */
public record OrderSubmissionResult(
        ExecutionStatus status,
        List<String> brokerOrderIds,
        boolean blocked,
        String reason
) {

    public static OrderSubmissionResult blocked(String reason) {
        return new OrderSubmissionResult(ExecutionStatus.REJECTED, List.of(), true, reason);
    }

    public static OrderSubmissionResult accepted(ExecutionStatus status, List<String> brokerOrderIds) {
        return new OrderSubmissionResult(status, List.copyOf(brokerOrderIds), false, null);
    }

    public static OrderSubmissionResult failed(String reason) {
        return new OrderSubmissionResult(ExecutionStatus.REJECTED, List.of(), false, reason);
    }
}
