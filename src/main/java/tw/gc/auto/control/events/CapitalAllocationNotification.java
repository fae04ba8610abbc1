package tw.gc.auto.control.events;

import tw.gc.auto.control.entities.ControlEvent.EventSeverity;
import tw.gc.auto.control.enums.TransactionType;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record CapitalAllocationNotification(
        TransactionType change,
        String poolId,
        Long allocationId,
        String experimentId,
        BigDecimal amount,
        LocalDateTime occurredAt
) implements ControlPlaneNotification {

    @Override
    public String type() {
        return "CAPITAL_" + change.name();
    }

    @Override
    public String category() {
        return "CAPITAL";
    }

    @Override
    public EventSeverity severity() {
        return EventSeverity.MEDIUM;
    }

    @Override
    public String message() {
        return String.format("%s %s in pool %s (allocation %s, experiment %s)",
                change, amount.toPlainString(), poolId, allocationId, experimentId);
    }
}
