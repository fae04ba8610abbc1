package tw.gc.auto.control.enums;

/**
 * Execution status of a decision trace. FILLED, REJECTED and CANCELLED are terminal.
 */
public enum ExecutionStatus {
    PENDING,
    LIVE,
    FILLED,
    REJECTED,
    CANCELLED;

    public boolean isTerminal() {
        return this == FILLED || this == REJECTED || this == CANCELLED;
    }

    public boolean canTransitionTo(ExecutionStatus next) {
        if (isTerminal() || next == null) {
            return false;
        }
        if (this == next) {
            return true;
        }
        return next != PENDING;
    }
}
