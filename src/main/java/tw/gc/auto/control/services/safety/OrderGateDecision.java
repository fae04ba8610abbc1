package tw.gc.auto.control.services.safety;

public record OrderGateDecision(boolean permitted, String blockReason) {

    public static OrderGateDecision permit() {
        return new OrderGateDecision(true, null);
    }

    public static OrderGateDecision block(String reason) {
        return new OrderGateDecision(false, reason);
    }
}
