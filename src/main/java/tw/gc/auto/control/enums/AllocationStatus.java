package tw.gc.auto.control.enums;

public enum AllocationStatus {
    ACTIVE,
    RELEASED
}
