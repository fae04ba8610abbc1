package tw.gc.auto.control.enums;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH
}
