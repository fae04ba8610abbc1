package tw.gc.auto.control.enums;

public enum PoolPurpose {
    RESEARCH,
    COMPETITION,
    VALIDATION
}
