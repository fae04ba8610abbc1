package tw.gc.auto.control.enums;

public enum ProofStrength {
    STRONG,
    MEDIUM,
    WEAK
}
