package tw.gc.auto.control.enums;

/**
 * Where orders are routed. PAPER is the default; LIVE is only ever set explicitly.
 */
public enum TradingMode {
    LIVE,
    PAPER
}
