package tw.gc.auto.control.enums;

public enum TradeAction {
    BUY,
    SELL,
    HOLD
}
