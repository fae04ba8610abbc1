package tw.gc.auto.control.enums;

public enum OrderType {
    MARKET,
    LIMIT,
    STOP
}
