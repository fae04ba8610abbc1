package tw.gc.auto.control.events;

import tw.gc.auto.control.entities.ControlEvent.EventSeverity;
import tw.gc.auto.control.enums.TradingMode;

import java.time.LocalDateTime;

public record TradingModeNotification(TradingMode from, TradingMode to, LocalDateTime occurredAt)
        implements ControlPlaneNotification {

    @Override
    public String type() {
        return "TRADING_MODE_CHANGED";
    }

    @Override
    public String category() {
        return "SAFETY";
    }

    @Override
    public EventSeverity severity() {
        return to == TradingMode.LIVE ? EventSeverity.HIGH : EventSeverity.MEDIUM;
    }

    @Override
    public String message() {
        return "Trading mode changed: " + from + " → " + to;
    }
}
