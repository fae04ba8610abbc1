package tw.gc.auto.control.services.nudge;

/**
 * Market conditions at decision time. Any field may be null when the feed does not supply it.
 */
public record MarketContext(Double vix, Double spreadPercent, Double trendStrength, String regime, Double volatility) {

    public static MarketContext of(Double vix) {
        return new MarketContext(vix, null, null, null, null);
    }
}
