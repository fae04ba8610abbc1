package tw.gc.auto.control.services.safety;

/**
 * What an order would do, as far as the safety gates are concerned.
 *
 * @param symbol instrument
 * @param entry  true when the order opens or adds to a position; exits and reductions pass a cooldown
 */
public record OrderIntent(String symbol, boolean entry) {

    public static OrderIntent entry(String symbol) {
        return new OrderIntent(symbol, true);
    }

    public static OrderIntent exit(String symbol) {
        return new OrderIntent(symbol, false);
    }
}
