package tw.gc.auto.control.services.execution;

import tw.gc.auto.control.enums.OrderType;
import tw.gc.auto.control.enums.TradeAction;

/**
 * @param entry true when the order opens or adds to a position
 */
public record OrderRequest(
        String strategyId,
        String symbol,
        TradeAction action,
        OrderType orderType,
        int quantity,
        Double limitPrice,
        boolean entry
) {
}
