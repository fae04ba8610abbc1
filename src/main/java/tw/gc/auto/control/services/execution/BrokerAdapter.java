package tw.gc.auto.control.services.execution;

import tw.gc.auto.control.enums.TradingMode;

/**
 * Order execution adapter. Live brokers are provided as separate beans; only the
 * {@link PaperBrokerAdapter} ships with the control plane.
 */
public interface BrokerAdapter {

    boolean supports(TradingMode mode);

    OrderSubmissionResult submit(OrderRequest request);
}
