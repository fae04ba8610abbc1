package tw.gc.auto.control.services.execution;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.auto.control.enums.ExecutionStatus;
import tw.gc.auto.control.enums.TradingMode;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Simulated fills for paper trading.
 */
@Component
@Slf4j
public class PaperBrokerAdapter implements BrokerAdapter {

    private final AtomicLong idGenerator = new AtomicLong(1);

    @Override
    public boolean supports(TradingMode mode) {
        return mode == TradingMode.PAPER;
    }

    @Override
    public OrderSubmissionResult submit(OrderRequest request) {
        if (request.quantity() <= 0) {
            return OrderSubmissionResult.failed("Quantity must be positive");
        }
        String orderId = "PAPER-" + idGenerator.getAndIncrement();
        log.info("📝 Paper {} {} x{} → {}", request.action(), request.symbol(), request.quantity(), orderId);
        return OrderSubmissionResult.accepted(ExecutionStatus.FILLED, List.of(orderId));
    }
}
