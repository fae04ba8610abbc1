package tw.gc.auto.control.exceptions;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Requested amount exceeds the unallocated capital of a pool. Nothing is allocated.
 */
@Getter
public class InsufficientCapitalException extends ControlPlaneException {
    private static final String DEFAULT_ERROR_CODE = "CAP-001";

    private final String poolId;
    private final BigDecimal available;
    private final BigDecimal requested;

    public InsufficientCapitalException(String poolId, BigDecimal available, BigDecimal requested) {
        super(String.format("Insufficient capital in pool %s. Available: %s, Requested: %s",
                poolId, available.toPlainString(), requested.toPlainString()));
        this.poolId = poolId;
        this.available = available;
        this.requested = requested;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
