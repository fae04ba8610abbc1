package tw.gc.auto.control.services.nudge;

import java.util.List;

public record NudgeExplanation(
        double nudgeBasisPoints,
        String reason,
        double confidence,
        List<Factor> factors,
        Double regimeShrink,
        Double vixLevel,
        boolean circuitBreakerActive
) {

    public record Factor(
            String eventType,
            String direction,
            double confidence,
            Double effectSize,
            Double expectedReturn,
            Double hitRate
    ) {
    }

    static NudgeExplanation none(boolean circuitBreakerActive) {
        return new NudgeExplanation(0.0, "No validated news events", 0.0, List.of(), null, null, circuitBreakerActive);
    }
}
