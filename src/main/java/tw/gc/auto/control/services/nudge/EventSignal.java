package tw.gc.auto.control.services.nudge;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A classified news event for one symbol. {@code effectZ}, {@code expectedReturn5m} and
 * {@code hitRate} are filled in by {@link ConfidenceNudgeService#validateEvent}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventSignal {
    private String type;
    private String sector;
    private String symbol;
    /** +1 bullish, -1 bearish */
    private int direction;
    /** Classifier confidence in [0, 1] */
    private double confidence;
    private Double effectZ;
    private Double expectedReturn5m;
    private Double hitRate;
    private boolean validated;
}
