package tw.gc.auto.control.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One news event consulted by the confidence nudge and its statistical backing.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NewsEvidence {

    @Column(name = "event_type", length = 100)
    private String eventType;

    @Column(name = "direction", length = 10)
    private String direction;

    @Column(name = "confidence")
    private double confidence;

    @Column(name = "effect_size")
    private Double effectSize;

    @Column(name = "expected_return")
    private Double expectedReturn;

    @Column(name = "hit_rate")
    private Double hitRate;
}
