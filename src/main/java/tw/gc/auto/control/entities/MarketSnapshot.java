package tw.gc.auto.control.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketSnapshot {

    @Column(name = "market_regime", length = 50)
    private String regime;

    @Column(name = "market_volatility")
    private Double volatility;

    @Column(name = "market_vix")
    private Double vix;
}
