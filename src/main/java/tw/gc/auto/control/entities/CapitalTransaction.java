package tw.gc.auto.control.entities;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;
import tw.gc.auto.control.enums.TransactionType;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Append-only journal entry for every allocate, release, P&L update and transfer leg.
 */
@Entity
@Immutable
@Table(name = "capital_transactions", indexes = {
    @Index(name = "idx_capital_tx_pool", columnList = "pool_id, id")
})
@Getter
@ToString
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class CapitalTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 20)
    private TransactionType type;

    @Column(name = "pool_id", nullable = false, length = 100)
    private String poolId;

    @Column(name = "experiment_id", length = 100)
    private String experimentId;

    @Column(name = "allocation_id")
    private Long allocationId;

    /** Signed amount: transfers out are negative */
    @Column(name = "amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "recorded_at", nullable = false)
    private LocalDateTime timestamp;
}
