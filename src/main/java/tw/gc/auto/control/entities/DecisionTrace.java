package tw.gc.auto.control.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.auto.control.enums.ExecutionStatus;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * DecisionTrace Entity - evidence for one trading decision cycle.
 *
 * <h3>Contents:</h3>
 * <ul>
 *   <li><b>Plan</b>: action, order type, size and exits chosen by the strategy</li>
 *   <li><b>Risk gates</b>: position limits, portfolio heat, drawdown with notes</li>
 *   <li><b>Safety gate</b>: whether the safety supervisor permitted the order and why not</li>
 *   <li><b>Context</b>: market regime and the news evidence behind the confidence nudge</li>
 *   <li><b>Execution</b>: status and broker order ids</li>
 * </ul>
 *
 * <p>Everything except the execution fields is written once. Execution status only moves
 * forward and is frozen once terminal.</p>
 */
@Entity
@Table(name = "decision_traces", indexes = {
    @Index(name = "idx_decision_symbol_asof", columnList = "symbol, as_of")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionTrace {

    @Id
    @Column(name = "trace_id", length = 64)
    private String traceId;

    @Column(name = "symbol", nullable = false, length = 50)
    private String symbol;

    @Column(name = "as_of", nullable = false)
    private LocalDateTime asOf;

    @Embedded
    private TradePlan plan;

    @Embedded
    private RiskGateOutcome riskGate;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "decision_risk_notes", joinColumns = @JoinColumn(name = "trace_id"))
    @OrderColumn(name = "note_order")
    @Column(name = "note", length = 500)
    @Builder.Default
    private List<String> riskNotes = new ArrayList<>();

    @Column(name = "safety_permitted", nullable = false)
    private boolean safetyPermitted;

    @Column(name = "safety_block_reason", length = 500)
    private String safetyBlockReason;

    @Embedded
    private MarketSnapshot marketContext;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "decision_news_evidence", joinColumns = @JoinColumn(name = "trace_id"))
    @OrderColumn(name = "evidence_order")
    @Builder.Default
    private List<NewsEvidence> newsEvidence = new ArrayList<>();

    @Column(name = "nudge_value")
    private Double nudgeValue;

    @Column(name = "nudge_regime_shrink")
    private Double nudgeRegimeShrink;

    @Column(name = "nudge_reason", length = 200)
    private String nudgeReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "execution_status", nullable = false, length = 20)
    @Builder.Default
    private ExecutionStatus executionStatus = ExecutionStatus.PENDING;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "decision_broker_orders", joinColumns = @JoinColumn(name = "trace_id"))
    @OrderColumn(name = "order_seq")
    @Column(name = "broker_order_id", length = 100)
    @Builder.Default
    private List<String> brokerOrderIds = new ArrayList<>();

    @Column(name = "execution_updated_at")
    private LocalDateTime executionUpdatedAt;

    @Version
    private Long version;
}
