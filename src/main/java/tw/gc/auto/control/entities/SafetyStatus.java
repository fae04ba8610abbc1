package tw.gc.auto.control.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.auto.control.enums.TradingMode;

import java.time.LocalDateTime;

/**
 * Process-wide trading safety state. Exactly one row ({@link #SINGLETON_ID}) exists and only
 * {@link tw.gc.auto.control.services.safety.SafetySupervisorService} writes it.
 */
@Entity
@Table(name = "safety_status")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SafetyStatus {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "trading_mode", nullable = false, length = 10)
    @Builder.Default
    private TradingMode tradingMode = TradingMode.PAPER;

    @Column(name = "emergency_stop_active", nullable = false)
    private boolean emergencyStopActive;

    @Column(name = "emergency_stop_reason", length = 500)
    private String emergencyStopReason;

    // Circuit breaker
    @Column(name = "breaker_active", nullable = false)
    private boolean circuitBreakerActive;

    @Column(name = "breaker_reason", length = 500)
    private String circuitBreakerReason;

    @Column(name = "breaker_triggered_at")
    private LocalDateTime circuitBreakerTriggeredAt;

    @Column(name = "max_daily_loss", nullable = false)
    private double maxDailyLoss;

    @Column(name = "current_daily_loss", nullable = false)
    private double currentDailyLoss;

    @Column(name = "max_trades_per_day", nullable = false)
    private int maxTradesPerDay;

    @Column(name = "current_trade_count", nullable = false)
    private int currentTradeCount;

    // Cooldown
    @Column(name = "cooldown_active", nullable = false)
    private boolean cooldownActive;

    @Column(name = "cooldown_ends_at")
    private LocalDateTime cooldownEndsAt;

    @Column(name = "cooldown_reason", length = 500)
    private String cooldownReason;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Version
    private Long version;
}
