package com.pickem.bet.entity;

import com.pickem.bet.enums.WagerStatus;
import com.pickem.bet.model.EventOutcome;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

@Entity
@Table(
        name = "wager",
        indexes = {
                @Index(name = "idx_wager_event_status", columnList = "event_id,status"),
                @Index(name = "idx_wager_user_placed", columnList = "user_id,placedAt"),
                @Index(name = "idx_wager_status", columnList = "status")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString(exclude = {"user", "event"})
public class Wager {

    @Id
    @Column(length = 36)
    private String id;

    @Version
    private Integer version;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(
            name = "user_id",
            nullable = false,
            foreignKey = @ForeignKey(name = "fk_wager_user")
    )
    private UserAccount user;

    @Column(name = "user_id", length = 64, insertable = false, updatable = false)
    private String userId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(
            name = "event_id",
            nullable = false,
            foreignKey = @ForeignKey(name = "fk_wager_event")
    )
    private SportEvent event;

    @Column(name = "event_id", insertable = false, updatable = false)
    private Long eventId;

    @Column(length = 64, nullable = false)
    private String pick;

    @Column(precision = 19, scale = 2, nullable = false)
    private BigDecimal stake;

    @Column(precision = 19, scale = 2, nullable = false)
    private BigDecimal potentialPayout;

    @Column(precision = 19, scale = 2, nullable = false)
    @Builder.Default
    private BigDecimal realizedPayout = BigDecimal.ZERO;

    @Enumerated(EnumType.STRING)
    @Column(length = 24, nullable = false)
    @Builder.Default
    private WagerStatus status = WagerStatus.PENDING;

    @Column(nullable = false)
    private Instant placedAt;

    private Instant settledAt;

    /** Largest amount the money columns hold (precision 19, scale 2). */
    public static final BigDecimal MAX_AMOUNT = new BigDecimal("99999999999999999.99");

    /* -------------------- Business logic -------------------- */

    public static BigDecimal calculatePotentialPayout(BigDecimal stake, BigDecimal multiplier) {
        if (stake == null || multiplier == null) return BigDecimal.ZERO;
        return stake.multiply(multiplier).setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Status this wager settles to for a final outcome.
     */
    public WagerStatus grade(EventOutcome outcome) {
        if (outcome.isTie()) {
            return WagerStatus.PUSH;
        }
        return pick.equals(outcome.winner()) ? WagerStatus.WON : WagerStatus.LOST;
    }

    /**
     * Amount credited back to the user when settling to {@code settledStatus}.
     */
    public BigDecimal payoutFor(WagerStatus settledStatus) {
        return switch (settledStatus) {
            case WON -> potentialPayout;
            case PUSH -> stake;
            default -> BigDecimal.ZERO;
        };
    }
}
