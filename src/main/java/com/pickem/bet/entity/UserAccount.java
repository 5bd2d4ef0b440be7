package com.pickem.bet.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Play-money account of one user. The balance is only ever changed through
 * {@link com.pickem.bet.finance.LedgerService#applyDelta}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@Entity
@Table(name = "user_account",
        indexes = {
                @Index(name = "idx_account_balance", columnList = "balance"),
                @Index(name = "idx_account_last_updated", columnList = "lastUpdated")
        })
public class UserAccount {

    @Id
    @Column(length = 64)
    private String userId;

    @Column(length = 64)
    private String displayName;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal balance;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant lastUpdated;

    @Version
    private Integer version;
}
