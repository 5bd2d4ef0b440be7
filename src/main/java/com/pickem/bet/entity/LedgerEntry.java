package com.pickem.bet.entity;

import com.pickem.bet.enums.LedgerReason;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Append-only audit record of one balance delta.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@Entity
@Table(name = "ledger_entry",
        indexes = {
                @Index(name = "idx_ledger_user_created", columnList = "userId,createdAt"),
                @Index(name = "idx_ledger_reference", columnList = "reference")
        })
public class LedgerEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64, updatable = false)
    private String userId;

    /** positive = credit, negative = debit */
    @Column(nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32, updatable = false)
    private LedgerReason reason;

    @Column(length = 64, updatable = false)
    private String reference;

    @Column(nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal balanceAfter;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;
}
