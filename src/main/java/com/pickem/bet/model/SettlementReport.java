package com.pickem.bet.model;

import com.pickem.bet.enums.WagerStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Outcome of one settlement pass over an event.
 * {@code skipped} counts wagers another actor had already moved out of PENDING.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SettlementReport {

    private Long eventId;
    private int won;
    private int lost;
    private int push;
    private int refunded;
    private int skipped;
    private int failed;
    @Builder.Default
    private BigDecimal totalCredited = BigDecimal.ZERO;

    public static SettlementReport empty(Long eventId) {
        return SettlementReport.builder().eventId(eventId).build();
    }

    public void record(WagerStatus status, BigDecimal credited) {
        switch (status) {
            case WON -> won++;
            case LOST -> lost++;
            case PUSH -> push++;
            case CANCELLED -> refunded++;
            default -> throw new IllegalArgumentException("Not a settled status: " + status);
        }
        if (credited != null) {
            totalCredited = totalCredited.add(credited);
        }
    }

    public void recordSkipped() {
        skipped++;
    }

    public void recordFailed() {
        failed++;
    }

    public int settledCount() {
        return won + lost + push + refunded;
    }

    public void merge(SettlementReport other) {
        won += other.won;
        lost += other.lost;
        push += other.push;
        refunded += other.refunded;
        skipped += other.skipped;
        failed += other.failed;
        totalCredited = totalCredited.add(other.totalCredited);
    }
}
