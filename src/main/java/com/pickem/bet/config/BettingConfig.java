package com.pickem.bet.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

@Component
@Data
public class BettingConfig {

    // ==================== WAGER RULES ====================

    /** Betting closes this long before the scheduled start. */
    @Value("${betting.cutoff:PT5M}")
    private Duration cutoff = Duration.ofMinutes(5);

    @Value("${betting.min-stake:1.00}")
    private BigDecimal minStake = new BigDecimal("1.00");

    /** 2.0 = double or nothing */
    @Value("${betting.payout-multiplier:2.0}")
    private BigDecimal payoutMultiplier = new BigDecimal("2.0");

    // ==================== ACCOUNTS ====================

    @Value("${betting.starting-balance:10000.00}")
    private BigDecimal startingBalance = new BigDecimal("10000.00");

    @Value("${betting.page-size:20}")
    private int pageSize = 20;

    // ==================== SETTLEMENT ====================

    @Value("${settlement.parallelism:4}")
    private int settlementParallelism = 4;

    /** Upper bound for settling one wager, including lock waits. */
    @Value("${settlement.wager-timeout.ms:30000}")
    private long settlementWagerTimeoutMs = 30_000;
}
