package com.pickem.bet.tasks;

import com.pickem.bet.config.FeedConfig;
import com.pickem.bet.finance.LedgerService;
import com.pickem.bet.service.FeedSynchronizer;
import com.pickem.bet.service.SettlementEngine;
import com.pickem.bet.service.SettlementMetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background cadence: feed polling, the settlement sweep, ledger reconciliation and metrics.
 * Every job catches its own failures so one bad run never stops the schedule.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "jobs.enabled", havingValue = "true", matchIfMissing = true)
public class BackgroundJobScheduler {

    private final FeedConfig feedConfig;
    private final FeedSynchronizer feedSynchronizer;
    private final SettlementEngine settlementEngine;
    private final LedgerService ledgerService;
    private final SettlementMetricsService metricsService;

    @Scheduled(initialDelayString = "${feed.poll.initial-delay.ms:10000}",
            fixedDelayString = "${feed.poll.interval.ms:900000}")
    public void pollFeed() {
        if (!feedConfig.isEnabled()) {
            log.debug("Feed polling disabled");
            return;
        }
        try {
            feedSynchronizer.synchronize();
        } catch (RuntimeException e) {
            log.error("❌ Feed poll failed | Error: {}", e.getMessage(), e);
        }
    }

    @Scheduled(initialDelayString = "${settlement.sweep.initial-delay.ms:60000}",
            fixedDelayString = "${settlement.sweep.interval.ms:1800000}")
    public void sweepSettlements() {
        try {
            settlementEngine.settleOutstanding();
        } catch (RuntimeException e) {
            log.error("❌ Settlement sweep failed | Error: {}", e.getMessage(), e);
        }
    }

    @Scheduled(initialDelayString = "${ledger.reconcile.initial-delay.ms:120000}",
            fixedDelayString = "${ledger.reconcile.interval.ms:300000}")
    public void reconcileLedger() {
        try {
            ledgerService.reconcileAllAccounts();
        } catch (RuntimeException e) {
            log.error("❌ Ledger reconciliation failed | Error: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedRate = 60000) // Every minute
    public void logMetrics() {
        metricsService.logMetrics();
    }
}
