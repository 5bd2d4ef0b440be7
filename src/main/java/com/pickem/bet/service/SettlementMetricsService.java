package com.pickem.bet.service;

import com.pickem.bet.model.SettlementReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

@Service
@Slf4j
public class SettlementMetricsService {

    private final AtomicInteger wagersPlaced = new AtomicInteger(0);
    private final AtomicInteger wagersCancelled = new AtomicInteger(0);
    private final AtomicInteger eventsSettled = new AtomicInteger(0);
    private final AtomicInteger wagersSettled = new AtomicInteger(0);
    private final AtomicInteger settlementFailures = new AtomicInteger(0);
    private final AtomicInteger feedUpdatesApplied = new AtomicInteger(0);
    private final AtomicInteger feedUpdatesRejected = new AtomicInteger(0);
    private final AtomicInteger feedOutages = new AtomicInteger(0);

    public void recordWagerPlaced() {
        wagersPlaced.incrementAndGet();
    }

    public void recordWagerCancelled() {
        wagersCancelled.incrementAndGet();
    }

    public void recordSettlement(SettlementReport report) {
        eventsSettled.incrementAndGet();
        wagersSettled.addAndGet(report.settledCount());
        settlementFailures.addAndGet(report.getFailed());
    }

    public void recordFeedResult(int applied, int rejected) {
        feedUpdatesApplied.addAndGet(applied);
        feedUpdatesRejected.addAndGet(rejected);
    }

    public void recordFeedOutage() {
        feedOutages.incrementAndGet();
    }

    public Map<String, Object> getMetrics() {
        int settled = wagersSettled.get();
        int failures = settlementFailures.get();
        int attempts = settled + failures;

        return Map.of(
                "wagersPlaced", wagersPlaced.get(),
                "wagersCancelled", wagersCancelled.get(),
                "eventsSettled", eventsSettled.get(),
                "wagersSettled", settled,
                "settlementFailures", failures,
                "settlementFailureRate", attempts > 0 ? (failures * 100.0 / attempts) : 0.0,
                "feedUpdatesApplied", feedUpdatesApplied.get(),
                "feedUpdatesRejected", feedUpdatesRejected.get(),
                "feedOutages", feedOutages.get()
        );
    }

    public void logMetrics() {
        Map<String, Object> metrics = getMetrics();
        log.info("📊 Settlement Metrics: {}", metrics);

        double failureRate = (double) metrics.get("settlementFailureRate");
        if (failureRate > 5.0) {
            log.warn("⚠️ HIGH SETTLEMENT FAILURE RATE: {}%", String.format("%.2f", failureRate));
        }
    }
}
