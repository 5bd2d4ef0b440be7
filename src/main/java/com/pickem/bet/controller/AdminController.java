package com.pickem.bet.controller;

import com.pickem.bet.finance.LedgerService;
import com.pickem.bet.model.FeedSyncSummary;
import com.pickem.bet.model.ReconciliationReport;
import com.pickem.bet.model.SettlementReport;
import com.pickem.bet.service.FeedSynchronizer;
import com.pickem.bet.service.SettlementEngine;
import com.pickem.bet.service.SettlementMetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Operator triggers. Access control is left to the gateway in front of {@code /api/v1/admin}.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/admin")
public class AdminController {

    private final SettlementEngine settlementEngine;
    private final FeedSynchronizer feedSynchronizer;
    private final LedgerService ledgerService;
    private final SettlementMetricsService metricsService;

    @PostMapping("/events/{id}/settle")
    public ResponseEntity<SettlementReport> settleEvent(@PathVariable Long id) {
        log.info("POST /api/v1/admin/events/{}/settle", id);
        return ResponseEntity.ok(settlementEngine.settleEvent(id));
    }

    @PostMapping("/settlement/sweep")
    public ResponseEntity<SettlementReport> sweep() {
        log.info("POST /api/v1/admin/settlement/sweep");
        return ResponseEntity.ok(settlementEngine.settleOutstanding());
    }

    /**
     * Poll the feed now, optionally for an explicit season week.
     */
    @PostMapping("/feed/sync")
    public ResponseEntity<FeedSyncSummary> syncFeed(
            @RequestParam(required = false) Integer season,
            @RequestParam(required = false) Integer week
    ) {
        log.info("POST /api/v1/admin/feed/sync - season={}, week={}", season, week);
        if (season != null && week != null) {
            return ResponseEntity.ok(feedSynchronizer.synchronizeWeek(season, week));
        }
        return ResponseEntity.ok(feedSynchronizer.synchronize());
    }

    @GetMapping("/accounts/{userId}/reconcile")
    public ResponseEntity<ReconciliationReport> reconcile(@PathVariable String userId) {
        return ResponseEntity.ok(ledgerService.reconcile(userId));
    }

    @GetMapping("/metrics")
    public ResponseEntity<Map<String, Object>> metrics() {
        return ResponseEntity.ok(metricsService.getMetrics());
    }
}
