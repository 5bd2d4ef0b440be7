package com.pickem.bet.service;

import com.pickem.bet.config.BettingConfig;
import com.pickem.bet.entity.SportEvent;
import com.pickem.bet.enums.EventStatus;
import com.pickem.bet.enums.WagerStatus;
import com.pickem.bet.logservice.WagerFlowLogger;
import com.pickem.bet.model.EventOutcome;
import com.pickem.bet.model.SettledWager;
import com.pickem.bet.model.SettlementReport;
import com.pickem.bet.repository.WagerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Resolves the PENDING wagers of a terminal event. Safe to invoke any number of times,
 * concurrently or after a crash: each wager is guarded by its own compare-and-set.
 */
@Slf4j
@Service
public class SettlementEngine {

    private final EventStore eventStore;
    private final WagerRepository wagerRepository;
    private final WagerSettler wagerSettler;
    private final ExecutorService settlementExecutor;
    private final BettingConfig bettingConfig;
    private final WagerFlowLogger flowLogger;
    private final SettlementMetricsService metricsService;

    public SettlementEngine(EventStore eventStore,
                            WagerRepository wagerRepository,
                            WagerSettler wagerSettler,
                            @Qualifier("settlementExecutor") ExecutorService settlementExecutor,
                            BettingConfig bettingConfig,
                            WagerFlowLogger flowLogger,
                            SettlementMetricsService metricsService) {
        this.eventStore = eventStore;
        this.wagerRepository = wagerRepository;
        this.wagerSettler = wagerSettler;
        this.settlementExecutor = settlementExecutor;
        this.bettingConfig = bettingConfig;
        this.flowLogger = flowLogger;
        this.metricsService = metricsService;
    }

    /**
     * Settle every PENDING wager of the event. Does nothing until the event is FINAL or CANCELLED,
     * even if live scores are already present.
     */
    public SettlementReport settleEvent(Long eventId) {
        SportEvent event = eventStore.getEvent(eventId);

        if (!event.getStatus().isTerminal()) {
            log.info("⏳ Event not terminal yet, settlement deferred | EventId: {} | Status: {}",
                    eventId, event.getStatus());
            return SettlementReport.empty(eventId);
        }

        List<String> pending = wagerRepository.findIdsByEventIdAndStatus(eventId, WagerStatus.PENDING);
        if (pending.isEmpty()) {
            log.debug("No pending wagers | EventId: {}", eventId);
            return SettlementReport.empty(eventId);
        }

        flowLogger.logSettlementStart(event, pending.size());
        Function<String, Optional<SettledWager>> action = settlementAction(event);

        List<WagerTask> tasks = new ArrayList<>(pending.size());
        for (String wagerId : pending) {
            tasks.add(submit(wagerId, action));
        }

        SettlementReport report = SettlementReport.empty(eventId);
        for (WagerTask task : tasks) {
            try {
                Optional<SettledWager> settled = awaitOutcome(task, eventId);
                if (settled.isPresent()) {
                    report.record(settled.get().status(), settled.get().credited());
                } else {
                    report.recordSkipped();
                }
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                flowLogger.logWagerSettlementFailed(task.wagerId(), eventId, cause);
                report.recordFailed();
            }
        }

        flowLogger.logSettlementComplete(eventId, report);
        metricsService.recordSettlement(report);
        return report;
    }

    /**
     * Settle every terminal event that still holds PENDING wagers. Recovers from crashes
     * between a terminal feed update and its settlement.
     */
    public SettlementReport settleOutstanding() {
        List<Long> eventIds = eventStore.findTerminalWithPendingWagers();
        SettlementReport total = SettlementReport.empty(null);
        if (eventIds.isEmpty()) {
            return total;
        }

        log.info("🧹 Settlement sweep | Events with pending wagers: {}", eventIds.size());
        for (Long eventId : eventIds) {
            try {
                total.merge(settleEvent(eventId));
            } catch (RuntimeException e) {
                log.error("❌ Sweep failed for event | EventId: {} | Error: {}", eventId, e.getMessage(), e);
            }
        }
        return total;
    }

    private WagerTask submit(String wagerId, Function<String, Optional<SettledWager>> action) {
        long deadlineMs = System.currentTimeMillis() + bettingConfig.getSettlementWagerTimeoutMs();
        CompletableFuture<Optional<SettledWager>> work = CompletableFuture.supplyAsync(() -> {
            if (System.currentTimeMillis() > deadlineMs) {
                throw new WagerSettlementAbandonedException(wagerId);
            }
            return action.apply(wagerId);
        }, settlementExecutor);
        return new WagerTask(wagerId, work, deadlineMs);
    }

    /**
     * Waits until the wager's deadline. A task that had not started by then abandons itself and
     * the wager stays PENDING; a task already running is awaited so the report reflects what
     * was actually written.
     */
    private Optional<SettledWager> awaitOutcome(WagerTask task, Long eventId) {
        long remainingMs = Math.max(task.deadlineMs() - System.currentTimeMillis(), 1);
        try {
            return task.work().copy()
                    .orTimeout(remainingMs, TimeUnit.MILLISECONDS)
                    .join();
        } catch (CompletionException e) {
            if (!(e.getCause() instanceof TimeoutException)) {
                throw e;
            }
            log.warn("⏱️ Wager settlement past deadline, awaiting outcome | WagerId: {} | EventId: {} | TimeoutMs: {}",
                    task.wagerId(), eventId, bettingConfig.getSettlementWagerTimeoutMs());
            return task.work().join();
        }
    }

    private record WagerTask(String wagerId,
                             CompletableFuture<Optional<SettledWager>> work,
                             long deadlineMs) {
    }

    static class WagerSettlementAbandonedException extends RuntimeException {
        WagerSettlementAbandonedException(String wagerId) {
            super("Settlement of wager " + wagerId + " not started before its deadline");
        }
    }

    private Function<String, Optional<SettledWager>> settlementAction(SportEvent event) {
        if (event.getStatus() == EventStatus.CANCELLED) {
            return wagerSettler::refund;
        }
        EventOutcome outcome = event.getOutcome()
                .orElseThrow(() -> new IllegalStateException("Final event without outcome: " + event.getId()));
        return wagerId -> wagerSettler.grade(wagerId, outcome);
    }
}
