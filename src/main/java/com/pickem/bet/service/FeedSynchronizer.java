package com.pickem.bet.service;

import com.pickem.bet.exception.FeedDataInconsistentException;
import com.pickem.bet.exception.FeedUnavailableException;
import com.pickem.bet.interfaces.GameFeed;
import com.pickem.bet.model.FeedSyncSummary;
import com.pickem.bet.model.FeedUpdate;
import com.pickem.bet.model.FeedUpdateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Moves feed snapshots into the event store and triggers settlement for every event that
 * just became FINAL or CANCELLED. Duplicates and reordering are absorbed downstream.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeedSynchronizer {

    private final GameFeed gameFeed;
    private final EventStore eventStore;
    private final SettlementEngine settlementEngine;
    private final SettlementMetricsService metricsService;

    /**
     * Poll the feed's current window. An unreachable feed is "no update", never an error.
     */
    public FeedSyncSummary synchronize() {
        return synchronize(gameFeed::fetchUpdates);
    }

    public FeedSyncSummary synchronizeWeek(int season, int week) {
        return synchronize(() -> gameFeed.fetchUpdates(season, week));
    }

    private FeedSyncSummary synchronize(Supplier<List<FeedUpdate>> fetch) {
        long start = System.currentTimeMillis();
        List<FeedUpdate> updates;
        try {
            updates = fetch.get();
        } catch (FeedUnavailableException e) {
            log.warn("📡 Feed {} unavailable, treating as no update | Error: {}", gameFeed.getName(), e.getMessage());
            metricsService.recordFeedOutage();
            return FeedSyncSummary.unavailable();
        }

        FeedSyncSummary summary = FeedSyncSummary.builder()
                .feedAvailable(true)
                .received(updates.size())
                .build();

        for (FeedUpdate update : updates) {
            Optional<FeedUpdateResult> result = apply(update);
            if (result.isEmpty()) {
                summary.setRejected(summary.getRejected() + 1);
                continue;
            }
            if (result.get().isApplied()) {
                summary.setApplied(summary.getApplied() + 1);
            } else {
                summary.setUnchanged(summary.getUnchanged() + 1);
            }
            if (result.get().becameTerminal() && settle(result.get())) {
                summary.setEventsSettled(summary.getEventsSettled() + 1);
            }
        }

        metricsService.recordFeedResult(summary.getApplied(), summary.getRejected());
        log.info("📡 Feed sync complete | Feed: {} | Received: {} | Applied: {} | Unchanged: {} | Rejected: {} | Settled: {} | Took: {}ms",
                gameFeed.getName(), summary.getReceived(), summary.getApplied(), summary.getUnchanged(),
                summary.getRejected(), summary.getEventsSettled(), System.currentTimeMillis() - start);
        return summary;
    }

    /**
     * Push-style delivery of a single update.
     *
     * @return the store result, or empty when the update was rejected as inconsistent
     */
    public Optional<FeedUpdateResult> ingest(FeedUpdate update) {
        Optional<FeedUpdateResult> result = apply(update);
        result.filter(FeedUpdateResult::becameTerminal).ifPresent(this::settle);
        return result;
    }

    private Optional<FeedUpdateResult> apply(FeedUpdate update) {
        try {
            return Optional.of(record(update));
        } catch (FeedDataInconsistentException e) {
            log.warn("⚠️ Discarding inconsistent feed update | FeedId: {} | Reason: {}",
                    e.getFeedEventId(), e.getMessage());
            return Optional.empty();
        } catch (DataAccessException e) {
            log.error("❌ Storage failure while recording feed update | FeedId: {} | Error: {}",
                    update.getFeedEventId(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * A concurrent delivery may create the same new event first; the retry then takes the
     * existing-event path under the row lock.
     */
    private FeedUpdateResult record(FeedUpdate update) {
        try {
            return eventStore.recordFeedUpdate(update);
        } catch (DataIntegrityViolationException e) {
            log.debug("Event created concurrently, re-applying update | FeedId: {}", update.getFeedEventId());
            return eventStore.recordFeedUpdate(update);
        }
    }

    /**
     * Failures here leave wagers PENDING; the settlement sweep picks them up later.
     */
    private boolean settle(FeedUpdateResult result) {
        try {
            settlementEngine.settleEvent(result.getEventId());
            return true;
        } catch (RuntimeException e) {
            log.error("❌ Settlement after feed transition failed | EventId: {} | Status: {} | Error: {}",
                    result.getEventId(), result.getNewStatus(), e.getMessage(), e);
            return false;
        }
    }
}
