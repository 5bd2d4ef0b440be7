package com.pickem.bet.interfaces;

import com.pickem.bet.exception.FeedUnavailableException;
import com.pickem.bet.model.FeedUpdate;

import java.util.List;

/**
 * Source of event snapshots. Implementations are untrusted and eventually consistent:
 * updates may arrive late, repeated or out of order.
 */
public interface GameFeed {

    /**
     * Current snapshot of every event the feed knows about in its current window.
     *
     * @throws FeedUnavailableException when the feed cannot be reached or answers garbage
     */
    List<FeedUpdate> fetchUpdates();

    /**
     * Snapshot for an explicit season week. Feeds without week addressing return the current window.
     */
    default List<FeedUpdate> fetchUpdates(int season, int week) {
        return fetchUpdates();
    }

    String getName();
}
