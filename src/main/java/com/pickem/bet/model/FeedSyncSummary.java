package com.pickem.bet.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of one synchronization pass over the game feed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FeedSyncSummary {
    private boolean feedAvailable;
    private int received;
    private int applied;
    private int unchanged;
    private int rejected;
    private int eventsSettled;

    public static FeedSyncSummary unavailable() {
        return FeedSyncSummary.builder().feedAvailable(false).build();
    }
}
