package com.pickem.bet.model;

import com.pickem.bet.enums.EventStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One event snapshot as delivered by the game feed, keyed by the feed's own event id.
 * Scores may be partial while the event is in progress; winner is only meaningful once FINAL.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class FeedUpdate {
    private String feedEventId;
    private String homeTeam;
    private String awayTeam;
    private Instant scheduledStart;
    private EventStatus status;
    private Integer homeScore;
    private Integer awayScore;
    private String winner;
    private Integer season;
    private Integer week;
}
