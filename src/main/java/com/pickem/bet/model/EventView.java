package com.pickem.bet.model;

import com.pickem.bet.enums.EventStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Read model of an event with the clock-derived status and lock time filled in.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EventView {
    private Long id;
    private String feedEventId;
    private String homeTeam;
    private String awayTeam;
    private Instant scheduledStart;
    private Instant lockTime;
    private EventStatus status;
    private boolean bettable;
    private Integer season;
    private Integer week;
    private Integer homeScore;
    private Integer awayScore;
    private String winner;
}
