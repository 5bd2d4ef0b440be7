package com.pickem.bet.service;

import com.pickem.bet.config.BettingConfig;
import com.pickem.bet.entity.SportEvent;
import com.pickem.bet.enums.EventStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Lock time is a pure function of (now, scheduled start, cutoff) and is evaluated on every
 * call, never stored. The window is exclusive: betting is closed from lockTime onwards.
 */
@Component
@RequiredArgsConstructor
public class BettingWindow {

    private final BettingConfig bettingConfig;
    private final Clock clock;

    public Instant now() {
        return clock.instant();
    }

    public Instant lockTime(SportEvent event) {
        return event.getScheduledStart().minus(bettingConfig.getCutoff());
    }

    public boolean isOpen(SportEvent event, Instant now) {
        return event.getStatus() == EventStatus.SCHEDULED && now.isBefore(lockTime(event));
    }

    public boolean isOpen(SportEvent event) {
        return isOpen(event, now());
    }

    /**
     * Stored status, except that a SCHEDULED event past its lock time reads as LOCKED.
     */
    public EventStatus effectiveStatus(SportEvent event, Instant now) {
        if (event.getStatus() == EventStatus.SCHEDULED && !now.isBefore(lockTime(event))) {
            return EventStatus.LOCKED;
        }
        return event.getStatus();
    }
}
