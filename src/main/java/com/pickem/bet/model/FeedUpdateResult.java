package com.pickem.bet.model;

import com.pickem.bet.enums.EventStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FeedUpdateResult {

    public enum Kind {
        APPLIED,
        NOOP
    }

    private Kind kind;
    private Long eventId;
    private String feedEventId;
    /** null when the update created the event */
    private EventStatus previousStatus;
    private EventStatus newStatus;

    public boolean isApplied() {
        return kind == Kind.APPLIED;
    }

    /**
     * True only for the update that moved the event into FINAL or CANCELLED.
     */
    public boolean becameTerminal() {
        return isApplied()
                && newStatus != null
                && newStatus.isTerminal()
                && previousStatus != newStatus;
    }
}
