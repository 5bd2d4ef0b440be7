package com.pickem.bet.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle of a bettable event. Progression is monotonic by {@link #getStage()};
 * CANCELLED can be reached from any non-final state.
 */
@Getter
@RequiredArgsConstructor
public enum EventStatus {
    SCHEDULED(0),
    LOCKED(1),
    IN_PROGRESS(2),
    FINAL(3),
    CANCELLED(3);

    private final int stage;

    public boolean isTerminal() {
        return this == FINAL || this == CANCELLED;
    }

    /**
     * Whether a feed update carrying {@code next} may follow this status.
     * Staying in the same status is allowed (live score refresh or duplicate delivery).
     */
    public boolean canMoveTo(EventStatus next) {
        if (next == null) {
            return false;
        }
        if (this == next) {
            return true;
        }
        if (isTerminal()) {
            return false;
        }
        if (next == CANCELLED) {
            return true;
        }
        return next.stage > this.stage;
    }
}
