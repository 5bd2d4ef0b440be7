package com.pickem.bet.enums;

import java.util.Arrays;
import java.util.Optional;

public enum WagerStatus {

    /**
     * Stake debited, waiting for the event outcome
     */
    PENDING,

    /**
     * Picked participant won, potential payout credited
     */
    WON,

    /**
     * Picked participant lost, nothing credited
     */
    LOST,

    /**
     * Event ended in a tie, stake returned
     */
    PUSH,

    /**
     * Cancelled by the user or refunded because the event was cancelled
     */
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * Parse a status filter (case-insensitive). Blank or "all" means no filter.
     */
    public static Optional<WagerStatus> fromFilter(String value) {
        if (value == null || value.isBlank() || value.trim().equalsIgnoreCase("all")) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(s -> s.name().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
