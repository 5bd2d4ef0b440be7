package com.pickem.bet.model;

/**
 * Final result of an event. {@code winner} is null on a tie.
 */
public record EventOutcome(int homeScore, int awayScore, String winner) {

    public boolean isTie() {
        return winner == null;
    }
}
