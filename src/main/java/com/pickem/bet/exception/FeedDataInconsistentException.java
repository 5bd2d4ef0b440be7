package com.pickem.bet.exception;

import lombok.Getter;

/**
 * A feed update that contradicts what the event store already holds
 * (status going backwards, a second different final score, unknown winner).
 * The update is discarded as a whole.
 */
@Getter
public class FeedDataInconsistentException extends RuntimeException {

    private final String feedEventId;

    public FeedDataInconsistentException(String feedEventId, String message) {
        super(message + " [feedEventId=" + feedEventId + "]");
        this.feedEventId = feedEventId;
    }
}
