package com.pickem.bet.exception;

public class FeedUnavailableException extends RuntimeException {

    public FeedUnavailableException(String message) {
        super(message);
    }

    public FeedUnavailableException(String message, Throwable e) {
        super(message, e);
    }
}
