package com.pickem.bet.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    UNKNOWN_USER(HttpStatus.NOT_FOUND),
    UNKNOWN_EVENT(HttpStatus.NOT_FOUND),
    UNKNOWN_WAGER(HttpStatus.NOT_FOUND),
    BETTING_CLOSED(HttpStatus.CONFLICT),
    INVALID_STAKE(HttpStatus.BAD_REQUEST),
    INVALID_SELECTION(HttpStatus.BAD_REQUEST),
    INSUFFICIENT_FUNDS(HttpStatus.UNPROCESSABLE_ENTITY),
    NOT_CANCELLABLE(HttpStatus.CONFLICT);

    private final HttpStatus httpStatus;
}
