package com.pickem.bet.exception;

import com.pickem.bet.enums.ErrorCode;
import lombok.Getter;

/**
 * Base class of every precondition failure returned to a bettor.
 * Thrown inside the transactional boundary, so state is left unchanged.
 */
@Getter
public abstract class BettingException extends RuntimeException {

    private final ErrorCode errorCode;

    protected BettingException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
