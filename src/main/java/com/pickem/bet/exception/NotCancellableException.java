package com.pickem.bet.exception;

import com.pickem.bet.enums.ErrorCode;

public class NotCancellableException extends BettingException {

    public NotCancellableException(String message) {
        super(ErrorCode.NOT_CANCELLABLE, message);
    }
}
