package com.pickem.bet.exception;

import com.pickem.bet.enums.ErrorCode;

public class UnknownEventException extends BettingException {

    public UnknownEventException(String message) {
        super(ErrorCode.UNKNOWN_EVENT, message);
    }
}
